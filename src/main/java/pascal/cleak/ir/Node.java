/*
 * CLeak: A Resource-Ownership Checker for C/C++
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of CLeak.
 *
 * CLeak is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * CLeak is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with CLeak. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.cleak.ir;

import pascal.cleak.util.Indexable;

import java.util.List;

/**
 * Element of the syntax graph of a function. Nodes are immutable once
 * added to their {@link SyntaxGraph}; the links to enclosing nodes are
 * kept by the graph, see {@link SyntaxGraph#getParent(Node)}.
 */
public interface Node extends Indexable {

    /**
     * @return the index of this node in its {@link SyntaxGraph},
     * or -1 if it has not been added to a graph yet.
     */
    @Override
    int getIndex();

    void setIndex(int index);

    /**
     * @return the line number of this node in the original source file.
     * If the line number is unavailable, return -1.
     */
    int getLineNumber();

    Category getCategory();

    /**
     * @return the textual content of the token that starts this node,
     * e.g., the variable name, the operator or the keyword.
     */
    String getText();

    /**
     * @return the nodes directly enclosed by this node, in source order.
     */
    List<Node> getChildren();
}
