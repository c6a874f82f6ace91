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

package pascal.cleak.ir.exp;

import pascal.cleak.ir.AbstractNode;
import pascal.cleak.ir.Category;
import pascal.cleak.ir.Node;

import java.util.List;

public class ArrayAccess extends AbstractNode implements Exp {

    private final Exp base;

    private final Exp subscript;

    public ArrayAccess(int lineNumber, Exp base, Exp subscript) {
        super(lineNumber);
        this.base = base;
        this.subscript = subscript;
    }

    public Exp getBase() {
        return base;
    }

    public Exp getSubscript() {
        return subscript;
    }

    @Override
    public Category getCategory() {
        return Category.OPERATOR;
    }

    @Override
    public String getText() {
        return "[";
    }

    @Override
    public List<Node> getChildren() {
        return List.of(base, subscript);
    }
}
