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

package pascal.cleak.ir.stmt;

import pascal.cleak.ir.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code try { ... } catch (...) { ... }}.
 */
public class Try extends AbstractStmt {

    private final Block body;

    private final List<Block> handlers;

    public Try(int lineNumber, Block body, List<Block> handlers) {
        super(lineNumber);
        this.body = body;
        this.handlers = List.copyOf(handlers);
    }

    public Block getBody() {
        return body;
    }

    public List<Block> getHandlers() {
        return handlers;
    }

    @Override
    public String getText() {
        return "try";
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(handlers.size() + 1);
        children.add(body);
        children.addAll(handlers);
        return children;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
