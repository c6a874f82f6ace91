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
import pascal.cleak.ir.exp.Exp;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement that executes a block a statically unknown number of times
 * or selects an entry point into it: loops, {@code switch}, and
 * macro-like constructs such as {@code FOREACH(x) { ... }}.
 */
public class LoopStmt extends AbstractStmt {

    public enum Kind {
        WHILE,
        FOR,
        DO,
        SWITCH,
        MACRO,
    }

    private final Kind kind;

    private final String keyword;

    private final Exp header;

    private final Block body;

    public LoopStmt(int lineNumber, Kind kind, String keyword,
                    Exp header, Block body) {
        super(lineNumber);
        this.kind = kind;
        this.keyword = keyword;
        this.header = header;
        this.body = body;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the controlling expression, or null if there is none.
     */
    public Exp getHeader() {
        return header;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public String getText() {
        return keyword;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(2);
        if (header != null) {
            children.add(header);
        }
        children.add(body);
        return children;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
