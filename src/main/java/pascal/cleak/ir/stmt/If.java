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
 * {@code if (condition) { ... } else { ... }}.
 * An {@code else if} is an else block containing a single {@code If}.
 */
public class If extends AbstractStmt {

    private final Exp condition;

    private final Block thenBlock;

    private final Block elseBlock;

    public If(int lineNumber, Exp condition, Block thenBlock, Block elseBlock) {
        super(lineNumber);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Exp getCondition() {
        return condition;
    }

    public Block getThen() {
        return thenBlock;
    }

    /**
     * @return the else block, or null if there is none.
     */
    public Block getElse() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public String getText() {
        return "if";
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(3);
        children.add(condition);
        children.add(thenBlock);
        if (elseBlock != null) {
            children.add(elseBlock);
        }
        return children;
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
