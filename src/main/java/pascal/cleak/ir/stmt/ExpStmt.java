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

import pascal.cleak.ir.Category;
import pascal.cleak.ir.Node;
import pascal.cleak.ir.exp.Exp;

import java.util.List;

/**
 * Expression evaluated for its side effects, e.g., a call.
 */
public class ExpStmt extends AbstractStmt {

    private final Exp exp;

    public ExpStmt(int lineNumber, Exp exp) {
        super(lineNumber);
        this.exp = exp;
    }

    public Exp getExp() {
        return exp;
    }

    @Override
    public Category getCategory() {
        return exp.getCategory();
    }

    @Override
    public String getText() {
        return exp.getText();
    }

    @Override
    public List<Node> getChildren() {
        return List.of(exp);
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
