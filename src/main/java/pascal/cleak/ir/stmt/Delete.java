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

import java.util.List;

/**
 * {@code delete p;} or {@code delete[] p;}.
 */
public class Delete extends AbstractStmt {

    private final Exp operand;

    private final boolean array;

    public Delete(int lineNumber, Exp operand, boolean array) {
        super(lineNumber);
        this.operand = operand;
        this.array = array;
    }

    public Exp getOperand() {
        return operand;
    }

    public boolean isArray() {
        return array;
    }

    @Override
    public String getText() {
        return "delete";
    }

    @Override
    public List<Node> getChildren() {
        return List.of(operand);
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
