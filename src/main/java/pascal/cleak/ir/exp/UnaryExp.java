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

public class UnaryExp extends AbstractNode implements Exp {

    public enum Op {

        NOT("!"),
        DEREF("*"),
        ADDRESS_OF("&"),
        NEG("-"),
        PLUS("+"),
        BIT_NOT("~"),
        PRE_INC("++"),
        PRE_DEC("--"),
        POST_INC("++"),
        POST_DEC("--"),
        ;

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    private final Op op;

    private final Exp operand;

    public UnaryExp(int lineNumber, Op op, Exp operand) {
        super(lineNumber);
        this.op = op;
        this.operand = operand;
    }

    public Op getOperator() {
        return op;
    }

    public Exp getOperand() {
        return operand;
    }

    @Override
    public Category getCategory() {
        return Category.OPERATOR;
    }

    @Override
    public String getText() {
        return op.toString();
    }

    @Override
    public List<Node> getChildren() {
        return List.of(operand);
    }
}
