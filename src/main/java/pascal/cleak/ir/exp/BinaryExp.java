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

/**
 * Binary expression, including comparisons, logical operators
 * and the comma operator.
 */
public class BinaryExp extends AbstractNode implements Exp {

    public enum Op {

        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        REM("%"),
        SHL("<<"),
        SHR(">>"),
        AND("&"),
        OR("|"),
        XOR("^"),
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        LOGICAL_AND("&&"),
        LOGICAL_OR("||"),
        COMMA(","),
        ;

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public boolean isComparison() {
            return switch (this) {
                case EQ, NE, LT, LE, GT, GE -> true;
                default -> false;
            };
        }

        /**
         * @return the operator that gives the same result
         * when the operands are swapped, e.g., {@code >} for {@code <}.
         */
        public Op swap() {
            return switch (this) {
                case LT -> GT;
                case LE -> GE;
                case GT -> LT;
                case GE -> LE;
                default -> this;
            };
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    private final Op op;

    private final Exp operand1;

    private final Exp operand2;

    public BinaryExp(int lineNumber, Op op, Exp operand1, Exp operand2) {
        super(lineNumber);
        this.op = op;
        this.operand1 = operand1;
        this.operand2 = operand2;
    }

    public Op getOperator() {
        return op;
    }

    public Exp getOperand1() {
        return operand1;
    }

    public Exp getOperand2() {
        return operand2;
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
        return List.of(operand1, operand2);
    }
}
