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

package pascal.cleak.analysis.constant;

import pascal.cleak.ir.exp.BinaryExp;
import pascal.cleak.ir.exp.CastExp;
import pascal.cleak.ir.exp.ConditionalExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.IntLiteral;
import pascal.cleak.ir.exp.NullLiteral;
import pascal.cleak.ir.exp.UnaryExp;
import pascal.cleak.ir.type.PrimitiveType;

/**
 * Folds expressions whose value is known without any information
 * about variables, e.g., {@code if (0)} or {@code if (1 + 1 == 2)}.
 */
public final class ConstantEvaluator {

    private ConstantEvaluator() {
    }

    public static Value evaluate(Exp exp) {
        if (exp instanceof IntLiteral literal) {
            return Value.makeConstant(literal.getValue());
        }
        if (exp instanceof NullLiteral) {
            return Value.makeConstant(0);
        }
        if (exp instanceof CastExp cast) {
            Value value = evaluate(cast.getOperand());
            if (value.isConstant() && cast.getType().type() == PrimitiveType.BOOL) {
                return Value.makeBool(value.getConstant() != 0);
            }
            return value;
        }
        if (exp instanceof UnaryExp unary) {
            return evaluateUnary(unary);
        }
        if (exp instanceof ConditionalExp conditional) {
            Value cond = evaluate(conditional.getCondition());
            if (!cond.isConstant()) {
                return Value.getNAC();
            }
            return evaluate(cond.getConstant() != 0
                    ? conditional.getTrueExp() : conditional.getFalseExp());
        }
        if (exp instanceof BinaryExp binary) {
            return evaluateBinary(binary);
        }
        return Value.getNAC();
    }

    /**
     * @return the truth value of a condition, or null if it is unknown.
     */
    public static Boolean evaluateCondition(Exp condition) {
        Value value = evaluate(condition);
        return value.isConstant() ? value.getConstant() != 0 : null;
    }

    private static Value evaluateUnary(UnaryExp unary) {
        Value operand = evaluate(unary.getOperand());
        if (!operand.isConstant()) {
            return Value.getNAC();
        }
        long val = operand.getConstant();
        return switch (unary.getOperator()) {
            case NOT -> Value.makeBool(val == 0);
            case NEG -> Value.makeConstant(-val);
            case PLUS -> operand;
            case BIT_NOT -> Value.makeConstant(~val);
            default -> Value.getNAC();
        };
    }

    private static Value evaluateBinary(BinaryExp binary) {
        BinaryExp.Op op = binary.getOperator();
        Value op1Val = evaluate(binary.getOperand1());
        // an absorbing operand decides && and || on its own
        if (op == BinaryExp.Op.LOGICAL_AND || op == BinaryExp.Op.LOGICAL_OR) {
            boolean absorbing = op == BinaryExp.Op.LOGICAL_OR;
            Value op2Val = evaluate(binary.getOperand2());
            if (hasTruth(op1Val, absorbing) || hasTruth(op2Val, absorbing)) {
                return Value.makeBool(absorbing);
            }
            if (op1Val.isConstant() && op2Val.isConstant()) {
                return Value.makeBool(!absorbing);
            }
            return Value.getNAC();
        }
        if (op == BinaryExp.Op.COMMA) {
            return evaluate(binary.getOperand2());
        }
        Value op2Val = evaluate(binary.getOperand2());
        if (!op1Val.isConstant() || !op2Val.isConstant()) {
            return handleNonConstantOperands(op, op2Val);
        }
        return computeBinaryOperation(op, op1Val.getConstant(), op2Val.getConstant());
    }

    private static boolean hasTruth(Value value, boolean truth) {
        return value.isConstant() && (value.getConstant() != 0) == truth;
    }

    private static Value handleNonConstantOperands(BinaryExp.Op op, Value op2Val) {
        if (op == BinaryExp.Op.DIV || op == BinaryExp.Op.REM) {
            // x / 0 => UNDEF
            if (op2Val.isConstant() && op2Val.getConstant() == 0) {
                return Value.getUndef();
            }
        }
        return Value.getNAC();
    }

    private static Value computeBinaryOperation(BinaryExp.Op op, long val1, long val2) {
        return switch (op) {
            case ADD -> Value.makeConstant(val1 + val2);
            case SUB -> Value.makeConstant(val1 - val2);
            case MUL -> Value.makeConstant(val1 * val2);
            case DIV -> val2 == 0 ? Value.getUndef() : Value.makeConstant(val1 / val2);
            case REM -> val2 == 0 ? Value.getUndef() : Value.makeConstant(val1 % val2);
            case LE -> Value.makeBool(val1 <= val2);
            case LT -> Value.makeBool(val1 < val2);
            case GT -> Value.makeBool(val1 > val2);
            case GE -> Value.makeBool(val1 >= val2);
            case EQ -> Value.makeBool(val1 == val2);
            case NE -> Value.makeBool(val1 != val2);
            case OR -> Value.makeConstant(val1 | val2);
            case XOR -> Value.makeConstant(val1 ^ val2);
            case AND -> Value.makeConstant(val1 & val2);
            case SHL -> Value.makeConstant(val1 << val2);
            case SHR -> Value.makeConstant(val1 >> val2);
            default -> Value.getUndef();
        };
    }
}
