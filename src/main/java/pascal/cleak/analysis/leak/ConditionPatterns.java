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

package pascal.cleak.analysis.leak;

import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.AssignExp;
import pascal.cleak.ir.exp.BinaryExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.FieldAccess;
import pascal.cleak.ir.exp.IntLiteral;
import pascal.cleak.ir.exp.NullLiteral;
import pascal.cleak.ir.exp.UnaryExp;
import pascal.cleak.ir.exp.VarExp;

import java.util.List;

/**
 * Recognizes conditions that compare a variable against a constant which
 * tells whether an allocation succeeded, such as {@code p != NULL} or
 * {@code fd < 0}.
 */
public final class ConditionPatterns {

    private record Pattern(BinaryExp.Op op, long constant) {
    }

    private static final List<Pattern> SUCCESS = List.of(
            new Pattern(BinaryExp.Op.NE, 0),
            new Pattern(BinaryExp.Op.GT, 0),
            new Pattern(BinaryExp.Op.NE, -1),
            new Pattern(BinaryExp.Op.GE, 0),
            new Pattern(BinaryExp.Op.GT, -1));

    private static final List<Pattern> FAILURE = List.of(
            new Pattern(BinaryExp.Op.EQ, 0),
            new Pattern(BinaryExp.Op.LT, 0),
            new Pattern(BinaryExp.Op.EQ, -1),
            new Pattern(BinaryExp.Op.LE, -1));

    private ConditionPatterns() {
    }

    /**
     * @return the variable whose allocation succeeded when the condition
     * holds, or null if the condition is no such test.
     */
    public static Var matchSuccess(Exp cond) {
        return match(cond, SUCCESS);
    }

    /**
     * @return the variable whose allocation failed when the condition
     * holds, or null if the condition is no such test.
     */
    public static Var matchFailure(Exp cond) {
        return match(cond, FAILURE);
    }

    private static Var match(Exp cond, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Var var = matchComparison(cond, pattern.op(), pattern.constant());
            if (var != null) {
                return var;
            }
        }
        return null;
    }

    /**
     * Matches {@code x op constant} and its mirrored form. Tests of
     * truth are comparisons against zero: {@code x} matches
     * {@code x != 0}, and {@code !x} matches {@code x == 0}.
     *
     * @return the compared variable, or null if there is no match.
     */
    public static Var matchComparison(Exp cond, BinaryExp.Op op, long constant) {
        Exp operand = null;
        if (cond instanceof BinaryExp binary && binary.getOperator().isComparison()) {
            if (isConstant(binary.getOperand1(), constant)) {
                if (binary.getOperator().swap() == op) {
                    operand = binary.getOperand2();
                }
            } else if (binary.getOperator() == op
                    && isConstant(binary.getOperand2(), constant)) {
                operand = binary.getOperand1();
            }
        } else if (op == BinaryExp.Op.NE && constant == 0) {
            if (isNot(cond)) {
                // !(x == 0)
                return matchComparison(((UnaryExp) cond).getOperand(),
                        BinaryExp.Op.EQ, 0);
            }
            operand = cond;
        } else if (op == BinaryExp.Op.EQ && constant == 0) {
            if (isNot(cond)) {
                // !x and !(x != 0)
                return matchComparison(((UnaryExp) cond).getOperand(),
                        BinaryExp.Op.NE, 0);
            }
        }
        return resolve(operand);
    }

    private static boolean isNot(Exp exp) {
        return exp instanceof UnaryExp unary
                && unary.getOperator() == UnaryExp.Op.NOT;
    }

    private static boolean isConstant(Exp exp, long constant) {
        if (exp instanceof IntLiteral literal) {
            return literal.getValue() == constant;
        }
        if (exp instanceof NullLiteral) {
            return constant == 0;
        }
        if (exp instanceof UnaryExp unary
                && unary.getOperator() == UnaryExp.Op.NEG
                && unary.getOperand() instanceof IntLiteral literal) {
            return -literal.getValue() == constant;
        }
        return false;
    }

    /**
     * Resolves the compared operand: {@code s.p} to the member,
     * {@code (p = f())} to {@code p}.
     */
    private static Var resolve(Exp operand) {
        if (operand instanceof FieldAccess access) {
            return access.getField();
        }
        if (operand instanceof AssignExp assign) {
            return assign.getLValue() instanceof VarExp varExp ? varExp.getVar() : null;
        }
        if (operand instanceof VarExp varExp) {
            return varExp.getVar();
        }
        return null;
    }
}
