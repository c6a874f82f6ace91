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

import org.junit.Test;
import pascal.cleak.ir.IRBuilder;
import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.BinaryExp;
import pascal.cleak.ir.type.PrimitiveType;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ConstantEvaluatorTest {

    private final IRBuilder b = new IRBuilder();

    private final Var x = b.param("x", PrimitiveType.INT);

    @Test
    public void testArithmetic() {
        assertEquals(Value.makeConstant(7),
                ConstantEvaluator.evaluate(b.add(b.lit(3), b.lit(4))));
        assertEquals(Value.makeConstant(-2),
                ConstantEvaluator.evaluate(b.neg(b.lit(2))));
        assertEquals(Value.makeConstant(1),
                ConstantEvaluator.evaluate(b.binary(BinaryExp.Op.REM, b.lit(7), b.lit(3))));
        assertEquals(Value.makeConstant(0), ConstantEvaluator.evaluate(b.nullptr()));
    }

    @Test
    public void testDivisionByZeroIsUndefined() {
        assertTrue(ConstantEvaluator.evaluate(
                b.binary(BinaryExp.Op.DIV, b.lit(1), b.lit(0))).isUndef());
        assertTrue(ConstantEvaluator.evaluate(
                b.binary(BinaryExp.Op.DIV, b.var(x), b.lit(0))).isUndef());
    }

    @Test
    public void testVariablesAreNotConstant() {
        assertTrue(ConstantEvaluator.evaluate(b.var(x)).isNAC());
        assertTrue(ConstantEvaluator.evaluate(b.add(b.var(x), b.lit(1))).isNAC());
    }

    @Test
    public void testConditions() {
        assertEquals(Boolean.FALSE, ConstantEvaluator.evaluateCondition(b.lit(0)));
        assertEquals(Boolean.TRUE, ConstantEvaluator.evaluateCondition(b.not(b.lit(0))));
        assertEquals(Boolean.TRUE, ConstantEvaluator.evaluateCondition(b.lt(b.lit(1), b.lit(2))));
        assertNull(ConstantEvaluator.evaluateCondition(b.var(x)));
    }

    @Test
    public void testShortCircuit() {
        assertEquals(Boolean.FALSE, ConstantEvaluator.evaluateCondition(
                b.and(b.var(x), b.lit(0))));
        assertEquals(Boolean.TRUE, ConstantEvaluator.evaluateCondition(
                b.or(b.lit(5), b.var(x))));
        assertNull(ConstantEvaluator.evaluateCondition(b.and(b.var(x), b.lit(1))));
        assertEquals(Boolean.TRUE, ConstantEvaluator.evaluateCondition(
                b.and(b.lit(1), b.lit(2))));
    }

    @Test
    public void testConditionalAndComma() {
        assertEquals(Value.makeConstant(4), ConstantEvaluator.evaluate(
                b.cond(b.lit(0), b.var(x), b.lit(4))));
        assertTrue(ConstantEvaluator.evaluate(
                b.cond(b.var(x), b.lit(1), b.lit(2))).isNAC());
        assertEquals(Value.makeConstant(9), ConstantEvaluator.evaluate(
                b.comma(b.var(x), b.lit(9))));
    }

    @Test
    public void testBoolCast() {
        Value value = ConstantEvaluator.evaluate(b.cast(PrimitiveType.BOOL, b.lit(42)));
        assertEquals(Value.makeBool(true), value);
        assertFalse(ConstantEvaluator.evaluate(b.cast(PrimitiveType.LONG, b.lit(42)))
                .equals(Value.makeBool(true)));
    }
}
