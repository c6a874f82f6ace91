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

import pascal.cleak.ir.Node;
import pascal.cleak.ir.SyntaxGraph;
import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.ArrayAccess;
import pascal.cleak.ir.exp.BinaryExp;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.exp.CastExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.FieldAccess;
import pascal.cleak.ir.exp.InitListExp;
import pascal.cleak.ir.exp.LambdaExp;
import pascal.cleak.ir.exp.UnaryExp;
import pascal.cleak.ir.exp.UnevaluatedExp;
import pascal.cleak.ir.exp.VarExp;
import pascal.cleak.ir.stmt.Return;
import pascal.cleak.ir.type.PointerType;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.ir.type.Type;
import pascal.cleak.ir.type.UnknownType;

/**
 * How the value of a {@code return} or {@code throw} statement uses
 * a variable.
 */
enum ReturnUsage {

    NONE,

    /**
     * The variable is dereferenced.
     */
    DEREF,

    /**
     * The pointer itself escapes, e.g., it is returned or
     * passed to a call.
     */
    PTR,
    ;

    /**
     * @param graph     graph of the statement
     * @param stmt      the return or throw statement
     * @param value     its value, may be null
     * @param var       the variable
     * @param boolValue whether the function returns {@code bool}, in which
     *                  case returning the pointer does not hand it over
     */
    static ReturnUsage of(SyntaxGraph graph, Node stmt, Exp value, Var var, boolean boolValue) {
        if (value == null) {
            return NONE;
        }
        for (Node node : graph.walk(value,
                n -> n instanceof UnevaluatedExp || n instanceof LambdaExp)) {
            if (node instanceof VarExp varExp && varExp.getVar() == var) {
                ReturnUsage usage = classify(graph, stmt, varExp, boolValue);
                if (usage != NONE) {
                    return usage;
                }
            }
        }
        return NONE;
    }

    private static ReturnUsage classify(SyntaxGraph graph, Node stmt,
                                        VarExp varExp, boolean boolValue) {
        Node parent = graph.getParent(varExp);
        if (parent instanceof FieldAccess access && access.getBase() == varExp) {
            // &p->f only computes an address
            return graph.getParent(access) instanceof UnaryExp unary
                    && unary.getOperator() == UnaryExp.Op.ADDRESS_OF ? PTR : DEREF;
        }
        if ((parent instanceof ArrayAccess access && access.getBase() == varExp)
                || (parent instanceof CallExp call && call.getReceiver() == varExp)) {
            return DEREF;
        }
        Node top = varExp;
        parent = graph.getParent(top);
        while (parent instanceof CastExp cast && keepsPointer(cast.getType().type())) {
            top = parent;
            parent = graph.getParent(top);
        }
        if (parent instanceof UnaryExp unary) {
            return unary.getOperator() == UnaryExp.Op.DEREF ? DEREF : NONE;
        }
        if (parent == stmt) {
            return stmt instanceof Return && !boolValue ? PTR : NONE;
        }
        if (parent instanceof CallExp call) {
            return call.getArgs().contains(top) ? PTR : NONE;
        }
        if (parent instanceof InitListExp) {
            return PTR;
        }
        if (parent instanceof BinaryExp binary) {
            return switch (binary.getOperator()) {
                case COMMA -> PTR;
                case ADD -> binary.getOperand1() == top ? PTR : NONE;
                default -> NONE;
            };
        }
        return NONE;
    }

    /**
     * A cast keeps the pointer if its target type can hold it.
     */
    private static boolean keepsPointer(Type type) {
        if (type instanceof PointerType) {
            return true;
        }
        if (type instanceof PrimitiveType primitive) {
            return primitive.getSize() == 0
                    || primitive.getSize() >= PrimitiveType.POINTER_SIZE;
        }
        return type != UnknownType.UNKNOWN;
    }
}
