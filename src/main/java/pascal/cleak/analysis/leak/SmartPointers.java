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
import pascal.cleak.ir.exp.AssignExp;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.LambdaExp;
import pascal.cleak.ir.exp.NameExp;
import pascal.cleak.ir.exp.TypeExp;
import pascal.cleak.ir.exp.UnaryExp;
import pascal.cleak.ir.exp.UnevaluatedExp;
import pascal.cleak.ir.exp.VarExp;
import pascal.cleak.ir.stmt.AssignStmt;
import pascal.cleak.ir.stmt.Block;
import pascal.cleak.ir.stmt.DeclStmt;
import pascal.cleak.ir.stmt.Stmt;
import pascal.cleak.ir.type.ClassType;
import pascal.cleak.ir.type.TypeRef;
import pascal.cleak.library.AllocFunc;
import pascal.cleak.library.Library;

import java.util.List;
import java.util.Optional;

/**
 * Models smart pointers taking ownership of a raw pointer,
 * e.g., {@code std::unique_ptr<FILE, decltype(&fclose)> f(fp, &fclose)}.
 */
class SmartPointers {

    /**
     * Outcome of inspecting a deleter.
     *
     * @param resolved    whether the deleter could be inspected
     * @param deallocator the deallocator it calls, or null if none
     */
    private record Deleter(boolean resolved, AllocFunc deallocator) {

        private static final Deleter UNRESOLVED = new Deleter(false, null);

        private static Deleter of(Optional<AllocFunc> deallocator) {
            return new Deleter(true, deallocator.orElse(null));
        }
    }

    private final Library library;

    private final SyntaxGraph graph;

    SmartPointers(Library library, SyntaxGraph graph) {
        this.library = library;
        this.graph = graph;
    }

    /**
     * @return the raw pointer wrapped by the smart pointer constructor,
     * or null if the first argument is no plain variable.
     */
    static VarExp getWrappedPointer(CallExp constructor) {
        if (constructor.getArgCount() > 0
                && constructor.getArg(0) instanceof VarExp varExp) {
            return varExp;
        }
        return null;
    }

    /**
     * Describes the ownership the smart pointer takes: the allocation
     * family is the one released by its deleter, or that of {@code new}
     * or {@code new[]} if it has none.
     *
     * @return the ownership, or null if the deleter cannot be resolved.
     */
    AllocInfo ownership(CallExp constructor) {
        Exp deleter = getDeleter(constructor);
        AllocFunc func = null;
        if (deleter != null) {
            Deleter resolved = resolveDeleter(deleter);
            if (!resolved.resolved()) {
                return null;
            }
            func = resolved.deallocator();
        }
        int family;
        if (func != null) {
            family = func.family();
        } else {
            family = isArray(constructor) ? Library.NEW_ARRAY : Library.NEW;
        }
        return new AllocInfo(family, AllocStatus.OWNED, constructor);
    }

    private static Exp getDeleter(CallExp constructor) {
        if (constructor.getSimpleName().equals("unique_ptr")) {
            List<Exp> templateArgs = constructor.getTemplateArgs();
            return templateArgs.size() >= 2 ? templateArgs.get(1) : null;
        }
        return constructor.getArgCount() >= 2 ? constructor.getArg(1) : null;
    }

    private static boolean isArray(CallExp constructor) {
        List<Exp> templateArgs = constructor.getTemplateArgs();
        if (!templateArgs.isEmpty() && templateArgs.get(0) instanceof TypeExp type) {
            return type.getType().array();
        }
        TypeRef constructed = constructor.getConstructedType();
        return constructed != null && constructed.array();
    }

    private Deleter resolveDeleter(Exp deleter) {
        if (deleter instanceof UnevaluatedExp decltype
                && decltype.getKind() == UnevaluatedExp.Kind.DECLTYPE) {
            deleter = decltype.getOperand();
        }
        if (deleter instanceof UnaryExp unary && unary.getOperator() == UnaryExp.Op.PLUS) {
            // +[](T *p) { ... }
            deleter = unary.getOperand();
        }
        if (deleter instanceof UnaryExp unary && unary.getOperator() == UnaryExp.Op.ADDRESS_OF) {
            deleter = unary.getOperand();
        }
        if (deleter instanceof NameExp name) {
            Optional<AllocFunc> func = library.getDeallocator(name.getName());
            if (func.isPresent()) {
                return Deleter.of(func);
            }
            if (name.getFunction() != null && name.getFunction().hasBody()) {
                return Deleter.of(findDeallocator(name.getFunction().body()));
            }
            return Deleter.UNRESOLVED;
        }
        if (deleter instanceof LambdaExp lambda) {
            return Deleter.of(findDeallocator(lambda.getBody()));
        }
        ClassType classType = null;
        if (deleter instanceof TypeExp type
                && type.getType().type() instanceof ClassType c) {
            classType = c;
        } else if (deleter instanceof CallExp call && call.isConstructor()
                && call.getConstructedType().type() instanceof ClassType c) {
            classType = c;
        }
        if (classType != null) {
            for (Block body : classType.methodBodies()) {
                Optional<AllocFunc> func = findDeallocator(body);
                if (func.isPresent()) {
                    return Deleter.of(func);
                }
            }
            return Deleter.of(Optional.empty());
        }
        return Deleter.UNRESOLVED;
    }

    private Optional<AllocFunc> findDeallocator(Block body) {
        for (Node node : graph.walk(body, n -> false)) {
            if (node instanceof CallExp call) {
                Optional<AllocFunc> func = library.getDeallocator(call);
                if (func.isPresent()) {
                    return func;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return true if {@code sp.release()} is called on the smart pointer
     * declared by {@code decl} before it is reassigned, in the rest of
     * the enclosing block.
     */
    boolean isReleased(DeclStmt decl) {
        Var smartPointer = decl.getVar();
        if (!(graph.getParent(decl) instanceof Block block)) {
            return false;
        }
        List<Stmt> stmts = block.getStmts();
        for (Stmt stmt : stmts.subList(stmts.indexOf(decl) + 1, stmts.size())) {
            for (Node node : graph.walk(stmt, n -> false)) {
                if (!(node instanceof VarExp varExp) || varExp.getVar() != smartPointer) {
                    continue;
                }
                Node parent = graph.getParent(varExp);
                if (parent instanceof CallExp call && call.getReceiver() == varExp
                        && call.getName().equals("release") && call.getArgCount() == 0) {
                    return true;
                }
                if ((parent instanceof AssignStmt assign && assign.getLValue() == varExp)
                        || (parent instanceof AssignExp assignExp && assignExp.getLValue() == varExp)) {
                    return false;
                }
            }
        }
        return false;
    }
}
