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
import pascal.cleak.ir.exp.AssignExp;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.exp.CastExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.FieldAccess;
import pascal.cleak.ir.exp.LambdaExp;
import pascal.cleak.ir.exp.UnaryExp;
import pascal.cleak.ir.exp.UnevaluatedExp;
import pascal.cleak.ir.exp.VarExp;
import pascal.cleak.ir.stmt.AssignStmt;
import pascal.cleak.ir.stmt.DeclStmt;
import pascal.cleak.ir.stmt.Return;
import pascal.cleak.ir.stmt.Stmt;
import pascal.cleak.ir.type.ContainerType;
import pascal.cleak.library.AllocFunc;
import pascal.cleak.library.Direction;
import pascal.cleak.library.Library;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Interprets the effects of calls and expressions on the allocation
 * records of their variable arguments.
 */
class CallInterpreter {

    private final Library library;

    private final SyntaxGraph graph;

    private final LeakReporter reporter;

    private final SmartPointers smartPointers;

    CallInterpreter(Library library, SyntaxGraph graph, LeakReporter reporter) {
        this.library = library;
        this.graph = graph;
        this.reporter = reporter;
        this.smartPointers = new SmartPointers(library, graph);
    }

    SmartPointers getSmartPointers() {
        return smartPointers;
    }

    /**
     * @return the deallocation performed by the call,
     * or an {@link AllocStatus#UNALLOCATED} event if it performs none.
     */
    AllocInfo callEffect(CallExp call) {
        return library.getDeallocator(call)
                .map(f -> new AllocInfo(f.family(), AllocStatus.DEALLOCATED, call))
                .orElseGet(() -> new AllocInfo(Library.UNKNOWN, AllocStatus.UNALLOCATED, call));
    }

    /**
     * Applies a call to its arguments.
     *
     * @param call        the call
     * @param fact        the fact to update
     * @param effect      the effect of the call on variable arguments
     *                    without a deallocator of their own
     * @param deallocator if non-null, only the argument it releases is
     *                    considered
     */
    void functionCall(CallExp call, AllocFact fact, AllocInfo effect, AllocFunc deallocator) {
        if (library.getReallocator(call).isPresent() || isContainerCall(call)) {
            return;
        }
        boolean leakIgnore = library.isLeakIgnore(library.getFunctionName(call));
        int argNr = 0;
        for (Exp argExp : call.getArgs()) {
            ++argNr;
            Exp arg = CastExp.strip(argExp);
            boolean addressOf = false;
            Exp target = arg;
            if (arg instanceof UnaryExp unary && unary.getOperator() == UnaryExp.Op.ADDRESS_OF) {
                addressOf = true;
                target = unary.getOperand();
            }
            Var var = getTrackable(target);
            if (var != null) {
                if (deallocator == null || deallocator.arg() == argNr) {
                    argument(call, fact, effect, argNr, target, var, addressOf, leakIgnore);
                }
            } else if (arg instanceof CallExp constructor && library.isSmartPointer(constructor)) {
                smartPointerArgument(constructor, fact);
            } else {
                scan(argExp, fact, leakIgnore);
            }
        }
    }

    private void argument(CallExp call, AllocFact fact, AllocInfo effect, int argNr,
                          Exp target, Var var, boolean addressOf, boolean leakIgnore) {
        AllocInfo dealloc = library.getDeallocator(call)
                .map(f -> new AllocInfo(f.family(), AllocStatus.DEALLOCATED, call))
                .orElse(null);
        Optional<AllocFunc> allocator = library.getAllocator(call);
        if (allocator.isPresent()) {
            if (dealloc != null) {
                changeAllocStatus(fact, dealloc, call, var, addressOf);
            }
            AllocFunc func = allocator.get();
            if (func.arg() == argNr
                    && !(var.isArgument() && var.getPointerDepth() > 1)
                    && (addressOf || var.getPointerDepth() == 2)) {
                // allocation through an out-parameter
                leakIfAllocated(fact, var, target);
                fact.put(var.getId(), new AllocInfo(func.family(), AllocStatus.ALLOCATED, target));
            }
        } else if (leakIgnore) {
            if (target instanceof VarExp varExp) {
                checkVar(varExp, fact);
            }
        } else {
            changeAllocStatus(fact, dealloc != null ? dealloc : effect, call, var, addressOf);
        }
    }

    /**
     * Calls on string-like containers never take part
     * in resource management.
     */
    private boolean isContainerCall(CallExp call) {
        if (call.isConstructor() && call.getConstructedType().type() instanceof ContainerType c
                && c.stringLike()) {
            return true;
        }
        return library.isContainerBuiltin(call);
    }

    /**
     * @return the variable denoted by a plain variable or member access
     * argument, or null if the argument is anything else.
     */
    static Var getTrackable(Exp exp) {
        Var var = null;
        if (exp instanceof VarExp varExp) {
            var = varExp.getVar();
        } else if (exp instanceof FieldAccess access && isNamePath(access.getBase())) {
            var = access.getField();
        }
        return var != null && !var.isArray() ? var : null;
    }

    private static boolean isNamePath(Exp exp) {
        return exp instanceof VarExp
                || (exp instanceof FieldAccess access && isNamePath(access.getBase()));
    }

    /**
     * Hands the raw pointer wrapped by a smart-pointer temporary over
     * to the smart pointer.
     */
    private void smartPointerArgument(CallExp constructor, AllocFact fact) {
        VarExp pointer = SmartPointers.getWrappedPointer(constructor);
        if (pointer == null) {
            return;
        }
        AllocInfo ownership = smartPointers.ownership(constructor);
        if (ownership == null) {
            fact.erase(pointer.getVar().getId());
        } else {
            changeAllocStatus(fact, ownership, pointer, pointer.getVar(), false);
        }
    }

    /**
     * Applies an ownership event to the record of a variable.
     *
     * @param fact       the fact to update
     * @param event      the event; its origin becomes the new origin of the record
     * @param node       the node where the event happens, for diagnostics
     * @param var        the affected variable
     * @param addressOf  whether the address of the variable was passed
     */
    void changeAllocStatus(AllocFact fact, AllocInfo event, Node node, Var var, boolean addressOf) {
        int id = var.getId();
        AllocInfo info = fact.get(id);
        if (info != null) {
            if (event.getOrigin() instanceof CallExp call
                    && library.getAllocator(call).isPresent()) {
                // the callee also allocates, e.g., fdopen
                fact.erase(id);
                return;
            }
            if (event.getStatus() == AllocStatus.UNALLOCATED) {
                if (event.getOrigin() instanceof CallExp call) {
                    fact.putUsage(id, new Usage(call, Usage.Kind.USED));
                }
                if (info.getStatus() == AllocStatus.DEALLOCATED && addressOf) {
                    fact.erase(id);
                }
            } else if (info.managed()) {
                reporter.doubleFree(node, info.getOrigin(), var.getName(), event.getFamily());
                info.setStatus(event.getStatus());
            } else if (info.getFamily() != event.getFamily()
                    && info.getFamily() != Library.UNKNOWN) {
                reporter.mismatch(node, info.getOrigin(), var.getName());
                fact.erase(id);
            } else {
                info.setFamily(event.getFamily());
                info.setStatus(event.getStatus());
                info.setOrigin(event.getOrigin());
            }
        } else if (event.getStatus() != AllocStatus.UNALLOCATED
                && event.getStatus() != AllocStatus.OWNED
                && !(graph.getEnclosingStmt(node) instanceof Return)) {
            fact.put(id, new AllocInfo(Library.UNKNOWN, AllocStatus.DEALLOCATED, event.getOrigin()));
        }
    }

    /**
     * Installs the record of {@code var = call} if the call reallocates,
     * marking the reallocated argument.
     */
    void changeAllocStatusIfRealloc(AllocFact fact, CallExp call, Var var) {
        Optional<AllocFunc> realloc = library.getReallocator(call);
        if (realloc.isEmpty() || !realloc.get().returnsResource()) {
            return;
        }
        AllocFunc func = realloc.get();
        if (func.reallocArg() <= 0 || func.reallocArg() > call.getArgCount()) {
            return;
        }
        int from = AllocInfo.NONE;
        if (call.getArg(func.reallocArg() - 1) instanceof VarExp arg) {
            from = arg.getVar().getId();
            AllocInfo argAlloc = fact.get(from);
            if (argAlloc != null) {
                if (argAlloc.getFamily() != Library.UNKNOWN
                        && argAlloc.getFamily() != func.family()) {
                    reporter.mismatch(call, argAlloc.getOrigin(), arg.getVar().getName());
                }
                argAlloc.setStatus(AllocStatus.REALLOCATED);
                argAlloc.setOrigin(call);
            }
        }
        fact.put(var.getId(), new AllocInfo(func.family(), AllocStatus.ALLOCATED, call, from));
    }

    /**
     * Reports a leak if the variable holds an allocated resource that is
     * about to be overwritten.
     */
    void leakIfAllocated(AllocFact fact, Var var, Node node) {
        AllocInfo info = fact.get(var.getId());
        if (info != null && info.getStatus() == AllocStatus.ALLOCATED) {
            Usage usage = fact.getUsage(var.getId());
            if (usage == null) {
                reporter.leak(node, var.getName(), info.getFamily());
            } else {
                reporter.configurationInfo(node, usage);
            }
        }
    }

    /**
     * @return the library call that allocated through the argument
     * containing {@code origin}, or null if the origin is not an
     * out-parameter of an allocator.
     */
    CallExp outParamAllocation(Node origin) {
        if (origin == null) {
            return null;
        }
        Node child = origin;
        for (Node parent = graph.getParent(origin);
             parent != null && !(parent instanceof Stmt);
             parent = graph.getParent(parent)) {
            if (parent instanceof CallExp call) {
                int position = call.getArgs().indexOf(child) + 1;
                if (position > 0) {
                    return library.getAllocator(call)
                            .filter(f -> f.arg() == position)
                            .map(f -> call)
                            .orElse(null);
                }
            }
            child = parent;
        }
        return null;
    }

    /**
     * @return the variable that receives the result of the call,
     * or null if the result is not assigned to a variable.
     */
    Var resultVar(CallExp call) {
        Node parent = graph.getParent(call);
        Exp lvalue = null;
        if (parent instanceof AssignStmt assign && assign.getRValue() == call) {
            lvalue = assign.getLValue();
        } else if (parent instanceof AssignExp assign && assign.getRValue() == call) {
            lvalue = assign.getLValue();
        } else if (parent instanceof DeclStmt decl && decl.getInitializer() == call) {
            return decl.getVar();
        }
        return lvalue instanceof VarExp varExp ? varExp.getVar() : null;
    }

    /**
     * Stops tracking variables whose address is passed to an input
     * argument of a library function that writes through another argument,
     * e.g., {@code memcpy(&dst, &p, sizeof(p))}.
     */
    void outParamBailout(CallExp call, AllocFact fact) {
        int argCount = call.getArgCount();
        boolean hasOut = false;
        for (int i = 1; i <= argCount; ++i) {
            if (library.getArgDirection(call, i).contains(Direction.OUT)) {
                hasOut = true;
                break;
            }
        }
        if (!hasOut) {
            return;
        }
        for (int i = 1; i <= argCount; ++i) {
            if (!library.getArgDirection(call, i).contains(Direction.IN)) {
                continue;
            }
            Exp arg = call.getArg(i - 1);
            int indirect = 0;
            while (arg instanceof UnaryExp unary && unary.getOperator() == UnaryExp.Op.ADDRESS_OF) {
                arg = unary.getOperand();
                ++indirect;
            }
            if (arg instanceof VarExp varExp && indirect > 0) {
                fact.erase(varExp.getVar().getId());
            }
        }
    }

    /**
     * Scans an expression for uses of tracked variables and for calls.
     *
     * @param inFuncCall if true, nested calls are not interpreted
     */
    void scan(Exp exp, AllocFact fact, boolean inFuncCall) {
        if (exp == null || exp instanceof UnevaluatedExp || exp instanceof LambdaExp) {
            return;
        }
        if (exp instanceof VarExp varExp) {
            checkVar(varExp, fact);
            return;
        }
        if (!inFuncCall && exp instanceof CallExp call) {
            scan(call.getReceiver(), fact, false);
            functionCall(call, fact, callEffect(call), null);
            if (library.getReturnedArg(call).isPresent()) {
                // the result aliases an argument
                call.getArgs().forEach(arg -> scan(arg, fact, false));
            }
            return;
        }
        for (Node child : exp.getChildren()) {
            if (child instanceof Exp e) {
                scan(e, fact, inFuncCall);
            }
        }
    }

    /**
     * Checks one use of a tracked variable: a dereference after free is
     * an error, and copying the pointer elsewhere stops its tracking.
     */
    void checkVar(VarExp varExp, AllocFact fact) {
        Var var = varExp.getVar();
        AllocInfo info = fact.get(var.getId());
        if (info == null) {
            return;
        }
        if (info.getStatus() == AllocStatus.DEALLOCATED && var.isPointer()
                && isDereferenced(varExp)) {
            reporter.deallocUse(varExp, var.getName());
            return;
        }
        Node parent = graph.getParent(varExp);
        if (parent instanceof UnaryExp unary && unary.getOperator() == UnaryExp.Op.ADDRESS_OF
                && isAssignedValue(unary)) {
            // q = &p
            fact.erase(var.getId());
            return;
        }
        Node value = varExp;
        while (parent != null && !(parent instanceof Stmt) && !(parent instanceof AssignExp)) {
            value = parent;
            parent = graph.getParent(parent);
        }
        if (!isAssignedValue(value)) {
            return;
        }
        Exp rhs = CastExp.strip((Exp) value);
        if (rhs == varExp || rhs instanceof FieldAccess) {
            fact.erase(var.getId());
        } else if (rhs instanceof CallExp call) {
            OptionalInt returned = library.getReturnedArg(call);
            if (returned.isPresent() && returned.getAsInt() == argumentPosition(call, varExp)) {
                fact.erase(var.getId());
            }
        }
    }

    /**
     * @return true if the node is the value assigned by its parent.
     */
    boolean isAssignedValue(Node node) {
        Node parent = graph.getParent(node);
        if (parent instanceof AssignStmt assign) {
            return assign.getRValue() == node;
        }
        if (parent instanceof AssignExp assign) {
            return assign.getRValue() == node;
        }
        if (parent instanceof DeclStmt decl) {
            return decl.getInitializer() == node;
        }
        return false;
    }

    /**
     * @return 1-based position of the argument of {@code call} that
     * contains {@code node}, or 0 if there is none.
     */
    private int argumentPosition(CallExp call, Node node) {
        List<Exp> args = call.getArgs();
        for (int i = 0; i < args.size(); ++i) {
            if (graph.isWithin(node, args.get(i))) {
                return i + 1;
            }
        }
        return 0;
    }

    private boolean isDereferenced(VarExp varExp) {
        Node child = varExp;
        Node parent = graph.getParent(varExp);
        while (parent instanceof CastExp) {
            child = parent;
            parent = graph.getParent(parent);
        }
        if (parent instanceof UnaryExp unary) {
            return unary.getOperator() == UnaryExp.Op.DEREF;
        }
        if (parent instanceof ArrayAccess access) {
            return access.getBase() == child;
        }
        if (parent instanceof FieldAccess access) {
            return access.isArrow() && access.getBase() == child;
        }
        if (parent instanceof CallExp call) {
            return call.isArrow() && call.getReceiver() == child;
        }
        return false;
    }
}
