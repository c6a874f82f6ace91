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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import pascal.cleak.analysis.constant.ConstantEvaluator;
import pascal.cleak.analysis.constant.Value;
import pascal.cleak.ir.Function;
import pascal.cleak.ir.IR;
import pascal.cleak.ir.Node;
import pascal.cleak.ir.SyntaxGraph;
import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.AssignExp;
import pascal.cleak.ir.exp.BinaryExp;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.exp.CastExp;
import pascal.cleak.ir.exp.ConditionalExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.FieldAccess;
import pascal.cleak.ir.exp.LambdaExp;
import pascal.cleak.ir.exp.NewExp;
import pascal.cleak.ir.exp.NullLiteral;
import pascal.cleak.ir.exp.UnaryExp;
import pascal.cleak.ir.exp.UnevaluatedExp;
import pascal.cleak.ir.exp.VarExp;
import pascal.cleak.ir.stmt.AssignStmt;
import pascal.cleak.ir.stmt.Block;
import pascal.cleak.ir.stmt.Break;
import pascal.cleak.ir.stmt.Continue;
import pascal.cleak.ir.stmt.DeclStmt;
import pascal.cleak.ir.stmt.Delete;
import pascal.cleak.ir.stmt.ExpStmt;
import pascal.cleak.ir.stmt.Goto;
import pascal.cleak.ir.stmt.If;
import pascal.cleak.ir.stmt.Label;
import pascal.cleak.ir.stmt.LoopStmt;
import pascal.cleak.ir.stmt.Return;
import pascal.cleak.ir.stmt.Stmt;
import pascal.cleak.ir.stmt.StmtVisitor;
import pascal.cleak.ir.stmt.Throw;
import pascal.cleak.ir.stmt.Try;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.library.AllocFunc;
import pascal.cleak.library.Library;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the body of one function in program order and keeps the
 * allocation state of its local variables up to date.
 * <p>
 * Each block is checked by {@link #checkScope}; an {@code if} checks its
 * branches on private copies of the state and merges them afterwards.
 * When the control flow cannot be followed (loops, {@code goto},
 * exception handlers) the state is discarded and the checker gives up
 * on the rest of the function.
 */
class LeakChecker {

    private static final Logger logger = LogManager.getLogger(LeakChecker.class);

    private final IR ir;

    private final SyntaxGraph graph;

    private final Library library;

    private final LeakReporter reporter;

    private final CallInterpreter calls;

    private final int recursionLimit;

    LeakChecker(IR ir, Library library, LeakReporter reporter, int recursionLimit) {
        this.ir = ir;
        this.graph = ir.getGraph();
        this.library = library;
        this.reporter = reporter;
        this.calls = new CallInterpreter(library, graph, reporter);
        this.recursionLimit = recursionLimit;
    }

    /**
     * Checks the whole function.
     *
     * @return false if the checker gave up before the end of the function.
     * @throws AnalysisLimitException if blocks are nested too deeply
     */
    boolean check() {
        return checkScope(ir.getBody(), new AllocFact(), new HashSet<>(), 0);
    }

    /**
     * Checks the statements of a block, then reports the variables whose
     * scope ends with it.
     *
     * @param notZero ids of variables known to hold a non-zero value;
     *                updates stay local to the block
     * @return false if tracking was abandoned.
     */
    private boolean checkScope(Block block, AllocFact fact, Set<Integer> notZero, int depth) {
        if (++depth > recursionLimit) {
            throw new AnalysisLimitException(
                    ir.getFunction().name(), recursionLimit, block);
        }
        ScopeVisitor visitor = new ScopeVisitor(fact, new HashSet<>(notZero), depth,
                fact.getConditionalAlloc());
        for (Stmt stmt : block.getStmts()) {
            if (!stmt.accept(visitor)) {
                return false;
            }
        }
        ret(block.getEnd(), null, fact, true, block);
        return true;
    }

    private class ScopeVisitor implements StmtVisitor<Boolean> {

        private final AllocFact fact;

        private final Set<Integer> notZero;

        private final int depth;

        /**
         * Variables conditionally allocated when the block was entered.
         */
        private final Set<Integer> conditionalAtEntry;

        private ScopeVisitor(AllocFact fact, Set<Integer> notZero, int depth,
                             Set<Integer> conditionalAtEntry) {
            this.fact = fact;
            this.notZero = notZero;
            this.depth = depth;
            this.conditionalAtEntry = conditionalAtEntry;
        }

        @Override
        public Boolean visit(Block stmt) {
            return checkScope(stmt, fact, notZero, depth);
        }

        @Override
        public Boolean visit(DeclStmt stmt) {
            Var var = stmt.getVar();
            Exp init = stmt.getInitializer();
            if (init == null) {
                return true;
            }
            if (var.isReference()) {
                if (init instanceof VarExp source) {
                    fact.addReferenced(source.getVar().getId());
                } else {
                    calls.scan(init, fact, false);
                }
                return true;
            }
            if (init instanceof CallExp ctor && library.isSmartPointer(ctor)) {
                smartPointer(stmt, ctor);
                return true;
            }
            if (init instanceof CallExp ctor && ctor.isConstructor()
                    && !var.isPointer() && !(var.getType() instanceof PrimitiveType)) {
                // construction of a local object
                calls.functionCall(ctor, fact, calls.callEffect(ctor), null);
                return true;
            }
            assign(stmt.getDeclarator(), init);
            return true;
        }

        @Override
        public Boolean visit(AssignStmt stmt) {
            assign(stmt.getLValue(), stmt.getRValue());
            return true;
        }

        @Override
        public Boolean visit(ExpStmt stmt) {
            Exp exp = stmt.getExp();
            if (exp instanceof AssignExp assign) {
                assign(assign.getLValue(), assign.getRValue());
            } else if (exp instanceof CallExp call && call.getReceiver() == null) {
                calls.outParamBailout(call, fact);
                AllocInfo effect = calls.callEffect(call);
                AllocFunc deallocator = library.getDeallocator(call).orElse(null);
                calls.functionCall(call, fact, effect, deallocator);
                if (effect.getStatus() == AllocStatus.UNALLOCATED && isLastInBlock(stmt)) {
                    possiblyNoReturn(call);
                }
            } else {
                calls.scan(exp, fact, false);
            }
            return true;
        }

        @Override
        public Boolean visit(If stmt) {
            Exp cond = stmt.getCondition();
            Boolean known = ConstantEvaluator.evaluateCondition(cond);
            scanCondition(cond);
            AllocFact thenFact = fact.copy();
            AllocFact elseFact = fact.copy();
            Exp comparisons = cond;
            while (comparisons instanceof BinaryExp comma
                    && comma.getOperator() == BinaryExp.Op.COMMA) {
                comparisons = comma.getOperand2();
            }
            applyComparisons(comparisons, thenFact, elseFact);
            if (!Boolean.FALSE.equals(known)
                    && !checkScope(stmt.getThen(), thenFact, notZero, depth)) {
                return abandon(stmt, "then branch");
            }
            if (stmt.hasElse() && !Boolean.TRUE.equals(known)
                    && !checkScope(stmt.getElse(), elseFact, notZero, depth)) {
                return abandon(stmt, "else branch");
            }
            if (known != null) {
                fact.copyFrom(known ? thenFact : elseFact);
            } else {
                BranchMerger.merge(fact, thenFact, elseFact);
            }
            return true;
        }

        @Override
        public Boolean visit(Return stmt) {
            ret(stmt, stmt.getValue(), fact, false, null);
            fact.clear();
            return true;
        }

        @Override
        public Boolean visit(Throw stmt) {
            if (!isInsideTry(stmt)) {
                ret(stmt, stmt.getException(), fact, false, null);
            }
            fact.clear();
            return true;
        }

        @Override
        public Boolean visit(Delete stmt) {
            Exp operand = stmt.getOperand();
            if (operand instanceof FieldAccess || operand instanceof NullLiteral) {
                return true;
            }
            if (operand instanceof VarExp varExp) {
                int family = stmt.isArray() ? Library.NEW_ARRAY : Library.NEW;
                calls.changeAllocStatus(fact,
                        new AllocInfo(family, AllocStatus.DEALLOCATED, stmt),
                        varExp, varExp.getVar(), false);
            } else {
                calls.scan(operand, fact, false);
            }
            return true;
        }

        @Override
        public Boolean visit(Goto stmt) {
            return abandon(stmt, "goto");
        }

        @Override
        public Boolean visit(Label stmt) {
            return true;
        }

        @Override
        public Boolean visit(Break stmt) {
            fact.clear();
            return true;
        }

        @Override
        public Boolean visit(Continue stmt) {
            fact.clear();
            return true;
        }

        @Override
        public Boolean visit(LoopStmt stmt) {
            return abandon(stmt, stmt.getText());
        }

        @Override
        public Boolean visit(Try stmt) {
            if (!checkScope(stmt.getBody(), fact, notZero, depth)) {
                return false;
            }
            if (!stmt.getHandlers().isEmpty()) {
                return abandon(stmt, "catch");
            }
            return true;
        }

        @Override
        public Boolean visitDefault(Stmt stmt) {
            return true;
        }

        private boolean abandon(Stmt stmt, String reason) {
            logger.debug("Abandon {} at line {}: {}",
                    ir.getFunction().name(), stmt.getLineNumber(), reason);
            fact.clear();
            return false;
        }

        private void smartPointer(DeclStmt decl, CallExp ctor) {
            SmartPointers smartPointers = calls.getSmartPointers();
            VarExp pointer = SmartPointers.getWrappedPointer(ctor);
            if (pointer == null) {
                ctor.getArgs().forEach(arg -> calls.scan(arg, fact, false));
                return;
            }
            if (smartPointers.isReleased(decl)) {
                return;
            }
            AllocInfo ownership = smartPointers.ownership(ctor);
            if (ownership == null) {
                logger.debug("Unresolved deleter of {} in {}",
                        decl.getVar().getName(), ir.getFunction().name());
                fact.erase(pointer.getVar().getId());
                return;
            }
            calls.changeAllocStatus(fact, ownership, pointer, pointer.getVar(), false);
        }

        /**
         * Handles {@code lvalue = rvalue}, including initialization.
         */
        private void assign(Exp lvalue, Exp rvalue) {
            Var var = assignedVar(lvalue);
            if (var == null) {
                calls.scan(lvalue, fact, false);
                calls.scan(rvalue, fact, false);
                return;
            }
            int id = var.getId();
            Var source = copiedVar(rvalue);
            if (source != null && source != var) {
                // no tracking of more than one variable per resource
                calls.leakIfAllocated(fact, var, lvalue);
                fact.erase(id);
                eraseVars(rvalue);
            }
            Exp value = CastExp.strip(rvalue);
            if (!uses(value, var)) {
                if (!conditionalAtEntry.contains(id)) {
                    calls.leakIfAllocated(fact, var, lvalue);
                }
                fact.erase(id);
                if (Variables.isLocalVarNoAutoDealloc(var, rvalue, ir.isCpp())) {
                    if (value instanceof CallExp call) {
                        library.getAllocator(call)
                                .filter(AllocFunc::returnsResource)
                                .ifPresent(f -> fact.put(id,
                                        new AllocInfo(f.family(), AllocStatus.ALLOCATED, call)));
                        calls.changeAllocStatusIfRealloc(fact, call, var);
                    } else if (ir.isCpp() && value instanceof NewExp newExp
                            && !newExp.isPlacement()) {
                        fact.put(id, new AllocInfo(
                                newExp.isArray() ? Library.NEW_ARRAY : Library.NEW,
                                AllocStatus.ALLOCATED, newExp));
                    }
                    Value constant = ConstantEvaluator.evaluate(rvalue);
                    if (constant.isConstant() && constant.getConstant() != 0) {
                        notZero.add(id);
                    } else {
                        notZero.remove(id);
                    }
                }
            }
            if (!(lvalue instanceof VarExp)) {
                calls.scan(lvalue, fact, false);
            }
            calls.scan(rvalue, fact, false);
        }

        private void eraseVars(Exp exp) {
            for (Node node : graph.walk(exp, n -> false)) {
                Var var = node instanceof Exp e ? CallInterpreter.getTrackable(e) : null;
                if (var != null) {
                    fact.erase(var.getId());
                }
            }
        }

        /**
         * Interprets the calls and assignments of an {@code if} condition.
         */
        private void scanCondition(Exp exp) {
            if (exp == null || exp instanceof UnevaluatedExp || exp instanceof LambdaExp) {
                return;
            }
            if (exp instanceof CallExp call) {
                scanCondition(call.getReceiver());
                AllocInfo noAlloc = new AllocInfo(Library.UNKNOWN, AllocStatus.UNALLOCATED, call);
                calls.functionCall(call, fact, noAlloc,
                        library.getDeallocator(call).orElse(null));
                return;
            }
            if (exp instanceof VarExp varExp) {
                calls.checkVar(varExp, fact);
                Node parent = graph.getParent(varExp);
                if (parent instanceof AssignExp assign && assign.getLValue() == varExp
                        && !(graph.getParent(assign) instanceof AssignExp)
                        && Variables.isLocalVarNoAutoDealloc(
                                varExp.getVar(), assign.getRValue(), ir.isCpp())) {
                    conditionAssignment(varExp.getVar(), assign.getRValue());
                }
                return;
            }
            for (Node child : exp.getChildren()) {
                if (child instanceof Exp e) {
                    scanCondition(e);
                }
            }
        }

        /**
         * Handles an allocation assigned inside a condition,
         * e.g., {@code if ((p = malloc(n)) == NULL)}.
         */
        private void conditionAssignment(Var var, Exp rvalue) {
            int id = var.getId();
            Exp value = CastExp.strip(rvalue);
            if (value instanceof CallExp call) {
                Optional<AllocFunc> allocator = library.getAllocator(call)
                        .filter(AllocFunc::returnsResource);
                if (allocator.isPresent()) {
                    fact.put(id, new AllocInfo(
                            allocator.get().family(), AllocStatus.ALLOCATED, call));
                } else {
                    fact.erase(id);
                }
                calls.changeAllocStatusIfRealloc(fact, call, var);
            } else if (ir.isCpp() && value instanceof NewExp newExp && !newExp.isPlacement()) {
                fact.put(id, new AllocInfo(
                        newExp.isArray() ? Library.NEW_ARRAY : Library.NEW,
                        AllocStatus.ALLOCATED, newExp));
            }
        }

        /**
         * Refines the branch copies by the comparisons of a condition.
         */
        private void applyComparisons(Exp cond, AllocFact thenFact, AllocFact elseFact) {
            if (cond instanceof BinaryExp binary
                    && (binary.getOperator() == BinaryExp.Op.LOGICAL_AND
                    || binary.getOperator() == BinaryExp.Op.LOGICAL_OR)) {
                applyComparisons(binary.getOperand1(), thenFact, elseFact);
                applyComparisons(binary.getOperand2(), thenFact, elseFact);
                return;
            }
            if (cond instanceof CallExp call) {
                if (call.getReceiver() == null && isLikely(call.getName())) {
                    if (call.getArgCount() > 0) {
                        applyComparisons(call.getArg(0), thenFact, elseFact);
                    }
                    return;
                }
                for (Exp arg : call.getArgs()) {
                    if (!(arg instanceof BinaryExp comparison)
                            || !comparison.getOperator().isComparison()) {
                        continue;
                    }
                    Var var = ConditionPatterns.matchSuccess(arg);
                    if (var == null) {
                        var = ConditionPatterns.matchFailure(arg);
                    }
                    if (var != null) {
                        thenFact.erase(var.getId());
                        elseFact.erase(var.getId());
                    }
                }
                return;
            }
            Var var = ConditionPatterns.matchSuccess(cond);
            if (var != null) {
                int id = var.getId();
                elseFact.reallocToAlloc(id);
                elseFact.erase(id);
                if (ConditionPatterns.matchComparison(cond, BinaryExp.Op.NE, 0) == var
                        && notZero.contains(id)) {
                    elseFact.clear();
                }
                if (testsOutParamResult(thenFact, var)) {
                    thenFact.clear();
                }
                return;
            }
            var = ConditionPatterns.matchFailure(cond);
            if (var != null) {
                thenFact.reallocToAlloc(var.getId());
                thenFact.erase(var.getId());
            }
        }

        /**
         * @return true if {@code var} holds the result of a call that
         * allocated through an out-parameter.
         */
        private boolean testsOutParamResult(AllocFact branch, Var var) {
            for (AllocInfo info : branch.getAllocs().values()) {
                if (info.getStatus() != AllocStatus.ALLOCATED) {
                    continue;
                }
                CallExp call = calls.outParamAllocation(info.getOrigin());
                if (call != null && calls.resultVar(call) == var) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Handles a call that ends its block and may not return.
         */
        private void possiblyNoReturn(CallExp call) {
            Optional<Boolean> noReturn = library.isNoReturn(call);
            if (noReturn.isPresent()) {
                if (noReturn.get()) {
                    fact.clear();
                }
                return;
            }
            Function callee = call.getFunction();
            if (callee != null) {
                if (callee.noReturn()) {
                    fact.clear();
                    return;
                }
                if (!callee.hasBody() || !endsWithNoReturn(callee.body())) {
                    return;
                }
            }
            String name = library.getFunctionName(call);
            if (!library.isLeakIgnore(name) && !library.isUse(name)) {
                fact.possibleUsageAll(new Usage(call, call.getArgCount() == 0
                        ? Usage.Kind.NO_RETURN : Usage.Kind.USED));
            }
        }

        private boolean isLastInBlock(Stmt stmt) {
            if (graph.getParent(stmt) instanceof Block block) {
                List<Stmt> stmts = block.getStmts();
                return stmts.get(stmts.size() - 1) == stmt;
            }
            return false;
        }
    }

    /**
     * Reports the tracked variables that are lost when control reaches
     * {@code node}: a {@code return}, a {@code throw} or the end of a block.
     *
     * @param value        value of the return or throw, may be null
     * @param isEndOfScope whether {@code node} ends {@code scope}
     */
    private void ret(Node node, Exp value, AllocFact fact, boolean isEndOfScope, Block scope) {
        List<Integer> reported = new ArrayList<>();
        boolean boolValue = node instanceof Return && ir.getFunction().returnsBool();
        for (Map.Entry<Integer, AllocInfo> entry : fact.getAllocs().entrySet()) {
            int id = entry.getKey();
            AllocInfo info = entry.getValue();
            if (!isEndOfScope && !info.managed() && fact.isConditional(id)) {
                continue;
            }
            if (fact.isReferenced(id)) {
                continue;
            }
            Var var = ir.getVar(id);
            if (var == null) {
                continue;
            }
            if (isEndOfScope && !declares(scope, var)) {
                continue;
            }
            if (isCheckedOutParamAllocation(node, info)) {
                continue;
            }
            ReturnUsage used = ReturnUsage.of(graph, node, value, var, boolValue);
            if (used != ReturnUsage.NONE && info.getStatus() == AllocStatus.DEALLOCATED) {
                reporter.deallocReturn(node, info.getOrigin(), var.getName());
            } else if (used != ReturnUsage.PTR && !info.managed() && !var.isReference()) {
                Usage usage = fact.getUsage(id);
                if (usage == null) {
                    reporter.leak(node, var.getName(), info.getFamily());
                } else if (!usage.call().isConstructor()) {
                    reporter.configurationInfo(node, usage);
                }
            }
            reported.add(id);
        }
        reported.forEach(fact::erase);
    }

    private boolean declares(Block scope, Var var) {
        return scope.declares(var) || (scope == ir.getBody() && var.isArgument());
    }

    /**
     * @return true if {@code node} leaves a branch of an {@code if} whose
     * condition tests the result of the out-parameter allocation
     * that produced {@code info}.
     */
    private boolean isCheckedOutParamAllocation(Node node, AllocInfo info) {
        if (!(graph.getParent(node) instanceof Block block)
                || !(graph.getParent(block) instanceof If ifStmt)) {
            return false;
        }
        CallExp call = calls.outParamAllocation(info.getOrigin());
        if (call == null) {
            return false;
        }
        Exp cond = ifStmt.getCondition();
        if (graph.isWithin(info.getOrigin(), cond)) {
            Node parent = graph.getParent(call);
            return parent == ifStmt
                    || (parent instanceof BinaryExp comparison
                    && comparison.getOperator().isComparison());
        }
        Var result = calls.resultVar(call);
        return result != null && uses(cond, result);
    }

    private boolean isInsideTry(Stmt stmt) {
        for (Node n = graph.getParent(stmt); n != null; n = graph.getParent(n)) {
            if (n instanceof Try) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if the last statement of the body never returns.
     */
    private boolean endsWithNoReturn(Block body) {
        List<Stmt> stmts = body.getStmts();
        if (stmts.isEmpty()) {
            return false;
        }
        Stmt last = stmts.get(stmts.size() - 1);
        if (last instanceof Throw) {
            return true;
        }
        if (last instanceof ExpStmt expStmt && expStmt.getExp() instanceof CallExp call) {
            return library.isNoReturn(call).orElse(false)
                    || (call.getFunction() != null && call.getFunction().noReturn());
        }
        return false;
    }

    /**
     * @return true if the evaluated part of {@code exp} mentions {@code var}.
     */
    private boolean uses(Exp exp, Var var) {
        if (exp == null) {
            return false;
        }
        for (Node node : graph.walk(exp, n -> n instanceof UnevaluatedExp)) {
            if (node instanceof UnevaluatedExp) {
                continue;
            }
            if ((node instanceof VarExp varExp && varExp.getVar() == var)
                    || (node instanceof FieldAccess access && access.getField() == var)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the variable whose value the assignment sets, or null if
     * the target is not a variable.
     */
    private static Var assignedVar(Exp lvalue) {
        if (lvalue instanceof UnaryExp deref && deref.getOperator() == UnaryExp.Op.DEREF
                && deref.getOperand() instanceof UnaryExp addressOf
                && addressOf.getOperator() == UnaryExp.Op.ADDRESS_OF) {
            // *&p = ...
            return CallInterpreter.getTrackable(addressOf.getOperand());
        }
        return CallInterpreter.getTrackable(lvalue);
    }

    /**
     * @return the variable that starts the assigned value if the value
     * copies it, as in {@code w}, {@code w + n}, {@code w < n}
     * or {@code w ? a : b}; otherwise null.
     */
    private static Var copiedVar(Exp rvalue) {
        if (rvalue instanceof VarExp varExp) {
            return varExp.getVar();
        }
        Exp leftmost = rvalue;
        Exp follower = null;
        while (true) {
            if (leftmost instanceof BinaryExp binary) {
                follower = leftmost;
                leftmost = binary.getOperand1();
            } else if (leftmost instanceof ConditionalExp conditional) {
                follower = leftmost;
                leftmost = conditional.getCondition();
            } else {
                break;
            }
        }
        if (!(leftmost instanceof VarExp varExp)) {
            return null;
        }
        if (follower instanceof BinaryExp binary
                && (binary.getOperator() == BinaryExp.Op.ADD
                || binary.getOperator().isComparison())) {
            return varExp.getVar();
        }
        return follower instanceof ConditionalExp ? varExp.getVar() : null;
    }

    private static boolean isLikely(String name) {
        return name.equals("LIKELY") || name.equals("UNLIKELY");
    }
}
