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

package pascal.cleak.ir;

import pascal.cleak.ir.exp.ArrayAccess;
import pascal.cleak.ir.exp.AssignExp;
import pascal.cleak.ir.exp.BinaryExp;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.exp.CastExp;
import pascal.cleak.ir.exp.ConditionalExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.FieldAccess;
import pascal.cleak.ir.exp.InitListExp;
import pascal.cleak.ir.exp.IntLiteral;
import pascal.cleak.ir.exp.LambdaExp;
import pascal.cleak.ir.exp.NameExp;
import pascal.cleak.ir.exp.NewExp;
import pascal.cleak.ir.exp.NullLiteral;
import pascal.cleak.ir.exp.StringLiteral;
import pascal.cleak.ir.exp.TypeExp;
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
import pascal.cleak.ir.stmt.ScopeEnd;
import pascal.cleak.ir.stmt.Stmt;
import pascal.cleak.ir.stmt.Throw;
import pascal.cleak.ir.stmt.Try;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.ir.type.Type;
import pascal.cleak.ir.type.TypeRef;
import pascal.cleak.ir.type.UnknownType;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link IR} of one function. Nodes must be created
 * bottom-up (operands before the expressions using them), which is the
 * natural evaluation order of nested builder calls.
 * <p>
 * New nodes get the current line, set with {@link #at(int)}; compound
 * statements take the line of their first child, and the end of a
 * block is placed one line after the last line used so far.
 */
public class IRBuilder {

    private final SyntaxGraph graph = new SyntaxGraph();

    private final List<Var> vars = new ArrayList<>();

    private final boolean cpp;

    private int nextVarId = 1;

    private int line = 1;

    private int maxLine = 1;

    public IRBuilder() {
        this(true);
    }

    /**
     * @param cpp whether the function is written in C++ rather than C
     */
    public IRBuilder(boolean cpp) {
        this.cpp = cpp;
    }

    /**
     * Sets the line number of the nodes created next.
     */
    public IRBuilder at(int line) {
        this.line = line;
        maxLine = Math.max(maxLine, line);
        return this;
    }

    public SyntaxGraph getGraph() {
        return graph;
    }

    // ---------- variables ----------

    public Var local(String name, Type type) {
        return newVar(name, type, false, true, false, false, false);
    }

    public Var param(String name, Type type) {
        return newVar(name, type, true, false, false, false, false);
    }

    public Var staticLocal(String name, Type type) {
        return newVar(name, type, false, true, true, false, false);
    }

    public Var global(String name, Type type) {
        return newVar(name, type, false, false, true, false, false);
    }

    public Var localRef(String name, Type type) {
        return newVar(name, type, false, true, false, true, false);
    }

    public Var paramRef(String name, Type type) {
        return newVar(name, type, true, false, false, true, false);
    }

    public Var localArray(String name, Type elementType) {
        return newVar(name, elementType, false, true, false, false, true);
    }

    /**
     * Creates the descriptor of a data member, used by {@link #field}.
     */
    public Var member(String name, Type type) {
        return newVar(name, type, false, false, false, false, false);
    }

    private Var newVar(String name, Type type, boolean argument, boolean local,
                       boolean isStatic, boolean reference, boolean array) {
        Var var = new Var(nextVarId++, name, type,
                argument, local, isStatic, reference, array);
        vars.add(var);
        return var;
    }

    // ---------- expressions ----------

    public VarExp var(Var var) {
        return graph.add(new VarExp(line, var));
    }

    public NameExp name(String name) {
        return graph.add(new NameExp(line, name, null));
    }

    public NameExp name(Function function) {
        return graph.add(new NameExp(line, function.name(), function));
    }

    public IntLiteral lit(long value) {
        return graph.add(new IntLiteral(line, value));
    }

    public NullLiteral nullptr() {
        return graph.add(new NullLiteral(line, cpp ? "nullptr" : "NULL"));
    }

    public StringLiteral str(String value) {
        return graph.add(new StringLiteral(line, value));
    }

    public CallExp call(String name, Exp... args) {
        return graph.add(new CallExp(line, name, null, false,
                List.of(), List.of(args), null, null));
    }

    public CallExp call(Function function, Exp... args) {
        return graph.add(new CallExp(line, function.name(), null, false,
                List.of(), List.of(args), null, function));
    }

    public CallExp memberCall(Exp receiver, boolean arrow, String name, Exp... args) {
        return graph.add(new CallExp(line, name, receiver, arrow,
                List.of(), List.of(args), null, null));
    }

    /**
     * Creates a call of a constructor of a class template instance,
     * e.g., {@code std::unique_ptr<T>(p)}.
     */
    public CallExp construct(String name, List<Exp> templateArgs, Exp... args) {
        TypeRef type = new TypeRef(name, UnknownType.UNKNOWN, false);
        return graph.add(new CallExp(line, name, null, false,
                templateArgs, List.of(args), type, null));
    }

    public CallExp construct(TypeRef type, Exp... args) {
        return graph.add(new CallExp(line, type.name(), null, false,
                List.of(), List.of(args), type, null));
    }

    public NewExp newObject(Type type, Exp... args) {
        return graph.add(new NewExp(line, TypeRef.of(type), null,
                List.of(args), List.of(), false));
    }

    public NewExp newArray(Type type, Exp length) {
        return graph.add(new NewExp(line, TypeRef.of(type), length,
                List.of(), List.of(), false));
    }

    public NewExp newNothrow(Type type) {
        return graph.add(new NewExp(line, TypeRef.of(type), null,
                List.of(), List.of(), true));
    }

    public NewExp placementNew(Exp place, Type type, Exp... args) {
        return graph.add(new NewExp(line, TypeRef.of(type), null,
                List.of(args), List.of(place), false));
    }

    public UnaryExp unary(UnaryExp.Op op, Exp operand) {
        return graph.add(new UnaryExp(line, op, operand));
    }

    public UnaryExp addressOf(Exp operand) {
        return unary(UnaryExp.Op.ADDRESS_OF, operand);
    }

    public UnaryExp deref(Exp operand) {
        return unary(UnaryExp.Op.DEREF, operand);
    }

    public UnaryExp not(Exp operand) {
        return unary(UnaryExp.Op.NOT, operand);
    }

    public UnaryExp neg(Exp operand) {
        return unary(UnaryExp.Op.NEG, operand);
    }

    public BinaryExp binary(BinaryExp.Op op, Exp operand1, Exp operand2) {
        return graph.add(new BinaryExp(line, op, operand1, operand2));
    }

    public BinaryExp eq(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.EQ, operand1, operand2);
    }

    public BinaryExp ne(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.NE, operand1, operand2);
    }

    public BinaryExp lt(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.LT, operand1, operand2);
    }

    public BinaryExp gt(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.GT, operand1, operand2);
    }

    public BinaryExp and(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.LOGICAL_AND, operand1, operand2);
    }

    public BinaryExp or(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.LOGICAL_OR, operand1, operand2);
    }

    public BinaryExp add(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.ADD, operand1, operand2);
    }

    public BinaryExp comma(Exp operand1, Exp operand2) {
        return binary(BinaryExp.Op.COMMA, operand1, operand2);
    }

    public ConditionalExp cond(Exp condition, Exp trueExp, Exp falseExp) {
        return graph.add(new ConditionalExp(line, condition, trueExp, falseExp));
    }

    public CastExp cast(Type type, Exp operand) {
        return graph.add(new CastExp(line, TypeRef.of(type), operand));
    }

    public FieldAccess field(Exp base, String fieldName) {
        return graph.add(new FieldAccess(line, base, fieldName, false, null));
    }

    public FieldAccess arrow(Exp base, String fieldName) {
        return graph.add(new FieldAccess(line, base, fieldName, true, null));
    }

    public FieldAccess field(Exp base, Var member, boolean arrow) {
        return graph.add(new FieldAccess(line, base, member.getName(), arrow, member));
    }

    public ArrayAccess index(Exp base, Exp index) {
        return graph.add(new ArrayAccess(line, base, index));
    }

    public AssignExp assignExp(Exp lValue, Exp rValue) {
        return graph.add(new AssignExp(line, lValue, rValue));
    }

    public UnevaluatedExp sizeof(Exp operand) {
        return unevaluated(UnevaluatedExp.Kind.SIZEOF, operand);
    }

    public UnevaluatedExp unevaluated(UnevaluatedExp.Kind kind, Exp operand) {
        return graph.add(new UnevaluatedExp(line, kind, operand));
    }

    public LambdaExp lambda(Block body) {
        return graph.add(new LambdaExp(body.getLineNumber(), body));
    }

    public InitListExp initList(Exp... elements) {
        return graph.add(new InitListExp(line, List.of(elements)));
    }

    public TypeExp type(Type type) {
        return type(TypeRef.of(type));
    }

    public TypeExp type(TypeRef type) {
        return graph.add(new TypeExp(line, type));
    }

    // ---------- statements ----------

    public DeclStmt decl(Var var) {
        return decl(var, null, DeclStmt.InitStyle.ASSIGN);
    }

    public DeclStmt decl(Var var, Exp initializer) {
        return decl(var, initializer, DeclStmt.InitStyle.ASSIGN);
    }

    public DeclStmt decl(Var var, Exp initializer, DeclStmt.InitStyle style) {
        VarExp declarator = graph.add(new VarExp(
                initializer == null ? line : initializer.getLineNumber(), var));
        return graph.add(new DeclStmt(declarator.getLineNumber(),
                declarator, initializer, style));
    }

    public AssignStmt assign(Exp lValue, Exp rValue) {
        return graph.add(new AssignStmt(lValue.getLineNumber(), lValue, rValue));
    }

    public AssignStmt assign(Var var, Exp rValue) {
        VarExp lValue = graph.add(new VarExp(rValue.getLineNumber(), var));
        return assign(lValue, rValue);
    }

    public ExpStmt eval(Exp exp) {
        return graph.add(new ExpStmt(exp.getLineNumber(), exp));
    }

    public If ifThen(Exp condition, Block thenBlock) {
        return graph.add(new If(condition.getLineNumber(), condition, thenBlock, null));
    }

    public If ifElse(Exp condition, Block thenBlock, Block elseBlock) {
        return graph.add(new If(condition.getLineNumber(), condition, thenBlock, elseBlock));
    }

    public Return ret() {
        return graph.add(new Return(line, null));
    }

    public Return ret(Exp value) {
        return graph.add(new Return(value.getLineNumber(), value));
    }

    public Throw throwStmt(Exp exception) {
        return graph.add(new Throw(exception == null ? line : exception.getLineNumber(),
                exception));
    }

    public Delete delete(Exp operand) {
        return graph.add(new Delete(operand.getLineNumber(), operand, false));
    }

    public Delete deleteArray(Exp operand) {
        return graph.add(new Delete(operand.getLineNumber(), operand, true));
    }

    public Goto gotoStmt(String label) {
        return graph.add(new Goto(line, label));
    }

    public Label label(String name) {
        return graph.add(new Label(line, name));
    }

    public Break breakStmt() {
        return graph.add(new Break(line));
    }

    public Continue continueStmt() {
        return graph.add(new Continue(line));
    }

    public LoopStmt whileLoop(Exp condition, Block body) {
        return loop(LoopStmt.Kind.WHILE, "while", condition, body);
    }

    public LoopStmt forLoop(Exp condition, Block body) {
        return loop(LoopStmt.Kind.FOR, "for", condition, body);
    }

    public LoopStmt doWhile(Block body, Exp condition) {
        return graph.add(new LoopStmt(body.getLineNumber(),
                LoopStmt.Kind.DO, "do", condition, body));
    }

    public LoopStmt switchStmt(Exp selector, Block body) {
        return loop(LoopStmt.Kind.SWITCH, "switch", selector, body);
    }

    /**
     * Creates a block introduced by a macro, e.g., {@code FOREACH(x) { ... }}.
     */
    public LoopStmt macroBlock(String macro, Exp arg, Block body) {
        return loop(LoopStmt.Kind.MACRO, macro, arg, body);
    }

    private LoopStmt loop(LoopStmt.Kind kind, String keyword, Exp header, Block body) {
        int lineNumber = header != null ? header.getLineNumber() : body.getLineNumber();
        return graph.add(new LoopStmt(lineNumber, kind, keyword, header, body));
    }

    public Try tryCatch(Block body, Block... handlers) {
        return graph.add(new Try(body.getLineNumber(), body, List.of(handlers)));
    }

    public Block block(Stmt... stmts) {
        int start = stmts.length > 0 ? stmts[0].getLineNumber() : line;
        int end = ++maxLine;
        ScopeEnd scopeEnd = graph.add(new ScopeEnd(end));
        return graph.add(new Block(start, List.of(stmts), scopeEnd));
    }

    // ---------- functions ----------

    /**
     * Creates the descriptor of another function defined with the given
     * body, e.g., a user-defined deleter.
     */
    public Function function(String name, Type returnType, Block body) {
        return new Function(name, returnType, body, false);
    }

    public IR build(String name, Block body) {
        return build(name, PrimitiveType.VOID, body);
    }

    public IR build(String name, Type returnType, Block body) {
        return build(new Function(name, returnType, body, false));
    }

    public IR build(Function function) {
        if (!function.hasBody()) {
            throw new IllegalArgumentException(function + " has no body");
        }
        return new IR(function, graph, function.body(), vars, cpp);
    }
}
