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

import org.junit.Test;
import pascal.cleak.config.AnalysisConfig;
import pascal.cleak.diagnostic.Diagnostic;
import pascal.cleak.diagnostic.Diagnostics;
import pascal.cleak.diagnostic.ErrorKind;
import pascal.cleak.diagnostic.Severity;
import pascal.cleak.ir.Function;
import pascal.cleak.ir.IR;
import pascal.cleak.ir.IRBuilder;
import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.UnevaluatedExp;
import pascal.cleak.ir.type.ClassType;
import pascal.cleak.ir.type.PointerType;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.ir.type.Type;
import pascal.cleak.library.ConfigLibrary;
import pascal.cleak.library.Library;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LeakAutoVarAnalysisTest {

    private static final Library STD = ConfigLibrary.loadDefault();

    private static final Type CHAR_PTR = PointerType.of(PrimitiveType.CHAR);

    private static final Type INT_PTR = PointerType.of(PrimitiveType.INT);

    private static final Type FILE_PTR = PointerType.of(ClassType.struct("FILE"));

    private static Diagnostics check(IR ir) {
        return check(ir, STD);
    }

    private static Diagnostics check(IR ir, Library library, Object... options) {
        AnalysisConfig config = AnalysisConfig.of(LeakAutoVarAnalysis.ID, options);
        return new LeakAutoVarAnalysis(config, library).analyze(ir);
    }

    private static Diagnostic single(Diagnostics diagnostics, ErrorKind kind) {
        assertEquals(diagnostics.toString(), 1, diagnostics.size());
        Diagnostic d = diagnostics.get(0);
        assertEquals(kind, d.kind());
        return d;
    }

    // ---------- leaks ----------

    @Test
    public void testLeakAtReturn() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).ret()));
        Diagnostic d = single(check(ir), ErrorKind.LEAK);
        assertEquals("memleak", d.id());
        assertEquals("Memory leak: p", d.message());
        assertEquals(Severity.ERROR, d.severity());
        assertEquals(401, d.cwe());
        assertEquals(3, d.line());
        assertEquals("f", d.function());
    }

    @Test
    public void testLeakAtEndOfScope() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10)))));
        Diagnostic d = single(check(ir), ErrorKind.LEAK);
        assertEquals(3, d.line());
    }

    @Test
    public void testResourceLeak() {
        IRBuilder b = new IRBuilder(false);
        Var f = b.local("f", FILE_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(f, b.call("fopen", b.str("a.txt"), b.str("r")))));
        Diagnostic d = single(check(ir), ErrorKind.LEAK);
        assertEquals("resourceLeak", d.id());
        assertEquals("Resource leak: f", d.message());
        assertEquals(775, d.cwe());
    }

    @Test
    public void testFreedVariableDoesNotLeak() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var f = b.local("f", FILE_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(f, b.call("fopen", b.str("a.txt"), b.str("r"))),
                b.eval(b.call("fclose", b.var(f))),
                b.eval(b.call("free", b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testOverwriteLeaks() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).assign(p, b.call("malloc", b.lit(20)))));
        Diagnostics ds = check(ir);
        assertEquals(2, ds.ofKind(ErrorKind.LEAK).size());
        assertEquals(3, ds.get(0).line());
        assertEquals(4, ds.get(1).line());
    }

    @Test
    public void testReturningPointerHandsItOver() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", CHAR_PTR, b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ret(b.var(p))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReturningDereferenceLeaks() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", PrimitiveType.CHAR, b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).ret(b.deref(b.var(p)))));
        assertEquals(3, single(check(ir), ErrorKind.LEAK).line());
    }

    @Test
    public void testCopyStopsTracking() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var q = b.local("q", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(q, b.var(p))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testAddressTakenStopsTracking() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var pp = b.local("pp", PointerType.of(CHAR_PTR));
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(pp, b.addressOf(b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReturnedArgumentStopsTracking() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var q = b.local("q", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(q, b.call("strcpy", b.var(p), b.str("x")))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReferenceBindingSuppressesLeak() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        Var r = b.localRef("r", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(r, b.var(p))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testStaticVariableIsNotTracked() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.staticLocal("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testLeakIgnoredCallKeepsTracking() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("strlen", b.var(p)))));
        assertEquals("memleak", single(check(ir), ErrorKind.LEAK).id());
    }

    // ---------- double free, mismatch, use after free ----------

    @Test
    public void testDoubleFree() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).eval(b.call("free", b.var(p))),
                b.at(4).eval(b.call("free", b.var(p)))));
        Diagnostic d = single(check(ir), ErrorKind.DOUBLE_FREE);
        assertEquals("doubleFree", d.id());
        assertEquals("Memory pointed to by 'p' is freed twice.", d.message());
        assertEquals(415, d.cwe());
        assertEquals(2, d.locations().size());
        assertEquals(3, d.locations().get(0).line());
        assertEquals(4, d.line());
    }

    @Test
    public void testDoubleCloseOfResource() {
        IRBuilder b = new IRBuilder(false);
        Var f = b.local("f", FILE_PTR);
        IR ir = b.build("f", b.block(
                b.decl(f, b.call("fopen", b.str("a.txt"), b.str("r"))),
                b.eval(b.call("fclose", b.var(f))),
                b.eval(b.call("fclose", b.var(f)))));
        Diagnostic d = single(check(ir), ErrorKind.DOUBLE_FREE);
        assertEquals("Resource handle 'f' freed twice.", d.message());
    }

    @Test
    public void testDoubleFreeOfArgument() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.param("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.eval(b.call("free", b.var(p))),
                b.eval(b.call("free", b.var(p)))));
        single(check(ir), ErrorKind.DOUBLE_FREE);
    }

    @Test
    public void testMismatchBetweenFamilies() {
        ConfigLibrary.Builder builder = ConfigLibrary.builder();
        int mine = builder.newGroup(false);
        int other = builder.newGroup(false);
        Library library = builder
                .allocator("alloc", mine).deallocator("release", mine)
                .allocator("other_alloc", other).deallocator("other_free", other)
                .build();
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("alloc")),
                b.at(3).eval(b.call("other_free", b.var(p)))));
        Diagnostic d = single(check(ir, library), ErrorKind.MISMATCH);
        assertEquals("mismatchAllocDealloc", d.id());
        assertEquals("Mismatching allocation and deallocation: p", d.message());
        assertEquals(762, d.cwe());
        assertEquals(2, d.locations().get(0).line());
        assertEquals(3, d.line());
    }

    @Test
    public void testMismatchOfNewArrayAndFree() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.newArray(PrimitiveType.CHAR, b.lit(10))),
                b.eval(b.call("free", b.var(p)))));
        single(check(ir), ErrorKind.MISMATCH);
    }

    @Test
    public void testMismatchOfNewArrayAndScalarDelete() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", INT_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.newArray(PrimitiveType.INT, b.lit(10))),
                b.delete(b.var(p))));
        single(check(ir), ErrorKind.MISMATCH);
    }

    @Test
    public void testNewAndDelete() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", INT_PTR);
        Var a = b.local("a", INT_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.newObject(PrimitiveType.INT)),
                b.decl(a, b.newArray(PrimitiveType.INT, b.lit(4))),
                b.delete(b.var(p)),
                b.deleteArray(b.var(a))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testNewLeaks() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", INT_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.newObject(PrimitiveType.INT))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testSelfDestroyingClassIsNotTracked() {
        IRBuilder b = new IRBuilder(true);
        ClassType widget = new ClassType("Widget", 1, List.of(), List.of(), List.of());
        Var w = b.local("w", PointerType.of(widget));
        IR ir = b.build("f", b.block(
                b.decl(w, b.newObject(widget))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testDereferenceAfterFree() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).eval(b.call("free", b.var(p))),
                b.at(4).assign(b.deref(b.var(p)), b.lit(0))));
        Diagnostic d = single(check(ir), ErrorKind.DEALLOCATED_USE);
        assertEquals("deallocuse", d.id());
        assertEquals("Dereferencing 'p' after it is deallocated / released", d.message());
        assertEquals(416, d.cwe());
        assertEquals(4, d.line());
    }

    @Test
    public void testMemberWriteAfterFree() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", PointerType.of(ClassType.struct("S", PrimitiveType.INT)));
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(4))),
                b.eval(b.call("free", b.var(p))),
                b.assign(b.arrow(b.var(p), "x"), b.lit(1))));
        single(check(ir), ErrorKind.DEALLOCATED_USE);
    }

    @Test
    public void testSizeofAfterFreeIsNoUse() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var n = b.local("n", PrimitiveType.SIZE_T);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("free", b.var(p))),
                b.decl(n, b.unevaluated(UnevaluatedExp.Kind.SIZEOF, b.deref(b.var(p))))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReturnAfterFree() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", CHAR_PTR, b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).eval(b.call("free", b.var(p))),
                b.at(4).ret(b.var(p))));
        Diagnostic d = single(check(ir), ErrorKind.DEALLOCATED_RETURN);
        assertEquals("deallocret", d.id());
        assertEquals(672, d.cwe());
        assertEquals(3, d.locations().get(0).line());
        assertEquals(4, d.line());
    }

    @Test
    public void testFunctionThatAllocatesAndDeallocates() {
        IRBuilder b = new IRBuilder(false);
        Var fd = b.local("fd", PrimitiveType.INT);
        Var f = b.local("f", FILE_PTR);
        IR ir = b.build("f", b.block(
                b.decl(fd, b.call("open", b.str("a.txt"), b.lit(0))),
                b.decl(f, b.call("fdopen", b.var(fd), b.str("r"))),
                b.eval(b.call("fclose", b.var(f)))));
        assertTrue(check(ir).isEmpty());
    }

    // ---------- branches ----------

    @Test
    public void testConditionalAllocationFreedUnderSameCondition() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.nullptr()),
                b.ifThen(b.var(c), b.block(
                        b.assign(p, b.call("malloc", b.lit(10))))),
                b.ifThen(b.var(c), b.block(
                        b.eval(b.call("free", b.var(p))),
                        b.assign(p, b.nullptr())))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testConditionalAllocationFreedWithoutReset() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.nullptr()),
                b.ifThen(b.var(c), b.block(
                        b.assign(p, b.call("malloc", b.lit(10))))),
                b.ifThen(b.var(c), b.block(
                        b.eval(b.call("free", b.var(p)))))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testConditionalAllocationLeaksAtScopeEnd() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.nullptr()),
                b.at(3).ifThen(b.var(c), b.block(
                        b.at(4).assign(p, b.call("malloc", b.lit(10)))))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testFreeOnOneBranchLeaksOnTheOther() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ifThen(b.var(c), b.block(
                        b.eval(b.call("free", b.var(p)))))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testFreeOnBothBranches() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ifElse(b.var(c),
                        b.block(b.eval(b.call("free", b.var(p)))),
                        b.block(b.eval(b.call("free", b.var(p)))))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testNullCheckAfterAllocation() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ifThen(b.not(b.var(p)), b.block(b.ret())),
                b.eval(b.call("free", b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testAllocationInCondition() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p),
                b.ifThen(b.eq(b.assignExp(b.var(p), b.call("malloc", b.lit(10))), b.nullptr()),
                        b.block(b.ret())),
                b.eval(b.call("free", b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testAllocationInConditionLeaks() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p),
                b.ifThen(b.eq(b.assignExp(b.var(p), b.call("malloc", b.lit(10))), b.nullptr()),
                        b.block(b.ret()))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testKnownFalseConditionSkipsBranch() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ifThen(b.lit(0), b.block(b.eval(b.call("free", b.var(p)))))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testKnownTrueConditionTakesBranch() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ifThen(b.lit(1), b.block(b.eval(b.call("free", b.var(p)))))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testNonZeroVariableDiscardsFalseBranch() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var v = b.local("v", PrimitiveType.INT);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(v, b.lit(5)),
                b.ifThen(b.ne(b.var(v), b.lit(0)),
                        b.block(b.eval(b.call("free", b.var(p)))))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReallocOfSameVariable() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.assign(p, b.call("realloc", b.var(p), b.lit(20))),
                b.ifThen(b.not(b.var(p)), b.block(b.ret())),
                b.eval(b.call("free", b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReallocToOtherVariable() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var q = b.local("q", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(q, b.call("realloc", b.var(p), b.lit(20))),
                b.ifThen(b.not(b.var(q)), b.block(
                        b.eval(b.call("free", b.var(p))),
                        b.ret())),
                b.eval(b.call("free", b.var(q)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReallocOfOtherFamily() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        Var q = b.local("q", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.newArray(PrimitiveType.CHAR, b.lit(10))),
                b.at(3).decl(q, b.call("realloc", b.var(p), b.lit(20))),
                b.at(4).eval(b.call("free", b.var(q)))));
        Diagnostic d = single(check(ir), ErrorKind.MISMATCH);
        assertEquals(3, d.line());
        assertTrue(d.message(), d.message().contains("p"));
    }

    // ---------- out-parameters ----------

    @Test
    public void testOutParameterAllocationLeaks() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p),
                b.eval(b.call("posix_memalign", b.addressOf(b.var(p)), b.lit(16), b.lit(64)))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testOutParameterAllocationCheckedInCondition() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p),
                b.ifThen(b.ne(b.call("posix_memalign",
                                b.addressOf(b.var(p)), b.lit(16), b.lit(64)), b.lit(0)),
                        b.block(b.ret())),
                b.eval(b.call("free", b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testOutParameterAllocationCheckedThroughResult() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var r = b.local("r", PrimitiveType.INT);
        IR ir = b.build("f", b.block(
                b.decl(p),
                b.decl(r, b.call("posix_memalign", b.addressOf(b.var(p)), b.lit(16), b.lit(64))),
                b.ifThen(b.ne(b.var(r), b.lit(0)), b.block(b.ret())),
                b.eval(b.call("free", b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testOutParameterBailout() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        Var q = b.local("q", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(q),
                b.eval(b.call("memcpy", b.addressOf(b.var(q)), b.addressOf(b.var(p)),
                        b.sizeof(b.var(p))))));
        assertTrue(check(ir).isEmpty());
    }

    // ---------- smart pointers ----------

    @Test
    public void testUniquePointerTakesOwnership() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", INT_PTR);
        Var sp = b.local("sp", ClassType.struct("std::unique_ptr"));
        IR ir = b.build("f", b.block(
                b.decl(p, b.newObject(PrimitiveType.INT)),
                b.decl(sp, b.construct("std::unique_ptr",
                        List.of(b.type(PrimitiveType.INT)), b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testReleasedSmartPointerDoesNotOwn() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", INT_PTR);
        Var sp = b.local("sp", ClassType.struct("std::unique_ptr"));
        IR ir = b.build("f", b.block(
                b.decl(p, b.newObject(PrimitiveType.INT)),
                b.decl(sp, b.construct("std::unique_ptr",
                        List.of(b.type(PrimitiveType.INT)), b.var(p))),
                b.eval(b.memberCall(b.var(sp), false, "release"))));
        single(check(ir), ErrorKind.LEAK);
    }

    @Test
    public void testSmartPointerReassignedBeforeRelease() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", INT_PTR);
        Var sp = b.local("sp", ClassType.struct("std::unique_ptr"));
        IR ir = b.build("f", b.block(
                b.decl(p, b.newObject(PrimitiveType.INT)),
                b.decl(sp, b.construct("std::unique_ptr",
                        List.of(b.type(PrimitiveType.INT)), b.var(p))),
                b.eval(b.assignExp(b.var(sp), b.nullptr())),
                b.eval(b.memberCall(b.var(sp), false, "release"))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testSharedPointerWithLibraryDeleter() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        Var sp = b.local("sp", ClassType.struct("std::shared_ptr"));
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(sp, b.construct("std::shared_ptr",
                        List.of(b.type(PrimitiveType.CHAR)),
                        b.var(p), b.addressOf(b.name("free"))))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testSharedPointerWithUserDeleter() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", FILE_PTR);
        Var sp = b.local("sp", ClassType.struct("std::shared_ptr"));
        Var arg = b.param("f", FILE_PTR);
        Function closer = b.function("closer", PrimitiveType.VOID,
                b.block(b.eval(b.call("fclose", b.var(arg)))));
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("fopen", b.str("a.txt"), b.str("r"))),
                b.decl(sp, b.construct("std::shared_ptr",
                        List.of(b.type(ClassType.struct("FILE"))),
                        b.var(p), b.name(closer)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testUnresolvedDeleterStopsTracking() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        Var d = b.local("d", PointerType.of(PrimitiveType.VOID));
        Var sp = b.local("sp", ClassType.struct("std::shared_ptr"));
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(sp, b.construct("std::shared_ptr",
                        List.of(b.type(PrimitiveType.CHAR)), b.var(p), b.var(d)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testSmartPointerOfMallocMismatches() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        Var sp = b.local("sp", ClassType.struct("std::unique_ptr"));
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(sp, b.construct("std::unique_ptr",
                        List.of(b.type(PrimitiveType.CHAR)), b.var(p)))));
        single(check(ir), ErrorKind.MISMATCH);
    }

    // ---------- calls of unknown functions ----------

    @Test
    public void testNoReturnCallClearsState() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("exit", b.lit(1)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testUnknownCallNeedsConfiguration() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("consume", b.var(p)))));
        Diagnostic d = single(check(ir), ErrorKind.CONFIGURATION_INFO);
        assertEquals("checkLibraryUseIgnore", d.id());
        assertEquals(Severity.INFORMATION, d.severity());
        assertEquals("--check-library: Function consume() should have "
                + "<use>/<leak-ignore> configuration", d.message());
    }

    @Test
    public void testConfigurationNotesCanBeDisabled() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("consume", b.var(p)))));
        assertTrue(check(ir, STD, "check-library", false).isEmpty());
    }

    @Test
    public void testPointerPassedToDefinedFunction() {
        IRBuilder b = new IRBuilder(false);
        Var q = b.param("q", CHAR_PTR);
        Function keep = b.function("keep", PrimitiveType.VOID,
                b.block(b.eval(b.call("free", b.var(q)))));
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call(keep, b.var(p)))));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testNoReturnFunctionOfLibrary() {
        ConfigLibrary.Builder builder = ConfigLibrary.builder();
        int mem = builder.newGroup(false);
        Library library = builder.allocator("malloc", mem).deallocator("free", mem)
                .noReturn("fatal", true).build();
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("fatal", b.var(p)))));
        assertTrue(check(ir, library).isEmpty());
    }

    // ---------- abandoning ----------

    @Test
    public void testGotoAbandonsFunction() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.gotoStmt("out"),
                b.label("out")));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testLoopAbandonsFunction() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.whileLoop(b.var(c), b.block())));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testAbandonInBranchPropagates() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.ifThen(b.var(c), b.block(b.gotoStmt("out"))),
                b.label("out")));
        assertTrue(check(ir).isEmpty());
    }

    @Test
    public void testThrowLeavesFunction() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).throwStmt(b.lit(1))));
        assertEquals(3, single(check(ir), ErrorKind.LEAK).line());
    }

    @Test
    public void testThrowInsideTryDoesNotReport() {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.tryCatch(
                        b.block(b.decl(p, b.call("malloc", b.lit(10))),
                                b.throwStmt(b.lit(1))),
                        b.block())));
        assertTrue(check(ir).isEmpty());
    }

    // ---------- limits and determinism ----------

    @Test
    public void testRecursionLimit() {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", CHAR_PTR);
        IR ir = b.build("deep", b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10))),
                b.at(3).eval(b.call("free", b.var(p))),
                b.at(4).eval(b.call("free", b.var(p))),
                b.block(b.block(b.block()))));
        Diagnostics ds = check(ir, STD, "recursion-limit", 3);
        assertEquals(ds.toString(), 2, ds.size());
        assertEquals(ErrorKind.DOUBLE_FREE, ds.get(0).kind());
        Diagnostic limit = ds.get(1);
        assertEquals(ErrorKind.ANALYSIS_LIMIT_EXCEEDED, limit.kind());
        assertEquals("internalLimit", limit.id());
        assertEquals("Internal limit: maximum recursion depth of 3 reached in function deep",
                limit.message());
    }

    @Test
    public void testAnalysisIsRepeatable() {
        IRBuilder b = new IRBuilder(false);
        Var c = b.param("c", PrimitiveType.INT);
        Var p = b.local("p", CHAR_PTR);
        Var q = b.local("q", CHAR_PTR);
        IR ir = b.build("f", b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(q, b.call("malloc", b.lit(10))),
                b.ifThen(b.var(c), b.block(
                        b.eval(b.call("free", b.var(p))),
                        b.eval(b.call("free", b.var(p)))))));
        Diagnostics first = check(ir);
        assertEquals(first, check(ir));
        assertEquals(1, first.ofKind(ErrorKind.DOUBLE_FREE).size());
        assertEquals(2, first.ofKind(ErrorKind.LEAK).size());
    }
}
