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

package pascal.cleak.analysis;

import org.junit.Test;
import pascal.cleak.analysis.leak.LeakAutoVarAnalysis;
import pascal.cleak.config.AnalysisConfig;
import pascal.cleak.diagnostic.Diagnostic;
import pascal.cleak.diagnostic.Diagnostics;
import pascal.cleak.diagnostic.ErrorKind;
import pascal.cleak.ir.IR;
import pascal.cleak.ir.IRBuilder;
import pascal.cleak.ir.Program;
import pascal.cleak.ir.Var;
import pascal.cleak.ir.type.PointerType;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.library.ConfigLibrary;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AnalysisManagerTest {

    private static IR leaking(String name) {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", PointerType.of(PrimitiveType.CHAR));
        return b.build(name, b.block(
                b.at(2).decl(p, b.call("malloc", b.lit(10)))));
    }

    private static IR clean(String name) {
        IRBuilder b = new IRBuilder(false);
        Var p = b.local("p", PointerType.of(PrimitiveType.CHAR));
        return b.build(name, b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.eval(b.call("free", b.var(p)))));
    }

    private static IR withLambda(String name) {
        IRBuilder b = new IRBuilder(true);
        Var p = b.local("p", PointerType.of(PrimitiveType.CHAR));
        Var f = b.local("f", PrimitiveType.INT);
        return b.build(name, b.block(
                b.decl(p, b.call("malloc", b.lit(10))),
                b.decl(f, b.lambda(b.block()))));
    }

    private static IR deep(String name) {
        IRBuilder b = new IRBuilder(false);
        return b.build(name, b.block(b.block(b.block())));
    }

    private static LeakAutoVarAnalysis analysis(Object... options) {
        return new LeakAutoVarAnalysis(
                AnalysisConfig.of(LeakAutoVarAnalysis.ID, options),
                ConfigLibrary.loadDefault());
    }

    private static List<String> functions(Diagnostics diagnostics) {
        return diagnostics.stream()
                .map(Diagnostic::function)
                .collect(Collectors.toList());
    }

    @Test
    public void testSequential() {
        Program program = new Program("a.c",
                List.of(leaking("f"), clean("g"), leaking("h")));
        Diagnostics ds = new AnalysisManager(analysis()).run(program);
        assertEquals(List.of("f", "h"), functions(ds));
    }

    @Test
    public void testParallelKeepsProgramOrder() {
        List<IR> irs = new ArrayList<>();
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 16; ++i) {
            String name = "f" + i;
            irs.add(leaking(name));
            expected.add(name);
        }
        Program program = new Program("a.c", irs);
        Diagnostics parallel = new AnalysisManager(analysis(), 4).run(program);
        assertEquals(expected, functions(parallel));
        assertEquals(new AnalysisManager(analysis(), 1).run(program), parallel);
    }

    @Test
    public void testParallelismFromOptions() {
        Program program = new Program("a.c", List.of(leaking("f"), leaking("g")));
        Diagnostics ds = new AnalysisManager(analysis("parallelism", 2)).run(program);
        assertEquals(List.of("f", "g"), functions(ds));
    }

    @Test
    public void testFunctionWithLambdaIsSkipped() {
        Program program = new Program("a.cpp", List.of(withLambda("f"), leaking("g")));
        Diagnostics ds = new AnalysisManager(analysis()).run(program);
        assertEquals(List.of("g"), functions(ds));
    }

    @Test
    public void testLimitIsReportedAndOthersGoOn() {
        Program program = new Program("a.c", List.of(deep("f"), leaking("g")));
        Diagnostics ds = new AnalysisManager(analysis("recursion-limit", 2)).run(program);
        assertEquals(2, ds.size());
        assertEquals(ErrorKind.ANALYSIS_LIMIT_EXCEEDED, ds.get(0).kind());
        assertEquals("f", ds.get(0).function());
        assertEquals(ErrorKind.LEAK, ds.get(1).kind());
    }

    @Test
    public void testEmptyProgram() {
        Diagnostics ds = new AnalysisManager(analysis(), 3)
                .run(new Program("empty.c", List.of()));
        assertTrue(ds.isEmpty());
    }
}
