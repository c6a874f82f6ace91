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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import pascal.cleak.diagnostic.DiagnosticCollector;
import pascal.cleak.diagnostic.Diagnostics;
import pascal.cleak.ir.IR;
import pascal.cleak.ir.Program;
import pascal.cleak.util.AnalysisException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a function analysis over all functions of a program and collects
 * the diagnostics in function order.
 */
public class AnalysisManager {

    private static final Logger logger = LogManager.getLogger(AnalysisManager.class);

    private final FunctionAnalysis<Diagnostics> analysis;

    private final int parallelism;

    /**
     * Creates a manager whose parallelism is read from the
     * {@code parallelism} option of the analysis.
     */
    public AnalysisManager(FunctionAnalysis<Diagnostics> analysis) {
        this(analysis, analysis.getConfig().getOptions().getInt("parallelism", 1));
    }

    public AnalysisManager(FunctionAnalysis<Diagnostics> analysis, int parallelism) {
        this.analysis = analysis;
        this.parallelism = Math.max(1, parallelism);
    }

    public Diagnostics run(Program program) {
        long start = System.currentTimeMillis();
        List<IR> functions = program.functions();
        DiagnosticCollector collector = new DiagnosticCollector();
        if (parallelism == 1 || functions.size() <= 1) {
            functions.forEach(ir -> collector.reportAll(runFunction(ir)));
        } else {
            runParallel(functions, collector);
        }
        logger.info("{} finished on {}: {} function(s), {} diagnostic(s) [{}ms]",
                analysis.getId(), program.fileName(), functions.size(),
                collector.size(), System.currentTimeMillis() - start);
        return collector.getDiagnostics();
    }

    private void runParallel(List<IR> functions, DiagnosticCollector collector) {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<Diagnostics>> results = new ArrayList<>(functions.size());
            for (IR ir : functions) {
                results.add(executor.submit(() -> runFunction(ir)));
            }
            for (Future<Diagnostics> result : results) {
                collector.reportAll(result.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted while running " + analysis.getId(), e);
        } catch (ExecutionException e) {
            throw new AnalysisException("Failed to run " + analysis.getId(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private Diagnostics runFunction(IR ir) {
        String name = ir.getFunction().name();
        if (ir.hasInlineOrLambda()) {
            logger.warn("Skip {}: contains a lambda", name);
            return Diagnostics.empty();
        }
        try {
            return analysis.analyze(ir);
        } catch (AnalysisException e) {
            logger.warn("Skip {}: {}", name, e.getMessage());
            return Diagnostics.empty();
        }
    }
}
