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
import pascal.cleak.analysis.FunctionAnalysis;
import pascal.cleak.config.AnalysisConfig;
import pascal.cleak.config.AnalysisOptions;
import pascal.cleak.config.ConfigException;
import pascal.cleak.diagnostic.Diagnostics;
import pascal.cleak.ir.IR;
import pascal.cleak.library.ConfigLibrary;
import pascal.cleak.library.Library;

import java.nio.file.Path;

/**
 * Checks the local variables of a function for leaks, double frees,
 * mismatching deallocations and uses after release.
 * <p>
 * Options:
 * <ul>
 *     <li>{@code recursion-limit}: maximum nesting of analyzed blocks</li>
 *     <li>{@code check-library}: report calls whose library configuration
 *     is missing</li>
 *     <li>{@code library}: path of the YAML library; the bundled one
 *     is used if absent</li>
 * </ul>
 */
public class LeakAutoVarAnalysis extends FunctionAnalysis<Diagnostics> {

    public static final String ID = "leakautovar";

    private static final Logger logger = LogManager.getLogger(LeakAutoVarAnalysis.class);

    private static final int DEFAULT_RECURSION_LIMIT = 1000;

    private final Library library;

    private final int recursionLimit;

    private final boolean checkLibrary;

    public LeakAutoVarAnalysis(AnalysisConfig config) {
        this(config, loadLibrary(config.getOptions()));
    }

    public LeakAutoVarAnalysis(AnalysisConfig config, Library library) {
        super(config);
        this.library = library;
        AnalysisOptions options = config.getOptions();
        this.recursionLimit = options.getInt("recursion-limit", DEFAULT_RECURSION_LIMIT);
        if (recursionLimit <= 0) {
            throw new ConfigException("recursion-limit must be positive, given: "
                    + recursionLimit);
        }
        this.checkLibrary = options.getBoolean("check-library", true);
    }

    private static Library loadLibrary(AnalysisOptions options) {
        String path = options.getString("library", null);
        return path == null
                ? ConfigLibrary.loadDefault()
                : ConfigLibrary.readLibrary(Path.of(path));
    }

    public Library getLibrary() {
        return library;
    }

    @Override
    public Diagnostics analyze(IR ir) {
        String function = ir.getFunction().name();
        logger.debug("Checking {}", function);
        LeakReporter reporter = new LeakReporter(function, library, checkLibrary);
        LeakChecker checker = new LeakChecker(ir, library, reporter, recursionLimit);
        try {
            if (!checker.check()) {
                logger.debug("Stopped tracking in {}", function);
            }
        } catch (AnalysisLimitException e) {
            logger.warn(e.getMessage());
            reporter.limit(e);
        }
        return reporter.getDiagnostics();
    }
}
