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

import pascal.cleak.config.AnalysisConfig;
import pascal.cleak.ir.IR;

/**
 * Abstract base class for all function-level analyses, i.e.,
 * analyses that are performed on one function at a time.
 *
 * @param <R> result type of the analysis
 */
public abstract class FunctionAnalysis<R> extends Analysis {

    protected FunctionAnalysis(AnalysisConfig config) {
        super(config);
    }

    /**
     * Runs this analysis for the given {@link IR}. Implementations keep
     * no state between calls, so distinct functions may be analyzed
     * concurrently.
     *
     * @param ir IR of the function to be analyzed
     * @return the analysis result for given ir.
     */
    public abstract R analyze(IR ir);
}
