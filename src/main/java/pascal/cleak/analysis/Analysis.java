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

/**
 * Abstract base class for all analyses.
 */
public abstract class Analysis {

    /**
     * Configuration of this analysis.
     */
    private final AnalysisConfig config;

    protected Analysis(AnalysisConfig config) {
        this.config = config;
    }

    public String getId() {
        return config.getId();
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getId() + ")";
    }
}
