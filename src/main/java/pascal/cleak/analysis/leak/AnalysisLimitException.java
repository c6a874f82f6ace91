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
import pascal.cleak.util.AnalysisException;

/**
 * Thrown when the nesting of scopes in a function exceeds
 * the configured recursion limit.
 */
public class AnalysisLimitException extends AnalysisException {

    private final transient Node node;

    private final int limit;

    public AnalysisLimitException(String function, int limit, Node node) {
        super("Internal limit: maximum recursion depth of " + limit
                + " reached in function " + function);
        this.node = node;
        this.limit = limit;
    }

    /**
     * @return the scope at which the limit was exceeded.
     */
    public Node getNode() {
        return node;
    }

    public int getLimit() {
        return limit;
    }
}
