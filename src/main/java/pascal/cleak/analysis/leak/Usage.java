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

import pascal.cleak.ir.exp.CallExp;

/**
 * Call that may have consumed a tracked variable, recorded when the
 * library metadata does not tell what the callee does with it.
 *
 * @param call the call
 * @param kind how the variable may have been consumed
 */
public record Usage(CallExp call, Kind kind) {

    public enum Kind {

        /**
         * The variable was passed to the call.
         */
        USED,

        /**
         * The call has no arguments but may not return.
         */
        NO_RETURN,
    }
}
