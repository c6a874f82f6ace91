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

package pascal.cleak.diagnostic;

/**
 * Kinds of findings of the leak checker.
 */
public enum ErrorKind {

    /**
     * Allocated resource never freed on a path that leaves its scope.
     */
    LEAK,

    /**
     * Resource released by a deallocator of another allocation family.
     */
    MISMATCH,

    DOUBLE_FREE,

    /**
     * Pointer dereferenced after its memory has been released.
     */
    DEALLOCATED_USE,

    /**
     * Released pointer returned or dereferenced in a return statement.
     */
    DEALLOCATED_RETURN,

    /**
     * Nesting limit hit; the function is skipped.
     */
    ANALYSIS_LIMIT_EXCEEDED,

    /**
     * Library metadata is insufficient to decide whether a resource leaks.
     */
    CONFIGURATION_INFO,
}
