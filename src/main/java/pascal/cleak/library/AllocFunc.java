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

package pascal.cleak.library;

/**
 * Allocation metadata of a library function.
 *
 * @param family     allocation group the function belongs to
 * @param arg        for allocators, the 1-based position of the out-parameter
 *                   receiving the allocated resource, or -1 if it is returned;
 *                   for deallocators, the 1-based position of the released
 *                   argument
 * @param reallocArg for reallocators, the 1-based position of the
 *                   argument being reallocated; otherwise -1
 */
public record AllocFunc(int family, int arg, int reallocArg) {

    /**
     * Value of {@link #arg()} for allocators returning the resource.
     */
    public static final int RETURNED = -1;

    public static AllocFunc allocator(int family) {
        return new AllocFunc(family, RETURNED, -1);
    }

    public static AllocFunc outParamAllocator(int family, int arg) {
        return new AllocFunc(family, arg, -1);
    }

    public static AllocFunc deallocator(int family, int arg) {
        return new AllocFunc(family, arg, -1);
    }

    public static AllocFunc reallocator(int family, int reallocArg) {
        return new AllocFunc(family, RETURNED, reallocArg);
    }

    public boolean returnsResource() {
        return arg == RETURNED;
    }
}
