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

import pascal.cleak.ir.exp.CallExp;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read-only metadata about library functions: which functions allocate,
 * deallocate or reallocate resources, and how they treat their arguments.
 * <p>
 * Allocation families are positive integers assigned by the implementation.
 * The families of {@code new} and {@code new[]} are hard-wired,
 * see {@link #NEW} and {@link #NEW_ARRAY}.
 */
public interface Library {

    /**
     * Family of memory allocated by scalar {@code new}.
     */
    int NEW = -1;

    /**
     * Family of memory allocated by {@code new[]}.
     */
    int NEW_ARRAY = -2;

    /**
     * Family of allocations whose allocator is unknown.
     */
    int UNKNOWN = 0;

    Optional<AllocFunc> getAllocator(CallExp call);

    Optional<AllocFunc> getDeallocator(CallExp call);

    /**
     * Looks up a deallocator by name, e.g., for a function designator
     * given as a smart-pointer deleter.
     */
    Optional<AllocFunc> getDeallocator(String functionName);

    Optional<AllocFunc> getReallocator(CallExp call);

    /**
     * @return true if the call constructs a smart pointer,
     * e.g., {@code std::unique_ptr<T>(p)}.
     */
    boolean isSmartPointer(CallExp call);

    /**
     * @param argNr 1-based position of the argument
     * @return the declared directions of the argument; empty if unknown.
     */
    Set<Direction> getArgDirection(CallExp call, int argNr);

    /**
     * @return true if calls to the function neither release nor keep
     * pointers passed to it.
     */
    boolean isLeakIgnore(String functionName);

    /**
     * @return true if the function takes ownership of pointers passed to it.
     */
    boolean isUse(String functionName);

    /**
     * @return 1-based position of the argument that the function returns,
     * e.g., 1 for {@code strcpy}.
     */
    OptionalInt getReturnedArg(CallExp call);

    /**
     * @return true if the family denotes resources (e.g., file handles)
     * rather than memory.
     */
    boolean isResource(int family);

    /**
     * @return whether the function never returns; empty if the library
     * does not know the function.
     */
    Optional<Boolean> isNoReturn(CallExp call);

    /**
     * @return true if the function is a built-in of a library container,
     * whose calls never take part in resource management.
     */
    boolean isContainerBuiltin(CallExp call);

    /**
     * @return the name of the called function as known to the library,
     * or an empty string if the callee cannot be named.
     */
    String getFunctionName(CallExp call);
}
