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

package pascal.cleak.ir.type;

/**
 * Pointer to another type. Pointers to pointers nest.
 */
public record PointerType(Type pointee) implements Type {

    public static PointerType of(Type pointee) {
        return new PointerType(pointee);
    }

    /**
     * @return number of pointer levels, e.g., 2 for {@code char **}.
     */
    public int getDepth() {
        return pointee instanceof PointerType p ? p.getDepth() + 1 : 1;
    }

    /**
     * @return the innermost non-pointer type.
     */
    public Type getBaseType() {
        return pointee instanceof PointerType p ? p.getBaseType() : pointee;
    }

    @Override
    public String getName() {
        return pointee.getName() + " *";
    }

    @Override
    public String toString() {
        return getName();
    }
}
