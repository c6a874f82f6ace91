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
 * Built-in arithmetic types and {@code void}. Sizes follow the LP64
 * data model.
 */
public enum PrimitiveType implements Type {

    VOID("void", 0),
    BOOL("bool", 1),
    CHAR("char", 1),
    SHORT("short", 2),
    INT("int", 4),
    LONG("long", 8),
    SIZE_T("size_t", 8),
    FLOAT("float", 4),
    DOUBLE("double", 8),
    ;

    /**
     * Size of a data pointer in bytes.
     */
    public static final int POINTER_SIZE = 8;

    private final String name;

    private final int size;

    PrimitiveType(String name, int size) {
        this.name = name;
        this.size = size;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @return size of this type in bytes.
     */
    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return name;
    }
}
