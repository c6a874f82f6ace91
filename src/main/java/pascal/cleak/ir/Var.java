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

package pascal.cleak.ir;

import pascal.cleak.ir.type.PointerType;
import pascal.cleak.ir.type.Type;

/**
 * Descriptor of a variable or parameter, as resolved by the front end.
 * Uses of a variable in the syntax graph refer to it via
 * {@link pascal.cleak.ir.exp.VarExp}.
 */
public class Var {

    /**
     * Unique id of this variable in its function.
     */
    private final int id;

    private final String name;

    private final Type type;

    private final boolean argument;

    private final boolean local;

    private final boolean isStatic;

    private final boolean reference;

    private final boolean array;

    public Var(int id, String name, Type type,
               boolean argument, boolean local, boolean isStatic,
               boolean reference, boolean array) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.argument = argument;
        this.local = local;
        this.isStatic = isStatic;
        this.reference = reference;
        this.array = array;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isArgument() {
        return argument;
    }

    public boolean isLocal() {
        return local;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isReference() {
        return reference;
    }

    public boolean isArray() {
        return array;
    }

    public boolean isPointer() {
        return type instanceof PointerType;
    }

    /**
     * @return levels of indirection of this variable's type, 0 for non-pointers.
     */
    public int getPointerDepth() {
        return type instanceof PointerType p ? p.getDepth() : 0;
    }

    @Override
    public String toString() {
        return name;
    }
}
