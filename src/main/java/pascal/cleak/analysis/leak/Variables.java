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

import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.NewExp;
import pascal.cleak.ir.type.ClassType;
import pascal.cleak.ir.type.ContainerType;
import pascal.cleak.ir.type.PointerType;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.ir.type.Type;
import pascal.cleak.ir.type.UnknownType;

/**
 * Decides which variables the leak checker tracks.
 */
final class Variables {

    private Variables() {
    }

    /**
     * @param var   the assigned variable
     * @param value the value assigned to it
     * @param cpp   whether the function is C++ code
     * @return true if a resource assigned to the variable is not released
     * automatically, so it must be tracked.
     */
    static boolean isLocalVarNoAutoDealloc(Var var, Exp value, boolean cpp) {
        if (!var.isArgument() && (!var.isLocal() || var.isStatic())) {
            return false;
        }
        if (var.isReference() && !var.isArgument()) {
            return false;
        }
        if (cpp) {
            if (value instanceof NewExp && isAutoDealloc(var)) {
                return false;
            }
            if (!var.isPointer() && !(var.getType() instanceof PrimitiveType)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if objects of the variable's base type may release
     * their resources by themselves.
     */
    private static boolean isAutoDealloc(Var var) {
        Type type = var.getType() instanceof PointerType pointer
                ? pointer.getBaseType() : var.getType();
        if (type instanceof ClassType classType) {
            return isAutoDeallocType(classType);
        }
        return type == UnknownType.UNKNOWN;
    }

    /**
     * A class may release resources by itself if it has a constructor or
     * a member of class type; otherwise it may if one of its bases may.
     */
    static boolean isAutoDeallocType(ClassType type) {
        if (type.constructorCount() > 0) {
            return true;
        }
        for (Type member : type.memberTypes()) {
            Type base = member instanceof PointerType pointer
                    ? pointer.getBaseType() : member;
            if (!(base instanceof PrimitiveType) && !(base instanceof ContainerType)) {
                return true;
            }
        }
        return type.bases().stream().anyMatch(Variables::isAutoDeallocType);
    }
}
