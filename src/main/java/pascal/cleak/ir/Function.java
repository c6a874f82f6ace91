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

import pascal.cleak.ir.stmt.Block;
import pascal.cleak.ir.type.PrimitiveType;
import pascal.cleak.ir.type.Type;

/**
 * Descriptor of a function declared in the program.
 *
 * @param name       name of the function
 * @param returnType declared return type
 * @param body       body of the function, or null if only declared
 * @param noReturn   whether the function carries the noreturn attribute
 */
public record Function(String name, Type returnType,
                       Block body, boolean noReturn) {

    /**
     * Creates a descriptor of a function that is declared but not defined.
     */
    public static Function declared(String name, Type returnType) {
        return new Function(name, returnType, null, false);
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean returnsBool() {
        return returnType == PrimitiveType.BOOL;
    }

    @Override
    public String toString() {
        return name + "()";
    }
}
