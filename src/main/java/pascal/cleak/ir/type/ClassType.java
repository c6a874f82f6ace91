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

import pascal.cleak.ir.stmt.Block;

import java.util.List;

/**
 * Class, struct or union type whose definition is known.
 *
 * @param name             name of the class
 * @param constructorCount number of user-declared constructors
 * @param memberTypes      types of the data members
 * @param bases            direct base classes whose definitions are known
 * @param methodBodies     bodies of the member functions defined in the class
 */
public record ClassType(String name,
                        int constructorCount,
                        List<Type> memberTypes,
                        List<ClassType> bases,
                        List<Block> methodBodies) implements Type {

    public ClassType {
        memberTypes = List.copyOf(memberTypes);
        bases = List.copyOf(bases);
        methodBodies = List.copyOf(methodBodies);
    }

    /**
     * Creates a plain struct: no constructors, no bases, no methods.
     */
    public static ClassType struct(String name, Type... memberTypes) {
        return new ClassType(name, 0, List.of(memberTypes), List.of(), List.of());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
