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

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Direction of data flow through a function argument.
 */
public enum Direction {

    /**
     * The function reads the argument.
     */
    IN,

    /**
     * The function writes through the argument.
     */
    OUT,
    ;

    @JsonCreator
    public static Direction of(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
