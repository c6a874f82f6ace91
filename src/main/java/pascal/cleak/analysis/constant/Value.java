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

package pascal.cleak.analysis.constant;

/**
 * Abstract integer value: UNDEF (no value), a constant, or
 * NAC (not a constant).
 */
public class Value {

    private static final Value NAC = new Value(Kind.NAC);

    private static final Value UNDEF = new Value(Kind.UNDEF);

    private final Kind kind;

    private final long value;

    private Value(Kind kind) {
        this.kind = kind;
        this.value = 0;
    }

    private Value(long value) {
        this.kind = Kind.CONSTANT;
        this.value = value;
    }

    public static Value getNAC() {
        return NAC;
    }

    public static Value getUndef() {
        return UNDEF;
    }

    public static Value makeConstant(long value) {
        return new Value(value);
    }

    public static Value makeBool(boolean b) {
        return new Value(b ? 1 : 0);
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    public boolean isNAC() {
        return kind == Kind.NAC;
    }

    public boolean isUndef() {
        return kind == Kind.UNDEF;
    }

    /**
     * @throws UnsupportedOperationException if this value is not a constant
     */
    public long getConstant() {
        if (!isConstant()) {
            throw new UnsupportedOperationException(this + " is not a constant");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value other)) {
            return false;
        }
        return kind == other.kind && value == other.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value) * 31 + kind.hashCode();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NAC -> "NAC";
            case UNDEF -> "UNDEF";
            case CONSTANT -> Long.toString(value);
        };
    }

    private enum Kind {
        UNDEF,
        CONSTANT,
        NAC,
    }
}
