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

import pascal.cleak.ir.Node;

/**
 * Allocation state of one tracked variable.
 */
public class AllocInfo {

    /**
     * Variable id of {@link #reallocatedFrom} when the resource
     * is not the result of a reallocation.
     */
    public static final int NONE = -1;

    private int family;

    private AllocStatus status;

    /**
     * Node that produced the current status, e.g., the allocating call.
     */
    private Node origin;

    private int reallocatedFrom;

    public AllocInfo(int family, AllocStatus status, Node origin) {
        this(family, status, origin, NONE);
    }

    public AllocInfo(int family, AllocStatus status, Node origin, int reallocatedFrom) {
        this.family = family;
        this.status = status;
        this.origin = origin;
        this.reallocatedFrom = reallocatedFrom;
    }

    public int getFamily() {
        return family;
    }

    public void setFamily(int family) {
        this.family = family;
    }

    public AllocStatus getStatus() {
        return status;
    }

    public void setStatus(AllocStatus status) {
        this.status = status;
    }

    public Node getOrigin() {
        return origin;
    }

    public void setOrigin(Node origin) {
        this.origin = origin;
    }

    /**
     * @return id of the variable this resource was reallocated from,
     * or {@link #NONE}.
     */
    public int getReallocatedFrom() {
        return reallocatedFrom;
    }

    public boolean managed() {
        return status.managed();
    }

    public AllocInfo copy() {
        return new AllocInfo(family, status, origin, reallocatedFrom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllocInfo that)) {
            return false;
        }
        return family == that.family && status == that.status
                && origin == that.origin && reallocatedFrom == that.reallocatedFrom;
    }

    @Override
    public int hashCode() {
        int result = family;
        result = 31 * result + status.hashCode();
        result = 31 * result + (origin == null ? 0 : origin.getIndex());
        result = 31 * result + reallocatedFrom;
        return result;
    }

    @Override
    public String toString() {
        return status + "(" + family + ")";
    }
}
