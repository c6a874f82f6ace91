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

package pascal.cleak.diagnostic;

import java.util.List;

/**
 * A finding reported by an analysis.
 *
 * @param kind      kind of the finding
 * @param id        stable identifier, e.g., {@code memleak}
 * @param severity  severity
 * @param locations related locations; the last one is where the finding is
 *                  triggered, earlier ones lead up to it (e.g., the allocation)
 * @param message   human-readable message
 * @param certainty certainty
 * @param cwe       CWE number, or 0 if none applies
 * @param function  name of the function in which the finding occurs
 */
public record Diagnostic(ErrorKind kind,
                         String id,
                         Severity severity,
                         List<Location> locations,
                         String message,
                         Certainty certainty,
                         int cwe,
                         String function) {

    public Diagnostic {
        if (locations.isEmpty()) {
            throw new IllegalArgumentException("Diagnostic " + id + " has no location");
        }
        locations = List.copyOf(locations);
    }

    /**
     * @return the location where the finding is triggered.
     */
    public Location location() {
        return locations.get(locations.size() - 1);
    }

    /**
     * @return the line where the finding is triggered.
     */
    public int line() {
        return location().line();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(function).append(':').append(line()).append(": ")
                .append(severity).append(": ").append(message)
                .append(" [").append(id).append(']');
        if (certainty == Certainty.INCONCLUSIVE) {
            sb.append(" (inconclusive)");
        }
        return sb.toString();
    }
}
