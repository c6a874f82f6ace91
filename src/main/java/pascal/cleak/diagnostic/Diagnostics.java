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

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable, ordered list of diagnostics.
 */
public class Diagnostics implements Iterable<Diagnostic> {

    private static final Diagnostics EMPTY = new Diagnostics(List.of());

    private final List<Diagnostic> diagnostics;

    public Diagnostics(List<Diagnostic> diagnostics) {
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static Diagnostics empty() {
        return EMPTY;
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public Diagnostic get(int i) {
        return diagnostics.get(i);
    }

    public List<Diagnostic> ofKind(ErrorKind kind) {
        return diagnostics.stream()
                .filter(d -> d.kind() == kind)
                .toList();
    }

    public Stream<Diagnostic> stream() {
        return diagnostics.stream();
    }

    public List<Diagnostic> toList() {
        return diagnostics;
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return diagnostics.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Diagnostics that
                && diagnostics.equals(that.diagnostics));
    }

    @Override
    public int hashCode() {
        return diagnostics.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        diagnostics.forEach(d -> sb.append(d).append('\n'));
        return sb.toString();
    }
}
