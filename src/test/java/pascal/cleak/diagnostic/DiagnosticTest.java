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

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;

public class DiagnosticTest {

    private static Diagnostic memleak(Certainty certainty) {
        return new Diagnostic(ErrorKind.LEAK, "memleak", Severity.ERROR,
                List.of(new Location(0, 2), new Location(5, 4)),
                "Memory leak: p", certainty, 401, "f");
    }

    @Test
    public void testLastLocationIsReported() {
        Diagnostic d = memleak(Certainty.NORMAL);
        assertEquals(4, d.line());
        assertEquals("f:4: error: Memory leak: p [memleak]", d.toString());
    }

    @Test
    public void testInconclusiveIsMarked() {
        assertEquals("f:4: error: Memory leak: p [memleak] (inconclusive)",
                memleak(Certainty.INCONCLUSIVE).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoLocation() {
        new Diagnostic(ErrorKind.LEAK, "memleak", Severity.ERROR, List.of(),
                "Memory leak: p", Certainty.NORMAL, 401, "f");
    }
}
