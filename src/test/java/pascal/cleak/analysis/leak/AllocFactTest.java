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

import org.junit.Test;
import pascal.cleak.ir.IRBuilder;
import pascal.cleak.ir.exp.CallExp;

import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class AllocFactTest {

    private static AllocInfo alloc(int family) {
        return new AllocInfo(family, AllocStatus.ALLOCATED, null);
    }

    @Test
    public void testCopyIsDeep() {
        AllocFact fact = new AllocFact();
        fact.put(1, alloc(1));
        fact.addConditional(1);
        AllocFact copy = fact.copy();
        assertEquals(fact, copy);
        copy.get(1).setStatus(AllocStatus.DEALLOCATED);
        copy.addReferenced(1);
        assertEquals(AllocStatus.ALLOCATED, fact.get(1).getStatus());
        assertFalse(fact.isReferenced(1));
        assertNotEquals(fact, copy);
    }

    @Test
    public void testEraseForgetsEverything() {
        CallExp call = new IRBuilder().call("use");
        AllocFact fact = new AllocFact();
        fact.put(1, alloc(1));
        fact.putUsage(1, new Usage(call, Usage.Kind.USED));
        fact.addConditional(1);
        fact.addReferenced(1);
        fact.erase(1);
        assertFalse(fact.has(1));
        assertNull(fact.getUsage(1));
        assertFalse(fact.isConditional(1));
        assertFalse(fact.isReferenced(1));
        assertTrue(fact.isEmpty());
    }

    @Test
    public void testPossibleUsageAllReplacesUsages() {
        IRBuilder b = new IRBuilder();
        CallExp first = b.call("first");
        CallExp second = b.call("second");
        AllocFact fact = new AllocFact();
        fact.put(1, alloc(1));
        fact.put(2, alloc(1));
        fact.putUsage(1, new Usage(first, Usage.Kind.USED));
        fact.putUsage(7, new Usage(first, Usage.Kind.USED));
        fact.possibleUsageAll(new Usage(second, Usage.Kind.NO_RETURN));
        assertEquals(Set.of(1, 2), fact.getUsages().keySet());
        assertEquals(second, fact.getUsage(1).call());
        assertEquals(Usage.Kind.NO_RETURN, fact.getUsage(2).kind());
    }

    @Test
    public void testReallocToAlloc() {
        AllocFact fact = new AllocFact();
        fact.put(1, new AllocInfo(1, AllocStatus.REALLOCATED, null));
        fact.put(2, new AllocInfo(1, AllocStatus.ALLOCATED, null, 1));
        fact.reallocToAlloc(2);
        assertEquals(AllocStatus.ALLOCATED, fact.get(1).getStatus());
    }

    @Test
    public void testReallocToAllocWithoutSource() {
        AllocFact fact = new AllocFact();
        fact.put(1, new AllocInfo(1, AllocStatus.REALLOCATED, null));
        fact.put(2, alloc(1));
        fact.reallocToAlloc(2);
        fact.reallocToAlloc(3);
        assertEquals(AllocStatus.REALLOCATED, fact.get(1).getStatus());
    }

    @Test
    public void testCopyFrom() {
        AllocFact source = new AllocFact();
        source.put(3, alloc(2));
        source.addReferenced(3);
        AllocFact fact = new AllocFact();
        fact.put(1, alloc(1));
        fact.copyFrom(source);
        assertEquals(source, fact);
        assertFalse(fact.has(1));
        fact.get(3).setFamily(5);
        assertEquals(2, source.get(3).getFamily());
    }

    @Test
    public void testManagedStatuses() {
        assertFalse(AllocStatus.ALLOCATED.managed());
        assertFalse(AllocStatus.UNALLOCATED.managed());
        assertTrue(AllocStatus.DEALLOCATED.managed());
        assertTrue(AllocStatus.REALLOCATED.managed());
        assertTrue(AllocStatus.OWNED.managed());
    }
}
