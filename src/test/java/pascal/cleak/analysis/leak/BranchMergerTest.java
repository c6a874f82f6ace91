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

import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BranchMergerTest {

    private static AllocInfo info(AllocStatus status) {
        return new AllocInfo(1, status, null);
    }

    @Test
    public void testAllocationOnOneArmIsConditional() {
        AllocFact fact = new AllocFact();
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        thenFact.put(1, info(AllocStatus.ALLOCATED));
        BranchMerger.merge(fact, thenFact, elseFact);
        assertTrue(fact.has(1));
        assertTrue(fact.isConditional(1));
    }

    @Test
    public void testAllocationOnBothArms() {
        AllocFact fact = new AllocFact();
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        thenFact.put(1, info(AllocStatus.ALLOCATED));
        elseFact.put(1, info(AllocStatus.ALLOCATED));
        BranchMerger.merge(fact, thenFact, elseFact);
        assertTrue(fact.has(1));
        assertFalse(fact.isConditional(1));
    }

    @Test
    public void testElseArmWinsOnCollision() {
        AllocFact fact = new AllocFact();
        fact.put(1, info(AllocStatus.ALLOCATED));
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        thenFact.get(1).setStatus(AllocStatus.DEALLOCATED);
        BranchMerger.merge(fact, thenFact, elseFact);
        assertEquals(AllocStatus.ALLOCATED, fact.get(1).getStatus());
        assertFalse(fact.isConditional(1));
    }

    @Test
    public void testReleasedConditionalAllocationIsSettled() {
        AllocFact fact = new AllocFact();
        fact.put(1, info(AllocStatus.ALLOCATED));
        fact.addConditional(1);
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        thenFact.get(1).setStatus(AllocStatus.DEALLOCATED);
        BranchMerger.merge(fact, thenFact, elseFact);
        assertEquals(AllocStatus.DEALLOCATED, fact.get(1).getStatus());
        assertFalse(fact.isConditional(1));
    }

    @Test
    public void testConditionalAllocationReleasedOnElseArm() {
        AllocFact fact = new AllocFact();
        fact.put(1, info(AllocStatus.ALLOCATED));
        fact.addConditional(1);
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        elseFact.get(1).setStatus(AllocStatus.DEALLOCATED);
        BranchMerger.merge(fact, thenFact, elseFact);
        assertEquals(AllocStatus.DEALLOCATED, fact.get(1).getStatus());
        assertFalse(fact.isConditional(1));
    }

    @Test
    public void testUnconditionalAllocationReleasedOnOneArmIsNotSettled() {
        AllocFact fact = new AllocFact();
        fact.put(1, info(AllocStatus.ALLOCATED));
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        elseFact.get(1).setStatus(AllocStatus.DEALLOCATED);
        BranchMerger.merge(fact, thenFact, elseFact);
        assertTrue(thenFact.has(1));
        assertEquals(AllocStatus.DEALLOCATED, fact.get(1).getStatus());
    }

    @Test
    public void testConditionalAllocationDroppedByOneArm() {
        AllocFact fact = new AllocFact();
        fact.put(1, info(AllocStatus.ALLOCATED));
        fact.addConditional(1);
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        thenFact.erase(1);
        BranchMerger.merge(fact, thenFact, elseFact);
        assertFalse(fact.has(1));
        assertFalse(fact.isConditional(1));
    }

    @Test
    public void testUsagesAndReferencesAreUnited() {
        IRBuilder b = new IRBuilder();
        AllocFact fact = new AllocFact();
        fact.put(1, info(AllocStatus.ALLOCATED));
        fact.put(2, info(AllocStatus.ALLOCATED));
        AllocFact thenFact = fact.copy();
        AllocFact elseFact = fact.copy();
        thenFact.putUsage(1, new Usage(b.call("keep"), Usage.Kind.USED));
        elseFact.addReferenced(2);
        BranchMerger.merge(fact, thenFact, elseFact);
        assertEquals("keep", fact.getUsage(1).call().getName());
        assertTrue(fact.isReferenced(2));
        assertEquals(Set.of(1, 2), fact.getAllocs().keySet());
    }
}
