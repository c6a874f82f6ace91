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

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins the facts of the two arms of an if-statement.
 */
public final class BranchMerger {

    private BranchMerger() {
    }

    /**
     * Merges the facts at the ends of the two arms into {@code target},
     * which holds the fact before the if-statement. Both arm facts are
     * modified.
     *
     * @param target   the fact before the if-statement, receives the result
     * @param thenFact fact at the end of the then-arm
     * @param elseFact fact at the end of the else-arm (or of the
     *                 condition being false, when there is no else)
     */
    public static void merge(AllocFact target, AllocFact thenFact, AllocFact elseFact) {
        AllocFact old = target.copy();
        target.clear();

        // a conditional allocation that one arm stopped tracking is dropped
        for (int id : old.getConditionalAlloc()) {
            if (!thenFact.has(id) || !elseFact.has(id)) {
                thenFact.erase(id);
                elseFact.erase(id);
            }
        }

        // allocations made on one arm only
        markConditional(target, thenFact, elseFact, old);
        markConditional(target, elseFact, thenFact, old);
        for (int id : old.getConditionalAlloc()) {
            if (thenFact.has(id)) {
                target.addConditional(id);
            }
        }

        // a conditional allocation released on one arm is settled
        settle(target, thenFact, elseFact, old.getConditionalAlloc());
        settle(target, elseFact, thenFact, old.getConditionalAlloc());

        for (AllocFact fact : List.of(thenFact, elseFact)) {
            fact.getAllocs().forEach((id, info) -> target.put(id, info.copy()));
            fact.getUsages().forEach(target::putUsage);
            fact.getReferenced().forEach(target::addReferenced);
        }
    }

    private static void markConditional(AllocFact target, AllocFact fact,
                                        AllocFact other, AllocFact old) {
        for (int id : fact.getAllocs().keySet()) {
            if (!other.has(id) && !old.has(id)) {
                target.addConditional(id);
            }
        }
    }

    private static void settle(AllocFact target, AllocFact fact, AllocFact other,
                               Set<Integer> conditionalBefore) {
        for (Map.Entry<Integer, AllocInfo> e : fact.getAllocs().entrySet()) {
            int id = e.getKey();
            if (e.getValue().managed() && conditionalBefore.contains(id)) {
                target.removeConditional(id);
                other.erase(id);
            }
        }
    }
}
