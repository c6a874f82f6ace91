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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Data-flow fact of the leak checker: the allocation records of the
 * tracked variables of one control-flow region, keyed by variable id.
 * Iteration is in increasing id order.
 */
public class AllocFact {

    private final TreeMap<Integer, AllocInfo> allocs;

    private final TreeMap<Integer, Usage> possibleUsage;

    /**
     * Variables allocated on only one arm of a preceding branch.
     */
    private final TreeSet<Integer> conditionalAlloc;

    /**
     * Variables bound to a reference, whose leaks are not reported.
     */
    private final TreeSet<Integer> referenced;

    public AllocFact() {
        this(new TreeMap<>(), new TreeMap<>(), new TreeSet<>(), new TreeSet<>());
    }

    private AllocFact(TreeMap<Integer, AllocInfo> allocs,
                      TreeMap<Integer, Usage> possibleUsage,
                      TreeSet<Integer> conditionalAlloc,
                      TreeSet<Integer> referenced) {
        this.allocs = allocs;
        this.possibleUsage = possibleUsage;
        this.conditionalAlloc = conditionalAlloc;
        this.referenced = referenced;
    }

    /**
     * @return the record of the given variable, or null if it is untracked.
     */
    public AllocInfo get(int id) {
        return allocs.get(id);
    }

    public boolean has(int id) {
        return allocs.containsKey(id);
    }

    public void put(int id, AllocInfo info) {
        allocs.put(id, info);
    }

    /**
     * @return unmodifiable view of the allocation records.
     */
    public Map<Integer, AllocInfo> getAllocs() {
        return Collections.unmodifiableMap(allocs);
    }

    public boolean isEmpty() {
        return allocs.isEmpty();
    }

    /**
     * @return the possible usage of the given variable, or null if none.
     */
    public Usage getUsage(int id) {
        return possibleUsage.get(id);
    }

    public void putUsage(int id, Usage usage) {
        possibleUsage.put(id, usage);
    }

    public Map<Integer, Usage> getUsages() {
        return Collections.unmodifiableMap(possibleUsage);
    }

    /**
     * Records the given usage for every tracked variable,
     * replacing all previous usages.
     */
    public void possibleUsageAll(Usage usage) {
        possibleUsage.clear();
        allocs.keySet().forEach(id -> possibleUsage.put(id, usage));
    }

    public boolean isConditional(int id) {
        return conditionalAlloc.contains(id);
    }

    public void addConditional(int id) {
        conditionalAlloc.add(id);
    }

    public void removeConditional(int id) {
        conditionalAlloc.remove(id);
    }

    /**
     * @return a snapshot of the conditionally allocated variables.
     */
    public Set<Integer> getConditionalAlloc() {
        return Set.copyOf(conditionalAlloc);
    }

    public boolean isReferenced(int id) {
        return referenced.contains(id);
    }

    public void addReferenced(int id) {
        referenced.add(id);
    }

    public Set<Integer> getReferenced() {
        return Collections.unmodifiableSet(referenced);
    }

    /**
     * Stops tracking the given variable.
     */
    public void erase(int id) {
        allocs.remove(id);
        possibleUsage.remove(id);
        conditionalAlloc.remove(id);
        referenced.remove(id);
    }

    public void clear() {
        allocs.clear();
        possibleUsage.clear();
        conditionalAlloc.clear();
        referenced.clear();
    }

    /**
     * If the given variable holds the result of a reallocation, turns the
     * reallocated source back into an allocation: the reallocation failed
     * and the source still owns its resource.
     */
    public void reallocToAlloc(int id) {
        AllocInfo info = allocs.get(id);
        if (info == null || info.getReallocatedFrom() == AllocInfo.NONE) {
            return;
        }
        AllocInfo source = allocs.get(info.getReallocatedFrom());
        if (source != null && source.getStatus() == AllocStatus.REALLOCATED) {
            source.setStatus(AllocStatus.ALLOCATED);
        }
    }

    /**
     * @return a deep copy of this fact.
     */
    public AllocFact copy() {
        TreeMap<Integer, AllocInfo> allocsCopy = new TreeMap<>();
        allocs.forEach((id, info) -> allocsCopy.put(id, info.copy()));
        return new AllocFact(allocsCopy, new TreeMap<>(possibleUsage),
                new TreeSet<>(conditionalAlloc), new TreeSet<>(referenced));
    }

    /**
     * Sets the content of this fact to a deep copy of the given fact.
     */
    public void copyFrom(AllocFact fact) {
        clear();
        fact.allocs.forEach((id, info) -> allocs.put(id, info.copy()));
        possibleUsage.putAll(fact.possibleUsage);
        conditionalAlloc.addAll(fact.conditionalAlloc);
        referenced.addAll(fact.referenced);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllocFact that)) {
            return false;
        }
        return allocs.equals(that.allocs)
                && possibleUsage.equals(that.possibleUsage)
                && conditionalAlloc.equals(that.conditionalAlloc)
                && referenced.equals(that.referenced);
    }

    @Override
    public int hashCode() {
        return allocs.hashCode() * 31 + possibleUsage.hashCode();
    }

    @Override
    public String toString() {
        return "AllocFact{allocs=" + allocs
                + ", possibleUsage=" + possibleUsage.keySet()
                + ", conditional=" + conditionalAlloc
                + ", referenced=" + referenced + '}';
    }
}
