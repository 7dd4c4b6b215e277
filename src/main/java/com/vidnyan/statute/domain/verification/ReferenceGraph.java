package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.model.Statute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph of supersession and amendment links within one statute set.
 * An edge {@code A → B} means A supersedes or amends B. Links to ids outside
 * the set are left out; resolving them is the registry's job.
 */
public final class ReferenceGraph {

    private final Map<String, SortedSet<String>> references; // statute → statutes it references
    private final SortedSet<String> statutes;

    private ReferenceGraph(Map<String, SortedSet<String>> references, SortedSet<String> statutes) {
        this.references = Collections.unmodifiableMap(references);
        this.statutes = Collections.unmodifiableSortedSet(statutes);
    }

    /**
     * Build the reference graph of a statute set.
     */
    public static ReferenceGraph build(List<Statute> statuteSet) {
        SortedSet<String> ids = new TreeSet<>();
        statuteSet.forEach(s -> ids.add(s.id()));

        Map<String, SortedSet<String>> refs = new TreeMap<>();
        for (Statute statute : statuteSet) {
            for (String target : statute.references()) {
                if (ids.contains(target)) {
                    refs.computeIfAbsent(statute.id(), k -> new TreeSet<>()).add(target);
                }
            }
        }
        return new ReferenceGraph(refs, ids);
    }

    /**
     * Get statutes that a statute references.
     */
    public Set<String> getReferences(String statuteId) {
        return references.getOrDefault(statuteId, Collections.emptySortedSet());
    }

    public Set<String> getAllStatutes() {
        return statutes;
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    /**
     * Find every elementary cycle exactly once.
     * Each cycle starts at its smallest id, so a cycle's members are listed in
     * link order from that id; the closing edge back to the start is implied.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        for (String start : statutes) {
            List<String> path = new ArrayList<>();
            Set<String> inStack = new HashSet<>();
            path.add(start);
            inStack.add(start);
            findCyclesFrom(start, start, path, inStack, cycles);
        }
        return cycles;
    }

    private void findCyclesFrom(
            String start,
            String current,
            List<String> path,
            Set<String> inStack,
            List<List<String>> cycles
    ) {
        for (String next : getReferences(current)) {
            if (next.equals(start)) {
                cycles.add(List.copyOf(path));
            } else if (next.compareTo(start) > 0 && !inStack.contains(next)) {
                // only ids above the start, so each cycle is found from its smallest member
                path.add(next);
                inStack.add(next);
                findCyclesFrom(start, next, path, inStack, cycles);
                path.remove(path.size() - 1);
                inStack.remove(next);
            }
        }
    }

    /**
     * Statutes reachable from {@code statuteId} by following links, excluding itself unless on a cycle.
     */
    public Set<String> reachableFrom(String statuteId) {
        Set<String> visited = new TreeSet<>();
        List<String> queue = new ArrayList<>(getReferences(statuteId));
        while (!queue.isEmpty()) {
            String id = queue.remove(queue.size() - 1);
            if (visited.add(id)) {
                queue.addAll(getReferences(id));
            }
        }
        return visited;
    }

    public Stats stats() {
        return new Stats(
                statutes.size(),
                references.values().stream().mapToInt(Set::size).sum()
        );
    }

    public record Stats(int statuteCount, int linkCount) {}
}
