package com.storyroom.parser;

import com.storyroom.models.Edge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the dead ends reachable from a node in a partial edge list.
 */
public final class LeafFinder {

    private LeafFinder() {}

    /**
     * All ids reachable from {@code startId} (itself included) that have no outgoing edge.
     * Cycles are walked once; a start id with no edges at all is its own leaf.
     */
    public static List<Integer> findLeaves(int startId, List<Edge> edges) {
        Map<Integer, List<Integer>> successors = new LinkedHashMap<>();
        for (Edge edge : edges) {
            successors.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
        }

        Set<Integer> reachable = new LinkedHashSet<>();
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(startId);
        while (!pending.isEmpty()) {
            int id = pending.pop();
            if (!reachable.add(id)) {
                continue;
            }
            for (int next : successors.getOrDefault(id, List.of())) {
                if (!reachable.contains(next)) {
                    pending.push(next);
                }
            }
        }

        List<Integer> leaves = new ArrayList<>();
        for (int id : reachable) {
            if (successors.getOrDefault(id, List.of()).isEmpty()) {
                leaves.add(id);
            }
        }
        return leaves;
    }
}
