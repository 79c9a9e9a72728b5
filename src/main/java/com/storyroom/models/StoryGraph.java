package com.storyroom.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat result of a parse: traversable nodes by id (sentinels included) and the raw edge list.
 * Divert nodes are consumed into edges and kept apart for inspection.
 */
public class StoryGraph {
    private final Map<Integer, Node> nodes;
    private final List<Edge> edges;
    private final List<Node> diverts;

    public StoryGraph(Map<Integer, Node> nodes, List<Edge> edges, List<Node> diverts) {
        this.nodes = nodes != null ? nodes : new LinkedHashMap<>();
        this.edges = edges != null ? edges : new ArrayList<>();
        this.diverts = diverts != null ? diverts : new ArrayList<>();
    }

    public Map<Integer, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Node> getDiverts() {
        return Collections.unmodifiableList(diverts);
    }

    public Node getNode(int id) {
        return nodes.get(id);
    }
}
