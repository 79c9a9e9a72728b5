package com.storyroom.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nested form of a parsed script: the story header block plus the knots in parse order.
 */
public class RawStory {
    private final Map<Integer, Node> header;
    private final Map<Integer, RawKnot> knots;
    private final Map<Integer, Node> knotsInfo;

    public RawStory(Map<Integer, Node> header, Map<Integer, RawKnot> knots, Map<Integer, Node> knotsInfo) {
        this.header = header != null ? header : new LinkedHashMap<>();
        this.knots = knots != null ? knots : new LinkedHashMap<>();
        this.knotsInfo = knotsInfo != null ? knotsInfo : new LinkedHashMap<>();
    }

    public Map<Integer, Node> getHeader() {
        return Collections.unmodifiableMap(header);
    }

    public Map<Integer, RawKnot> getKnots() {
        return Collections.unmodifiableMap(knots);
    }

    public Map<Integer, Node> getKnotsInfo() {
        return Collections.unmodifiableMap(knotsInfo);
    }

    /**
     * Story-wide lookup: "knot" and "knot.stitch" to the id of their first node.
     */
    public Map<String, Integer> getBlockNameToId() {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<Integer, Node> entry : knotsInfo.entrySet()) {
            RawKnot knot = knots.get(entry.getKey());
            String knotName = entry.getValue().getName();
            if (knot == null || knotName == null) {
                continue;
            }
            Integer first = knot.getFirstId();
            if (first != null) {
                result.put(knotName, first);
            }
            for (Map.Entry<String, Integer> stitch : knot.getBlockNameToId().entrySet()) {
                result.put(knotName + "." + stitch.getKey(), stitch.getValue());
            }
        }
        return result;
    }

    public Node getNode(int id) {
        if (header.containsKey(id)) {
            return header.get(id);
        }
        if (knotsInfo.containsKey(id)) {
            return knotsInfo.get(id);
        }
        for (RawKnot knot : knots.values()) {
            Node node = knot.getNode(id);
            if (node != null) {
                return node;
            }
        }
        return null;
    }
}
