package com.storyroom.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A knot as filed by the tree builder: an optional header block and its stitch blocks.
 * Every block is an ordered id-to-node map.
 */
public class RawKnot {
    private final Map<Integer, Node> header;
    private final Map<Integer, Map<Integer, Node>> stitches;
    private final Map<Integer, Node> stitchesInfo;

    public RawKnot(Map<Integer, Node> header, Map<Integer, Map<Integer, Node>> stitches,
                   Map<Integer, Node> stitchesInfo) {
        this.header = header != null ? header : new LinkedHashMap<>();
        this.stitches = stitches != null ? stitches : new LinkedHashMap<>();
        this.stitchesInfo = stitchesInfo != null ? stitchesInfo : new LinkedHashMap<>();
    }

    public Map<Integer, Node> getHeader() {
        return Collections.unmodifiableMap(header);
    }

    public Map<Integer, Map<Integer, Node>> getStitches() {
        return Collections.unmodifiableMap(stitches);
    }

    public Map<Integer, Node> getStitchesInfo() {
        return Collections.unmodifiableMap(stitchesInfo);
    }

    /**
     * Stitch name to the id of the first node of that stitch. Empty stitches are not listed.
     */
    public Map<String, Integer> getBlockNameToId() {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<Integer, Node> entry : stitchesInfo.entrySet()) {
            Map<Integer, Node> block = stitches.get(entry.getKey());
            Integer first = firstIdOf(block);
            if (first != null && entry.getValue().getName() != null) {
                result.put(entry.getValue().getName(), first);
            }
        }
        return result;
    }

    /**
     * Header block first (when non-empty), then the stitch blocks in declaration order.
     */
    public List<Map<Integer, Node>> getBlocks() {
        List<Map<Integer, Node>> blocks = new ArrayList<>();
        if (!header.isEmpty()) {
            blocks.add(header);
        }
        blocks.addAll(stitches.values());
        return blocks;
    }

    /**
     * Entry point of the knot: first header node, else first node of the first non-empty stitch.
     */
    public Integer getFirstId() {
        Integer first = firstIdOf(header);
        if (first != null) {
            return first;
        }
        for (Map<Integer, Node> block : stitches.values()) {
            first = firstIdOf(block);
            if (first != null) {
                return first;
            }
        }
        return null;
    }

    public Node getNode(int id) {
        if (header.containsKey(id)) {
            return header.get(id);
        }
        if (stitchesInfo.containsKey(id)) {
            return stitchesInfo.get(id);
        }
        for (Map<Integer, Node> block : stitches.values()) {
            Node node = block.get(id);
            if (node != null) {
                return node;
            }
        }
        return null;
    }

    private static Integer firstIdOf(Map<Integer, Node> block) {
        if (block == null || block.isEmpty()) {
            return null;
        }
        return block.keySet().iterator().next();
    }
}
