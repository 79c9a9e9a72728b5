package com.storyroom.parser;

import com.storyroom.models.Node;

/**
 * Outcome of classifying one raw line: the node (null for skipped lines) and the level
 * carried to the next line.
 */
public class LineParseResult {
    private final Node node;
    private final int level;

    private LineParseResult(Node node, int level) {
        this.node = node;
        this.level = level;
    }

    public static LineParseResult node(Node node, int level) {
        return new LineParseResult(node, level);
    }

    public static LineParseResult skipped(int level) {
        return new LineParseResult(null, level);
    }

    public boolean hasNode() {
        return node != null;
    }

    public Node getNode() {
        return node;
    }

    public int getLevel() {
        return level;
    }
}
