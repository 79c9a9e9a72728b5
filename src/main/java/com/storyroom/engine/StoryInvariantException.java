package com.storyroom.engine;

/**
 * The traversal reached a state the graph builder should never produce,
 * such as a dead end that is neither END nor AUTO_END.
 */
public class StoryInvariantException extends RuntimeException {
    private final int nodeId;

    public StoryInvariantException(String message, int nodeId) {
        super(message + " (node " + nodeId + ")");
        this.nodeId = nodeId;
    }

    public int getNodeId() {
        return nodeId;
    }
}
