package com.storyroom.models;

public class StoryStats {
    private int totalNodes;
    private int totalEdges;
    private int currentNode;
    private int historyLength;
    private int choicesAvailable;
    private boolean complete;

    public StoryStats() {}

    public StoryStats(int totalNodes, int totalEdges, int currentNode, int historyLength,
                      int choicesAvailable, boolean complete) {
        this.totalNodes = totalNodes;
        this.totalEdges = totalEdges;
        this.currentNode = currentNode;
        this.historyLength = historyLength;
        this.choicesAvailable = choicesAvailable;
        this.complete = complete;
    }

    public int getTotalNodes() { return totalNodes; }
    public void setTotalNodes(int totalNodes) { this.totalNodes = totalNodes; }

    public int getTotalEdges() { return totalEdges; }
    public void setTotalEdges(int totalEdges) { this.totalEdges = totalEdges; }

    public int getCurrentNode() { return currentNode; }
    public void setCurrentNode(int currentNode) { this.currentNode = currentNode; }

    public int getHistoryLength() { return historyLength; }
    public void setHistoryLength(int historyLength) { this.historyLength = historyLength; }

    public int getChoicesAvailable() { return choicesAvailable; }
    public void setChoicesAvailable(int choicesAvailable) { this.choicesAvailable = choicesAvailable; }

    public boolean isComplete() { return complete; }
    public void setComplete(boolean complete) { this.complete = complete; }
}
