package com.storyroom.models;

/**
 * Visitation state of one knot or knot.stitch container during a run.
 */
public class ContainerState {
    private ContainerStatus status = ContainerStatus.NOT_CLICKED;
    private int seenCount;
    private Integer lastSeenTurn;

    public ContainerState() {}

    public ContainerState(ContainerStatus status, int seenCount, Integer lastSeenTurn) {
        this.status = status;
        this.seenCount = seenCount;
        this.lastSeenTurn = lastSeenTurn;
    }

    public void markSeen(int turn) {
        this.seenCount++;
        this.lastSeenTurn = turn;
        this.status = ContainerStatus.SEEN;
    }

    public ContainerStatus getStatus() { return status; }
    public void setStatus(ContainerStatus status) { this.status = status; }

    public int getSeenCount() { return seenCount; }
    public void setSeenCount(int seenCount) { this.seenCount = seenCount; }

    public Integer getLastSeenTurn() { return lastSeenTurn; }
    public void setLastSeenTurn(Integer lastSeenTurn) { this.lastSeenTurn = lastSeenTurn; }

    @Override
    public String toString() {
        return "ContainerState{" +
            "status=" + status +
            ", seenCount=" + seenCount +
            ", lastSeenTurn=" + lastSeenTurn +
            '}';
    }
}
