package com.storyroom.models;

import java.util.Objects;

/**
 * Directed link between two node ids. Edges carry no key, the same pair may appear twice.
 */
public class Edge {
    private int source;
    private int target;

    public Edge() {}

    public Edge(int source, int target) {
        this.source = source;
        this.target = target;
    }

    public int getSource() { return source; }
    public void setSource(int source) { this.source = source; }

    public int getTarget() { return target; }
    public void setTarget(int target) { this.target = target; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge)) {
            return false;
        }
        Edge other = (Edge) o;
        return source == other.source && target == other.target;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
