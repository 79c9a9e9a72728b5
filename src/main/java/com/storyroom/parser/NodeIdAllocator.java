package com.storyroom.parser;

/**
 * Hands out node ids for one parse session, starting at 1. Sentinel ids are negative
 * and never come from here.
 */
public class NodeIdAllocator {

    private int nextId;

    public NodeIdAllocator() {
        this(1);
    }

    public NodeIdAllocator(int firstId) {
        if (firstId < 1) {
            throw new IllegalArgumentException("firstId must be >= 1");
        }
        this.nextId = firstId;
    }

    public int next() {
        return nextId++;
    }

    public int peek() {
        return nextId;
    }
}
