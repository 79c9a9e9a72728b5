package com.storyroom.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.storyroom.engine.StoryEngine;

/**
 * One player's run through a story. The engine is single-caller, so all access to it goes
 * through a lock on the session.
 */
public class StorySession {
    private final String id;
    private final String storyName;
    private final long createdAt;
    private final StoryEngine engine;

    public StorySession(String id, String storyName, StoryEngine engine) {
        this.id = id;
        this.storyName = storyName;
        this.engine = engine;
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() { return id; }

    public String getStoryName() { return storyName; }

    public long getCreatedAt() { return createdAt; }

    @JsonIgnore
    public StoryEngine getEngine() { return engine; }
}
