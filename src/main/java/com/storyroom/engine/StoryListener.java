package com.storyroom.engine;

import com.storyroom.models.Node;

import java.util.List;

/**
 * Presentation-side hooks. Called synchronously from inside engine methods; implementations
 * must not drive the engine from these callbacks.
 */
public interface StoryListener {

    StoryListener NONE = new StoryListener() {};

    default void onContentAdded(String content) {}

    default void onChoicesUpdated(List<Node> choices) {}

    default void onStoryComplete() {}
}
