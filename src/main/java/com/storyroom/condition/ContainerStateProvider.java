package com.storyroom.condition;

import com.storyroom.models.ContainerState;

import java.util.Map;

/**
 * Read access to the run-time state that conditions are evaluated against.
 */
public interface ContainerStateProvider {

    /**
     * @param containerReference "knot" or "knot.stitch"
     * @return the state, or null when the container is unknown
     */
    ContainerState getContainerState(String containerReference);

    Map<String, Object> getGameVariables();

    int getCurrentTurn();
}
