package com.storyroom.models;

/**
 * Possible statuses of a knot or stitch container.
 */
public enum ContainerStatus {
    NOT_CLICKED,
    CLICKED,
    SEEN,
    NOT_SEEN,
    DISABLED,
    ACTIVE
}
