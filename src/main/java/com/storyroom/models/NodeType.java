package com.storyroom.models;

public enum NodeType {
    BASE,
    CHOICE,
    GATHER,
    KNOT,
    STITCHES,
    DIVERT,
    END,
    BEGIN,
    AUTO_END
}
