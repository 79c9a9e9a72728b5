package com.storyroom.condition;

public enum ConditionType {
    STATUS_EQUALS("status_equals"),
    SEEN_COUNT_GT("seen_count_gt"),
    SEEN_COUNT_LT("seen_count_lt"),
    SEEN_COUNT_EQ("seen_count_eq"),
    VARIABLE_EQ("variable_eq"),
    VARIABLE_GT("variable_gt"),
    VARIABLE_LT("variable_lt"),
    TURN_GT("turn_gt");

    private final String key;

    ConditionType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isSeenCount() {
        return this == SEEN_COUNT_GT || this == SEEN_COUNT_LT || this == SEEN_COUNT_EQ;
    }

    public boolean isVariable() {
        return this == VARIABLE_EQ || this == VARIABLE_GT || this == VARIABLE_LT;
    }

    public static ConditionType fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim();
        for (ConditionType type : values()) {
            if (type.key.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
