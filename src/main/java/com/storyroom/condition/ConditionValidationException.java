package com.storyroom.condition;

/**
 * Raised when a condition is built with a payload that does not fit its kind.
 */
public class ConditionValidationException extends RuntimeException {
    private final ConditionType conditionType;
    private final Object offendingValue;

    public ConditionValidationException(ConditionType conditionType, Object offendingValue, String detail) {
        super("Invalid " + (conditionType != null ? conditionType.getKey() : "condition")
            + " condition (value=" + offendingValue + "): " + detail);
        this.conditionType = conditionType;
        this.offendingValue = offendingValue;
    }

    public ConditionType getConditionType() {
        return conditionType;
    }

    public Object getOffendingValue() {
        return offendingValue;
    }
}
