package com.storyroom.condition;

import java.util.Objects;

/**
 * Payload of the variable conditions: which game variable, compared against which value.
 */
public class VariableExpectation {
    private final String variable;
    private final Object value;

    public VariableExpectation(String variable, Object value) {
        this.variable = variable;
        this.value = value;
    }

    public String getVariable() {
        return variable;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableExpectation)) {
            return false;
        }
        VariableExpectation other = (VariableExpectation) o;
        return Objects.equals(variable, other.variable) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value);
    }

    @Override
    public String toString() {
        return "{variable=" + variable + ", value=" + value + "}";
    }
}
