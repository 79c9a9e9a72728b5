package com.storyroom.condition;

import com.storyroom.models.ContainerState;
import com.storyroom.models.ContainerStatus;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Single check against container, variable or turn state.
 *
 * The expected value depends on the kind:
 *   STATUS_EQUALS              -> container reference + {@link ContainerStatus}
 *   SEEN_COUNT_GT / LT / EQ    -> container reference + non-negative int
 *   TURN_GT                    -> non-negative int
 *   VARIABLE_EQ / GT / LT      -> {@link VariableExpectation}
 *
 * The typed factories cannot build an ill-shaped condition. {@link #of} accepts loose input
 * (JSON payloads) and rejects it with {@link ConditionValidationException}.
 */
public class UnaryCondition implements Condition {

    private final ConditionType type;
    private final String containerReference;
    private final Object expectedValue;

    private UnaryCondition(ConditionType type, String containerReference, Object expectedValue) {
        this.type = type;
        this.containerReference = containerReference;
        this.expectedValue = expectedValue;
    }

    public static UnaryCondition statusEquals(String containerReference, ContainerStatus status) {
        return of(ConditionType.STATUS_EQUALS, containerReference, status);
    }

    public static UnaryCondition seenCountGt(String containerReference, int count) {
        return of(ConditionType.SEEN_COUNT_GT, containerReference, count);
    }

    public static UnaryCondition seenCountLt(String containerReference, int count) {
        return of(ConditionType.SEEN_COUNT_LT, containerReference, count);
    }

    public static UnaryCondition seenCountEq(String containerReference, int count) {
        return of(ConditionType.SEEN_COUNT_EQ, containerReference, count);
    }

    public static UnaryCondition turnGt(int turn) {
        return of(ConditionType.TURN_GT, null, turn);
    }

    public static UnaryCondition variableEq(String variable, Object value) {
        return of(ConditionType.VARIABLE_EQ, null, new VariableExpectation(variable, value));
    }

    public static UnaryCondition variableGt(String variable, Number value) {
        return of(ConditionType.VARIABLE_GT, null, new VariableExpectation(variable, value));
    }

    public static UnaryCondition variableLt(String variable, Number value) {
        return of(ConditionType.VARIABLE_LT, null, new VariableExpectation(variable, value));
    }

    /**
     * Builds and validates a condition from loosely typed parts.
     */
    public static UnaryCondition of(ConditionType type, String containerReference, Object expectedValue) {
        if (type == null) {
            throw new ConditionValidationException(null, expectedValue, "condition type is required");
        }
        switch (type) {
            case STATUS_EQUALS:
                if (!(expectedValue instanceof ContainerStatus)) {
                    throw new ConditionValidationException(type, expectedValue, "requires a container status");
                }
                requireReference(type, containerReference, expectedValue);
                break;
            case SEEN_COUNT_GT:
            case SEEN_COUNT_LT:
            case SEEN_COUNT_EQ:
                requireNonNegativeInt(type, expectedValue);
                requireReference(type, containerReference, expectedValue);
                break;
            case TURN_GT:
                requireNonNegativeInt(type, expectedValue);
                break;
            case VARIABLE_EQ:
            case VARIABLE_GT:
            case VARIABLE_LT:
                if (!(expectedValue instanceof VariableExpectation)) {
                    throw new ConditionValidationException(type, expectedValue,
                        "requires an object with 'variable' and 'value'");
                }
                VariableExpectation expectation = (VariableExpectation) expectedValue;
                if (expectation.getVariable() == null || expectation.getVariable().isBlank()) {
                    throw new ConditionValidationException(type, expectedValue, "'variable' must be a non-empty string");
                }
                if (expectation.getValue() == null) {
                    throw new ConditionValidationException(type, expectedValue, "'value' is required");
                }
                if (type != ConditionType.VARIABLE_EQ && !(expectation.getValue() instanceof Number)) {
                    throw new ConditionValidationException(type, expectedValue, "'value' must be numeric");
                }
                break;
            default:
                throw new ConditionValidationException(type, expectedValue, "unsupported condition type");
        }
        return new UnaryCondition(type, containerReference, expectedValue);
    }

    private static void requireReference(ConditionType type, String reference, Object value) {
        if (reference == null || reference.isBlank()) {
            throw new ConditionValidationException(type, value, "requires a container reference");
        }
    }

    private static void requireNonNegativeInt(ConditionType type, Object value) {
        if (!(value instanceof Integer) || (Integer) value < 0) {
            throw new ConditionValidationException(type, value, "requires a non-negative integer");
        }
    }

    @Override
    public boolean evaluate(ContainerStateProvider provider) {
        switch (type) {
            case STATUS_EQUALS: {
                ContainerState state = provider.getContainerState(containerReference);
                return state != null && state.getStatus() == expectedValue;
            }
            case SEEN_COUNT_GT: {
                ContainerState state = provider.getContainerState(containerReference);
                return state != null && state.getSeenCount() > (Integer) expectedValue;
            }
            case SEEN_COUNT_LT: {
                ContainerState state = provider.getContainerState(containerReference);
                return state != null && state.getSeenCount() < (Integer) expectedValue;
            }
            case SEEN_COUNT_EQ: {
                ContainerState state = provider.getContainerState(containerReference);
                return state != null && state.getSeenCount() == (Integer) expectedValue;
            }
            case VARIABLE_EQ: {
                VariableExpectation expectation = (VariableExpectation) expectedValue;
                Object actual = variables(provider).get(expectation.getVariable());
                return valuesEqual(actual, expectation.getValue());
            }
            case VARIABLE_GT: {
                VariableExpectation expectation = (VariableExpectation) expectedValue;
                Integer cmp = compareNumeric(variables(provider).getOrDefault(expectation.getVariable(), 0),
                    expectation.getValue());
                return cmp != null && cmp > 0;
            }
            case VARIABLE_LT: {
                VariableExpectation expectation = (VariableExpectation) expectedValue;
                Integer cmp = compareNumeric(variables(provider).getOrDefault(expectation.getVariable(), 0),
                    expectation.getValue());
                return cmp != null && cmp < 0;
            }
            case TURN_GT:
                return provider.getCurrentTurn() > (Integer) expectedValue;
            default:
                return false;
        }
    }

    private static Map<String, Object> variables(ContainerStateProvider provider) {
        Map<String, Object> vars = provider.getGameVariables();
        return vars != null ? vars : Map.of();
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return compareNumeric(actual, expected) == 0;
        }
        return Objects.equals(actual, expected);
    }

    // Null when either side is not a number.
    private static Integer compareNumeric(Object actual, Object expected) {
        if (!(actual instanceof Number) || !(expected instanceof Number)) {
            return null;
        }
        try {
            BigDecimal left = new BigDecimal(actual.toString());
            BigDecimal right = new BigDecimal(expected.toString());
            return left.compareTo(right);
        } catch (NumberFormatException e) {
            // NaN and infinities
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue());
        }
    }

    public ConditionType getType() {
        return type;
    }

    public String getContainerReference() {
        return containerReference;
    }

    public Object getExpectedValue() {
        return expectedValue;
    }

    @Override
    public String toString() {
        return type.getKey() + "(" + (containerReference != null ? containerReference + ", " : "") + expectedValue + ")";
    }
}
