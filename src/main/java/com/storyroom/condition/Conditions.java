package com.storyroom.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.storyroom.models.ContainerStatus;

/**
 * Builds conditions from JSON payloads.
 *
 * Shapes:
 *   { "type": "seen_count_gt", "container": "forest", "value": 2 }
 *   { "type": "status_equals", "container": "forest", "value": "SEEN" }
 *   { "type": "variable_gt", "value": { "variable": "gold", "value": 10 } }
 *   { "type": "turn_gt", "value": 3 }
 *   { "left": {...}, "operator": "AND", "right": {...} }
 */
public final class Conditions {

    private Conditions() {}

    public static Condition fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConditionValidationException(null, node, "condition must be a JSON object");
        }
        if (node.has("operator")) {
            Condition left = fromJson(node.get("left"));
            Condition right = fromJson(node.get("right"));
            String operator = node.get("operator").asText("").trim().toUpperCase();
            return new BinaryCondition(left, operator, right);
        }

        String typeKey = node.path("type").asText(null);
        ConditionType type = ConditionType.fromKey(typeKey);
        if (type == null) {
            throw new ConditionValidationException(null, typeKey, "unknown condition type");
        }
        String container = node.hasNonNull("container") ? node.get("container").asText() : null;
        JsonNode valueNode = node.get("value");
        return UnaryCondition.of(type, container, toExpectedValue(type, valueNode));
    }

    private static Object toExpectedValue(ConditionType type, JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull()) {
            return null;
        }
        if (type == ConditionType.STATUS_EQUALS) {
            if (!valueNode.isTextual()) {
                return valueNode.toString();
            }
            try {
                return ContainerStatus.valueOf(valueNode.asText().trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new ConditionValidationException(type, valueNode.asText(), "unknown container status");
            }
        }
        if (type.isVariable()) {
            if (!valueNode.isObject() || !valueNode.has("variable") || !valueNode.has("value")
                || !valueNode.get("variable").isTextual()) {
                return valueNode.toString();
            }
            return new VariableExpectation(valueNode.get("variable").asText(), scalarValue(valueNode.get("value")));
        }
        // seen counts and turns
        return valueNode.isInt() ? valueNode.intValue() : valueNode.toString();
    }

    /**
     * JSON scalar as Integer, Long, Double, Boolean or String; null for JSON null.
     */
    public static Object scalarValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
