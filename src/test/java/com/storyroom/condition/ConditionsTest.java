package com.storyroom.condition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyroom.models.ContainerStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConditionsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Condition parse(String json) throws Exception {
        return Conditions.fromJson(mapper.readTree(json));
    }

    @Test
    void buildsSeenCountCondition() throws Exception {
        UnaryCondition condition = (UnaryCondition) parse("{\"type\":\"seen_count_gt\",\"container\":\"forest\",\"value\":2}");
        assertEquals(ConditionType.SEEN_COUNT_GT, condition.getType());
        assertEquals("forest", condition.getContainerReference());
        assertEquals(2, condition.getExpectedValue());
    }

    @Test
    void statusIsCaseInsensitive() throws Exception {
        UnaryCondition condition = (UnaryCondition) parse("{\"type\":\"status_equals\",\"container\":\"forest\",\"value\":\"seen\"}");
        assertEquals(ContainerStatus.SEEN, condition.getExpectedValue());
    }

    @Test
    void buildsVariableCondition() throws Exception {
        UnaryCondition condition = (UnaryCondition) parse(
            "{\"type\":\"variable_eq\",\"value\":{\"variable\":\"door\",\"value\":\"open\"}}");
        VariableExpectation expectation = (VariableExpectation) condition.getExpectedValue();
        assertEquals("door", expectation.getVariable());
        assertEquals("open", expectation.getValue());
    }

    @Test
    void buildsNestedBinaryCondition() throws Exception {
        BinaryCondition condition = (BinaryCondition) parse(
            "{\"left\":{\"type\":\"turn_gt\",\"value\":1},\"operator\":\"or\","
                + "\"right\":{\"type\":\"seen_count_eq\",\"container\":\"lake\",\"value\":0}}");
        assertEquals(BinaryCondition.OR, condition.getOperator());
        assertTrue(condition.getLeft() instanceof UnaryCondition);

        FakeStateProvider provider = new FakeStateProvider().container("lake");
        assertTrue(condition.evaluate(provider));
    }

    @Test
    void rejectsUnknownType() {
        assertThrows(ConditionValidationException.class, () -> parse("{\"type\":\"smells_like\",\"value\":1}"));
    }

    @Test
    void rejectsNonIntegerCount() {
        ConditionValidationException e = assertThrows(ConditionValidationException.class,
            () -> parse("{\"type\":\"seen_count_gt\",\"container\":\"forest\",\"value\":\"two\"}"));
        assertEquals(ConditionType.SEEN_COUNT_GT, e.getConditionType());
    }

    @Test
    void rejectsUnknownStatus() {
        assertThrows(ConditionValidationException.class,
            () -> parse("{\"type\":\"status_equals\",\"container\":\"forest\",\"value\":\"GLOWING\"}"));
    }

    @Test
    void rejectsNonObjectPayload() {
        assertThrows(ConditionValidationException.class, () -> parse("[1, 2]"));
    }
}
