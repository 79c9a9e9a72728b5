package com.storyroom.condition;

import com.storyroom.models.ContainerStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnaryConditionTest {

    @Test
    void seenCountZeroHoldsOnlyBeforeFirstVisit() {
        FakeStateProvider provider = new FakeStateProvider().container("forest");
        UnaryCondition neverSeen = UnaryCondition.seenCountEq("forest", 0);

        assertTrue(neverSeen.evaluate(provider));
        provider.containers.get("forest").markSeen(1);
        assertFalse(neverSeen.evaluate(provider));
    }

    @Test
    void seenCountComparisons() {
        FakeStateProvider provider = new FakeStateProvider().container("lake");
        provider.containers.get("lake").markSeen(1);
        provider.containers.get("lake").markSeen(2);

        assertTrue(UnaryCondition.seenCountGt("lake", 1).evaluate(provider));
        assertFalse(UnaryCondition.seenCountGt("lake", 2).evaluate(provider));
        assertTrue(UnaryCondition.seenCountLt("lake", 3).evaluate(provider));
    }

    @Test
    void unknownContainerIsFalse() {
        FakeStateProvider provider = new FakeStateProvider();
        assertFalse(UnaryCondition.seenCountEq("nowhere", 0).evaluate(provider));
        assertFalse(UnaryCondition.seenCountLt("nowhere", 5).evaluate(provider));
        assertFalse(UnaryCondition.statusEquals("nowhere", ContainerStatus.NOT_CLICKED).evaluate(provider));
    }

    @Test
    void statusEqualsTracksVisits() {
        FakeStateProvider provider = new FakeStateProvider().container("forest");
        UnaryCondition seen = UnaryCondition.statusEquals("forest", ContainerStatus.SEEN);
        assertFalse(seen.evaluate(provider));
        provider.containers.get("forest").markSeen(0);
        assertTrue(seen.evaluate(provider));
    }

    @Test
    void missingVariableCountsAsZero() {
        FakeStateProvider provider = new FakeStateProvider();
        assertFalse(UnaryCondition.variableGt("gold", 3).evaluate(provider));
        assertTrue(UnaryCondition.variableLt("gold", 5).evaluate(provider));
        assertFalse(UnaryCondition.variableEq("gold", 0).evaluate(provider));
    }

    @Test
    void variablesCompareNumericallyAcrossTypes() {
        FakeStateProvider provider = new FakeStateProvider();
        provider.variables.put("gold", 5);
        provider.variables.put("door", "open");

        assertTrue(UnaryCondition.variableEq("gold", 5.0).evaluate(provider));
        assertTrue(UnaryCondition.variableGt("gold", 4.5).evaluate(provider));
        assertFalse(UnaryCondition.variableLt("gold", 5L).evaluate(provider));
        assertTrue(UnaryCondition.variableEq("door", "open").evaluate(provider));
        assertFalse(UnaryCondition.variableGt("door", 1).evaluate(provider));
    }

    @Test
    void turnGtReadsCurrentTurn() {
        FakeStateProvider provider = new FakeStateProvider();
        provider.turn = 3;
        assertTrue(UnaryCondition.turnGt(2).evaluate(provider));
        assertFalse(UnaryCondition.turnGt(3).evaluate(provider));
    }

    @Test
    void rejectsNegativeCount() {
        ConditionValidationException e = assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(ConditionType.SEEN_COUNT_GT, "forest", -1));
        assertEquals(ConditionType.SEEN_COUNT_GT, e.getConditionType());
        assertEquals(-1, e.getOffendingValue());
    }

    @Test
    void rejectsMissingContainerReference() {
        assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(ConditionType.SEEN_COUNT_EQ, " ", 0));
        assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(ConditionType.STATUS_EQUALS, null, ContainerStatus.SEEN));
    }

    @Test
    void rejectsWronglyTypedValues() {
        assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(ConditionType.STATUS_EQUALS, "forest", "SEEN"));
        assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(ConditionType.VARIABLE_GT, null, new VariableExpectation("gold", "lots")));
        assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(ConditionType.VARIABLE_EQ, null, 3));
        assertThrows(ConditionValidationException.class,
            () -> UnaryCondition.of(null, "forest", 1));
    }

    @Test
    void turnNeedsNoContainer() {
        UnaryCondition condition = UnaryCondition.of(ConditionType.TURN_GT, null, 2);
        assertNull(condition.getContainerReference());
    }
}
