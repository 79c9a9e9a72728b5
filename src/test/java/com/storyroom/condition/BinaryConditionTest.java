package com.storyroom.condition;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BinaryConditionTest {

    private static final Condition TRUE = provider -> true;
    private static final Condition FALSE = provider -> false;

    private final FakeStateProvider provider = new FakeStateProvider();

    @Test
    void andOrTruthTable() {
        assertTrue(BinaryCondition.and(TRUE, TRUE).evaluate(provider));
        assertFalse(BinaryCondition.and(TRUE, FALSE).evaluate(provider));
        assertTrue(BinaryCondition.or(FALSE, TRUE).evaluate(provider));
        assertFalse(BinaryCondition.or(FALSE, FALSE).evaluate(provider));
    }

    @Test
    void bothSidesAreAlwaysEvaluated() {
        int[] calls = {0};
        Condition counting = p -> {
            calls[0]++;
            return true;
        };
        BinaryCondition.and(FALSE, counting).evaluate(provider);
        BinaryCondition.or(TRUE, counting).evaluate(provider);
        assertEquals(2, calls[0]);
    }

    @Test
    void unknownOperatorIsFalse() {
        assertFalse(new BinaryCondition(TRUE, "XOR", TRUE).evaluate(provider));
    }

    @Test
    void nestsWithUnaryConditions() {
        provider.container("forest");
        provider.variables.put("gold", 12);
        Condition condition = BinaryCondition.and(
            UnaryCondition.seenCountEq("forest", 0),
            BinaryCondition.or(UnaryCondition.variableGt("gold", 10), UnaryCondition.turnGt(5)));
        assertTrue(condition.evaluate(provider));
    }

    @Test
    void missingOperandIsRejected() {
        assertThrows(ConditionValidationException.class, () -> BinaryCondition.and(TRUE, null));
    }
}
