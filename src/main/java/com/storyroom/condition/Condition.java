package com.storyroom.condition;

/**
 * A boolean test over story state. Either a {@link UnaryCondition} or a {@link BinaryCondition}.
 */
public interface Condition {

    boolean evaluate(ContainerStateProvider provider);
}
