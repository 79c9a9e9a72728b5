package com.storyroom.condition;

/**
 * Two conditions joined by "AND" or "OR". Both sides are always evaluated; any other
 * operator evaluates to false.
 */
public class BinaryCondition implements Condition {

    public static final String AND = "AND";
    public static final String OR = "OR";

    private final Condition left;
    private final String operator;
    private final Condition right;

    public BinaryCondition(Condition left, String operator, Condition right) {
        if (left == null || right == null) {
            throw new ConditionValidationException(null, operator, "binary condition requires both operands");
        }
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public static BinaryCondition and(Condition left, Condition right) {
        return new BinaryCondition(left, AND, right);
    }

    public static BinaryCondition or(Condition left, Condition right) {
        return new BinaryCondition(left, OR, right);
    }

    @Override
    public boolean evaluate(ContainerStateProvider provider) {
        boolean leftResult = left.evaluate(provider);
        boolean rightResult = right.evaluate(provider);

        if (AND.equals(operator)) {
            return leftResult && rightResult;
        } else if (OR.equals(operator)) {
            return leftResult || rightResult;
        }
        return false;
    }

    public Condition getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public Condition getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
