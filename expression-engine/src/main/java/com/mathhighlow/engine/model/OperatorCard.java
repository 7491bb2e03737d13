package com.mathhighlow.engine.model;

/**
 * A base operator card. Each card instance may be placed in an expression once.
 */
public final class OperatorCard extends Card {
    private final OperatorType operator;

    public OperatorCard(OperatorType operator) {
        if (operator == null) {
            throw new IllegalArgumentException("Operator must not be null");
        }
        this.operator = operator;
    }

    public OperatorType getOperator() {
        return operator;
    }

    @Override
    public Type getType() {
        return Type.OPERATOR;
    }

    @Override
    public String getDisplayText() {
        return operator.getSymbol();
    }

    @Override
    public OperatorCard copy() {
        return new OperatorCard(operator);
    }

    @Override
    public String toString() {
        return "OperatorCard(" + operator.getSymbol() + ")";
    }
}
