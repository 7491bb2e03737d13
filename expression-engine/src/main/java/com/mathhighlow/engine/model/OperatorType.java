package com.mathhighlow.engine.model;

/**
 * Binary operators an expression can place between two numbers.
 */
public enum OperatorType {
    ADD("+", 1),
    SUBTRACT("-", 1),
    MULTIPLY("×", 2),
    DIVIDE("÷", 2);

    private final String symbol;
    private final int precedence;

    OperatorType(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Binding strength used by the evaluator; higher binds first.
     */
    public int getPrecedence() {
        return precedence;
    }

    /**
     * Parse an operator symbol. Accepts the display symbols and their ASCII forms.
     */
    public static OperatorType fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Invalid operator: null");
        }
        return switch (symbol.trim()) {
            case "+" -> ADD;
            case "-", "−" -> SUBTRACT;
            case "×", "*", "x", "X" -> MULTIPLY;
            case "÷", "/" -> DIVIDE;
            default -> throw new IllegalArgumentException("Invalid operator: " + symbol);
        };
    }
}
