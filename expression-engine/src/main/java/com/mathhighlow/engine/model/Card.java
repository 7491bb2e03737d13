package com.mathhighlow.engine.model;

/**
 * A card dealt into a {@link Hand}.
 *
 * <p>The set of card kinds is fixed: {@link NumberCard}, {@link OperatorCard} and
 * {@link SpecialCard}. Code that behaves differently per kind switches on {@link #getType()}.
 */
public abstract class Card {

    Card() {
    }

    public abstract Type getType();

    /**
     * Text shown on the face of the card.
     */
    public abstract String getDisplayText();

    /**
     * Independent copy of this card with any usage state reset.
     */
    public abstract Card copy();

    public boolean isSameType(Card other) {
        return other != null && getType() == other.getType();
    }

    /**
     * Parse a card from its face text: "0" to "10" for numbers, "+ - × ÷" for operators,
     * "√" (or "R") for a root card and "F" for a forced multiply card.
     */
    public static Card fromString(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Invalid card string: " + text);
        }

        String trimmed = text.trim();
        if (trimmed.equals("√") || trimmed.equalsIgnoreCase("R")) {
            return new SpecialCard(SpecialCard.Kind.UNARY_ROOT);
        }
        if (trimmed.equalsIgnoreCase("F")) {
            return new SpecialCard(SpecialCard.Kind.FORCED_MULTIPLY);
        }

        if (Character.isDigit(trimmed.charAt(0))) {
            try {
                return new NumberCard(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid card string: " + text, e);
            }
        }
        return new OperatorCard(OperatorType.fromSymbol(trimmed));
    }

    public enum Type {
        NUMBER,
        OPERATOR,
        SPECIAL
    }
}
