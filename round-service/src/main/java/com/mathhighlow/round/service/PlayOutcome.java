package com.mathhighlow.round.service;

/**
 * Result of playing one card into a {@link PlayerExpressionBuilder}.
 */
public enum PlayOutcome {
    ACCEPTED(true, "Card placed"),
    ROOT_PENDING(true, "√ will apply to the next number"),
    CARD_ALREADY_USED(false, "That card has already been played"),
    NOT_IN_HAND(false, "That card is not in your hand"),
    EXPECTING_NUMBER(false, "Play a number card now"),
    EXPECTING_OPERATOR(false, "Play an operator card now"),
    NO_NUMBERS_LEFT(false, "No number cards are left to follow it"),
    ROOT_ALREADY_PENDING(false, "A √ is already waiting for a number");

    private final boolean accepted;
    private final String message;

    PlayOutcome(boolean accepted, String message) {
        this.accepted = accepted;
        this.message = message;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getMessage() {
        return message;
    }
}
