package com.mathhighlow.round.model;

/**
 * Outcome of a scored round, from the table's point of view.
 */
public enum Winner {
    PLAYER,
    AI,
    DRAW,
    /** Neither side produced a value. */
    INVALID
}
