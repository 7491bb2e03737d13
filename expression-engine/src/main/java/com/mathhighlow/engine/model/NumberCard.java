package com.mathhighlow.engine.model;

import java.util.Objects;

/**
 * A number card holding a value between {@value #MIN_VALUE} and {@value #MAX_VALUE}.
 */
public final class NumberCard extends Card {
    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 10;

    private final int value;

    public NumberCard(int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException("Number card value out of range: " + value);
        }
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public boolean hasSameValue(NumberCard other) {
        return other != null && value == other.value;
    }

    @Override
    public Type getType() {
        return Type.NUMBER;
    }

    @Override
    public String getDisplayText() {
        return String.valueOf(value);
    }

    @Override
    public NumberCard copy() {
        return new NumberCard(value);
    }

    @Override
    public String toString() {
        return "NumberCard(" + value + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NumberCard that = (NumberCard) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }
}
