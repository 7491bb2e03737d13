package com.mathhighlow.engine.model;

/**
 * A card that imposes a rule on the expression: either a mandatory multiply or a
 * mandatory square root on one number.
 */
public final class SpecialCard extends Card {
    private final Kind kind;
    private boolean consumed;

    public SpecialCard(Kind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Special card kind must not be null");
        }
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConsumed() {
        return consumed;
    }

    public void consume() {
        consumed = true;
    }

    public void resetUsage() {
        consumed = false;
    }

    /**
     * Whether the card attaches to a single number rather than sitting between two.
     */
    public boolean isUnary() {
        return kind == Kind.UNARY_ROOT;
    }

    @Override
    public Type getType() {
        return Type.SPECIAL;
    }

    @Override
    public String getDisplayText() {
        return kind.getSymbol();
    }

    @Override
    public SpecialCard copy() {
        return new SpecialCard(kind);
    }

    @Override
    public String toString() {
        return "SpecialCard(" + kind.getSymbol() + (consumed ? ", consumed" : "") + ")";
    }

    public enum Kind {
        FORCED_MULTIPLY("×"),
        UNARY_ROOT("√");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
