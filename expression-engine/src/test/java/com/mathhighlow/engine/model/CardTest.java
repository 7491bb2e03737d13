package com.mathhighlow.engine.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CardTest {

    @Test
    void testFromStringParsesEveryKind() {
        assertEquals(new NumberCard(7), Card.fromString("7"));
        assertEquals(new NumberCard(10), Card.fromString("10"));
        assertEquals(OperatorType.DIVIDE, ((OperatorCard) Card.fromString("÷")).getOperator());
        assertEquals(OperatorType.SUBTRACT, ((OperatorCard) Card.fromString("-")).getOperator());
        assertEquals(SpecialCard.Kind.UNARY_ROOT, ((SpecialCard) Card.fromString("√")).getKind());
        assertEquals(SpecialCard.Kind.FORCED_MULTIPLY, ((SpecialCard) Card.fromString("F")).getKind());
    }

    @Test
    void testInvalidCardsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Card.fromString("11"));
        assertThrows(IllegalArgumentException.class, () -> Card.fromString("?"));
        assertThrows(IllegalArgumentException.class, () -> Card.fromString(" "));
        assertThrows(IllegalArgumentException.class, () -> new NumberCard(-1));
    }

    @Test
    void testCopyResetsConsumedFlag() {
        SpecialCard root = new SpecialCard(SpecialCard.Kind.UNARY_ROOT);
        root.consume();

        SpecialCard copy = root.copy();

        assertTrue(root.isConsumed());
        assertFalse(copy.isConsumed(), "Copied card should start unused");
        assertEquals(SpecialCard.Kind.UNARY_ROOT, copy.getKind());
        assertNotSame(root, copy);
    }

    @Test
    void testTypeTagsAndDisplayText() {
        assertEquals(Card.Type.NUMBER, new NumberCard(3).getType());
        assertEquals(Card.Type.OPERATOR, new OperatorCard(OperatorType.ADD).getType());
        assertEquals(Card.Type.SPECIAL, new SpecialCard(SpecialCard.Kind.FORCED_MULTIPLY).getType());
        assertEquals("×", new SpecialCard(SpecialCard.Kind.FORCED_MULTIPLY).getDisplayText());
        assertTrue(new NumberCard(1).isSameType(new NumberCard(2)));
        assertFalse(new NumberCard(1).isSameType(new OperatorCard(OperatorType.ADD)));
    }
}
