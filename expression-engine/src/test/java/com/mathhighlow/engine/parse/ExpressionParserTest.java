package com.mathhighlow.engine.parse;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.OperatorType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void testParsesDisplaySyntax() {
        Expression expression = parser.parse("√4 × 3 + 2");

        assertEquals(3, expression.size());
        assertTrue(expression.getTerms().get(0).isRooted());
        assertEquals(4, expression.getTerms().get(0).getValue());
        assertEquals(List.of(OperatorType.MULTIPLY, OperatorType.ADD), expression.getOperators());
    }

    @Test
    void testAsciiFormsMatchDisplaySyntax() {
        assertEquals(parser.parse("√4 × 3 + 2"), parser.parse("r4*3+2"));
        assertEquals(parser.parse("√9 ÷ 3 - 1"), parser.parse("sqrt 9 / 3 - 1"));
        assertEquals(parser.parse("2 × 5"), parser.parse("2x5"));
    }

    @Test
    void testPartialInputIsKept() {
        Expression expression = parser.parse("4 +");

        assertFalse(expression.isComplete());
        assertTrue(expression.expectingNumber());
    }

    @Test
    void testBlankInputIsEmpty() {
        assertTrue(parser.parse("   ").isEmpty());
    }

    @Test
    void testMalformedInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("4 4"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("+ 4"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("4 ^ 2"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("√ + 2"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(null));
    }

    @Test
    void testDecimalNumbersAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("4.4 × 5 - 2.4"));
        assertTrue(e.getMessage().contains("position 1"), e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> parser.parse("4 × 5 - 2."));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(".5 + 2"));
        assertEquals(10, parser.parse("10 - 2").getTerms().get(0).getValue());
    }
}
