package com.mathhighlow.engine.validation;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.OperatorType;
import com.mathhighlow.engine.parse.ExpressionParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionValidatorTest {

    private final ExpressionValidator validator = new ExpressionValidator();
    private final ExpressionParser parser = new ExpressionParser();

    private ValidationResult validate(String expression, Hand hand) {
        return validator.validate(parser.parse(expression), hand);
    }

    @Test
    void testValidExpression() {
        Hand hand = Hand.of("4", "5", "2", "+", "-", "÷");

        ValidationResult result = validate("5 ÷ 2 + 4", hand);

        assertTrue(result.isValid(), result.getDetail());
        assertEquals("", result.getErrorMessage());
    }

    @Test
    void testEmptyExpression() {
        ValidationResult result = validator.validate(new Expression(), Hand.of("1"));

        assertFalse(result.isValid());
        assertEquals(ExpressionValidator.GENERAL_FAILURE_MESSAGE, result.getErrorMessage());
        assertEquals("Expression is empty", result.getDetail());
    }

    @Test
    void testIncompleteExpression() {
        ValidationResult result = validate("4 + 5 -", Hand.of("4", "5", "2", "+", "-"));

        assertFalse(result.isValid());
        assertTrue(result.getDetail().startsWith("Expression is not complete"), result.getDetail());
    }

    @Test
    void testMissingNumber() {
        ValidationResult result = validate("4 + 5", Hand.of("4", "5", "2", "+", "-"));

        assertFalse(result.isValid());
        assertEquals("Number 2 must be used 1 more time(s)", result.getDetail());
    }

    @Test
    void testDuplicateNumberUsedTooOften() {
        ValidationResult result = validate("4 + 5 - 2 + 2", Hand.of("4", "5", "2", "+", "-"));

        assertFalse(result.isValid());
        assertEquals("Number 2 used 1 time(s) too many", result.getDetail());
    }

    @Test
    void testNumberNotInHand() {
        ValidationResult result = validate("4 + 5 + 7", Hand.of("4", "5", "+", "-"));

        assertFalse(result.isValid());
        assertEquals("Number 7 used 1 time(s) too many", result.getDetail());
    }

    @Test
    void testRepeatedValuesNeedEveryCopy() {
        Hand hand = Hand.of("3", "3", "3", "+", "-");

        assertEquals("Number 3 must be used 1 more time(s)", validate("3 + 3", hand).getDetail());
        assertTrue(validate("3 + 3 - 3", hand).isValid());
    }

    @Test
    void testRootCountMustMatch() {
        Hand hand = Hand.of("9", "3", "+", "√");

        assertEquals("√ must be used 1 more time(s)", validate("9 + 3", hand).getDetail());
        assertEquals("√ used 1 time(s) too many", validate("√9 + √3", hand).getDetail());
        assertTrue(validate("√9 + 3", hand).isValid());
    }

    @Test
    void testForcedMultiplyCountMustMatch() {
        Hand hand = Hand.of("4", "5", "2", "+", "-", "F");

        assertEquals("× must be used 1 more time(s)", validate("4 + 5 - 2", hand).getDetail());
        assertEquals("× used 1 time(s) too many", validate("4 × 5 × 2", hand).getDetail());
        assertTrue(validate("4 × 5 - 2", hand).isValid());
    }

    @Test
    void testDisabledOperatorRejected() {
        Hand hand = Hand.of("4", "5", "2", "+", "-", "÷");
        hand.disableOperator(OperatorType.ADD);

        ValidationResult result = validate("4 + 5 - 2", hand);

        assertFalse(result.isValid());
        assertEquals("Disabled operator used: +", result.getDetail());
    }

    @Test
    void testMultiplyIsExemptFromDisabledCheck() {
        Hand hand = Hand.of("4", "5", "2", "+", "F");
        hand.disableOperator(OperatorType.MULTIPLY);

        assertTrue(validate("4 × 5 + 2", hand).isValid());
    }

    @Test
    void testStagesStopAtFirstFailure() {
        Hand hand = Hand.of("4", "5", "+", "√", "F");

        // wrong numbers and missing specials: the number stage reports first
        assertEquals("Number 5 must be used 1 more time(s)", validate("4", hand).getDetail());
    }
}
