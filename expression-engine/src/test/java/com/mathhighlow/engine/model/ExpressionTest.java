package com.mathhighlow.engine.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private static Expression sample() {
        Expression expression = new Expression();
        expression.addNumber(4, true);
        expression.addOperator(OperatorType.MULTIPLY);
        expression.addNumber(3);
        expression.addOperator(OperatorType.ADD);
        expression.addNumber(2);
        return expression;
    }

    @Test
    void testStructureFlags() {
        Expression expression = new Expression();
        assertTrue(expression.isEmpty());
        assertFalse(expression.isComplete());
        assertTrue(expression.expectingNumber());

        expression.addNumber(4);
        assertTrue(expression.isComplete());
        assertFalse(expression.expectingNumber());

        expression.addOperator(OperatorType.ADD);
        assertFalse(expression.isComplete());
        assertTrue(expression.expectingNumber());
    }

    @Test
    void testDisplayString() {
        assertEquals("√4 × 3 + 2", sample().toDisplayString());

        Expression fractional = new Expression();
        fractional.addNumber(3.5);
        fractional.addOperator(OperatorType.DIVIDE);
        assertEquals("3.5 ÷", fractional.toDisplayString());
    }

    @Test
    void testCopyIsIndependent() {
        Expression original = sample();
        Expression copy = original.copy();
        assertEquals(original, copy);

        copy.addOperator(OperatorType.SUBTRACT);
        copy.addNumber(9);

        assertEquals("√4 × 3 + 2", original.toDisplayString(), "Mutating the copy must not touch the original");
        assertEquals(3, original.size());
        assertNotEquals(original, copy);
    }

    @Test
    void testRemoveLastSingleNumber() {
        Expression expression = new Expression();
        expression.addNumber(4);

        expression.removeLast();

        assertTrue(expression.isEmpty());
    }

    @Test
    void testRemoveLastDropsOperatorWhenOneFewerThanNumbers() {
        Expression expression = new Expression();
        expression.addNumber(4);
        expression.addOperator(OperatorType.ADD);
        expression.addNumber(3);

        expression.removeLast();

        assertEquals(2, expression.size());
        assertTrue(expression.getOperators().isEmpty());
    }

    @Test
    void testClear() {
        Expression expression = sample();
        expression.clear();

        assertTrue(expression.isEmpty());
        assertTrue(expression.getOperators().isEmpty());
    }

    @Test
    void testCounts() {
        Expression expression = sample();

        assertEquals(1, expression.countRootedTerms());
        assertEquals(1, expression.countOperator(OperatorType.MULTIPLY));
        assertEquals(List.of(OperatorType.MULTIPLY, OperatorType.ADD), expression.getOperators());
    }
}
