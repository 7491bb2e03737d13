package com.mathhighlow.round.service;

import com.mathhighlow.engine.evaluation.ExpressionEvaluator;
import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.parse.ExpressionParser;
import com.mathhighlow.engine.validation.ExpressionValidator;
import com.mathhighlow.round.model.RoundResult;
import com.mathhighlow.round.model.Winner;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoundScorerTest {

    private final RoundScorer scorer = new RoundScorer(new ExpressionValidator(), new ExpressionEvaluator());
    private final ExpressionParser parser = new ExpressionParser();

    private final Hand playerHand = Hand.of("4", "3", "2", "+", "-", "÷", "F");
    private final Hand aiHand = Hand.of("1", "5", "6", "+", "-", "÷");

    private Expression expr(String text) {
        return parser.parse(text);
    }

    @Test
    void testPlayerCloser() {
        RoundResult result = scorer.score(14, 3, playerHand, expr("4 × 3 + 2"), aiHand, expr("6 + 5 - 1"));

        assertEquals(Winner.PLAYER, result.getWinner());
        assertEquals(14.0, result.getPlayerValue(), 1e-9);
        assertEquals(0.0, result.getPlayerDistance(), 1e-9);
        assertEquals(10.0, result.getAiValue(), 1e-9);
        assertEquals(4.0, result.getAiDistance(), 1e-9);
        assertEquals(3, result.getPlayerScoreChange());
        assertEquals(-3, result.getAiScoreChange());
        assertNull(result.getPlayerError());
    }

    @Test
    void testComputerCloser() {
        RoundResult result = scorer.score(1, 2, playerHand, expr("4 × 3 + 2"), aiHand, expr("6 ÷ 5 - 1"));

        assertEquals(Winner.AI, result.getWinner());
        assertEquals(-2, result.getPlayerScoreChange());
        assertEquals(2, result.getAiScoreChange());
    }

    @Test
    void testEqualDistancesDraw() {
        // 14 and 10 are both 2 away from 12
        RoundResult result = scorer.score(12, 5, playerHand, expr("4 × 3 + 2"), aiHand, expr("6 + 5 - 1"));

        assertEquals(Winner.DRAW, result.getWinner());
        assertEquals(0, result.getPlayerScoreChange());
        assertEquals(0, result.getAiScoreChange());
    }

    @Test
    void testIllegalPlayerExpressionLoses() {
        // ignores the forced multiply
        RoundResult result = scorer.score(9, 1, playerHand, expr("4 + 3 + 2"), aiHand, expr("6 + 5 - 1"));

        assertEquals(Winner.AI, result.getWinner());
        assertNull(result.getPlayerValue());
        assertEquals(Double.POSITIVE_INFINITY, result.getPlayerDistance());
        assertTrue(result.getPlayerError().contains(ExpressionValidator.GENERAL_FAILURE_MESSAGE));
        assertEquals("4 + 3 + 2", result.getPlayerExpression());
    }

    @Test
    void testEvaluationFailureLoses() {
        Hand zeros = Hand.of("0", "0", "÷");

        RoundResult result = scorer.score(20, 4, playerHand, expr("4 × 3 + 2"), zeros, expr("0 ÷ 0"));

        assertEquals(Winner.PLAYER, result.getWinner());
        assertEquals("division by zero", result.getAiError());
        assertEquals(Double.POSITIVE_INFINITY, result.getAiDistance());
        assertEquals(4, result.getPlayerScoreChange());
    }

    @Test
    void testBothFailedIsInvalid() {
        RoundResult result = scorer.score(20, 4, playerHand, new Expression(), aiHand, expr("1 + 1"));

        assertEquals(Winner.INVALID, result.getWinner());
        assertEquals(0, result.getPlayerScoreChange());
        assertEquals(0, result.getAiScoreChange());
        assertNotNull(result.getPlayerError());
        assertNotNull(result.getAiError());
    }
}
