package com.mathhighlow.round.service;

import com.mathhighlow.engine.evaluation.EvaluationResult;
import com.mathhighlow.engine.evaluation.ExpressionEvaluator;
import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.validation.ExpressionValidator;
import com.mathhighlow.engine.validation.ValidationResult;
import com.mathhighlow.round.model.RoundResult;
import com.mathhighlow.round.model.Winner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides a round: each side's expression is validated against its own hand, evaluated,
 * and compared by distance to the target.
 */
@Slf4j
@Service
public class RoundScorer {

    private final ExpressionValidator validator;
    private final ExpressionEvaluator evaluator;

    public RoundScorer(ExpressionValidator validator, ExpressionEvaluator evaluator) {
        this.validator = validator;
        this.evaluator = evaluator;
    }

    public RoundResult score(int target, int bet,
                             Hand playerHand, Expression playerExpression,
                             Hand aiHand, Expression aiExpression) {
        SideOutcome player = scoreSide(target, playerHand, playerExpression);
        SideOutcome ai = scoreSide(target, aiHand, aiExpression);

        Winner winner;
        int playerChange;
        if (player.failed() && ai.failed()) {
            winner = Winner.INVALID;
            playerChange = 0;
        } else if (Math.abs(player.distance - ai.distance) <= ExpressionEvaluator.ZERO_TOLERANCE) {
            winner = Winner.DRAW;
            playerChange = 0;
        } else if (player.distance < ai.distance) {
            winner = Winner.PLAYER;
            playerChange = bet;
        } else {
            winner = Winner.AI;
            playerChange = -bet;
        }

        RoundResult result = RoundResult.builder()
                .target(target)
                .bet(bet)
                .playerExpression(playerExpression.toDisplayString())
                .playerValue(player.value)
                .playerDistance(player.distance)
                .playerError(player.error)
                .aiExpression(aiExpression.toDisplayString())
                .aiValue(ai.value)
                .aiDistance(ai.distance)
                .aiError(ai.error)
                .winner(winner)
                .playerScoreChange(playerChange)
                .aiScoreChange(-playerChange)
                .build();

        log.info("Round to {}: player [{}] vs computer [{}] -> {}", target,
                result.getPlayerExpression(), result.getAiExpression(), winner);
        return result;
    }

    private SideOutcome scoreSide(int target, Hand hand, Expression expression) {
        ValidationResult validation = validator.validate(expression, hand);
        if (!validation.isValid()) {
            return SideOutcome.failure(validation.getErrorMessage() + " (" + validation.getDetail() + ")");
        }

        EvaluationResult evaluation = evaluator.evaluate(expression);
        if (!evaluation.isSuccess()) {
            return SideOutcome.failure(evaluation.getErrorMessage());
        }
        return new SideOutcome(evaluation.getValue(), Math.abs(evaluation.getValue() - target), null);
    }

    private static final class SideOutcome {
        final Double value;
        final double distance;
        final String error;

        SideOutcome(Double value, double distance, String error) {
            this.value = value;
            this.distance = distance;
            this.error = error;
        }

        static SideOutcome failure(String error) {
            return new SideOutcome(null, Double.POSITIVE_INFINITY, error);
        }

        boolean failed() {
            return error != null;
        }
    }
}
