package com.mathhighlow.engine.player;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.search.ExpressionOptimizer;
import com.mathhighlow.engine.search.FallbackExpressionBuilder;
import com.mathhighlow.engine.validation.ExpressionValidator;
import com.mathhighlow.engine.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

/**
 * The computer side of a round: searches for the best expression and falls back to a
 * deterministic one when the search comes back with something illegal.
 */
@Slf4j
public class ComputerPlayer {

    private final ExpressionOptimizer optimizer;
    private final ExpressionValidator validator;
    private final FallbackExpressionBuilder fallbackBuilder;

    public ComputerPlayer() {
        this(new ExpressionOptimizer(), new ExpressionValidator(), new FallbackExpressionBuilder());
    }

    public ComputerPlayer(ExpressionOptimizer optimizer, ExpressionValidator validator,
                          FallbackExpressionBuilder fallbackBuilder) {
        this.optimizer = optimizer;
        this.validator = validator;
        this.fallbackBuilder = fallbackBuilder;
    }

    /**
     * Choose the expression to submit for this hand and target. Never returns null.
     */
    public Expression playTurn(Hand hand, int target) {
        Expression chosen = optimizer.findBestExpression(hand, target);

        ValidationResult validation = validator.validate(chosen, hand);
        if (!validation.isValid()) {
            log.info("Search result [{}] is not legal ({}), building fallback",
                    chosen.toDisplayString(), validation.getDetail());
            chosen = fallbackBuilder.build(hand);

            ValidationResult fallbackValidation = validator.validate(chosen, hand);
            if (!fallbackValidation.isValid()) {
                log.warn("Fallback expression [{}] is not legal either: {} ({})",
                        chosen.toDisplayString(), fallbackValidation.getDetail(), hand);
            }
        }

        log.debug("Computer chose [{}] for target {}", chosen.toDisplayString(), target);
        return chosen;
    }
}
