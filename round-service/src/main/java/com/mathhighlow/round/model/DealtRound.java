package com.mathhighlow.round.model;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import lombok.Builder;
import lombok.Data;

/**
 * A round after dealing: both hands, the target and the computer's chosen expression.
 */
@Data
@Builder
public class DealtRound {
    private int roundNumber;
    private int target;
    private int bet;
    private Hand playerHand;
    private Hand aiHand;
    private Expression aiExpression;
}
