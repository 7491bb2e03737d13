package com.mathhighlow.engine.search;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.OperatorType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds a deterministic expression that spends every special card, for when the search
 * result does not validate.
 *
 * <p>Numbers keep the hand's order and the first ones take the square roots. Gaps are filled
 * with multiplies first, then the hand's operator cards in the order held, then addition.
 * The result is not guaranteed to be legal for degenerate hands.
 */
public class FallbackExpressionBuilder {

    public Expression build(Hand hand) {
        Expression fallback = new Expression();

        List<Integer> numbers = hand.getNumberValues();
        if (numbers.isEmpty()) {
            return fallback;
        }

        int rootsLeft = hand.getUnaryRootCount();
        int multipliesLeft = Math.min(hand.getForcedMultiplyCount(), Math.max(0, numbers.size() - 1));
        Deque<OperatorType> operatorCards = new ArrayDeque<>();
        hand.getOperatorCards().forEach(card -> operatorCards.add(card.getOperator()));

        for (int i = 0; i < numbers.size(); i++) {
            boolean rooted = rootsLeft > 0;
            if (rooted) {
                rootsLeft--;
            }
            fallback.addNumber(numbers.get(i), rooted);

            if (i < numbers.size() - 1) {
                OperatorType op;
                if (multipliesLeft > 0) {
                    op = OperatorType.MULTIPLY;
                    multipliesLeft--;
                } else if (!operatorCards.isEmpty()) {
                    op = operatorCards.poll();
                } else {
                    op = OperatorType.ADD;
                }
                fallback.addOperator(op);
            }
        }

        return fallback;
    }
}
