package com.mathhighlow.engine.validation;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.NumberCard;
import com.mathhighlow.engine.model.OperatorType;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Checks that an expression is a legal use of a hand.
 *
 * <p>Rules are checked in order and the first failure wins:
 * <ol>
 *   <li>the expression is not empty</li>
 *   <li>the expression is complete (one operator fewer than numbers)</li>
 *   <li>every number card is used exactly once and no other number appears</li>
 *   <li>exactly one square root per root card</li>
 *   <li>exactly one multiply per forced multiply card</li>
 *   <li>no disabled operator is used (multiply is exempt)</li>
 * </ol>
 */
@Slf4j
public class ExpressionValidator {

    public static final String GENERAL_FAILURE_MESSAGE =
            "The expression does not use the dealt cards correctly.";

    public ValidationResult validate(Expression expression, Hand hand) {
        if (expression.isEmpty()) {
            return invalid("Expression is empty");
        }

        if (!expression.isComplete()) {
            return invalid(String.format("Expression is not complete (%d numbers, %d operators)",
                    expression.size(), expression.getOperators().size()));
        }

        String numberProblem = checkNumberUsage(expression, hand);
        if (numberProblem != null) {
            return invalid(numberProblem);
        }

        String rootProblem = checkCount("√", expression.countRootedTerms(), hand.getUnaryRootCount());
        if (rootProblem != null) {
            return invalid(rootProblem);
        }

        String multiplyProblem = checkCount(OperatorType.MULTIPLY.getSymbol(),
                expression.countOperator(OperatorType.MULTIPLY), hand.getForcedMultiplyCount());
        if (multiplyProblem != null) {
            return invalid(multiplyProblem);
        }

        for (OperatorType op : expression.getOperators()) {
            if (op != OperatorType.MULTIPLY && !hand.isOperatorEnabled(op)) {
                return invalid("Disabled operator used: " + op.getSymbol());
            }
        }

        return ValidationResult.valid();
    }

    /**
     * Compare the multiset of rounded expression numbers with the hand's number cards.
     */
    private String checkNumberUsage(Expression expression, Hand hand) {
        Map<Integer, Integer> available = new TreeMap<>();
        for (NumberCard card : hand.getNumberCards()) {
            available.merge(card.getValue(), 1, Integer::sum);
        }

        Map<Integer, Integer> used = new TreeMap<>();
        for (Expression.Term term : expression.getTerms()) {
            used.merge((int) Math.round(term.getValue()), 1, Integer::sum);
        }

        TreeSet<Integer> values = new TreeSet<>(available.keySet());
        values.addAll(used.keySet());
        for (int value : values) {
            int have = available.getOrDefault(value, 0);
            int usedCount = used.getOrDefault(value, 0);
            if (usedCount < have) {
                return String.format("Number %d must be used %d more time(s)", value, have - usedCount);
            }
            if (usedCount > have) {
                return String.format("Number %d used %d time(s) too many", value, usedCount - have);
            }
        }
        return null;
    }

    private String checkCount(String symbol, int usedCount, int requiredCount) {
        if (usedCount < requiredCount) {
            return String.format("%s must be used %d more time(s)", symbol, requiredCount - usedCount);
        }
        if (usedCount > requiredCount) {
            return String.format("%s used %d time(s) too many", symbol, usedCount - requiredCount);
        }
        return null;
    }

    private ValidationResult invalid(String detail) {
        log.debug("Expression rejected: {}", detail);
        return ValidationResult.invalid(GENERAL_FAILURE_MESSAGE, detail);
    }
}
