package com.mathhighlow.engine.search;

import com.mathhighlow.engine.evaluation.EvaluationResult;
import com.mathhighlow.engine.evaluation.ExpressionEvaluator;
import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.OperatorType;
import com.mathhighlow.engine.validation.ExpressionValidator;
import com.mathhighlow.engine.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the legal expression for a hand whose value is closest to a target.
 *
 * <p>The search is exhaustive over three nested choices, each explored by backtracking:
 * <ol>
 *   <li>every distinct ordering of the hand's numbers (equal values are not permuted
 *       against each other)</li>
 *   <li>which numbers carry a square root, exactly one per root card</li>
 *   <li>which operator fills each gap: a multiply while forced multiplies remain, or any
 *       enabled operator card not yet spent on this candidate</li>
 * </ol>
 * Each complete candidate is validated and evaluated; the first candidate found at the
 * smallest distance wins. Hands are dealt with at most three numbers, so the tree stays small.
 *
 * <p>All search state lives in a per-call context, so one optimizer can be shared.
 */
@Slf4j
public class ExpressionOptimizer {

    private final ExpressionValidator validator;
    private final ExpressionEvaluator evaluator;

    public ExpressionOptimizer() {
        this(new ExpressionValidator(), new ExpressionEvaluator());
    }

    public ExpressionOptimizer(ExpressionValidator validator, ExpressionEvaluator evaluator) {
        this.validator = validator;
        this.evaluator = evaluator;
    }

    /**
     * Search for the best expression.
     *
     * @param hand   The completed hand; it is only read
     * @param target The value to approach
     * @return an independent expression, empty when the hand has no numbers or no legal
     *         arrangement exists
     */
    public Expression findBestExpression(Hand hand, int target) {
        int numberCount = hand.getNumberCards().size();
        if (numberCount == 0) {
            return new Expression();
        }

        SearchContext context = new SearchContext(hand, target);
        int slots = numberCount - 1;

        if (context.requiredMultiplies > slots) {
            log.debug("No arrangement: {} forced multiplies for {} gaps", context.requiredMultiplies, slots);
            return new Expression();
        }
        if (slots - context.requiredMultiplies > context.availableOperators.size()) {
            log.debug("No arrangement: {} gaps left for {} operator cards",
                    slots - context.requiredMultiplies, context.availableOperators.size());
            return new Expression();
        }

        permuteNumbers(context, countValues(hand.getNumberValues()), new ArrayList<>());

        Expression result = context.result();
        log.debug("Search for target {} over {}: {} candidates, {} rejected, {} unevaluable, best [{}] at distance {}",
                target, hand, context.candidates, context.rejected, context.unevaluable,
                result.toDisplayString(), context.resultDistance());
        return result;
    }

    /**
     * Remaining count per distinct value, in the order values first appear in the hand.
     */
    private Map<Integer, Integer> countValues(List<Integer> values) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        return counts;
    }

    private void permuteNumbers(SearchContext context, Map<Integer, Integer> remaining, List<Integer> current) {
        if (current.size() == context.numberCount) {
            placeRoots(context, current, 0, new boolean[current.size()], 0);
            return;
        }

        for (Map.Entry<Integer, Integer> entry : remaining.entrySet()) {
            int left = entry.getValue();
            if (left == 0) {
                continue;
            }

            entry.setValue(left - 1);
            current.add(entry.getKey());

            permuteNumbers(context, remaining, current);

            current.remove(current.size() - 1);
            entry.setValue(left);
        }
    }

    private void placeRoots(SearchContext context, List<Integer> numbers, int index, boolean[] rooted, int placed) {
        if (index == numbers.size()) {
            if (placed == context.requiredRoots) {
                assignOperators(context, numbers, rooted, new ArrayList<>(),
                        new ArrayList<>(context.availableOperators), 0);
            }
            return;
        }

        int remaining = context.requiredRoots - placed;
        int positionsLeft = numbers.size() - index;
        int most = Math.min(1, remaining);
        int least = Math.max(0, remaining - (positionsLeft - 1));
        if (least > most) {
            return;
        }

        for (int count = most; count >= least; count--) {
            rooted[index] = count > 0;
            placeRoots(context, numbers, index + 1, rooted, placed + count);
        }
        rooted[index] = false;
    }

    private void assignOperators(SearchContext context, List<Integer> numbers, boolean[] rooted,
                                 List<OperatorType> placed, List<OperatorType> pool, int multipliesUsed) {
        int slots = numbers.size() - 1;
        int index = placed.size();

        if (context.requiredMultiplies - multipliesUsed > slots - index) {
            return;
        }

        if (index == slots) {
            if (multipliesUsed == context.requiredMultiplies) {
                consider(context, numbers, rooted, placed);
            }
            return;
        }

        if (multipliesUsed < context.requiredMultiplies) {
            placed.add(OperatorType.MULTIPLY);
            assignOperators(context, numbers, rooted, placed, pool, multipliesUsed + 1);
            placed.remove(placed.size() - 1);
        }

        Set<OperatorType> tried = EnumSet.noneOf(OperatorType.class);
        for (int i = 0; i < pool.size(); i++) {
            OperatorType op = pool.get(i);
            // two cards of the same kind lead to identical subtrees
            if (!tried.add(op)) {
                continue;
            }

            pool.remove(i);
            placed.add(op);

            assignOperators(context, numbers, rooted, placed, pool, multipliesUsed);

            placed.remove(placed.size() - 1);
            pool.add(i, op);
        }
    }

    private void consider(SearchContext context, List<Integer> numbers, boolean[] rooted, List<OperatorType> operators) {
        Expression candidate = new Expression();
        for (int i = 0; i < numbers.size(); i++) {
            candidate.addNumber(numbers.get(i), rooted[i]);
            if (i < operators.size()) {
                candidate.addOperator(operators.get(i));
            }
        }
        context.candidates++;

        ValidationResult validation = validator.validate(candidate, context.hand);
        if (!validation.isValid()) {
            context.rejected++;
            return;
        }

        EvaluationResult evaluation = evaluator.evaluate(candidate);
        if (!evaluation.isSuccess()) {
            context.unevaluable++;
            return;
        }

        context.offer(candidate, Math.abs(evaluation.getValue() - context.target));
    }

    /**
     * Everything one search call needs and accumulates.
     */
    private static final class SearchContext {
        final Hand hand;
        final int target;
        final int numberCount;
        final int requiredRoots;
        final int requiredMultiplies;
        final List<OperatorType> availableOperators;
        final boolean prioritizeSpecials;

        Expression best = new Expression();
        double bestDistance = Double.POSITIVE_INFINITY;
        Expression prioritized;
        double prioritizedDistance = Double.POSITIVE_INFINITY;

        int candidates;
        int rejected;
        int unevaluable;

        SearchContext(Hand hand, int target) {
            this.hand = hand;
            this.target = target;
            this.numberCount = hand.getNumberCards().size();
            this.requiredRoots = hand.getUnaryRootCount();
            this.requiredMultiplies = hand.getForcedMultiplyCount();
            this.availableOperators = hand.getEnabledOperatorCards();
            this.prioritizeSpecials = requiredRoots > 0 || requiredMultiplies > 0;
        }

        void offer(Expression candidate, double distance) {
            if (prioritizeSpecials && usesAllSpecials(candidate) && distance < prioritizedDistance) {
                prioritizedDistance = distance;
                prioritized = candidate.copy();
            }
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate.copy();
            }
        }

        boolean usesAllSpecials(Expression candidate) {
            return candidate.countRootedTerms() == requiredRoots
                    && candidate.countOperator(OperatorType.MULTIPLY) == requiredMultiplies;
        }

        Expression result() {
            if (prioritizeSpecials && prioritized != null) {
                return prioritized.copy();
            }
            return best.copy();
        }

        double resultDistance() {
            return prioritizeSpecials && prioritized != null ? prioritizedDistance : bestDistance;
        }
    }
}
