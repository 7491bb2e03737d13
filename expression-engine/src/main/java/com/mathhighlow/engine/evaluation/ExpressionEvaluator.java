package com.mathhighlow.engine.evaluation;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.OperatorType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Computes the value of an expression.
 *
 * <p>Square roots are applied to their numbers first. The binary operators are then reduced
 * with an operand stack and an operator stack: multiply and divide bind tighter than add and
 * subtract, and operators of equal precedence reduce left to right.
 *
 * <p>The evaluator does not check the expression against a hand, so it can score candidates
 * during the search as well as submitted expressions.
 */
@Slf4j
public class ExpressionEvaluator {

    /** Divisors closer to zero than this are treated as zero. */
    public static final double ZERO_TOLERANCE = 1e-6;

    public EvaluationResult evaluate(Expression expression) {
        EvaluationResult precheck = checkShape(expression);
        if (precheck != null) {
            return precheck;
        }

        List<Double> numbers = new ArrayList<>();
        EvaluationError rootError = applyRoots(expression, numbers);
        if (rootError != null) {
            return EvaluationResult.failure(rootError);
        }

        try {
            return reduceWithPrecedence(numbers, expression.getOperators());
        } catch (IllegalStateException e) {
            log.error("Internal fault while evaluating [{}]", expression.toDisplayString(), e);
            return EvaluationResult.failure(EvaluationError.INTERNAL_FAULT);
        }
    }

    /**
     * Evaluate strictly left to right, ignoring operator precedence.
     */
    public EvaluationResult evaluateLeftToRight(Expression expression) {
        EvaluationResult precheck = checkShape(expression);
        if (precheck != null) {
            return precheck;
        }

        List<Double> numbers = new ArrayList<>();
        EvaluationError rootError = applyRoots(expression, numbers);
        if (rootError != null) {
            return EvaluationResult.failure(rootError);
        }

        List<OperatorType> operators = expression.getOperators();
        double value = numbers.get(0);
        for (int i = 0; i < operators.size(); i++) {
            double right = numbers.get(i + 1);
            if (isDivisionByZero(operators.get(i), right)) {
                return EvaluationResult.failure(EvaluationError.DIVISION_BY_ZERO);
            }
            value = apply(value, operators.get(i), right);
        }
        return EvaluationResult.success(value);
    }

    private EvaluationResult checkShape(Expression expression) {
        if (expression.isEmpty()) {
            return EvaluationResult.failure(EvaluationError.EMPTY_EXPRESSION);
        }
        if (!expression.isComplete()) {
            return EvaluationResult.failure(EvaluationError.MALFORMED_EXPRESSION);
        }
        return null;
    }

    /**
     * Pass 1: replace every rooted number with its square root.
     */
    private EvaluationError applyRoots(Expression expression, List<Double> out) {
        for (Expression.Term term : expression.getTerms()) {
            double number = term.getValue();
            if (term.isRooted()) {
                if (number < 0) {
                    return EvaluationError.NEGATIVE_ROOT;
                }
                number = Math.sqrt(number);
            }
            out.add(number);
        }
        return null;
    }

    /**
     * Pass 2: dual-stack precedence evaluation.
     */
    private EvaluationResult reduceWithPrecedence(List<Double> numbers, List<OperatorType> operators) {
        Deque<Double> operands = new ArrayDeque<>();
        Deque<OperatorType> pending = new ArrayDeque<>();

        operands.push(numbers.get(0));

        for (int i = 0; i < operators.size(); i++) {
            OperatorType current = operators.get(i);

            // >= so that equal precedence reduces left to right
            while (!pending.isEmpty() && pending.peek().getPrecedence() >= current.getPrecedence()) {
                if (!reduceOnce(operands, pending)) {
                    return EvaluationResult.failure(EvaluationError.DIVISION_BY_ZERO);
                }
            }

            pending.push(current);
            operands.push(numbers.get(i + 1));
        }

        while (!pending.isEmpty()) {
            if (!reduceOnce(operands, pending)) {
                return EvaluationResult.failure(EvaluationError.DIVISION_BY_ZERO);
            }
        }

        if (operands.size() != 1) {
            throw new IllegalStateException("Expected a single operand after reduction, found " + operands.size());
        }
        return EvaluationResult.success(operands.pop());
    }

    /**
     * Pop one operator and two operands and push the result. Returns false on division by zero.
     */
    private boolean reduceOnce(Deque<Double> operands, Deque<OperatorType> pending) {
        if (operands.size() < 2) {
            throw new IllegalStateException("Operand stack underflow: " + operands.size() + " operand(s) left");
        }

        double right = operands.pop();
        double left = operands.pop();
        OperatorType op = pending.pop();

        if (isDivisionByZero(op, right)) {
            return false;
        }
        operands.push(apply(left, op, right));
        return true;
    }

    private static boolean isDivisionByZero(OperatorType op, double right) {
        return op == OperatorType.DIVIDE && Math.abs(right) < ZERO_TOLERANCE;
    }

    private static double apply(double left, OperatorType op, double right) {
        return switch (op) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
        };
    }
}
