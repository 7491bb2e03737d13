package com.mathhighlow.engine.model;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An arithmetic formula built from a hand: numbers (each optionally under a square root)
 * alternating with binary operators, e.g. {@code √4 × 3 + 2}.
 *
 * <p>The structure is complete when there is at least one number and exactly one operator
 * fewer than numbers. Mutators only maintain the sequences; game legality is checked by the
 * validator.
 */
public class Expression {
    private final List<Term> terms = new ArrayList<>();
    private final List<OperatorType> operators = new ArrayList<>();

    public Expression() {
    }

    public void addNumber(double value) {
        addNumber(value, false);
    }

    public void addNumber(double value, boolean rooted) {
        terms.add(new Term(value, rooted));
    }

    public void addOperator(OperatorType operator) {
        operators.add(Objects.requireNonNull(operator, "operator"));
    }

    /**
     * Undo step used by the card-by-card input path. Removes the last operator when the
     * operator count is exactly one below the number count, otherwise the last number.
     */
    public void removeLast() {
        if (!operators.isEmpty() && operators.size() == terms.size() - 1) {
            operators.remove(operators.size() - 1);
        } else if (!terms.isEmpty()) {
            terms.remove(terms.size() - 1);
        }
    }

    public void clear() {
        terms.clear();
        operators.clear();
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public boolean isComplete() {
        return !terms.isEmpty() && operators.size() == terms.size() - 1;
    }

    /**
     * True before the first number and after every operator.
     */
    public boolean expectingNumber() {
        return terms.size() == operators.size();
    }

    public List<Term> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    public List<OperatorType> getOperators() {
        return Collections.unmodifiableList(operators);
    }

    public int size() {
        return terms.size();
    }

    public int countRootedTerms() {
        return (int) terms.stream().filter(Term::isRooted).count();
    }

    public int countOperator(OperatorType operator) {
        return (int) operators.stream().filter(op -> op == operator).count();
    }

    public Expression copy() {
        Expression copy = new Expression();
        copy.terms.addAll(terms);
        copy.operators.addAll(operators);
        return copy;
    }

    public String toDisplayString() {
        DecimalFormat format = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < terms.size(); i++) {
            Term term = terms.get(i);
            if (term.isRooted()) {
                sb.append('√');
            }
            sb.append(format.format(term.getValue()));
            if (i < operators.size()) {
                sb.append(' ').append(operators.get(i).getSymbol()).append(' ');
            }
        }
        // a trailing operator leaves a dangling space
        return sb.toString().trim();
    }

    @Override
    public String toString() {
        return "Expression: " + toDisplayString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Expression that = (Expression) o;
        return terms.equals(that.terms) && operators.equals(that.operators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, operators);
    }

    /**
     * One number in the expression and whether a square root applies to it.
     */
    public static final class Term {
        private final double value;
        private final boolean rooted;

        public Term(double value, boolean rooted) {
            this.value = value;
            this.rooted = rooted;
        }

        public double getValue() {
            return value;
        }

        public boolean isRooted() {
            return rooted;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Term term = (Term) o;
            return Double.compare(term.value, value) == 0 && rooted == term.rooted;
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, rooted);
        }

        @Override
        public String toString() {
            return (rooted ? "√" : "") + value;
        }
    }
}
