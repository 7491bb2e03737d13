package com.mathhighlow.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The cards held by one side for a round.
 *
 * <p>The number cards define exactly which values an expression must use, the forced
 * multiply cards how many {@link OperatorType#MULTIPLY} operators it must contain and the
 * root cards how many numbers must carry a square root. A hand is cleared and dealt again
 * every round.
 */
public class Hand {
    private final List<NumberCard> numberCards = new ArrayList<>();
    private final List<OperatorCard> operatorCards = new ArrayList<>();
    private final List<SpecialCard> specialCards = new ArrayList<>();
    private final Set<OperatorType> disabledOperators = EnumSet.noneOf(OperatorType.class);

    public Hand() {
    }

    /**
     * Convenience for building a hand from face texts, e.g. {@code Hand.of("4", "5", "+", "√")}.
     */
    public static Hand of(String... cards) {
        Hand hand = new Hand();
        for (String card : cards) {
            hand.addCard(Card.fromString(card));
        }
        return hand;
    }

    public void clear() {
        numberCards.clear();
        operatorCards.clear();
        specialCards.clear();
        disabledOperators.clear();
    }

    public void addCard(Card card) {
        switch (card.getType()) {
            case NUMBER -> numberCards.add((NumberCard) card);
            case OPERATOR -> operatorCards.add((OperatorCard) card);
            case SPECIAL -> specialCards.add((SpecialCard) card);
        }
    }

    public boolean removeCard(Card card) {
        return switch (card.getType()) {
            case NUMBER -> numberCards.remove(card);
            case OPERATOR -> operatorCards.remove(card);
            case SPECIAL -> specialCards.remove(card);
        };
    }

    public boolean contains(Card card) {
        // identity, not equality: two number cards with the same value are distinct cards
        return switch (card.getType()) {
            case NUMBER -> numberCards.stream().anyMatch(c -> c == card);
            case OPERATOR -> operatorCards.stream().anyMatch(c -> c == card);
            case SPECIAL -> specialCards.stream().anyMatch(c -> c == card);
        };
    }

    public List<NumberCard> getNumberCards() {
        return Collections.unmodifiableList(numberCards);
    }

    public List<OperatorCard> getOperatorCards() {
        return Collections.unmodifiableList(operatorCards);
    }

    public List<SpecialCard> getSpecialCards() {
        return Collections.unmodifiableList(specialCards);
    }

    public List<Integer> getNumberValues() {
        return numberCards.stream()
                .map(NumberCard::getValue)
                .collect(Collectors.toList());
    }

    /**
     * Number of forced multiply cards, i.e. how many multiply operators the expression needs.
     */
    public int getForcedMultiplyCount() {
        return countSpecial(SpecialCard.Kind.FORCED_MULTIPLY);
    }

    /**
     * Number of root cards, i.e. how many numbers must carry a square root.
     */
    public int getUnaryRootCount() {
        return countSpecial(SpecialCard.Kind.UNARY_ROOT);
    }

    private int countSpecial(SpecialCard.Kind kind) {
        return (int) specialCards.stream()
                .filter(c -> c.getKind() == kind)
                .count();
    }

    public boolean isOperatorEnabled(OperatorType operator) {
        return !disabledOperators.contains(operator);
    }

    /**
     * Disable a base operator for this round. Multiply is governed by the special cards
     * and is never disabled.
     */
    public void disableOperator(OperatorType operator) {
        if (operator != OperatorType.MULTIPLY) {
            disabledOperators.add(operator);
        }
    }

    public Set<OperatorType> getDisabledOperators() {
        return Collections.unmodifiableSet(disabledOperators);
    }

    /**
     * Enabled operator kinds held, without duplicates, in the order they were dealt.
     */
    public List<OperatorType> getAvailableOperators() {
        return getEnabledOperatorCards().stream()
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * One entry per enabled operator card, in the order they were dealt. Each entry can be
     * spent once.
     */
    public List<OperatorType> getEnabledOperatorCards() {
        return operatorCards.stream()
                .map(OperatorCard::getOperator)
                .filter(this::isOperatorEnabled)
                .collect(Collectors.toList());
    }

    public void resetSpecialUsage() {
        specialCards.forEach(SpecialCard::resetUsage);
    }

    public int getTotalCardCount() {
        return numberCards.size() + operatorCards.size() + specialCards.size();
    }

    public boolean isEmpty() {
        return numberCards.isEmpty() && operatorCards.isEmpty() && specialCards.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("Hand: %d numbers %s, %d operators, %d specials",
                numberCards.size(), getNumberValues(), operatorCards.size(), specialCards.size());
    }
}
