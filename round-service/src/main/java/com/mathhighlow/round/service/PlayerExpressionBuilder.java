package com.mathhighlow.round.service;

import com.mathhighlow.engine.model.Card;
import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.NumberCard;
import com.mathhighlow.engine.model.OperatorCard;
import com.mathhighlow.engine.model.OperatorType;
import com.mathhighlow.engine.model.SpecialCard;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the human player's expression one card at a time.
 *
 * <p>Each card in the hand can be played once. A forced multiply card adds its operator
 * straight away; a root card waits and applies to the next number played. Moves that
 * don't fit the current position are refused with a {@link PlayOutcome} and leave the
 * state unchanged. Legality of the finished expression is still the validator's call.
 */
@Slf4j
public class PlayerExpressionBuilder {

    private final Hand hand;
    private final Expression expression = new Expression();
    private final Set<Card> usedCards = Collections.newSetFromMap(new IdentityHashMap<>());
    private SpecialCard pendingRoot;

    public PlayerExpressionBuilder(Hand hand) {
        this.hand = Objects.requireNonNull(hand, "hand");
    }

    public PlayOutcome play(Card card) {
        Objects.requireNonNull(card, "card");
        if (!hand.contains(card)) {
            return PlayOutcome.NOT_IN_HAND;
        }
        if (usedCards.contains(card)) {
            return PlayOutcome.CARD_ALREADY_USED;
        }

        PlayOutcome outcome = switch (card.getType()) {
            case NUMBER -> playNumber((NumberCard) card);
            case OPERATOR -> playOperator(card, ((OperatorCard) card).getOperator());
            case SPECIAL -> playSpecial((SpecialCard) card);
        };
        log.debug("Played {} -> {} [{}]", card.getDisplayText(), outcome, expression.toDisplayString());
        return outcome;
    }

    private PlayOutcome playNumber(NumberCard card) {
        if (!expression.expectingNumber()) {
            return PlayOutcome.EXPECTING_OPERATOR;
        }

        boolean rooted = pendingRoot != null;
        expression.addNumber(card.getValue(), rooted);
        usedCards.add(card);
        if (rooted) {
            pendingRoot.consume();
            usedCards.add(pendingRoot);
            pendingRoot = null;
        }
        return PlayOutcome.ACCEPTED;
    }

    private PlayOutcome playOperator(Card card, OperatorType operator) {
        if (expression.expectingNumber()) {
            return PlayOutcome.EXPECTING_NUMBER;
        }
        if (!hasUnusedNumberCards()) {
            return PlayOutcome.NO_NUMBERS_LEFT;
        }

        expression.addOperator(operator);
        usedCards.add(card);
        return PlayOutcome.ACCEPTED;
    }

    private PlayOutcome playSpecial(SpecialCard card) {
        if (card.getKind() == SpecialCard.Kind.FORCED_MULTIPLY) {
            PlayOutcome outcome = playOperator(card, OperatorType.MULTIPLY);
            if (outcome == PlayOutcome.ACCEPTED) {
                card.consume();
            }
            return outcome;
        }

        if (pendingRoot != null) {
            return PlayOutcome.ROOT_ALREADY_PENDING;
        }
        if (!expression.expectingNumber()) {
            return PlayOutcome.EXPECTING_OPERATOR;
        }
        if (!hasUnusedNumberCards()) {
            return PlayOutcome.NO_NUMBERS_LEFT;
        }
        pendingRoot = card;
        return PlayOutcome.ROOT_PENDING;
    }

    private boolean hasUnusedNumberCards() {
        return hand.getNumberCards().stream().anyMatch(c -> !usedCards.contains(c));
    }

    /**
     * Start over with the same hand.
     */
    public void reset() {
        expression.clear();
        usedCards.clear();
        pendingRoot = null;
        hand.resetSpecialUsage();
    }

    /**
     * True once every special card in the hand has been applied.
     */
    public boolean hasUsedRequiredSpecialCards() {
        return hand.getSpecialCards().stream().allMatch(usedCards::contains);
    }

    public boolean isRootPending() {
        return pendingRoot != null;
    }

    public boolean isUsed(Card card) {
        return usedCards.contains(card);
    }

    public Hand getHand() {
        return hand;
    }

    public Expression getExpression() {
        return expression.copy();
    }
}
