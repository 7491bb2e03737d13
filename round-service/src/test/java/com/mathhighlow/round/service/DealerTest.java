package com.mathhighlow.round.service;

import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.OperatorType;
import com.mathhighlow.round.config.GameProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DealerTest {

    private Dealer dealer(GameProperties properties, long seed) {
        return new Dealer(new DeckService(properties, new Random(seed)), properties);
    }

    @Test
    void testHandHasBaseOperatorsAndThreeNumbers() {
        GameProperties properties = new GameProperties();
        for (long seed = 0; seed < 50; seed++) {
            Hand hand = new Hand();
            dealer(properties, seed).dealHand(hand);

            assertEquals(List.of(OperatorType.ADD, OperatorType.SUBTRACT, OperatorType.DIVIDE),
                    hand.getEnabledOperatorCards());
            assertEquals(3, hand.getNumberCards().size(), "seed " + seed);
            assertEquals(6 + hand.getSpecialCards().size(), hand.getTotalCardCount());
        }
    }

    @Test
    void testSpecialCardsDrawnWhileToppingUpAreKept() {
        GameProperties properties = new GameProperties();
        properties.setNumberCopiesPerValue(1);
        properties.setForcedMultiplyCards(20);
        properties.setUnaryRootCards(20);

        int specials = 0;
        for (long seed = 0; seed < 20; seed++) {
            Hand hand = new Hand();
            dealer(properties, seed).dealHand(hand);

            assertEquals(3, hand.getNumberCards().size());
            specials += hand.getSpecialCards().size();
        }
        assertTrue(specials > 20, "A special-heavy deck should leave specials in most hands");
    }

    @Test
    void testDealingReplacesPreviousContents() {
        Hand hand = Hand.of("7", "7", "7", "7", "+", "F");
        hand.disableOperator(OperatorType.ADD);

        dealer(new GameProperties(), 3).dealHand(hand);

        assertTrue(hand.isOperatorEnabled(OperatorType.ADD));
        assertEquals(3, hand.getNumberCards().size());
        assertEquals(3, hand.getOperatorCards().size());
    }

    @Test
    void testNoInitialDrawsStillFillsNumbers() {
        GameProperties properties = new GameProperties();
        properties.setInitialCardCount(0);
        properties.setRequiredNumberCards(4);

        Hand hand = new Hand();
        dealer(properties, 9).dealHand(hand);

        assertEquals(4, hand.getNumberCards().size());
    }
}
