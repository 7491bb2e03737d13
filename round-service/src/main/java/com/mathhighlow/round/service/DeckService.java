package com.mathhighlow.round.service;

import com.mathhighlow.engine.model.Card;
import com.mathhighlow.engine.model.NumberCard;
import com.mathhighlow.engine.model.SpecialCard;
import com.mathhighlow.round.config.GameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * The shared slot deck: every number 0..10 in several copies plus the special cards,
 * shuffled and drawn from the end.
 */
@Slf4j
@Service
public class DeckService {

    private final GameProperties properties;
    private final Random random;
    private final List<Card> slotDeck = new ArrayList<>();

    public DeckService(GameProperties properties, Random random) {
        this.properties = properties;
        this.random = random;
    }

    public void buildSlotDeck() {
        slotDeck.clear();

        for (int value = NumberCard.MIN_VALUE; value <= NumberCard.MAX_VALUE; value++) {
            for (int copy = 0; copy < properties.getNumberCopiesPerValue(); copy++) {
                slotDeck.add(new NumberCard(value));
            }
        }
        for (int i = 0; i < properties.getForcedMultiplyCards(); i++) {
            slotDeck.add(new SpecialCard(SpecialCard.Kind.FORCED_MULTIPLY));
        }
        for (int i = 0; i < properties.getUnaryRootCards(); i++) {
            slotDeck.add(new SpecialCard(SpecialCard.Kind.UNARY_ROOT));
        }

        Collections.shuffle(slotDeck, random);
        log.debug("Built slot deck with {} cards", slotDeck.size());
    }

    /**
     * Draw the top card, rebuilding the deck first when it has run out.
     *
     * @return a fresh copy of the drawn card
     */
    public Card drawSlotCard() {
        if (slotDeck.isEmpty()) {
            buildSlotDeck();
        }
        if (slotDeck.isEmpty()) {
            throw new IllegalStateException("Slot deck is configured without any cards");
        }
        return slotDeck.remove(slotDeck.size() - 1).copy();
    }

    /**
     * A number card with a uniformly random value, independent of the slot deck.
     */
    public NumberCard drawRandomNumberCard() {
        return new NumberCard(random.nextInt(NumberCard.MAX_VALUE - NumberCard.MIN_VALUE + 1) + NumberCard.MIN_VALUE);
    }

    public int getRemainingCardCount() {
        return slotDeck.size();
    }
}
