package com.mathhighlow.round.service;

import com.mathhighlow.engine.model.Card;
import com.mathhighlow.engine.model.Hand;
import com.mathhighlow.engine.model.OperatorCard;
import com.mathhighlow.engine.model.OperatorType;
import com.mathhighlow.round.config.GameProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Deals a hand for one round from the slot deck.
 */
@Slf4j
@Service
public class Dealer {

    private static final OperatorType[] BASE_OPERATORS = {
            OperatorType.ADD, OperatorType.SUBTRACT, OperatorType.DIVIDE
    };

    private final DeckService deckService;
    private final GameProperties properties;

    public Dealer(DeckService deckService, GameProperties properties) {
        this.deckService = deckService;
        this.properties = properties;
    }

    /**
     * Replace the hand's contents: the base operator cards, the initial slot draws, then
     * more slot draws until enough number cards are held. Special cards drawn while topping
     * up are kept.
     */
    public void dealHand(Hand hand) {
        hand.clear();
        for (OperatorType op : BASE_OPERATORS) {
            hand.addCard(new OperatorCard(op));
        }

        for (int i = 0; i < properties.getInitialCardCount(); i++) {
            hand.addCard(deckService.drawSlotCard());
        }

        int topUps = 0;
        while (hand.getNumberCards().size() < properties.getRequiredNumberCards()) {
            Card card = deckService.drawSlotCard();
            hand.addCard(card);
            topUps++;
        }

        log.debug("Dealt {} ({} top-up draws)", hand, topUps);
    }
}
