package org.casino.blackjack.strategy;

import org.casino.blackjack.model.Card;
import org.casino.blackjack.model.Hand;

/**
 * Ce qu'une stratégie voit au moment de décider. La main est une copie :
 * la modifier n'a aucun effet sur le round.
 */
public record DecisionContext(
        String participantName,
        Hand hand,
        Card dealerUpCard,
        long balance,
        long currentBet,
        int handIndex,
        int handCount,
        boolean splitAllowed) {

    public int handValue() { return hand.value(); }

    public int cardCount() { return hand.size(); }

    public boolean doubleAllowed() {
        return hand.size() == 2 && hand.getBet() <= balance;
    }
}
