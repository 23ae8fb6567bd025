package org.casino.blackjack.model.rules;

import org.casino.blackjack.model.Card;
import org.casino.blackjack.model.Seat;
import org.casino.blackjack.model.Table;

import java.util.List;

public final class DealingRules {
    private DealingRules(){}

    /** Cartes réservées par participant (croupier compris) avant une donne. */
    public static final int CARDS_PER_PARTICIPANT = 3;

    private static final List<Card> GOD_HAND = List.of(
            new Card(Card.Rank.ACE, Card.Suit.HEARTS),
            new Card(Card.Rank.KING, Card.Suit.HEARTS));

    public static boolean needsReshuffle(int remaining, int participants) {
        return remaining < (participants + 1) * CARDS_PER_PARTICIPANT;
    }

    /**
     * Deux cartes à chaque place qui a misé puis au croupier, une à la fois :
     * toutes les premières cartes, puis toutes les secondes, croupier en dernier.
     * Rien n'est distribué si personne n'a misé.
     */
    public static void dealInitial(Table t) {
        List<Seat> active = t.activeSeats();
        if (active.isEmpty()) return;

        if (t.isGodMode()) {
            for (Seat s : active) {
                if (s.isHuman()) s.getParticipant().replaceInitialHand(GOD_HAND);
            }
        }

        for (int i = 0; i < 2; i++) {
            for (Seat s : active) {
                if (t.isGodMode() && s.isHuman()) continue;
                s.getParticipant().hit(t.getShoe().draw());
            }
            t.getDealer().hit(t.getShoe().draw());
        }
    }
}
