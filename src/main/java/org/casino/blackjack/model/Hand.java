package org.casino.blackjack.model;

import lombok.Getter;
import lombok.Setter;
import org.casino.blackjack.model.rules.HandRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Main d'un participant pour un round (ou une des deux mains après split).
 * Ajout seulement ; la main est remplacée en bloc au split et jetée en fin de round.
 */
public class Hand {
    private final List<Card> cards = new ArrayList<>();

    @Getter @Setter
    private long bet;

    @Getter @Setter
    private RoundResult result;

    @Getter
    private boolean settled;

    public Hand() {}

    public Hand(List<Card> cards) {
        this.cards.addAll(cards);
    }

    public void add(Card c) {
        cards.add(c);
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public int size() { return cards.size(); }

    public int value() { return HandRules.value(cards); }

    public boolean isSoft() { return HandRules.isSoft(cards); }

    public boolean isBlackjack() {
        return cards.size() == 2 && value() == HandRules.BLACKJACK;
    }

    public boolean isBusted() { return value() > HandRules.BLACKJACK; }

    /** Deux cartes de même rang. */
    public boolean isPair() {
        return cards.size() == 2 && cards.get(0).getRank() == cards.get(1).getRank();
    }

    public Hand copy() {
        Hand h = new Hand(cards);
        h.bet = bet;
        h.result = result;
        h.settled = settled;
        return h;
    }

    void markSettled() { settled = true; }

    public List<String> describe() {
        List<String> out = new ArrayList<>(cards.size());
        for (Card c : cards) out.add(c.toString());
        return out;
    }

    @Override
    public String toString() {
        return cards + " | Value: " + value();
    }
}
