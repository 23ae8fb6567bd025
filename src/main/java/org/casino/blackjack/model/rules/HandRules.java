package org.casino.blackjack.model.rules;

import org.casino.blackjack.model.Card;

public final class HandRules {
    private HandRules(){}

    public static final int BLACKJACK = 21;

    /** Bits 0..21 : un bit par total atteignable <= 21. */
    private static final int IN_RANGE = (1 << (BLACKJACK + 1)) - 1;

    /**
     * Meilleure valeur de la main : le plus grand total atteignable <= 21,
     * sinon le plus petit total (bust affiché).
     * <p>
     * Repli de l'ensemble des totaux carte par carte. L'ensemble est un masque
     * de 22 bits (capacité fixe), le OR fait la déduplication. Un total partiel
     * > 21 ne peut plus redescendre, on ne garde donc que le minimum au-delà.
     */
    public static int value(Iterable<Card> cards) {
        Totals t = fold(cards);
        return t.reachable != 0 ? highestBit(t.reachable) : t.minimum;
    }

    /** Total dur : tous les As comptés 1. */
    public static int hardTotal(Iterable<Card> cards) {
        return fold(cards).minimum;
    }

    /** Main "soft" : la meilleure valeur compte un As à 11. */
    public static boolean isSoft(Iterable<Card> cards) {
        Totals t = fold(cards);
        return t.reachable != 0 && highestBit(t.reachable) != t.minimum;
    }

    private static Totals fold(Iterable<Card> cards) {
        int reachable = 1; // main vide : {0}
        int minimum = 0;
        for (Card c : cards) {
            int[] values = c.possibleValues();
            int next = 0;
            int low = Integer.MAX_VALUE;
            for (int v : values) {
                next |= (reachable << v);
                low = Math.min(low, v);
            }
            reachable = next & IN_RANGE;
            minimum += low;
        }
        return new Totals(reachable, minimum);
    }

    private static int highestBit(int mask) {
        return 31 - Integer.numberOfLeadingZeros(mask);
    }

    private record Totals(int reachable, int minimum) {}
}
