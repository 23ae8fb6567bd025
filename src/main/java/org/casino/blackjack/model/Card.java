package org.casino.blackjack.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class Card {
    private final Rank rank;
    private final Suit suit;

    /** Valeurs possibles de la carte : {1, 11} pour l'As, {10} pour les figures. */
    public int[] possibleValues() {
        return rank.values.clone();
    }

    /** Valeur "table" : l'As compte 11 (carte visible du croupier). */
    public int value() {
        return rank == Rank.ACE ? 11 : rank.values[0];
    }

    @Override
    public String toString() {
        return rank.label + " of " + suit.label;
    }

    public enum Suit {
        HEARTS("Hearts"), DIAMONDS("Diamonds"), CLUBS("Clubs"), SPADES("Spades");

        private final String label;

        Suit(String label) { this.label = label; }
    }

    public enum Rank {
        TWO("2", 2), THREE("3", 3), FOUR("4", 4), FIVE("5", 5), SIX("6", 6),
        SEVEN("7", 7), EIGHT("8", 8), NINE("9", 9), TEN("10", 10),
        JACK("Jack", 10), QUEEN("Queen", 10), KING("King", 10),
        ACE("Ace", 1, 11);

        private final String label;
        private final int[] values;

        Rank(String label, int... values) {
            this.label = label;
            this.values = values;
        }

        public String getLabel() { return label; }
    }
}
