package org.casino.blackjack.model;

import org.casino.blackjack.model.exception.ShoeEmptyException;

import java.util.*;

public class Shoe {
    private final Deque<Card> cards = new ArrayDeque<>();
    private final Random rnd;
    private final int decks;

    public Shoe(int decks, Random rnd) {
        if (decks < 1) throw new IllegalArgumentException("Nombre de decks invalide: " + decks);
        this.decks = decks;
        this.rnd = rnd;
        List<Card> tmp = new ArrayList<>(decks * 52);
        for (int d = 0; d < decks; d++) {
            for (Card.Suit s : Card.Suit.values()) {
                for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
            }
        }
        cards.addAll(tmp);
        shuffle();
    }

    private Shoe(int decks, Random rnd, List<Card> ordered) {
        this.decks = decks;
        this.rnd = rnd;
        cards.addAll(ordered);
    }

    /**
     * Shoe préparé, non mélangé : les cartes sortent dans l'ordre de la liste.
     * Sert aux tests et au rejeu d'une donne.
     */
    public static Shoe stacked(int decks, Random rnd, List<Card> ordered) {
        return new Shoe(decks, rnd, ordered);
    }

    public void shuffle() {
        List<Card> tmp = new ArrayList<>(cards);
        Collections.shuffle(tmp, rnd);
        cards.clear();
        cards.addAll(tmp);
    }

    public Card draw() {
        Card c = cards.pollFirst();
        if (c == null) throw new ShoeEmptyException(decks);
        return c;
    }

    public int remaining() { return cards.size(); }

    public int getDecks() { return decks; }

    public int capacity() { return decks * 52; }

    /** Nouveau shoe complet, même nombre de decks, même source aléatoire. */
    public Shoe fresh() {
        return new Shoe(decks, rnd);
    }
}
