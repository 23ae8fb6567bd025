package org.casino.blackjack.model.exception;

/** Tirage dans un shoe vide : défaut de programme, jamais rattrapé par un nouvel essai. */
public class ShoeEmptyException extends IllegalStateException {
    public ShoeEmptyException(int decks) {
        super("Le shoe (" + decks + " decks) est vide, impossible de tirer une carte");
    }
}
