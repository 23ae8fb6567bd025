package org.casino.blackjack.console;

/** Le joueur quitte la session (/exit ou fin de l'entrée standard). */
public class ExitRequestedException extends RuntimeException {
    public ExitRequestedException(String message) {
        super(message);
    }
}
