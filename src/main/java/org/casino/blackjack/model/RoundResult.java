package org.casino.blackjack.model;

public enum RoundResult {
    BLACKJACK, WIN, PUSH, LOSE, BUSTED;

    public String label() { return name().toLowerCase(); }
}
