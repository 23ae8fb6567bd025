package org.casino.blackjack.model;

/** Phases d'un round, dans l'ordre strict. IDLE = aucun round en cours. */
public enum RoundPhase {
    IDLE, RESHUFFLE_CHECK, SETUP, BETTING, DEALING, PLAYER_TURNS, DEALER_TURN, SETTLEMENT;

    public boolean canAdvanceTo(RoundPhase next) {
        if (next == RESHUFFLE_CHECK) return this == IDLE || this == SETTLEMENT;
        return next.ordinal() == ordinal() + 1 && next != IDLE;
    }
}
