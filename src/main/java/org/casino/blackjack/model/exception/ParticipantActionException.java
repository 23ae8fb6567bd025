package org.casino.blackjack.model.exception;

/**
 * Refus d'une action de participant (mise, double, split).
 * Levée avant toute mutation : le participant et le shoe restent inchangés.
 */
public abstract class ParticipantActionException extends RuntimeException {
    protected ParticipantActionException(String message) {
        super(message);
    }
}
