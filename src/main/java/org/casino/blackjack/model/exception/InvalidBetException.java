package org.casino.blackjack.model.exception;

public class InvalidBetException extends ParticipantActionException {
    public InvalidBetException(String message) {
        super(message);
    }
}
