package org.casino.blackjack.model.exception;

public class NotDoubleableException extends ParticipantActionException {
    public NotDoubleableException(String message) {
        super(message);
    }
}
