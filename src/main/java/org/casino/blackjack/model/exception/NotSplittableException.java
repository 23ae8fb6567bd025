package org.casino.blackjack.model.exception;

public class NotSplittableException extends ParticipantActionException {
    public NotSplittableException(String message) {
        super(message);
    }
}
