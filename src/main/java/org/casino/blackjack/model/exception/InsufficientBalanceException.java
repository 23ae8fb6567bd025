package org.casino.blackjack.model.exception;

public class InsufficientBalanceException extends ParticipantActionException {
    public InsufficientBalanceException(String message) {
        super(message);
    }
}
