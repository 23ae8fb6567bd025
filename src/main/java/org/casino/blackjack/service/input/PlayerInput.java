package org.casino.blackjack.service.input;

import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.Participant;
import org.casino.blackjack.strategy.DecisionContext;

/**
 * Entrée d'un joueur humain. Appels bloquants, sans timeout.
 */
public interface PlayerInput {

    /** Mise demandée pour ce round, 0 = ne joue pas ce round. */
    long requestBet(Participant participant);

    Action requestAction(DecisionContext ctx);

    /** Signale un refus ; la demande sera refaite. */
    void reject(String participantName, String reason);
}
