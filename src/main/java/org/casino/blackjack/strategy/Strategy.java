package org.casino.blackjack.strategy;

import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.Hand;
import org.casino.blackjack.model.exception.ParticipantActionException;

import java.util.Optional;

/**
 * Décision d'un participant, humain ou bot. Le moteur ne connaît que cette interface.
 */
public interface Strategy {

    Action decide(DecisionContext ctx);

    /** La stratégie accepte-t-elle de splitter cette main ? Consulté seulement si le split est légal. */
    default boolean splitEligible(Hand hand) {
        return hand.isPair();
    }

    /**
     * Appelé quand l'action choisie est refusée. Vide = redemander une décision,
     * sinon l'action de repli à appliquer.
     */
    default Optional<Action> onRejected(String participantName, Action rejected, ParticipantActionException cause) {
        return Optional.of(rejected.fallback());
    }

    String name();
}
