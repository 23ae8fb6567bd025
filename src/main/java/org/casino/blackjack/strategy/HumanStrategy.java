package org.casino.blackjack.strategy;

import lombok.RequiredArgsConstructor;
import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.exception.ParticipantActionException;
import org.casino.blackjack.service.input.PlayerInput;

import java.util.Optional;

/** Délègue chaque décision au joueur. Une action refusée est signalée puis redemandée. */
@RequiredArgsConstructor
public class HumanStrategy implements Strategy {
    private final PlayerInput input;

    @Override
    public Action decide(DecisionContext ctx) {
        return input.requestAction(ctx);
    }

    @Override
    public Optional<Action> onRejected(String participantName, Action rejected, ParticipantActionException cause) {
        input.reject(participantName, cause.getMessage());
        return Optional.empty();
    }

    @Override
    public String name() { return "human"; }
}
