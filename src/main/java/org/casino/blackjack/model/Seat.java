package org.casino.blackjack.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.casino.blackjack.strategy.Strategy;

/** Place à la table : un participant et la stratégie qui décide pour lui. */
@Getter
@AllArgsConstructor
public class Seat {
    private final Participant participant;
    private final Strategy strategy;
    private final boolean human;

    public boolean isActivePlayer() {
        return participant.hasBet();
    }
}
