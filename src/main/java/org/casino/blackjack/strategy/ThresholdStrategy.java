package org.casino.blackjack.strategy;

import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.Hand;

/** Tire tant que la main vaut au plus le seuil, sinon reste. Ignore la carte du croupier. */
public class ThresholdStrategy implements Strategy {
    public static final int DEFAULT_THRESHOLD = 16;

    private final int threshold;

    public ThresholdStrategy() {
        this(DEFAULT_THRESHOLD);
    }

    public ThresholdStrategy(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public Action decide(DecisionContext ctx) {
        return ctx.handValue() <= threshold ? Action.HIT : Action.STAND;
    }

    @Override
    public boolean splitEligible(Hand hand) {
        return false;
    }

    @Override
    public String name() { return "default"; }
}
