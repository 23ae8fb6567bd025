package org.casino.blackjack.strategy;

import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.Hand;

/**
 * Stratégie de base "by the books" : table (carte visible du croupier 2..11) x (valeur de la main 4..21).
 * L'As visible vaut 11 pour la lecture de la table. Hors table : STAND.
 */
public class BasicStrategy implements Strategy {
    private static final int MIN_DEALER = 2, MAX_DEALER = 11;
    private static final int MIN_HAND = 4, MAX_HAND = 21;

    // colonnes : main de 4 à 21 (H = hit, S = stand, D = double)
    private static final String[] ROWS = {
            /*  2 */ "HHHHHHDDHSSSSSSSSS",
            /*  3 */ "HHHHHDDDHSSSSSSSSS",
            /*  4 */ "HHHHHDDDSSSSSSSSSS",
            /*  5 */ "HHHHHDDDSSSSSSSSSS",
            /*  6 */ "HHHHHDDDSSSSSSSSSS",
            /*  7 */ "HHHHHHDDHHHHHSSSSS",
            /*  8 */ "HHHHHHDDHHHHHSSSSS",
            /*  9 */ "HHHHHHDDHHHHHSSSSS",
            /* 10 */ "HHHHHHHDHHHHHSSSSS",
            /* 11 */ "HHHHHHHHHHHHHSSSSS",
    };

    private static final Action[][] TABLE = build();

    private static Action[][] build() {
        Action[][] t = new Action[MAX_DEALER - MIN_DEALER + 1][MAX_HAND - MIN_HAND + 1];
        for (int d = 0; d < ROWS.length; d++) {
            String row = ROWS[d];
            if (row.length() != MAX_HAND - MIN_HAND + 1)
                throw new IllegalStateException("Ligne de table invalide pour le croupier " + (d + MIN_DEALER));
            for (int h = 0; h < row.length(); h++) {
                t[d][h] = switch (row.charAt(h)) {
                    case 'H' -> Action.HIT;
                    case 'D' -> Action.DOUBLE;
                    default -> Action.STAND;
                };
            }
        }
        return t;
    }

    public static Action lookup(int dealerValue, int handValue) {
        if (dealerValue < MIN_DEALER || dealerValue > MAX_DEALER) return Action.STAND;
        if (handValue < MIN_HAND || handValue > MAX_HAND) return Action.STAND;
        return TABLE[dealerValue - MIN_DEALER][handValue - MIN_HAND];
    }

    @Override
    public Action decide(DecisionContext ctx) {
        return lookup(ctx.dealerUpCard().value(), ctx.handValue());
    }

    @Override
    public boolean splitEligible(Hand hand) {
        return false;
    }

    @Override
    public String name() { return "basic"; }
}
