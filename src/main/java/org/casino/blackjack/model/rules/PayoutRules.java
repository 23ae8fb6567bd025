package org.casino.blackjack.model.rules;

import org.casino.blackjack.model.Hand;
import org.casino.blackjack.model.RoundResult;

public final class PayoutRules {
    private PayoutRules(){}

    /** credit = montant rendu au joueur (mise incluse), 0 si perdu. */
    public record Outcome(long credit, RoundResult result) {}

    /**
     * Fonction pure : ne touche ni la main ni le solde, peut être rejouée pour affichage.
     * La mise a déjà été débitée au moment du pari.
     */
    public static Outcome compute(Hand player, Hand dealer, long bet) {
        int pt = player.value(), dt = dealer.value();
        if (player.isBusted()) return new Outcome(0, RoundResult.BUSTED);
        if (player.isBlackjack()) return new Outcome(bet + (bet * 3) / 2, RoundResult.BLACKJACK);
        if (dt > HandRules.BLACKJACK || pt > dt) return new Outcome(bet * 2, RoundResult.WIN);
        if (pt == dt) return new Outcome(bet, RoundResult.PUSH);
        return new Outcome(0, RoundResult.LOSE);
    }
}
