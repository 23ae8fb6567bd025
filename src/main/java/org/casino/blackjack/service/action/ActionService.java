package org.casino.blackjack.service.action;

import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.Card;
import org.casino.blackjack.model.Participant;
import org.casino.blackjack.model.Table;
import org.springframework.stereotype.Service;

/**
 * Applique une action sur la main active. Les contrôles passent avant le moindre tirage :
 * une action refusée ne consomme aucune carte.
 */
@Slf4j
@Service
public class ActionService {

    public TurnStep apply(Table t, Participant p, Action action) {
        String dealerUp = t.dealerUpCard().map(Card::toString).orElse(null);
        switch (action) {
            case HIT -> {
                p.hit(t.getShoe().draw());
                p.logAction(Action.HIT, dealerUp);
                return TurnStep.CONTINUE;
            }
            case STAND -> {
                p.logAction(Action.STAND, dealerUp);
                return TurnStep.END;
            }
            case DOUBLE -> {
                p.checkDoubleDown();
                p.doubleDown(t.getShoe().draw());
                p.logAction(Action.DOUBLE, dealerUp);
                return TurnStep.END;
            }
            case SPLIT -> {
                p.checkSplit();
                p.split();
                int first = p.getActiveHandIndex();
                p.dealTo(first, t.getShoe().draw());
                p.dealTo(first + 1, t.getShoe().draw());
                p.logAction(Action.SPLIT, dealerUp);
                log.debug("{} split : {} / {}", p.getName(), p.getHand(first), p.getHand(first + 1));
                return TurnStep.CONTINUE;
            }
            default -> throw new IllegalArgumentException("Action non supportée: " + action);
        }
    }
}
