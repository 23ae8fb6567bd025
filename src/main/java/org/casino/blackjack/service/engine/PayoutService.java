package org.casino.blackjack.service.engine;

import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.model.Hand;
import org.casino.blackjack.model.Participant;
import org.casino.blackjack.model.Seat;
import org.casino.blackjack.model.Table;
import org.casino.blackjack.model.rules.PayoutRules;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class PayoutService {

    /** Règle chaque main de chaque place qui a misé et crédite les soldes. Une main réglée ne l'est qu'une fois. */
    public List<Settlement> computeAndPay(Table t) {
        return settle(t, true);
    }

    /** Même calcul, sans toucher aux soldes (affichage). */
    public List<Settlement> preview(Table t) {
        return settle(t, false);
    }

    private List<Settlement> settle(Table t, boolean apply) {
        List<Settlement> pay = new ArrayList<>();
        Hand dealerHand = t.getDealer().getHand(0);

        for (Seat s : t.getSeats()) {
            Participant p = s.getParticipant();
            if (!p.hasBet()) continue;

            for (int i = 0; i < p.getHands().size(); i++) {
                Hand h = p.getHand(i);
                var o = PayoutRules.compute(h, dealerHand, h.getBet());
                if (apply && !p.settle(i, o)) {
                    log.warn("Main {} de {} déjà réglée, crédit ignoré", i, p.getName());
                    continue;
                }
                pay.add(new Settlement(p.getName(), i, h.getBet(), o.credit(), h.value(), o.result()));
            }
        }
        if (apply) {
            for (Settlement st : pay) {
                log.info("round {} : {} main {} -> {} (mise {}, crédit {})",
                        t.getRoundNumber(), st.name(), st.handIndex(), st.result(), st.bet(), st.credit());
            }
        }
        return pay;
    }
}
