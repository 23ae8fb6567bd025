package org.casino.blackjack.service.betting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.config.SessionProperties;
import org.casino.blackjack.model.Participant;
import org.casino.blackjack.model.Seat;
import org.casino.blackjack.model.Table;
import org.casino.blackjack.model.exception.ParticipantActionException;
import org.casino.blackjack.service.input.PlayerInput;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class BettingService {
    private final SessionProperties props;
    private final PlayerInput input;

    /** Une mise par place, dans l'ordre de la session. Mise 0 = absent du round, solde intact. */
    public void collectBets(Table t) {
        for (Seat s : t.getSeats()) {
            if (s.isHuman()) betHuman(s.getParticipant());
            else betBot(s.getParticipant());
        }
    }

    /** Mise d'un bot selon la politique configurée ; 0 si le bot ne peut pas jouer. */
    public long botBet(long balance) {
        long bet = props.getDefaultBet();
        return switch (props.getBetSizing()) {
            case FIXED -> bet <= balance ? bet : 0;
            case CAPPED -> Math.min(bet, balance);
        };
    }

    private void betBot(Participant p) {
        long amount = botBet(p.getBalance());
        if (amount <= 0) {
            log.info("{} ne mise pas ce round (solde {})", p.getName(), p.getBalance());
            return;
        }
        p.placeBet(amount);
        log.debug("{} mise {}", p.getName(), amount);
    }

    private void betHuman(Participant p) {
        while (true) {
            long amount = input.requestBet(p);
            if (amount == 0) {
                log.debug("{} passe ce round", p.getName());
                return;
            }
            try {
                p.placeBet(amount);
                log.debug("{} mise {}", p.getName(), amount);
                return;
            } catch (ParticipantActionException ex) {
                input.reject(p.getName(), ex.getMessage());
            }
        }
    }
}
