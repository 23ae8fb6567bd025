package org.casino.blackjack.service.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.events.TableBroadcaster;
import org.casino.blackjack.model.*;
import org.casino.blackjack.model.exception.ParticipantActionException;
import org.casino.blackjack.model.rules.DealingRules;
import org.casino.blackjack.service.action.ActionService;
import org.casino.blackjack.service.action.TurnStep;
import org.casino.blackjack.service.betting.BettingService;
import org.casino.blackjack.strategy.DecisionContext;
import org.casino.blackjack.strategy.Strategy;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Machine à états d'un round :
 * reshuffle-check, setup, mises, donne, tours des joueurs, tour du croupier, règlement.
 * Seul point de mutation du shoe, des mains et des soldes pendant un round.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEngine {
    public static final int DEALER_STANDS_ON = 17;

    private final BettingService betting;
    private final ActionService actions;
    private final PayoutService payouts;
    private final TableBroadcaster broadcaster;

    public List<Settlement> playRound(Table t) {
        enter(t, RoundPhase.RESHUFFLE_CHECK);
        checkShoe(t);

        enter(t, RoundPhase.SETUP);
        setup(t);

        enter(t, RoundPhase.BETTING);
        betting.collectBets(t);

        enter(t, RoundPhase.DEALING);
        deal(t);

        enter(t, RoundPhase.PLAYER_TURNS);
        for (Seat s : t.activeSeats()) playTurn(t, s);

        enter(t, RoundPhase.DEALER_TURN);
        dealerTurn(t);

        enter(t, RoundPhase.SETTLEMENT);
        List<Settlement> pay = payouts.computeAndPay(t);
        broadcaster.broadcastToTable(t, TableBroadcaster.PAYOUTS, Map.of(
                "dealerTotal", t.getDealer().getHand(0).value(),
                "payouts", pay));
        return pay;
    }

    // ---------------------------------------------------------------- phases

    /** Remplace le shoe s'il reste moins de (participants + 1) x 3 cartes. */
    public boolean checkShoe(Table t) {
        int remaining = t.getShoe().remaining();
        if (!DealingRules.needsReshuffle(remaining, t.getSeats().size())) return false;
        reshuffle(t, remaining);
        return true;
    }

    /** Reshuffle demandé à la main, seulement tant qu'aucune carte du round n'est distribuée. */
    public void forceReshuffle(Table t) {
        requireBetweenDeals(t);
        reshuffle(t, t.getShoe().remaining());
    }

    /** Correction de solde à la main, mêmes conditions que le reshuffle forcé. */
    public void editBalance(Table t, String name, long newBalance) {
        requireBetweenDeals(t);
        Seat seat = t.findSeat(name)
                .orElseThrow(() -> new IllegalArgumentException("Joueur '" + name + "' introuvable"));
        long old = seat.getParticipant().getBalance();
        seat.getParticipant().editBalance(newBalance);
        log.info("Solde de {} modifié : {} -> {}", seat.getParticipant().getName(), old, newBalance);
    }

    private void reshuffle(Table t, int remaining) {
        t.setShoe(t.getShoe().fresh());
        log.info("Reshuffle : {} cartes restantes, nouveau shoe de {} decks", remaining, t.getNumDecks());
        broadcaster.broadcastToTable(t, TableBroadcaster.RESHUFFLE, Map.of(
                "remaining", remaining,
                "decks", t.getNumDecks()));
    }

    private void setup(Table t) {
        for (Seat s : t.getSeats()) s.getParticipant().resetForNewRound();
        t.getDealer().resetForNewRound();
        t.setRoundNumber(t.getRoundNumber() + 1);
        log.debug("Round {} : {} places", t.getRoundNumber(), t.getSeats().size());
    }

    private void deal(Table t) {
        DealingRules.dealInitial(t);

        Map<String, Object> players = new LinkedHashMap<>();
        for (Seat s : t.activeSeats()) {
            players.put(s.getParticipant().getName(), s.getParticipant().getHand(0).copy());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dealerUp", t.dealerUpCard().orElse(null));
        payload.put("players", players);
        broadcaster.broadcastToTable(t, TableBroadcaster.HAND_START, payload);
    }

    /** Joue chaque main du participant dans l'ordre de création (main d'origine puis main du split). */
    private void playTurn(Table t, Seat seat) {
        Participant p = seat.getParticipant();
        broadcaster.broadcastToTable(t, TableBroadcaster.PLAYER_TURN, Map.of("name", p.getName()));
        do {
            playHand(t, seat);
        } while (p.advanceHand());
    }

    private void playHand(Table t, Seat seat) {
        Participant p = seat.getParticipant();
        Strategy strategy = seat.getStrategy();
        while (true) {
            Hand h = p.activeHand();
            if (h.isBlackjack() || h.isBusted()) return;

            Action action = strategy.decide(context(t, seat));
            if (action == null) throw new IllegalStateException("Stratégie " + strategy.name() + " sans décision pour " + p.getName());

            Optional<TurnStep> step = applyOrFallback(t, seat, action);
            if (step.isEmpty()) continue;
            broadcaster.broadcastToTable(t, TableBroadcaster.ACTION_RESULT, Map.of(
                    "name", p.getName(),
                    "action", action,
                    "hand", p.activeHand().copy()));
            if (step.get() == TurnStep.END) return;
        }
    }

    /** Vide si l'action est refusée et que la stratégie veut redécider. */
    private Optional<TurnStep> applyOrFallback(Table t, Seat seat, Action action) {
        Participant p = seat.getParticipant();
        Action next = action;
        while (true) {
            try {
                return Optional.of(actions.apply(t, p, next));
            } catch (ParticipantActionException ex) {
                log.debug("{} : {} refusé ({})", p.getName(), next, ex.getMessage());
                broadcaster.broadcastToTable(t, TableBroadcaster.ACTION_REJECTED, Map.of(
                        "name", p.getName(),
                        "action", next,
                        "reason", ex.getMessage()));
                Optional<Action> fallback = seat.getStrategy().onRejected(p.getName(), next, ex);
                if (fallback.isEmpty()) return Optional.empty();
                if (fallback.get() == next)
                    throw new IllegalStateException("Repli identique à l'action refusée : " + next, ex);
                next = fallback.get();
            }
        }
    }

    private DecisionContext context(Table t, Seat seat) {
        Participant p = seat.getParticipant();
        Hand h = p.activeHand();
        boolean splitAllowed = !p.hasSplit()
                && h.isPair()
                && h.getBet() <= p.getBalance()
                && seat.getStrategy().splitEligible(h);
        return new DecisionContext(
                p.getName(),
                h.copy(),
                t.dealerUpCard().orElseThrow(() -> new IllegalStateException("Carte du croupier absente")),
                p.getBalance(),
                p.getCurrentBet(),
                p.getActiveHandIndex(),
                p.getHands().size(),
                splitAllowed);
    }

    /** Le croupier tire tant qu'il a moins de 17, reste sur tout 17 (soft compris). */
    private void dealerTurn(Table t) {
        Participant dealer = t.getDealer();
        Hand hand = dealer.getHand(0);
        broadcaster.broadcastToTable(t, TableBroadcaster.DEALER_TURN_START, Map.of("dealer", hand.copy()));
        if (hand.size() == 0) return;

        while (hand.value() < DEALER_STANDS_ON) {
            dealer.hit(t.getShoe().draw());
            broadcaster.broadcastToTable(t, TableBroadcaster.DEALER_TURN_UPDATE, Map.of("dealer", hand.copy()));
        }
        broadcaster.broadcastToTable(t, TableBroadcaster.DEALER_TURN_END, Map.of(
                "dealer", hand.copy(),
                "busted", hand.isBusted()));
    }

    // ---------------------------------------------------------------- transitions

    private void enter(Table t, RoundPhase next) {
        RoundPhase current = t.getPhase();
        if (!current.canAdvanceTo(next))
            throw new IllegalStateException("Transition interdite " + current + " -> " + next);
        t.setPhase(next);
    }

    private void requireBetweenDeals(Table t) {
        RoundPhase phase = t.getPhase();
        boolean beforeDeal = phase.ordinal() <= RoundPhase.BETTING.ordinal();
        if (!beforeDeal && phase != RoundPhase.SETTLEMENT)
            throw new IllegalStateException("Impossible pendant la phase " + phase);
    }
}
