package org.casino.blackjack.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.config.SessionProperties;
import org.casino.blackjack.dto.RoundRecord;
import org.casino.blackjack.model.Participant;
import org.casino.blackjack.model.Seat;
import org.casino.blackjack.model.Table;
import org.casino.blackjack.service.betting.BettingService;
import org.casino.blackjack.service.engine.RoundEngine;
import org.casino.blackjack.service.log.RoundLogService;
import org.casino.blackjack.strategy.StrategyFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Une session : une table construite depuis la configuration, des rounds successifs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {
    private final SessionProperties props;
    private final Random shoeRandom;
    private final StrategyFactory strategies;
    private final RoundEngine engine;
    private final BettingService betting;
    private final RoundLogService roundLog;

    private Table table;
    private int roundsPlayed = 0;

    public synchronized Table open() {
        Table t = new Table(props.getNumDecks(), shoeRandom);
        t.setGodMode(props.isGodMode());
        for (String name : props.getPlayers()) {
            t.seat(new Seat(new Participant(name, props.getStartingBalance()), strategies.human(), true));
        }
        for (SessionProperties.Bot bot : props.getBots()) {
            t.seat(new Seat(new Participant(bot.getName(), props.getStartingBalance()), strategies.forBot(bot.getStrategy()), false));
        }
        if (t.getSeats().isEmpty()) throw new IllegalStateException("Aucun joueur ni bot configuré");
        table = t;
        roundsPlayed = 0;
        log.info("Session ouverte : {} places, {} decks, solde initial {}",
                t.getSeats().size(), t.getNumDecks(), props.getStartingBalance());
        return t;
    }

    public Table getTable() {
        if (table == null) throw new IllegalStateException("Session non ouverte");
        return table;
    }

    public RoundRecord playRound() {
        Table t = getTable();
        engine.playRound(t);
        roundsPlayed++;
        RoundRecord record = roundLog.buildRecord(t);
        if (props.getSession().isLogRounds()) roundLog.append(record);
        return record;
    }

    /** Mode interactif dès qu'un joueur humain est assis. */
    public boolean isInteractive() {
        return getTable().getSeats().stream().anyMatch(Seat::isHuman);
    }

    /**
     * Fin de session : nombre de rounds atteint, tous les soldes au plus au minimum,
     * ou, sans humain, plus aucun bot capable de miser.
     */
    public boolean shouldContinue() {
        Table t = getTable();
        int max = props.getSession().getMaxRounds();
        if (max > 0 && roundsPlayed >= max) return false;

        long min = props.getSession().getMinBalance();
        boolean anyAboveMin = t.getSeats().stream().anyMatch(s -> s.getParticipant().getBalance() > min);
        if (!anyAboveMin) return false;

        if (!isInteractive()) {
            return t.getSeats().stream().anyMatch(s -> betting.botBet(s.getParticipant().getBalance()) > 0);
        }
        return true;
    }

    public int getRoundsPlayed() { return roundsPlayed; }

    public Map<String, Long> balances() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Seat s : getTable().getSeats()) out.put(s.getParticipant().getName(), s.getParticipant().getBalance());
        return out;
    }

    public void editBalance(String name, long newBalance) {
        engine.editBalance(getTable(), name, newBalance);
    }

    public void forceShuffle() {
        engine.forceReshuffle(getTable());
    }

    public void setGodMode(boolean on) {
        getTable().setGodMode(on);
        log.info("God mode {}", on ? "ON" : "OFF");
    }
}
