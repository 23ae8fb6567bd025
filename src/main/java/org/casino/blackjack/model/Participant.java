package org.casino.blackjack.model;

import lombok.Getter;
import org.casino.blackjack.model.exception.InsufficientBalanceException;
import org.casino.blackjack.model.exception.InvalidBetException;
import org.casino.blackjack.model.exception.NotDoubleableException;
import org.casino.blackjack.model.exception.NotSplittableException;
import org.casino.blackjack.model.rules.PayoutRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Joueur (humain ou bot) ou croupier.
 * <p>
 * Toutes les vérifications passent avant la moindre mutation : une action
 * refusée laisse solde, mains et mise intacts. Le solde ne devient jamais négatif.
 */
public class Participant {
    @Getter private final String name;
    @Getter private final boolean dealer;
    @Getter private long balance;
    @Getter private RoundResult result;

    private final List<Hand> hands = new ArrayList<>();
    private final List<ActionLogEntry> actionLog = new ArrayList<>();
    private int activeHandIndex = 0;

    public Participant(String name, long balance) {
        this(name, balance, false);
    }

    private Participant(String name, long balance, boolean dealer) {
        if (balance < 0) throw new IllegalArgumentException("Solde initial négatif pour " + name);
        this.name = name;
        this.balance = balance;
        this.dealer = dealer;
        hands.add(new Hand());
    }

    public static Participant dealer() {
        return new Participant("Dealer", 0, true);
    }

    // ---------------------------------------------------------------- mise

    public void placeBet(long amount) {
        if (dealer) throw new IllegalStateException("Le croupier ne mise pas");
        if (amount <= 0) throw new InvalidBetException("La mise doit être > 0 (reçu " + amount + ")");
        if (amount > balance) throw new InsufficientBalanceException("Mise de " + amount + " supérieure au solde (" + balance + ")");
        balance -= amount;
        hands.get(0).setBet(amount);
    }

    /** Total misé sur le round, toutes mains confondues. */
    public long getCurrentBet() {
        long total = 0;
        for (Hand h : hands) total += h.getBet();
        return total;
    }

    public boolean hasBet() { return getCurrentBet() > 0; }

    // ---------------------------------------------------------------- mains

    public List<Hand> getHands() { return Collections.unmodifiableList(hands); }

    public Hand getHand(int index) { return hands.get(index); }

    public Hand activeHand() { return hands.get(activeHandIndex); }

    public int getActiveHandIndex() { return activeHandIndex; }

    /** Passe à la main suivante (après split). Faux s'il n'y en a plus. */
    public boolean advanceHand() {
        if (activeHandIndex + 1 >= hands.size()) return false;
        activeHandIndex++;
        return true;
    }

    public void hit(Card card) {
        activeHand().add(card);
    }

    /** Carte donnée à une main précise (les deux mains issues d'un split). */
    public void dealTo(int handIndex, Card card) {
        hands.get(handIndex).add(card);
    }

    public boolean hasSplit() { return hands.size() > 1; }

    public void checkSplit() {
        if (dealer) throw new NotSplittableException("Le croupier ne split pas");
        if (hasSplit()) throw new NotSplittableException("Un seul split par round");
        Hand active = activeHand();
        if (!active.isPair())
            throw new NotSplittableException("Split impossible : il faut exactement deux cartes de même rang");
        if (active.getBet() > balance)
            throw new InsufficientBalanceException("Solde insuffisant pour split (" + balance + " < " + active.getBet() + ")");
    }

    /** Les deux cartes de la main active partent chacune dans une main neuve, avec la même mise. */
    public void split() {
        checkSplit();
        Hand active = activeHand();
        long stake = active.getBet();
        Hand first = new Hand(List.of(active.getCards().get(0)));
        Hand second = new Hand(List.of(active.getCards().get(1)));
        first.setBet(stake);
        second.setBet(stake);
        balance -= stake;
        hands.set(activeHandIndex, first);
        hands.add(activeHandIndex + 1, second);
    }

    public void checkDoubleDown() {
        if (dealer) throw new NotDoubleableException("Le croupier ne double pas");
        Hand active = activeHand();
        if (active.getBet() > balance)
            throw new InsufficientBalanceException("Solde insuffisant pour doubler (" + balance + " < " + active.getBet() + ")");
        if (active.size() != 2)
            throw new NotDoubleableException("Impossible de doubler après un hit");
    }

    public void doubleDown(Card card) {
        checkDoubleDown();
        Hand active = activeHand();
        balance -= active.getBet();
        active.setBet(active.getBet() * 2);
        active.add(card);
    }

    // ---------------------------------------------------------------- journal / règlement

    public void logAction(Action action, String dealerVisibleCard) {
        Hand active = activeHand();
        actionLog.add(new ActionLogEntry(action, activeHandIndex, active.describe(), active.value(), dealerVisibleCard));
    }

    public List<ActionLogEntry> getActionLog() { return Collections.unmodifiableList(actionLog); }

    /**
     * Crédite le gain d'une main. Une main déjà réglée ne l'est jamais deux fois.
     * @return false si la main était déjà réglée
     */
    public boolean settle(int handIndex, PayoutRules.Outcome outcome) {
        Hand h = hands.get(handIndex);
        if (h.isSettled()) return false;
        balance += outcome.credit();
        h.setResult(outcome.result());
        h.markSettled();
        result = outcome.result();
        return true;
    }

    public void resetForNewRound() {
        hands.clear();
        hands.add(new Hand());
        activeHandIndex = 0;
        actionLog.clear();
        result = null;
    }

    /** Remplace la main initiale (mode debug). La mise est conservée. */
    public void replaceInitialHand(List<Card> cards) {
        long stake = hands.get(0).getBet();
        Hand h = new Hand(cards);
        h.setBet(stake);
        hands.set(0, h);
    }

    public void editBalance(long newBalance) {
        if (newBalance < 0) throw new IllegalArgumentException("Le solde ne peut pas être négatif");
        balance = newBalance;
    }

    @Override
    public String toString() {
        return name + " ($" + balance + ")";
    }
}
