package org.casino.blackjack.model.rules;

import org.casino.blackjack.model.*;
import org.casino.blackjack.model.Card.Rank;
import org.casino.blackjack.model.Card.Suit;
import org.casino.blackjack.strategy.ThresholdStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class DealingRulesTest {

    private static Card c(Rank r, Suit s) { return new Card(r, s); }

    private static Seat seat(String name, boolean human, long bet) {
        Participant p = new Participant(name, 100);
        if (bet > 0) p.placeBet(bet);
        return new Seat(p, new ThresholdStrategy(), human);
    }

    // -------------------------------------------------------------------------
    // needsReshuffle()
    // -------------------------------------------------------------------------
    @Test
    void needsReshuffle_seuilTroisCartesParParticipant() {
        // 2 joueurs + croupier -> 9 cartes
        assertThat(DealingRules.needsReshuffle(8, 2)).isTrue();
        assertThat(DealingRules.needsReshuffle(9, 2)).isFalse();
        assertThat(DealingRules.needsReshuffle(0, 0)).isTrue();
        assertThat(DealingRules.needsReshuffle(3, 0)).isFalse();
    }

    // -------------------------------------------------------------------------
    // dealInitial()
    // -------------------------------------------------------------------------
    @Test
    void dealInitial_ordre_joueursPuisCroupier_deuxPasses() {
        Card a1 = c(Rank.TWO, Suit.CLUBS), b1 = c(Rank.THREE, Suit.CLUBS), d1 = c(Rank.FOUR, Suit.CLUBS);
        Card a2 = c(Rank.FIVE, Suit.CLUBS), b2 = c(Rank.SIX, Suit.CLUBS), d2 = c(Rank.SEVEN, Suit.CLUBS);
        Table t = new Table(1, new Random(0));
        t.setShoe(Shoe.stacked(1, new Random(0), List.of(a1, b1, d1, a2, b2, d2)));
        Seat a = seat("A", false, 10);
        Seat b = seat("B", false, 10);
        t.seat(a);
        t.seat(b);

        DealingRules.dealInitial(t);

        assertThat(a.getParticipant().getHand(0).getCards()).containsExactly(a1, a2);
        assertThat(b.getParticipant().getHand(0).getCards()).containsExactly(b1, b2);
        assertThat(t.getDealer().getHand(0).getCards()).containsExactly(d1, d2);
        assertThat(t.dealerUpCard()).contains(d1);
        assertThat(t.getShoe().remaining()).isZero();
    }

    @Test
    void dealInitial_placeSansMise_ignoree() {
        Table t = new Table(1, new Random(1));
        Seat absent = seat("Absent", false, 0);
        Seat present = seat("Present", false, 10);
        t.seat(absent);
        t.seat(present);

        DealingRules.dealInitial(t);

        assertThat(absent.getParticipant().getHand(0).size()).isZero();
        assertThat(present.getParticipant().getHand(0).size()).isEqualTo(2);
        assertThat(t.getShoe().remaining()).isEqualTo(48);
    }

    @Test
    void dealInitial_personneNaMise_rienNestDistribue() {
        Table t = new Table(1, new Random(1));
        t.seat(seat("A", false, 0));

        DealingRules.dealInitial(t);

        assertThat(t.getDealer().getHand(0).size()).isZero();
        assertThat(t.getShoe().remaining()).isEqualTo(52);
    }

    @Test
    void dealInitial_godMode_humainRecoitBlackjack() {
        Table t = new Table(1, new Random(5));
        t.setGodMode(true);
        Seat human = seat("Alice", true, 10);
        Seat bot = seat("Bot", false, 10);
        t.seat(human);
        t.seat(bot);

        DealingRules.dealInitial(t);

        Hand h = human.getParticipant().getHand(0);
        assertThat(h.isBlackjack()).isTrue();
        assertThat(h.getBet()).isEqualTo(10);
        assertThat(bot.getParticipant().getHand(0).size()).isEqualTo(2);
        // seuls le bot et le croupier ont tiré dans le shoe
        assertThat(t.getShoe().remaining()).isEqualTo(48);
    }
}
