package org.casino.blackjack.service.engine;

import org.casino.blackjack.config.SessionProperties;
import org.casino.blackjack.events.TableBroadcaster;
import org.casino.blackjack.model.*;
import org.casino.blackjack.model.Card.Rank;
import org.casino.blackjack.model.Card.Suit;
import org.casino.blackjack.model.rules.HandRules;
import org.casino.blackjack.service.action.ActionService;
import org.casino.blackjack.service.betting.BettingService;
import org.casino.blackjack.service.input.PlayerInput;
import org.casino.blackjack.strategy.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoundEngineTest {

    @Mock
    TableBroadcaster broadcaster;

    @Mock
    PlayerInput input;

    RoundEngine engine;

    @BeforeEach
    void setup() {
        SessionProperties props = new SessionProperties();
        engine = new RoundEngine(
                new BettingService(props, input),
                new ActionService(),
                new PayoutService(),
                broadcaster);
    }

    /** Shoe dont les cartes sortent dans l'ordre donné. */
    private static Table stackedTable(Rank... ranks) {
        Suit[] suits = Suit.values();
        List<Card> cards = new ArrayList<>();
        for (int i = 0; i < ranks.length; i++) cards.add(new Card(ranks[i], suits[i % suits.length]));
        Table t = new Table(1, new Random(0));
        t.setShoe(Shoe.stacked(1, new Random(0), cards));
        return t;
    }

    private static Participant seatBot(Table t, String name, Strategy strategy) {
        Participant p = new Participant(name, 100);
        t.seat(new Seat(p, strategy, false));
        return p;
    }

    /** Rejoue une liste d'actions fixée à l'avance. */
    static class ScriptedStrategy implements Strategy {
        private final Deque<Action> script;

        ScriptedStrategy(Action... actions) {
            this.script = new ArrayDeque<>(List.of(actions));
        }

        @Override
        public Action decide(DecisionContext ctx) {
            return script.isEmpty() ? Action.STAND : script.poll();
        }

        @Override
        public String name() { return "scripted"; }
    }

    // -------------------------------------------------------------------------
    // rounds complets
    // -------------------------------------------------------------------------
    @Test
    void playRound_botReste_croupierTire_joueurPerd() {
        Table t = stackedTable(Rank.TEN, Rank.NINE, Rank.SEVEN, Rank.SEVEN, Rank.FIVE,
                Rank.TWO, Rank.TWO, Rank.TWO);
        Participant bot = seatBot(t, "Bot", new ThresholdStrategy());

        List<Settlement> pay = engine.playRound(t);

        assertThat(bot.getHand(0).value()).isEqualTo(17);
        assertThat(t.getDealer().getHand(0).value()).isEqualTo(21);
        assertThat(bot.getResult()).isEqualTo(RoundResult.LOSE);
        assertThat(bot.getBalance()).isEqualTo(90);
        assertThat(pay).singleElement().satisfies(s -> assertThat(s.credit()).isZero());
        assertThat(t.getPhase()).isEqualTo(RoundPhase.SETTLEMENT);
        assertThat(t.getRoundNumber()).isEqualTo(1);
        verify(broadcaster).broadcastToTable(eq(t), eq(TableBroadcaster.PAYOUTS), anyMap());
    }

    @Test
    void playRound_blackjackNaturel_paie3Pour2_sansDecision() {
        Table t = stackedTable(Rank.ACE, Rank.TEN, Rank.KING, Rank.SEVEN,
                Rank.TWO, Rank.TWO, Rank.TWO, Rank.TWO);
        ScriptedStrategy strategy = new ScriptedStrategy(Action.HIT);
        Participant bot = seatBot(t, "Bot", strategy);

        engine.playRound(t);

        assertThat(bot.getResult()).isEqualTo(RoundResult.BLACKJACK);
        assertThat(bot.getBalance()).isEqualTo(115);
        assertThat(bot.getActionLog()).isEmpty();
        assertThat(strategy.script).containsExactly(Action.HIT);
    }

    @Test
    void playRound_strategieDeBase_double_surOnzeContreSix() {
        Table t = stackedTable(Rank.SIX, Rank.SIX, Rank.FIVE, Rank.TEN, Rank.TEN, Rank.TEN,
                Rank.TWO, Rank.TWO);
        Participant bot = seatBot(t, "Book", new BasicStrategy());

        engine.playRound(t);

        assertThat(bot.getHand(0).size()).isEqualTo(3);
        assertThat(bot.getHand(0).getBet()).isEqualTo(20);
        assertThat(t.getDealer().getHand(0).isBusted()).isTrue();
        assertThat(bot.getResult()).isEqualTo(RoundResult.WIN);
        assertThat(bot.getBalance()).isEqualTo(120);
        assertThat(bot.getActionLog()).extracting(ActionLogEntry::action).containsExactly(Action.DOUBLE);
    }

    @Test
    void playRound_doubleRefuseApresHit_botRetombeSurHit() {
        Table t = stackedTable(Rank.TWO, Rank.TEN, Rank.THREE, Rank.SEVEN, Rank.FOUR, Rank.FIVE,
                Rank.TWO, Rank.TWO);
        Participant bot = seatBot(t, "Bot", new ScriptedStrategy(Action.HIT, Action.DOUBLE, Action.STAND));

        engine.playRound(t);

        assertThat(bot.getHand(0).size()).isEqualTo(4);
        assertThat(bot.getHand(0).value()).isEqualTo(14);
        assertThat(bot.getCurrentBet()).isEqualTo(10);
        assertThat(bot.getActionLog()).extracting(ActionLogEntry::action)
                .containsExactly(Action.HIT, Action.HIT, Action.STAND);
        assertThat(bot.getBalance()).isEqualTo(90);
        verify(broadcaster).broadcastToTable(eq(t), eq(TableBroadcaster.ACTION_REJECTED), anyMap());
    }

    @Test
    void playRound_split_deuxMainsJoueesEtRegleesSeparement() {
        Table t = stackedTable(Rank.EIGHT, Rank.TEN, Rank.EIGHT, Rank.SEVEN, Rank.THREE, Rank.TEN, Rank.TEN,
                Rank.TWO, Rank.TWO, Rank.TWO);
        Participant bot = seatBot(t, "Bot", new ScriptedStrategy(Action.SPLIT, Action.HIT, Action.STAND, Action.STAND));

        List<Settlement> pay = engine.playRound(t);

        assertThat(bot.getHands()).hasSize(2);
        assertThat(bot.getHand(0).value()).isEqualTo(21);
        assertThat(bot.getHand(1).value()).isEqualTo(18);
        assertThat(bot.getHand(0).getResult()).isEqualTo(RoundResult.WIN);
        assertThat(bot.getHand(1).getResult()).isEqualTo(RoundResult.WIN);
        assertThat(pay).hasSize(2);
        assertThat(bot.getBalance()).isEqualTo(120);
        assertThat(bot.getActionLog()).extracting(ActionLogEntry::handIndex).containsExactly(0, 0, 0, 1);
    }

    @Test
    void playRound_humain_actionRefusee_redemandee() {
        Table t = stackedTable(Rank.TEN, Rank.NINE, Rank.FIVE, Rank.EIGHT,
                Rank.TWO, Rank.TWO, Rank.TWO, Rank.TWO);
        Participant alice = new Participant("Alice", 100);
        t.seat(new Seat(alice, new HumanStrategy(input), true));
        when(input.requestBet(alice)).thenReturn(10L);
        when(input.requestAction(any())).thenReturn(Action.SPLIT, Action.STAND);

        engine.playRound(t);

        verify(input).reject(eq("Alice"), anyString());
        verify(input, times(2)).requestAction(any());
        assertThat(alice.getHands()).hasSize(1);
        assertThat(alice.getResult()).isEqualTo(RoundResult.LOSE);
        assertThat(alice.getBalance()).isEqualTo(90);
    }

    @Test
    void playRound_miseZero_joueurExclu_soldeIntact() {
        Table t = new Table(1, new Random(3));
        Participant alice = new Participant("Alice", 100);
        t.seat(new Seat(alice, new HumanStrategy(input), true));
        when(input.requestBet(alice)).thenReturn(0L);

        List<Settlement> pay = engine.playRound(t);

        assertThat(pay).isEmpty();
        assertThat(alice.getBalance()).isEqualTo(100);
        assertThat(alice.getHand(0).size()).isZero();
        assertThat(t.getDealer().getHand(0).size()).isZero();
        assertThat(t.getShoe().remaining()).isEqualTo(52);
        verify(input, never()).requestAction(any());
    }

    @Test
    void playRound_croupierRestePile17OuPlus_surGrainesAleatoires() {
        for (long seed = 0; seed < 200; seed++) {
            Table t = new Table(1, new Random(seed));
            seatBot(t, "Bot", new ThresholdStrategy());

            engine.playRound(t);

            List<Card> cards = t.getDealer().getHand(0).getCards();
            assertThat(HandRules.value(cards)).as("graine %d", seed).isGreaterThanOrEqualTo(17);
            if (cards.size() > 2) {
                assertThat(HandRules.value(cards.subList(0, cards.size() - 1))).as("graine %d", seed).isLessThan(17);
            }
        }
    }

    @Test
    void playRound_plusieursRounds_enchaines() {
        Table t = new Table(1, new Random(11));
        Participant bot = seatBot(t, "Bot", new ThresholdStrategy());

        for (int i = 0; i < 30 && bot.getBalance() > 0; i++) engine.playRound(t);

        assertThat(t.getRoundNumber()).isGreaterThan(0);
        assertThat(bot.getBalance()).isNotNegative();
    }

    // -------------------------------------------------------------------------
    // reshuffle / transitions
    // -------------------------------------------------------------------------
    @Test
    void checkShoe_sousLeSeuil_nouveauShoeComplet() {
        Table t = stackedTable(Rank.TWO, Rank.THREE);
        seatBot(t, "Bot", new ThresholdStrategy());

        assertThat(engine.checkShoe(t)).isTrue();
        assertThat(t.getShoe().remaining()).isEqualTo(52);
        verify(broadcaster).broadcastToTable(eq(t), eq(TableBroadcaster.RESHUFFLE), anyMap());
    }

    @Test
    void checkShoe_auSeuil_shoeConserve() {
        Table t = stackedTable(Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE, Rank.SIX, Rank.SEVEN);
        seatBot(t, "Bot", new ThresholdStrategy());
        Shoe before = t.getShoe();

        assertThat(engine.checkShoe(t)).isFalse();
        assertThat(t.getShoe()).isSameAs(before);
    }

    @Test
    void playRound_phaseIncoherente_refuse() {
        Table t = new Table(1, new Random(0));
        seatBot(t, "Bot", new ThresholdStrategy());
        t.setPhase(RoundPhase.DEALING);

        assertThatThrownBy(() -> engine.playRound(t))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Transition interdite");
    }

    @Test
    void forceReshuffle_pendantLesTours_refuse() {
        Table t = new Table(1, new Random(0));
        t.setPhase(RoundPhase.PLAYER_TURNS);

        assertThatThrownBy(() -> engine.forceReshuffle(t)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void forceReshuffle_entreDeuxRounds_nouveauShoe() {
        Table t = new Table(1, new Random(0));
        t.getShoe().draw();
        t.setPhase(RoundPhase.SETTLEMENT);

        engine.forceReshuffle(t);

        assertThat(t.getShoe().remaining()).isEqualTo(52);
    }

    @Test
    void editBalance_joueurInconnu_refuse() {
        Table t = new Table(1, new Random(0));
        seatBot(t, "Bot", new ThresholdStrategy());

        assertThatThrownBy(() -> engine.editBalance(t, "Personne", 50))
                .isInstanceOf(IllegalArgumentException.class);
        engine.editBalance(t, "bot", 50);
        assertThat(t.getSeats().get(0).getParticipant().getBalance()).isEqualTo(50);
    }
}
