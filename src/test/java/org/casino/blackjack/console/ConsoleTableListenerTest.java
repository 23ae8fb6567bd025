package org.casino.blackjack.console;

import org.casino.blackjack.config.SessionProperties;
import org.casino.blackjack.events.TableBroadcaster;
import org.casino.blackjack.model.RoundResult;
import org.casino.blackjack.model.Table;
import org.casino.blackjack.service.engine.Settlement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class ConsoleTableListenerTest {

    SessionProperties props;
    ByteArrayOutputStream buffer;
    ConsoleTableListener listener;
    Table table;

    @BeforeEach
    void setup() {
        props = new SessionProperties();
        buffer = new ByteArrayOutputStream();
        listener = new ConsoleTableListener(props, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        table = new Table(1, new Random(0));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void payouts_uneLigneParMain() {
        listener.onTableEvent(table, TableBroadcaster.PAYOUTS, Map.of(
                "dealerTotal", 19,
                "payouts", List.of(
                        new Settlement("Alice", 0, 10, 25, 21, RoundResult.BLACKJACK),
                        new Settlement("Bot", 0, 10, 0, 24, RoundResult.BUSTED))));

        assertThat(output())
                .contains("Alice's hand: 21 => Blackjack! You win $25.")
                .contains("Bot's hand: 24 => Busted! Lost $10.");
    }

    @Test
    void affichageDesactive_rienNEstImprime() {
        props.setShowOutput(false);

        listener.onTableEvent(table, TableBroadcaster.RESHUFFLE, Map.of());

        assertThat(output()).isEmpty();
    }
}
