package org.casino.blackjack.console;

import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.config.SessionProperties;
import org.casino.blackjack.events.TableBroadcaster;
import org.casino.blackjack.events.TableListener;
import org.casino.blackjack.model.Table;
import org.casino.blackjack.service.engine.Settlement;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/** Vue console de la table. Le délai de donne ne s'applique qu'ici. */
@Slf4j
@Component
public class ConsoleTableListener implements TableListener {
    private final SessionProperties props;
    private final PrintStream out;

    @Autowired
    public ConsoleTableListener(SessionProperties props) {
        this(props, System.out);
    }

    public ConsoleTableListener(SessionProperties props, PrintStream out) {
        this.props = props;
        this.out = out;
    }

    @Override
    public void onTableEvent(Table table, String type, Map<String, Object> payload) {
        if (!props.isShowOutput()) return;
        switch (type) {
            case TableBroadcaster.RESHUFFLE -> out.println("[i] Reshuffling Deck");
            case TableBroadcaster.HAND_START -> {
                out.println("\n=== Round " + table.getRoundNumber() + " ===");
                out.println("Dealer's hand:\t" + payload.get("dealerUp") + ", [Hidden]");
                if (payload.get("players") instanceof Map<?, ?> players) {
                    players.forEach((name, hand) -> out.println(name + "'s hand:\t" + hand));
                }
                pause();
            }
            case TableBroadcaster.PLAYER_TURN -> out.println("\n" + payload.get("name") + "'s turn:");
            case TableBroadcaster.ACTION_RESULT -> {
                out.println("\t" + payload.get("name") + " " + payload.get("action").toString().toLowerCase() + ": " + payload.get("hand"));
                pause();
            }
            case TableBroadcaster.DEALER_TURN_START -> out.println("\nDealer's turn:\n\tCurrent Hand: " + payload.get("dealer"));
            case TableBroadcaster.DEALER_TURN_UPDATE -> {
                out.println("\tDealer hits: " + payload.get("dealer"));
                pause();
            }
            case TableBroadcaster.DEALER_TURN_END -> {
                if (Boolean.TRUE.equals(payload.get("busted"))) out.println("\tDealer busted!");
            }
            case TableBroadcaster.PAYOUTS -> printPayouts(payload);
            default -> { }
        }
    }

    private void printPayouts(Map<String, Object> payload) {
        out.println("\n=== Results ===");
        out.println("Dealer's hand: " + payload.get("dealerTotal"));
        if (!(payload.get("payouts") instanceof List<?> pay)) return;
        for (Object o : pay) {
            if (!(o instanceof Settlement s)) continue;
            String line = s.name() + "'s hand: " + s.total() + " => ";
            line += switch (s.result()) {
                case BUSTED -> "Busted! Lost $" + s.bet() + ".";
                case BLACKJACK -> "Blackjack! You win $" + s.credit() + ".";
                case WIN -> "Win! You win $" + s.credit() + ".";
                case PUSH -> "Push. $" + s.bet() + " returned.";
                case LOSE -> "Lose. Lost $" + s.bet() + ".";
            };
            out.println(line);
        }
    }

    private void pause() {
        long delay = props.getDealDelayMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
