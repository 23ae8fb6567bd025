package org.casino.blackjack.console;

import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.service.SessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;

/** Commandes tapées à la place d'une mise : /help, /exit, /showbalance, /editbalance, /shuffle, /godmode. */
@Slf4j
@Component
public class ConsoleCommands {
    private final SessionService session;
    private final PrintStream out;

    @Autowired
    public ConsoleCommands(SessionService session) {
        this(session, System.out);
    }

    public ConsoleCommands(SessionService session, PrintStream out) {
        this.session = session;
        this.out = out;
    }

    public void execute(String command) {
        String[] parts = command.trim().split("\\s+");
        String name = parts[0].toLowerCase();
        switch (name) {
            case "help" -> help();
            case "exit" -> throw new ExitRequestedException("Sortie demandée");
            case "showbalance" -> showBalances();
            case "editbalance" -> editBalance(parts);
            case "shuffle" -> {
                session.forceShuffle();
                out.println("[i] Reshuffling Deck");
            }
            case "godmode" -> godMode(parts);
            default -> out.println("[ERR] Invalid command -- run /help for list of commands.");
        }
    }

    private void help() {
        out.println("Available commands:");
        out.println("\t/help                                  Prints this message");
        out.println("\t/exit                                  Quits the game");
        out.println("\t/showbalance                           Display the players balance");
        out.println("\t/editbalance [player] [new balance]    Modify a players balance");
        out.println("\t/shuffle                               Shuffles and resets the deck");
        out.println("\t/godmode on|off                        Deal blackjack to human players");
    }

    public void showBalances() {
        out.println("\nPlayer Balance:");
        for (Map.Entry<String, Long> e : session.balances().entrySet()) {
            out.println(e.getKey() + ": $" + e.getValue());
        }
        out.println();
    }

    // le nom peut contenir des espaces : le dernier mot est le montant
    private void editBalance(String[] parts) {
        if (parts.length < 3) {
            out.println("[ERR] Invalid format. Usage: /editbalance [player name] [new balance]");
            return;
        }
        String player = String.join(" ", Arrays.copyOfRange(parts, 1, parts.length - 1));
        long amount;
        try {
            amount = Long.parseLong(parts[parts.length - 1]);
        } catch (NumberFormatException ex) {
            out.println("[ERR] Invalid balance amount. Must be a number.");
            return;
        }
        try {
            session.editBalance(player, amount);
            out.println("[ok] " + player + "'s balance updated: $" + amount);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            out.println("[ERR] " + ex.getMessage());
        }
    }

    private void godMode(String[] parts) {
        String flag = parts[parts.length - 1].toLowerCase();
        if (flag.equals("on") || flag.equals("off")) {
            session.setGodMode(flag.equals("on"));
            out.println("[i] GOD MODE " + flag.toUpperCase());
        } else {
            out.println("[ERR] Usage: /godmode on|off");
        }
    }
}
