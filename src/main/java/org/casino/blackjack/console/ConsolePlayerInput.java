package org.casino.blackjack.console;

import org.casino.blackjack.model.Action;
import org.casino.blackjack.model.Participant;
import org.casino.blackjack.service.input.PlayerInput;
import org.casino.blackjack.strategy.DecisionContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Saisie au terminal. Une saisie invalide est redemandée sans rien modifier.
 * Les lignes commençant par "/" au moment de la mise sont des commandes de session.
 */
@Component
public class ConsolePlayerInput implements PlayerInput {
    private final BufferedReader in;
    private final PrintStream out;
    private Consumer<String> commandHandler = cmd -> { };

    @Autowired
    public ConsolePlayerInput() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsolePlayerInput(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public void onCommand(Consumer<String> handler) {
        this.commandHandler = handler;
    }

    @Override
    public long requestBet(Participant participant) {
        while (true) {
            String line = prompt(participant.getName() + " ($" + participant.getBalance() + "), Enter bet amount: ");
            if (line.isEmpty()) continue;
            if (line.startsWith("/")) {
                commandHandler.accept(line.substring(1).trim());
                continue;
            }
            try {
                return Long.parseLong(line);
            } catch (NumberFormatException ex) {
                out.println("[ERR] Bet must be a number.");
            }
        }
    }

    @Override
    public Action requestAction(DecisionContext ctx) {
        out.println("\n\t" + ctx.participantName() + " - hand " + (ctx.handIndex() + 1) + "/" + ctx.handCount()
                + ": " + ctx.hand() + "  (dealer shows " + ctx.dealerUpCard() + ")");
        while (true) {
            String line = prompt("\tChoose action (1=hit / 2=stand / 3=double" + (ctx.splitAllowed() ? " / 4=split" : "") + "): ");
            Action action = parseAction(line);
            if (action != null) return action;
            out.println("\tInvalid action. Try again.");
        }
    }

    @Override
    public void reject(String participantName, String reason) {
        out.println("\t[ERR] " + reason);
    }

    public boolean askPlayAgain() {
        while (true) {
            String answer = prompt("Play another round? (yes/no): ").toLowerCase(Locale.ROOT);
            if (answer.equals("yes") || answer.equals("y")) return true;
            if (answer.equals("no") || answer.equals("n")) return false;
            out.println("[ERR] Invalid input. Please enter 'yes' or 'no'.");
        }
    }

    static Action parseAction(String line) {
        return switch (line.toLowerCase(Locale.ROOT)) {
            case "1", "hit", "h" -> Action.HIT;
            case "2", "stand", "s" -> Action.STAND;
            case "3", "double", "d" -> Action.DOUBLE;
            case "4", "split", "p" -> Action.SPLIT;
            default -> null;
        };
    }

    private String prompt(String message) {
        out.print(message);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) throw new ExitRequestedException("Entrée fermée");
            return line.trim();
        } catch (IOException ex) {
            throw new UncheckedIOException("Lecture de la console impossible", ex);
        }
    }
}
