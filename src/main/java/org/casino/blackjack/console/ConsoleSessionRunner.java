package org.casino.blackjack.console;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.service.SessionService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Boucle de session au démarrage : rounds successifs jusqu'à la fin de session ou /exit. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "blackjack.session", name = "autorun", havingValue = "true", matchIfMissing = true)
public class ConsoleSessionRunner implements CommandLineRunner {
    private final SessionService session;
    private final ConsolePlayerInput input;
    private final ConsoleCommands commands;

    @Override
    public void run(String... args) {
        session.open();
        input.onCommand(commands::execute);
        System.out.println("Welcome to Blackjack!");
        commands.showBalances();

        try {
            while (session.shouldContinue()) {
                session.playRound();
                if (session.isInteractive() && !input.askPlayAgain()) break;
            }
        } catch (ExitRequestedException ex) {
            log.info("Fin de session : {}", ex.getMessage());
        } finally {
            commands.showBalances();
            log.info("Session terminée après {} rounds, soldes {}", session.getRoundsPlayed(), session.balances());
        }
    }
}
