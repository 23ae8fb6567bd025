package org.casino.blackjack.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Réglages de la session (application.yml, préfixe "blackjack").
 * Les anciens drapeaux globaux (god mode, mode automatique...) vivent ici.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "blackjack")
public class SessionProperties {

    @Min(1)
    private int numDecks = 6;

    @Min(1)
    private long startingBalance = 100;

    @Min(1)
    private long defaultBet = 10;

    @NotNull
    private BetSizing betSizing = BetSizing.CAPPED;

    /** Pause entre deux cartes, affichage seulement. */
    @Min(0)
    private long dealDelayMs = 0;

    /** Graine du shoe ; absente = SecureRandom. */
    private Long seed;

    private boolean godMode = false;

    /** Affichage de la table sur la console. */
    private boolean showOutput = true;

    private List<String> players = new ArrayList<>();

    @Valid
    private List<Bot> bots = new ArrayList<>();

    @Valid
    private Session session = new Session();

    public enum BetSizing {
        /** Toujours defaultBet ; le bot passe son tour si son solde ne suffit pas. */
        FIXED,
        /** min(defaultBet, solde). */
        CAPPED
    }

    @Data
    public static class Bot {
        @NotBlank
        private String name;
        @NotBlank
        private String strategy = "default";
    }

    @Data
    public static class Session {
        private boolean autorun = true;
        /** 0 = illimité. */
        @Min(0)
        private int maxRounds = 0;
        @Min(0)
        private long minBalance = 0;
        private boolean logRounds = true;
        private String logDir = "logs";
    }
}
