package org.casino.blackjack.strategy;

import lombok.RequiredArgsConstructor;
import org.casino.blackjack.service.input.PlayerInput;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class StrategyFactory {
    private final PlayerInput input;

    public Strategy human() {
        return new HumanStrategy(input);
    }

    /** Noms acceptés : "default"/"threshold" et "basic"/"by the books"/"by-the-books". */
    public Strategy forBot(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "default", "threshold" -> new ThresholdStrategy();
            case "basic", "by the books", "by-the-books" -> new BasicStrategy();
            default -> throw new IllegalArgumentException("Stratégie de bot inconnue: " + name);
        };
    }
}
