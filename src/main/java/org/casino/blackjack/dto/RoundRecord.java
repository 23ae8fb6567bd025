package org.casino.blackjack.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** Une entrée du journal de session : un round complet. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RoundRecord(int gameNumber, DealerRecord dealer, List<ParticipantRecord> players) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DealerRecord(List<String> initialHand, List<String> finalHand, int finalValue) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ParticipantRecord(
            String name,
            long bet,
            List<ActionRecord> actions,
            List<String> finalHand,
            int finalValue,
            String result,
            long balance,
            List<HandRecord> hands) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ActionRecord(String action, int handIndex, List<String> playerHand, int handValue, String dealerVisibleCard) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HandRecord(List<String> cards, int value, long bet, String result) {}
}
