package org.casino.blackjack.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.casino.blackjack.model.Table;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class TableBroadcaster {
    public static final String RESHUFFLE = "RESHUFFLE";
    public static final String HAND_START = "HAND_START";
    public static final String PLAYER_TURN = "PLAYER_TURN";
    public static final String ACTION_RESULT = "ACTION_RESULT";
    public static final String ACTION_REJECTED = "ACTION_REJECTED";
    public static final String DEALER_TURN_START = "DEALER_TURN_START";
    public static final String DEALER_TURN_UPDATE = "DEALER_TURN_UPDATE";
    public static final String DEALER_TURN_END = "DEALER_TURN_END";
    public static final String PAYOUTS = "PAYOUTS";

    private final List<TableListener> listeners;

    public void broadcastToTable(Table t, String type, Map<String, Object> payload) {
        log.debug("round {} {} {}", t.getRoundNumber(), type, payload);
        for (TableListener l : listeners) {
            try {
                l.onTableEvent(t, type, payload);
            } catch (RuntimeException ex) {
                log.warn("Listener {} en échec sur {}: {}", l.getClass().getSimpleName(), type, ex.getMessage(), ex);
            }
        }
    }
}
