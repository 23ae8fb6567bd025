package org.casino.blackjack.events;

import org.casino.blackjack.model.Table;

import java.util.Map;

/** Observateur des événements d'une table (affichage, journal). N'agit jamais sur le round. */
public interface TableListener {
    void onTableEvent(Table table, String type, Map<String, Object> payload);
}
