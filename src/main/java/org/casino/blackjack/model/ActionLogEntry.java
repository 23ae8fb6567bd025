package org.casino.blackjack.model;

import java.util.List;

/** Une ligne du journal d'actions : action, main après l'action, valeur, carte visible du croupier. */
public record ActionLogEntry(Action action, int handIndex, List<String> hand, int handValue, String dealerVisibleCard) {}
