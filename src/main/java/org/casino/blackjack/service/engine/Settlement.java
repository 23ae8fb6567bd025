package org.casino.blackjack.service.engine;

import org.casino.blackjack.model.RoundResult;

/** Règlement d'une main : mise, montant crédité, total final, résultat. */
public record Settlement(String name, int handIndex, long bet, long credit, int total, RoundResult result) {}
