package org.casino.blackjack.service.action;

/** Après une action : la main continue ou son tour est fini. */
public enum TurnStep { CONTINUE, END }
