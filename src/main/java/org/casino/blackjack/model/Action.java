package org.casino.blackjack.model;

public enum Action {
    HIT, STAND, DOUBLE, SPLIT;

    /** Action de repli d'un bot quand celle-ci est refusée. */
    public Action fallback() {
        return switch (this) {
            case DOUBLE, SPLIT -> HIT;
            default -> this;
        };
    }

    public String label() { return name().toLowerCase(); }
}
