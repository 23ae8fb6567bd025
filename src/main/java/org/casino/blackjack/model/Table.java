package org.casino.blackjack.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Une table : un shoe, un croupier, des places dans l'ordre de la session.
 * Shoe, mains et soldes ne sont modifiés que par le RoundEngine pendant un round.
 */
@Getter
public class Table {
    private final int numDecks;
    private final Random random;
    private final Participant dealer = Participant.dealer();
    private final List<Seat> seats = new ArrayList<>();

    @Setter private Shoe shoe;
    @Setter private RoundPhase phase = RoundPhase.IDLE;
    @Setter private int roundNumber = 0;
    @Setter private boolean godMode;

    public Table(int numDecks, Random random) {
        this.numDecks = numDecks;
        this.random = random;
        this.shoe = new Shoe(numDecks, random);
    }

    public void seat(Seat seat) {
        seats.add(seat);
    }

    public List<Seat> getSeats() { return Collections.unmodifiableList(seats); }

    public List<Seat> activeSeats() {
        return seats.stream().filter(Seat::isActivePlayer).toList();
    }

    public Optional<Seat> findSeat(String name) {
        return seats.stream()
                .filter(s -> s.getParticipant().getName().equalsIgnoreCase(name))
                .findFirst();
    }

    /** Carte visible du croupier (sa première carte), absente avant la donne. */
    public Optional<Card> dealerUpCard() {
        List<Card> cards = dealer.getHand(0).getCards();
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(0));
    }
}
