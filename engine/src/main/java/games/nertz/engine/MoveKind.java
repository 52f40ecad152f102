package games.nertz.engine;

/**
 * All the move categories the generator produces.
 */
public enum MoveKind {
    NERTZ_TO_FOUNDATION(PileKind.NERTZ, PileKind.FOUNDATION),
    NERTZ_TO_RIVER(PileKind.NERTZ, PileKind.RIVER),
    RIVER_TO_FOUNDATION(PileKind.RIVER, PileKind.FOUNDATION),
    RIVER_TO_RIVER(PileKind.RIVER, PileKind.RIVER),
    DECK_TO_FOUNDATION(PileKind.DECK, PileKind.FOUNDATION),
    DECK_TO_RIVER(PileKind.DECK, PileKind.RIVER),
    /** Flipping up to three cards from the deck into the stream (recycling first if needed). */
    DECK_FLIP(PileKind.DECK, PileKind.DECK);

    private final PileKind source;
    private final PileKind destination;

    MoveKind(PileKind source, PileKind destination) {
        this.source = source;
        this.destination = destination;
    }

    /**
     * Returns the kind for a card leaving {@code source} for {@code destination}.
     *
     * @throws InvalidPileException if no move kind connects the two piles
     */
    public static MoveKind of(PileKind source, PileKind destination) {
        for (MoveKind kind : values()) {
            if (kind.source == source && kind.destination == destination) {
                return kind;
            }
        }
        throw new InvalidPileException(source.getLabel(),
                "unsupported source for destination " + destination.getLabel(), null);
    }
}
