package games.nertz.engine;

/**
 * The pile a move reads from or writes to.
 */
public enum PileKind {
    NERTZ("NertzPile"),
    RIVER("RiverPile"),
    /** The deck/stream pair; as a move source it means the top of the stream. */
    DECK("DeckPile"),
    FOUNDATION("FoundationPile");

    private final String label;

    PileKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
