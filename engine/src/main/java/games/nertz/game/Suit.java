package games.nertz.game;

/**
 * Enumeration representing the four suits of a standard playing card deck.
 * <p>
 * Each suit is represented by a Unicode symbol and is classified as either red
 * (Diamonds, Hearts) or black (Clubs, Spades). In Nertz, colour alternation is used
 * to validate placements on river slots, and each suit names the foundations built from it.
 */
public enum Suit {
    /** Spades – a black suit represented by the ♠ symbol. */
    SPADES("♠", false),
    /** Clubs – a black suit represented by the ♣ symbol. */
    CLUBS("♣", false),
    /** Hearts – a red suit represented by the ♥ symbol. */
    HEARTS("♥", true),
    /** Diamonds – a red suit represented by the ♦ symbol. */
    DIAMONDS("♦", true);

    /** The Unicode symbol representing this suit (e.g., "♣", "♦"). */
    private final String symbol;
    /** {@code true} if this suit is red (Diamonds or Hearts); {@code false} if black (Clubs or Spades). */
    private final boolean red;

    /**
     * Constructs a Suit with the given symbol and colour classification.
     *
     * @param symbol the Unicode symbol for the suit
     * @param red {@code true} if the suit is red; {@code false} if black
     */
    Suit(String symbol, boolean red) {
        this.symbol = symbol;
        this.red = red;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♣", "♦", "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Checks whether this suit is red.
     * <p>
     * Diamonds and Hearts are red; Clubs and Spades are black.
     *
     * @return {@code true} if this suit is red; {@code false} if black
     */
    public boolean isRed() {
        return red;
    }

    /**
     * Returns the lower-case name used in foundation identifiers (e.g., "spades").
     *
     * @return the identifier fragment for this suit
     */
    public String getId() {
        return name().toLowerCase();
    }

    /**
     * Resolves a suit from its symbol or its letter/name form ("♠", "S", "spades").
     *
     * @param token the token to resolve; may be null
     * @return the matching suit, or {@code null} if none matches
     */
    public static Suit fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String t = token.trim();
        for (Suit suit : values()) {
            if (suit.symbol.equals(t) || suit.name().equalsIgnoreCase(t)
                    || suit.name().substring(0, 1).equalsIgnoreCase(t)) {
                return suit;
            }
        }
        return null;
    }

    /**
     * Returns the string representation of this suit's symbol.
     *
     * @return the suit symbol
     */
    @Override
    public String toString() {
        return symbol;
    }
}
