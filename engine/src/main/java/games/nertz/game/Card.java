package games.nertz.game;

import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank}, a {@link Suit} and an owner.
 * <p>
 * Every Nertz player races their own 52-card deck, so the table holds one structurally
 * identical deck per player. A card is therefore identified by the full triple
 * (suit, rank, owner): an A♠ from player 0 and an A♠ from player 1 are different cards.
 * Cards are immutable and are moved between piles as the same instance; nothing in the
 * engine ever creates a second copy of a dealt card.
 */
public final class Card {
    /** The rank (Ace through King) of this card. */
    private final Rank rank;
    /** The suit of this card. */
    private final Suit suit;
    /** Index of the player whose deck this card belongs to. */
    private final int owner;

    /**
     * Constructs a Card with the given rank, suit and owning player.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @param owner the index of the player whose deck holds this card
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit, int owner) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
        this.owner = owner;
    }

    /**
     * Parses a short card name such as "Q♠", "10h" or "as" into a card owned by {@code owner}.
     *
     * @param shortName the short card name; the last character is the suit
     * @param owner the owning player index
     * @return the parsed card
     * @throws IllegalArgumentException if the name cannot be parsed
     */
    public static Card parse(String shortName, int owner) {
        if (shortName == null || shortName.trim().length() < 2) {
            throw new IllegalArgumentException("Invalid card name: " + shortName);
        }
        String trimmed = shortName.trim();
        Rank rank = Rank.fromLabel(trimmed.substring(0, trimmed.length() - 1));
        Suit suit = Suit.fromToken(trimmed.substring(trimmed.length() - 1));
        if (rank == null || suit == null) {
            throw new IllegalArgumentException("Invalid card name: " + shortName);
        }
        return new Card(rank, suit, owner);
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    public int getOwner() {
        return owner;
    }

    /**
     * Returns {@code true} if this card is red (Hearts or Diamonds).
     */
    public boolean isRed() {
        return suit.isRed();
    }

    /**
     * Returns {@code true} if this card is an Ace.
     */
    public boolean isAce() {
        return rank == Rank.ACE;
    }

    /**
     * Identity comparison used for every pile-membership check.
     * <p>
     * Compares suit, rank <em>and</em> owner. Use this rather than {@link #sameFace(Card)}
     * whenever the question is "is this the card the move was computed for".
     *
     * @param other the card to compare with; may be null
     * @return {@code true} if both cards are the same card of the same player's deck
     */
    public boolean isSameCard(Card other) {
        return other != null && rank == other.rank && suit == other.suit && owner == other.owner;
    }

    /**
     * Face comparison ignoring the owner (same suit and rank).
     *
     * @param other the card to compare with; may be null
     * @return {@code true} if both cards show the same face
     */
    public boolean sameFace(Card other) {
        return other != null && rank == other.rank && suit == other.suit;
    }

    /**
     * Returns a short string representation without the owner (e.g., "Q♠", "10♦").
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.toString() + suit.getSymbol();
    }

    /**
     * Returns the short name followed by the owning player, e.g. "Q♠@1".
     */
    @Override
    public String toString() {
        return shortName() + "@" + owner;
    }

    /**
     * Equality is identity equality: rank, suit and owner.
     *
     * @param o the object to compare with
     * @return {@code true} if {@code o} is a card with the same rank, suit and owner
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        return isSameCard((Card) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit, owner);
    }
}
