package games.nertz.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A shared, suit-pure pile built upwards from an Ace.
 * <p>
 * A foundation is created the instant an Ace is played to it and is never destroyed. Its
 * identifier {@code foundation_<owner>_<suit>} is bound to the player who created it, but any
 * player may extend it with the next rank of the same suit.
 * <p>
 * {@link #addCard(Card)} does not re-check adjacency: move generation is the sole guarantor
 * that only the next rank of the suit is ever offered.
 */
public final class Foundation {
    private final String identifier;
    private final Suit suit;
    private final int owner;
    private final List<Card> cards = new ArrayList<>();

    private Foundation(Card ace, int owner) {
        this.suit = ace.getSuit();
        this.owner = owner;
        this.identifier = identifierFor(owner, suit);
        this.cards.add(ace);
    }

    /**
     * Starts a new foundation with an Ace.
     *
     * @param card the Ace starting the foundation; must not be null
     * @param owner the index of the player creating the foundation
     * @return the new foundation holding exactly {@code card}
     * @throws IllegalArgumentException if {@code card} is not an Ace
     */
    public static Foundation create(Card card, int owner) {
        Objects.requireNonNull(card, "card");
        if (!card.isAce()) {
            throw new IllegalArgumentException("Initial card must be an ace, got " + card);
        }
        return new Foundation(card, owner);
    }

    /**
     * Returns the identifier a foundation of {@code suit} started by {@code owner} carries.
     *
     * @param owner the creating player index
     * @param suit the foundation suit
     * @return e.g. {@code "foundation_2_hearts"}
     */
    public static String identifierFor(int owner, Suit suit) {
        return "foundation_" + owner + "_" + suit.getId();
    }

    /**
     * Appends a card to the top of the foundation.
     *
     * @param card the card to append; must not be null
     */
    public void addCard(Card card) {
        cards.add(Objects.requireNonNull(card, "card"));
    }

    /**
     * Returns the top card. Never null: a foundation always holds its Ace.
     */
    public Card top() {
        return cards.get(cards.size() - 1);
    }

    public String getIdentifier() {
        return identifier;
    }

    public Suit getSuit() {
        return suit;
    }

    public int getOwner() {
        return owner;
    }

    public int size() {
        return cards.size();
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return identifier + "(top=" + top().shortName() + ", size=" + cards.size() + ")";
    }
}
