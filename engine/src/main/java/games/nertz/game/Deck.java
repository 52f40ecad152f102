package games.nertz.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Represents one player's 52-card deck.
 * <p>
 * A {@code Deck} is initialised with all 52 cards (13 ranks × 4 suits), each tagged with the
 * owning player's index, and is shuffled upon construction with the supplied random source so
 * that seeded games deal identically.
 */
public class Deck {
    /** Index of the player every card in this deck belongs to. */
    private final int owner;
    /** Random source used for shuffling. */
    private final Random random;
    /** The list of cards currently in the deck; the last element is the top. */
    private final List<Card> cards = new ArrayList<>();

    /**
     * Constructs a new Deck of 52 cards owned by {@code owner} and shuffles it.
     *
     * @param owner the owning player index
     * @param random the random source used for shuffling; must not be null
     */
    public Deck(int owner, Random random) {
        this.owner = owner;
        this.random = random;
        reset();
    }

    /**
     * Shuffles the cards in the deck using the deck's random source.
     */
    public void shuffle() {
        Collections.shuffle(cards, random);
    }

    /**
     * Draws and removes the top card from the deck.
     *
     * @return the top card of the deck
     * @throws IllegalStateException if the deck is empty
     */
    public Card deal() {
        if (cards.isEmpty()) {
            throw new IllegalStateException("No cards left in deck");
        }
        return cards.remove(cards.size() - 1);
    }

    public int getOwner() {
        return owner;
    }

    /**
     * Returns the number of cards remaining in the deck.
     *
     * @return the number of cards in the deck
     */
    public int size() {
        return cards.size();
    }

    /**
     * Checks whether the deck is empty.
     *
     * @return {@code true} if no cards remain in the deck; {@code false} otherwise
     */
    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the cards in the deck.
     *
     * @return an unmodifiable list of the deck's cards, bottom first
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Resets the deck to its initial state with all 52 cards.
     * <p>
     * Clears the deck, creates one card for each combination of {@link Suit} and {@link Rank}
     * owned by this deck's player, and then shuffles the deck.
     */
    public final void reset() {
        cards.clear();
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(rank, suit, owner));
            }
        }
        shuffle();
    }

    /**
     * Returns a string representation of the deck.
     *
     * @return a string showing the owner and deck size (e.g., "Deck(owner=0, size=52)")
     */
    @Override
    public String toString() {
        return "Deck(owner=" + owner + ", size=" + cards.size() + ")";
    }
}
