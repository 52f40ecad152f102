package games.nertz.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Complete model of one player's private piles in a Nertz game.
 * <p>
 * <strong>Layout:</strong>
 * <ul>
 *   <li><strong>Deck:</strong> face-down cards still to be flipped; the last element is the top.
 *       When empty, the stream is recycled back into it.</li>
 *   <li><strong>Stream:</strong> cards flipped from the deck in groups of three. Only the top card
 *       is playable.</li>
 *   <li><strong>River (R1–R4):</strong> four independent slots building down in alternating
 *       colours. Each slot is a double-ended queue: the top (last pushed) card is playable on its
 *       own, while a whole-slot transfer is led by the bottom card.</li>
 *   <li><strong>Nertz:</strong> the 13-card objective stack; only the top (last dealt) card is
 *       playable. Emptying it ends the game.</li>
 *   <li><strong>Lake:</strong> append-only ledger of every card this player has placed on a
 *       foundation. Never a move source; used only for scoring.</li>
 * </ul>
 * <p>
 * Accessors for the top of a pile return {@code null} when the pile is empty. The one exception
 * is {@link #topStreamCards(int)}, which fails when fewer cards are available than requested.
 */
public class PileSet {
    /** Number of river slots per player. */
    public static final int RIVER_SLOT_COUNT = 4;
    /** Number of cards dealt to the nertz pile. */
    public static final int NERTZ_SIZE = 13;
    /** Number of cards moved from deck to stream by a single flip. */
    public static final int FLIP_COUNT = 3;

    private final int owner;
    private final List<Card> deck = new ArrayList<>();
    private final List<Card> stream = new ArrayList<>();
    private final List<Deque<Card>> river = new ArrayList<>();
    private final List<Card> nertz = new ArrayList<>();
    private final List<Card> lake = new ArrayList<>();

    /**
     * Creates an empty pile set for {@code owner}.
     *
     * @param owner the owning player index
     */
    public PileSet(int owner) {
        this.owner = owner;
        for (int i = 0; i < RIVER_SLOT_COUNT; i++) {
            river.add(new ArrayDeque<>());
        }
    }

    /**
     * Builds a fresh shuffled deck for {@code owner} and deals the starting hand from it.
     *
     * @param owner the owning player index
     * @param random the random source used to shuffle the deck
     * @return the dealt pile set
     */
    public static PileSet dealStartingHand(int owner, Random random) {
        PileSet piles = new PileSet(owner);
        piles.dealStartingHand(new Deck(owner, random));
        return piles;
    }

    /**
     * Restores a pile set from explicit pile contents (all lists bottom-to-top).
     * <p>
     * The lists are copied; the card instances are reused.
     *
     * @param owner the owning player index
     * @param deck deck cards, last element is the top
     * @param stream stream cards, last element is the top
     * @param river exactly four river slots, each bottom-to-top
     * @param nertz nertz cards, last element is the top
     * @param lake cards already played to foundations
     * @return the restored pile set
     * @throws IllegalArgumentException if {@code river} does not hold exactly four slots
     */
    public static PileSet fromPiles(
            int owner,
            List<Card> deck,
            List<Card> stream,
            List<List<Card>> river,
            List<Card> nertz,
            List<Card> lake) {
        if (river.size() != RIVER_SLOT_COUNT) {
            throw new IllegalArgumentException("Expected " + RIVER_SLOT_COUNT + " river slots, got " + river.size());
        }
        PileSet piles = new PileSet(owner);
        piles.deck.addAll(deck);
        piles.stream.addAll(stream);
        for (int i = 0; i < RIVER_SLOT_COUNT; i++) {
            piles.river.get(i).addAll(river.get(i));
        }
        piles.nertz.addAll(nertz);
        piles.lake.addAll(lake);
        return piles;
    }

    /**
     * Deals the starting hand from a shuffled deck.
     * <p>
     * One card to each river slot, thirteen cards to the nertz pile (the last dealt is the top),
     * the remainder to the deck, and then the first group of three is flipped into the stream.
     *
     * @param source the shuffled deck to deal from; must hold 52 cards
     */
    private void dealStartingHand(Deck source) {
        Objects.requireNonNull(source, "source");
        for (int slot = 0; slot < RIVER_SLOT_COUNT; slot++) {
            river.get(slot).addLast(source.deal());
        }
        for (int i = 0; i < NERTZ_SIZE; i++) {
            nertz.add(source.deal());
        }
        deck.addAll(source.asUnmodifiableList());
        flipIntoStream();
    }

    /**
     * Flips the default group of three cards from the deck onto the stream.
     */
    public void flipIntoStream() {
        flipIntoStream(FLIP_COUNT);
    }

    /**
     * Moves up to {@code count} cards, one at a time, from the top of the deck to the top of
     * the stream.
     * <p>
     * If the deck is empty when the flip starts, the whole stream is first recycled into the
     * deck in its existing order and the stream is cleared. There is no recycling part-way
     * through a flip: if the deck runs out, fewer than {@code count} cards are flipped.
     *
     * @param count the maximum number of cards to flip
     */
    public void flipIntoStream(int count) {
        if (deck.isEmpty()) {
            deck.addAll(stream);
            stream.clear();
        }
        for (int i = 0; i < count && !deck.isEmpty(); i++) {
            stream.add(deck.remove(deck.size() - 1));
        }
    }

    public int getOwner() {
        return owner;
    }

    /**
     * Returns the playable nertz card.
     *
     * @return the top nertz card, or {@code null} if the pile is empty
     */
    public Card topNertzCard() {
        return nertz.isEmpty() ? null : nertz.get(nertz.size() - 1);
    }

    /**
     * Returns the playable stream card.
     *
     * @return the top stream card, or {@code null} if the stream is empty
     */
    public Card topStreamCard() {
        return stream.isEmpty() ? null : stream.get(stream.size() - 1);
    }

    /**
     * Returns the top {@code count} stream cards, bottom first.
     *
     * @param count the number of cards requested
     * @return the last {@code count} cards of the stream
     * @throws IllegalStateException if the stream holds fewer than {@code count} cards
     */
    public List<Card> topStreamCards(int count) {
        if (stream.size() < count) {
            throw new IllegalStateException("Not enough cards in stream: requested " + count + ", have " + stream.size());
        }
        return Collections.unmodifiableList(new ArrayList<>(stream.subList(stream.size() - count, stream.size())));
    }

    /**
     * Returns the top card of each river slot, with {@code null} for empty slots.
     *
     * @return a list of four entries, one per slot
     */
    public List<Card> riverSlotTopCards() {
        List<Card> tops = new ArrayList<>(RIVER_SLOT_COUNT);
        for (Deque<Card> slot : river) {
            tops.add(slot.peekLast());
        }
        return Collections.unmodifiableList(tops);
    }

    /**
     * Returns the top card of one river slot.
     *
     * @param slot the slot index (0–3)
     * @return the top card, or {@code null} if the slot is empty
     */
    public Card riverTop(int slot) {
        return river.get(slot).peekLast();
    }

    /**
     * Returns the bottom card of one river slot (the card leading a whole-slot transfer).
     *
     * @param slot the slot index (0–3)
     * @return the bottom card, or {@code null} if the slot is empty
     */
    public Card riverBottom(int slot) {
        return river.get(slot).peekFirst();
    }

    /**
     * Returns an immutable bottom-to-top snapshot of one river slot.
     *
     * @param slot the slot index (0–3)
     * @return the slot contents
     */
    public List<Card> getRiverSlot(int slot) {
        return Collections.unmodifiableList(new ArrayList<>(river.get(slot)));
    }

    /**
     * Returns immutable snapshots of all four river slots.
     */
    public List<List<Card>> getRiver() {
        List<List<Card>> snapshot = new ArrayList<>(RIVER_SLOT_COUNT);
        for (int i = 0; i < RIVER_SLOT_COUNT; i++) {
            snapshot.add(getRiverSlot(i));
        }
        return Collections.unmodifiableList(snapshot);
    }

    public List<Card> getDeck() {
        return Collections.unmodifiableList(deck);
    }

    public List<Card> getStream() {
        return Collections.unmodifiableList(stream);
    }

    public List<Card> getNertz() {
        return Collections.unmodifiableList(nertz);
    }

    public List<Card> getLake() {
        return Collections.unmodifiableList(lake);
    }

    public int nertzCount() {
        return nertz.size();
    }

    public int lakeCount() {
        return lake.size();
    }

    /**
     * Removes and returns the top nertz card.
     *
     * @return the removed card, or {@code null} if the pile was empty
     */
    public Card popNertz() {
        return nertz.isEmpty() ? null : nertz.remove(nertz.size() - 1);
    }

    /**
     * Removes and returns the top stream card.
     *
     * @return the removed card, or {@code null} if the stream was empty
     */
    public Card popStream() {
        return stream.isEmpty() ? null : stream.remove(stream.size() - 1);
    }

    /**
     * Removes and returns the top card of a river slot.
     *
     * @param slot the slot index (0–3)
     * @return the removed card, or {@code null} if the slot was empty
     */
    public Card popRiverTop(int slot) {
        return river.get(slot).pollLast();
    }

    /**
     * Removes and returns the bottom card of a river slot.
     *
     * @param slot the slot index (0–3)
     * @return the removed card, or {@code null} if the slot was empty
     */
    public Card popRiverBottom(int slot) {
        return river.get(slot).pollFirst();
    }

    /**
     * Pushes a card onto the top of a river slot.
     *
     * @param slot the slot index (0–3)
     * @param card the card to push; must not be null
     */
    public void pushRiver(int slot, Card card) {
        river.get(slot).addLast(Objects.requireNonNull(card, "card"));
    }

    /**
     * Records a card this player placed on a foundation.
     *
     * @param card the placed card; must not be null
     */
    public void addToLake(Card card) {
        lake.add(Objects.requireNonNull(card, "card"));
    }

    /**
     * Empties the nertz pile. Used to force the terminal condition in simulations and tests.
     */
    public void clearNertz() {
        nertz.clear();
    }

    /**
     * Renders a one-line summary of the playable cards, used in debug turn logs.
     *
     * @return e.g. {@code "river=[7♠, -, K♥, 2♦] stream=9♣ (3) deck=32 nertz=Q♦ (13) lake=0"}
     */
    public String describe() {
        StringBuilder sb = new StringBuilder("river=[");
        for (int i = 0; i < RIVER_SLOT_COUNT; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Card top = riverTop(i);
            sb.append(top == null ? "-" : top.shortName());
            int size = river.get(i).size();
            if (size > 1) {
                sb.append('+').append(size - 1);
            }
        }
        sb.append("] stream=").append(shortNameOrDash(topStreamCard())).append(" (").append(stream.size()).append(')');
        sb.append(" deck=").append(deck.size());
        sb.append(" nertz=").append(shortNameOrDash(topNertzCard())).append(" (").append(nertz.size()).append(')');
        sb.append(" lake=").append(lake.size());
        return sb.toString();
    }

    private static String shortNameOrDash(Card card) {
        return card == null ? "-" : card.shortName();
    }

    @Override
    public String toString() {
        return "PileSet(owner=" + owner + ", " + describe() + ")";
    }
}
