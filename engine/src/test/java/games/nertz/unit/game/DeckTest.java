package games.nertz.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.nertz.game.Card;
import games.nertz.game.Deck;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Deck construction and dealing.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>freshDeckHas52UniqueOwnedCards</b> - every card appears once and carries the owner</li>
 *   <li><b>sameSeedShufflesIdentically</b> - seeded games are reproducible</li>
 *   <li><b>dealTakesFromTopUntilEmpty</b> - deal removes the last element; an empty deck fails</li>
 * </ul>
 */
class DeckTest {

    @Test
    void freshDeckHas52UniqueOwnedCards() {
        Deck deck = new Deck(3, new Random(1));
        assertEquals(52, deck.size());
        Set<Card> unique = new HashSet<>(deck.asUnmodifiableList());
        assertEquals(52, unique.size());
        for (Card card : unique) {
            assertEquals(3, card.getOwner());
        }
    }

    @Test
    void sameSeedShufflesIdentically() {
        Deck first = new Deck(0, new Random(42));
        Deck second = new Deck(0, new Random(42));
        assertEquals(first.asUnmodifiableList(), second.asUnmodifiableList());
    }

    @Test
    void dealTakesFromTopUntilEmpty() {
        Deck deck = new Deck(0, new Random(5));
        Card top = deck.asUnmodifiableList().get(51);
        assertEquals(top, deck.deal());
        for (int i = 0; i < 51; i++) {
            deck.deal();
        }
        assertTrue(deck.isEmpty());
        assertThrows(IllegalStateException.class, deck::deal);
    }
}
