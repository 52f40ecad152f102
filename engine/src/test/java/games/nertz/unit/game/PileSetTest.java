package games.nertz.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.nertz.game.Card;
import games.nertz.game.PileSet;
import games.nertz.unit.helpers.GameStateBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Dealing and stream mechanics of a single player's piles.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>dealFillsEveryPile</b> - 1 card per river slot, 13 nertz, 3 flipped, 32 left in deck</li>
 *   <li><b>dealKeepsAll52Cards</b> - nothing lost or duplicated by the deal</li>
 *   <li><b>flipMovesThreeFromTopInOrder</b> - the deck top becomes the first card flipped</li>
 *   <li><b>flipShortOfThreeTakesWhatIsLeft</b> - no mid-flip recycling</li>
 *   <li><b>flipOnEmptyDeckRecyclesStream</b> - stream order is preserved by the recycle</li>
 *   <li><b>topStreamCardsFailsWhenShort</b> - requesting more than the stream holds throws</li>
 * </ul>
 */
@DisplayName("PileSet")
class PileSetTest {

    @Nested
    @DisplayName("Dealing")
    class DealingTests {

        @Test
        void dealFillsEveryPile() {
            PileSet piles = PileSet.dealStartingHand(0, new Random(11));
            for (int slot = 0; slot < PileSet.RIVER_SLOT_COUNT; slot++) {
                assertEquals(1, piles.getRiverSlot(slot).size(), "slot " + slot);
            }
            assertEquals(13, piles.nertzCount());
            assertEquals(3, piles.getStream().size());
            assertEquals(32, piles.getDeck().size());
            assertEquals(0, piles.lakeCount());
        }

        @Test
        void dealKeepsAll52Cards() {
            PileSet piles = PileSet.dealStartingHand(2, new Random(3));
            List<Card> all = new ArrayList<>();
            all.addAll(piles.getDeck());
            all.addAll(piles.getStream());
            all.addAll(piles.getNertz());
            piles.getRiver().forEach(all::addAll);
            assertEquals(52, all.size());
            assertEquals(52, new HashSet<>(all).size());
            for (Card card : all) {
                assertEquals(2, card.getOwner());
            }
        }
    }

    @Nested
    @DisplayName("Flipping")
    class FlippingTests {

        @Test
        void flipMovesThreeFromTopInOrder() {
            List<Card> deck = GameStateBuilder.parse(0, "2♠", "3♠", "4♠", "5♠", "6♠");
            PileSet piles = PileSet.fromPiles(0, deck, List.of(), emptyRiver(), List.of(), List.of());

            piles.flipIntoStream();

            assertEquals(GameStateBuilder.parse(0, "2♠", "3♠"), piles.getDeck());
            assertEquals(GameStateBuilder.parse(0, "6♠", "5♠", "4♠"), piles.getStream());
            assertEquals(Card.parse("4♠", 0), piles.topStreamCard());
        }

        @Test
        void flipShortOfThreeTakesWhatIsLeft() {
            List<Card> deck = GameStateBuilder.parse(0, "9♥");
            List<Card> stream = GameStateBuilder.parse(0, "2♣", "3♣");
            PileSet piles = PileSet.fromPiles(0, deck, stream, emptyRiver(), List.of(), List.of());

            piles.flipIntoStream();

            assertTrue(piles.getDeck().isEmpty());
            assertEquals(GameStateBuilder.parse(0, "2♣", "3♣", "9♥"), piles.getStream());
        }

        @Test
        void flipOnEmptyDeckRecyclesStream() {
            List<Card> stream = GameStateBuilder.parse(0, "A♦", "2♦", "3♦", "4♦", "5♦");
            PileSet piles = PileSet.fromPiles(0, List.of(), stream, emptyRiver(), List.of(), List.of());

            piles.flipIntoStream();

            // Recycled in the prior stream order, then the top three flipped back out.
            assertEquals(GameStateBuilder.parse(0, "A♦", "2♦"), piles.getDeck());
            assertEquals(GameStateBuilder.parse(0, "5♦", "4♦", "3♦"), piles.getStream());
        }

        @Test
        void flipWithBothEmptyDoesNothing() {
            PileSet piles = new PileSet(0);
            piles.flipIntoStream();
            assertTrue(piles.getDeck().isEmpty());
            assertNull(piles.topStreamCard());
        }
    }

    @Nested
    @DisplayName("Accessors")
    class AccessorTests {

        @Test
        void topStreamCardsReturnsBottomFirst() {
            List<Card> stream = GameStateBuilder.parse(0, "7♣", "8♣", "9♣", "10♣");
            PileSet piles = PileSet.fromPiles(0, List.of(), stream, emptyRiver(), List.of(), List.of());
            assertEquals(GameStateBuilder.parse(0, "8♣", "9♣", "10♣"), piles.topStreamCards(3));
        }

        /**
         * Unlike every other top accessor, which answers null on an empty pile, asking for more
         * stream cards than exist is an error.
         */
        @Test
        void topStreamCardsFailsWhenShort() {
            List<Card> stream = GameStateBuilder.parse(0, "7♣", "8♣");
            PileSet piles = PileSet.fromPiles(0, List.of(), stream, emptyRiver(), List.of(), List.of());
            assertThrows(IllegalStateException.class, () -> piles.topStreamCards(3));
        }

        @Test
        void riverTopAndBottom() {
            List<List<Card>> river = emptyRiver();
            river.set(2, GameStateBuilder.parse(0, "K♠", "Q♥", "J♣"));
            PileSet piles = PileSet.fromPiles(0, List.of(), List.of(), river, List.of(), List.of());
            assertEquals(Card.parse("K♠", 0), piles.riverBottom(2));
            assertEquals(Card.parse("J♣", 0), piles.riverTop(2));
            assertNull(piles.riverTop(0));
            assertEquals(Card.parse("J♣", 0), piles.riverSlotTopCards().get(2));
        }

        @Test
        void fromPilesRequiresFourSlots() {
            List<List<Card>> river = new ArrayList<>(Collections.nCopies(3, List.of()));
            assertThrows(IllegalArgumentException.class,
                    () -> PileSet.fromPiles(0, List.of(), List.of(), river, List.of(), List.of()));
        }

        @Test
        void describeSummarisesPlayableCards() {
            List<List<Card>> river = emptyRiver();
            river.set(0, GameStateBuilder.parse(0, "8♠", "7♥"));
            PileSet piles = PileSet.fromPiles(0, GameStateBuilder.parse(0, "2♣"),
                    GameStateBuilder.parse(0, "9♣"), river, GameStateBuilder.parse(0, "Q♦"), List.of());
            assertEquals("river=[7♥+1, -, -, -] stream=9♣ (1) deck=1 nertz=Q♦ (1) lake=0", piles.describe());
        }

        @Test
        void pileViewsAreReadOnly() {
            PileSet piles = PileSet.dealStartingHand(0, new Random(1));
            Set<Card> seen = new HashSet<>(piles.getNertz());
            assertEquals(13, seen.size());
            assertThrows(UnsupportedOperationException.class, () -> piles.getNertz().clear());
            assertThrows(UnsupportedOperationException.class, () -> piles.getRiverSlot(0).clear());
        }
    }

    private static List<List<Card>> emptyRiver() {
        List<List<Card>> river = new ArrayList<>();
        for (int i = 0; i < PileSet.RIVER_SLOT_COUNT; i++) {
            river.add(new ArrayList<>());
        }
        return river;
    }
}
