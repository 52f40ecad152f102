package games.nertz.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.nertz.game.Card;
import games.nertz.game.Rank;
import games.nertz.game.Suit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Card")
class CardTest {

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        void parsesUnicodeSuit() {
            Card card = Card.parse("Q♠", 1);
            assertEquals(Rank.QUEEN, card.getRank());
            assertEquals(Suit.SPADES, card.getSuit());
            assertEquals(1, card.getOwner());
        }

        @Test
        void parsesTenWithLetterSuit() {
            Card card = Card.parse("10h", 0);
            assertEquals(Rank.TEN, card.getRank());
            assertEquals(Suit.HEARTS, card.getSuit());
            assertEquals("10♥", card.shortName());
        }

        @Test
        void rejectsGarbage() {
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Z♠", 0));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Ax", 0));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("A", 0));
            assertThrows(IllegalArgumentException.class, () -> Card.parse(null, 0));
        }
    }

    @Nested
    @DisplayName("Identity")
    class IdentityTests {

        @Test
        void sameFaceDifferentOwnerIsADifferentCard() {
            Card mine = new Card(Rank.ACE, Suit.SPADES, 0);
            Card theirs = new Card(Rank.ACE, Suit.SPADES, 1);
            assertTrue(mine.sameFace(theirs));
            assertFalse(mine.isSameCard(theirs));
            assertNotEquals(mine, theirs);
        }

        @Test
        void equalTriplesAreEqual() {
            Card a = new Card(Rank.SEVEN, Suit.DIAMONDS, 2);
            Card b = Card.parse("7♦", 2);
            assertTrue(a.isSameCard(b));
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        void nullIsNeverTheSameCard() {
            assertFalse(Card.parse("K♣", 0).isSameCard(null));
            assertFalse(Card.parse("K♣", 0).sameFace(null));
        }

        @Test
        void toStringCarriesOwner() {
            assertEquals("Q♠@1", new Card(Rank.QUEEN, Suit.SPADES, 1).toString());
        }
    }

    @Test
    void colourAndAce() {
        assertTrue(Card.parse("3♦", 0).isRed());
        assertFalse(Card.parse("3♣", 0).isRed());
        assertTrue(Card.parse("A♥", 0).isAce());
        assertFalse(Card.parse("2♥", 0).isAce());
    }

    @Test
    void rankSuccessionStopsAtKing() {
        assertEquals(Rank.TWO, Rank.ACE.next());
        assertEquals(Rank.KING, Rank.QUEEN.next());
        assertNull(Rank.KING.next());
        assertEquals(0, Rank.ACE.getIndex());
        assertEquals(12, Rank.KING.getIndex());
    }
}
