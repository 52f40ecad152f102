package games.nertz.engine;

import games.nertz.game.Card;

/**
 * Raised when the card found at a pile location is not the card the move was computed for.
 * <p>
 * This means the piles diverged from the snapshot the move was generated against and is fatal
 * to the current turn.
 */
public class CardMismatchException extends InvalidMoveException {
    private final Card expected;
    private final Card actual;
    private final String pileName;

    public CardMismatchException(Card expected, Card actual, String pileName, Integer playerIndex) {
        super("Card mismatch at " + pileName + ": expected " + expected + ", got " + actual, playerIndex);
        this.expected = expected;
        this.actual = actual;
        this.pileName = pileName;
    }

    public Card getExpected() {
        return expected;
    }

    /**
     * Returns the card actually found, or {@code null} if the pile was empty.
     */
    public Card getActual() {
        return actual;
    }

    public String getPileName() {
        return pileName;
    }
}
