package games.nertz.engine;

import games.nertz.game.Foundation;
import games.nertz.game.Rank;
import games.nertz.game.Suit;
import games.nertz.layout.Point;
import java.util.Objects;

/**
 * Immutable snapshot of one foundation: just enough to test placements and score moves.
 *
 * @param identifier the foundation identifier
 * @param suit the foundation suit
 * @param topRank the rank of the current top card
 * @param position the foundation's placed position (rounded)
 */
public record FoundationSummary(String identifier, Suit suit, Rank topRank, Point position) {

    public FoundationSummary {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(suit, "suit");
        Objects.requireNonNull(topRank, "topRank");
    }

    static FoundationSummary of(Foundation foundation, Point position) {
        return new FoundationSummary(
                foundation.getIdentifier(), foundation.getSuit(), foundation.top().getRank(), position);
    }

    /**
     * Returns the rank this foundation accepts next, or {@code null} once it reaches the King.
     */
    public Rank nextRank() {
        return topRank.next();
    }
}
