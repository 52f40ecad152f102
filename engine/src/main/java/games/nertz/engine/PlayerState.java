package games.nertz.engine;

import games.nertz.game.PileSet;
import java.util.Objects;

/**
 * A seated player: index, running score and private piles.
 */
public class PlayerState {
    private final int index;
    private final PileSet piles;
    private int score;

    public PlayerState(int index, PileSet piles) {
        this.index = index;
        this.piles = Objects.requireNonNull(piles, "piles");
    }

    public int getIndex() {
        return index;
    }

    public PileSet getPiles() {
        return piles;
    }

    public int getScore() {
        return score;
    }

    /**
     * Adds {@code points} to the running score (points may be negative).
     */
    public void addScore(int points) {
        score += points;
    }
}
