package games.nertz.engine;

import games.nertz.game.PileSet;
import java.util.ArrayList;
import java.util.List;

/**
 * End-of-game scoring: two points lost for every card left in the nertz pile, one point gained for
 * every card the player placed on a foundation.
 */
public class Scoring {
    static final int NERTZ_PENALTY = 2;

    private final EngineLog log;

    public Scoring(EngineLog engineLog) {
        this.log = engineLog.forComponent(Scoring.class);
    }

    /**
     * Computes the points earned by one player's piles.
     */
    public static int score(PileSet piles) {
        return -NERTZ_PENALTY * piles.nertzCount() + piles.lakeCount();
    }

    /**
     * Adds each player's points to their running score.
     * <p>
     * Scores accumulate: applying twice to the same state counts the game twice.
     *
     * @param state the finished game
     * @return the points awarded this call, indexed by player
     */
    public List<Integer> apply(GameState state) {
        List<Integer> awarded = new ArrayList<>(state.getPlayerCount());
        for (PlayerState player : state.getPlayers()) {
            int points = score(player.getPiles());
            player.addScore(points);
            awarded.add(points);
            log.info("Player {} final score: {} (nertz left={}, lake={})",
                    player.getIndex(), player.getScore(),
                    player.getPiles().nertzCount(), player.getPiles().lakeCount());
        }
        return awarded;
    }
}
