package games.nertz.engine;

import java.util.List;

/**
 * Lightweight summary of a single game run.
 */
public final class GameResult {
    private final int winner;
    private final int turnsPlayed;
    private final List<Integer> finalScores;
    private final int foundationsCreated;
    private final double durationSeconds;
    private final boolean completed;

    public GameResult(
            int winner,
            int turnsPlayed,
            List<Integer> finalScores,
            int foundationsCreated,
            double durationSeconds,
            boolean completed) {
        this.winner = winner;
        this.turnsPlayed = turnsPlayed;
        this.finalScores = List.copyOf(finalScores);
        this.foundationsCreated = foundationsCreated;
        this.durationSeconds = durationSeconds;
        this.completed = completed;
    }

    /**
     * Picks the winner from final scores: highest score, ties to the lowest player index.
     *
     * @param scores final scores indexed by player; must not be empty
     * @return the winning player index
     */
    static int winnerOf(List<Integer> scores) {
        int best = 0;
        for (int i = 1; i < scores.size(); i++) {
            if (scores.get(i) > scores.get(best)) {
                best = i;
            }
        }
        return best;
    }

    public int getWinner() {
        return winner;
    }

    public int getTurnsPlayed() {
        return turnsPlayed;
    }

    public List<Integer> getFinalScores() {
        return finalScores;
    }

    public int getFoundationsCreated() {
        return foundationsCreated;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    /**
     * Returns false when the turn cap was reached before any nertz pile emptied.
     */
    public boolean isCompleted() {
        return completed;
    }

    @Override
    public String toString() {
        return String.format("GameResult(winner=%d, turns=%d, scores=%s, foundations=%d, duration=%.3fs, completed=%s)",
                winner, turnsPlayed, finalScores, foundationsCreated, durationSeconds, completed);
    }
}
