package games.nertz.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves collisions when several players target the same foundation in one turn.
 *
 * <p>Only foundation moves can collide. Ace moves are exempt because each one starts a brand-new
 * foundation whose identifier is unique to its player and suit. The remaining foundation moves are
 * grouped by target; a group of one passes through, a larger group keeps only its best move by
 * {@link #PRECEDENCE} and discards the rest.</p>
 *
 * <p>The output lists every non-conflicting move in input order, followed by one winner per
 * contested foundation in the order the foundations were first targeted.</p>
 */
public class ConflictResolver {

    /** Highest priority first, then shortest distance, then lowest player index. */
    public static final Comparator<Move> PRECEDENCE = Comparator
            .comparingDouble(Move::getPriority).reversed()
            .thenComparingDouble(Move::getDistance)
            .thenComparingInt(Move::getPlayer);

    private final EngineLog log;

    public ConflictResolver(EngineLog engineLog) {
        this.log = engineLog.forComponent(ConflictResolver.class);
    }

    /**
     * Returns the moves that will actually execute this turn.
     *
     * @param chosenMoves each player's single chosen move
     * @return at most one move per foundation identifier, plus every non-foundation move
     */
    public List<Move> resolve(List<Move> chosenMoves) {
        List<Move> executable = new ArrayList<>();
        Map<String, List<Move>> byFoundation = new LinkedHashMap<>();

        for (Move move : chosenMoves) {
            if (!move.targetsFoundation() || move.startsFoundation()) {
                executable.add(move);
                continue;
            }
            byFoundation.computeIfAbsent(move.getFoundationId(), id -> new ArrayList<>()).add(move);
        }

        for (Map.Entry<String, List<Move>> entry : byFoundation.entrySet()) {
            executable.add(resolveFoundationConflict(entry.getKey(), entry.getValue()));
        }
        return executable;
    }

    private Move resolveFoundationConflict(String foundationId, List<Move> moves) {
        if (moves.size() == 1) {
            return moves.get(0);
        }
        List<Move> ranked = new ArrayList<>(moves);
        ranked.sort(PRECEDENCE);
        Move winner = ranked.get(0);
        log.info("Conflict on foundation {}. Accepted move by player {} (priority={}, distance={}). {} competing move(s) discarded.",
                foundationId,
                winner.getPlayer(),
                String.format("%.2f", winner.getPriority()),
                String.format("%.2f", winner.getDistance()),
                ranked.size() - 1);
        if (log.isDebugEnabled()) {
            for (Move discarded : ranked.subList(1, ranked.size())) {
                log.debug("Discarded: {}", discarded);
            }
        }
        return winner;
    }
}
