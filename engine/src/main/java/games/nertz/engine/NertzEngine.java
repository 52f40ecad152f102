package games.nertz.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turn orchestration for one Nertz game.
 *
 * <p>Each turn runs in clearly separated phases:
 * <ol>
 *     <li>Check the terminal condition (any nertz pile empty).</li>
 *     <li>Reserve positions for foundations that visible Aces may start, in player order.</li>
 *     <li>Snapshot the foundations and reservations into a {@link MoveContext}.</li>
 *     <li>Generate every player's legal moves against that snapshot and choose one per player.</li>
 *     <li>Resolve foundation conflicts between the chosen moves.</li>
 *     <li>Execute the survivors in the resolver's order.</li>
 * </ol>
 *
 * <p>Generation only reads the owning player's piles and the snapshot, so it may run on several
 * threads. Resolution and execution always run on the calling thread. There is no rollback: when
 * an execution fails part-way through a turn, the moves already applied stay applied and the
 * exception reaches the caller.</p>
 */
public class NertzEngine {
    private final GameState state;
    private final EngineLog log;
    private final MoveGenerator generator;
    private final ConflictResolver resolver;
    private final MoveExecutor executor;
    private final Scoring scoring;
    private final boolean parallelGeneration;

    private int turnNumber;
    private boolean started;
    private boolean scored;

    public NertzEngine(GameState state, EngineLog engineLog, boolean parallelGeneration) {
        this.state = state;
        this.log = engineLog.forComponent(NertzEngine.class);
        this.generator = new MoveGenerator(state, engineLog);
        this.resolver = new ConflictResolver(engineLog);
        this.executor = new MoveExecutor(state, engineLog);
        this.scoring = new Scoring(engineLog);
        this.parallelGeneration = parallelGeneration;
    }

    /**
     * Deals a new table and builds an engine for it.
     *
     * @param playerCount number of players, at least one
     * @param seed seed for shuffles and foundation jitter, or {@code null} for a random one
     * @param verbose whether DEBUG events are emitted
     * @param parallelGeneration whether legal moves are generated concurrently
     * @return the engine, not yet started
     */
    public static NertzEngine create(int playerCount, Long seed, boolean verbose, boolean parallelGeneration) {
        if (playerCount < 1) {
            throw new IllegalArgumentException("Player count must be at least 1, got " + playerCount);
        }
        Random random = seed == null ? new Random() : new Random(seed);
        EngineLog engineLog = EngineLog.of(NertzEngine.class, verbose);
        return new NertzEngine(GameState.deal(playerCount, random, engineLog), engineLog, parallelGeneration);
    }

    /**
     * Resets the turn counter and allows turns to be played.
     */
    public void startNewGame() {
        turnNumber = 0;
        started = true;
        log.info("Starting new game with {} players.", state.getPlayerCount());
    }

    /**
     * Plays a single turn.
     *
     * @throws GameNotStartedException if {@link #startNewGame()} has not been called
     * @throws GameOverException if any player's nertz pile is empty; the first such call applies
     *         the final scores
     * @throws InvalidMoveException if a chosen move cannot be executed
     */
    public void playTurn() {
        if (!started) {
            throw new GameNotStartedException();
        }
        if (isGameOver()) {
            log.info("Game over detected after {} turns.", turnNumber);
            finishGame();
            throw new GameOverException();
        }

        turnNumber++;
        log.info("--- Turn {} ---", turnNumber);
        for (int player = 0; player < state.getPlayerCount(); player++) {
            generator.reserveAcePositions(player);
        }
        MoveContext context = MoveContext.from(state);

        List<Move> chosen = new ArrayList<>();
        for (List<Move> moves : generateAll(context)) {
            Move move = choose(moves);
            if (move != null) {
                chosen.add(move);
            }
        }

        List<Move> executable = resolver.resolve(chosen);
        for (Move move : executable) {
            executor.execute(move);
        }
    }

    /**
     * Starts a game and plays it until a nertz pile empties or {@code maxTurns} turns have been
     * played, then scores it.
     *
     * @param maxTurns safety cap on the number of turns
     * @return the summary of the run
     */
    public GameResult playGame(int maxTurns) {
        long startNanos = System.nanoTime();
        startNewGame();
        while (turnNumber < maxTurns && !isGameOver()) {
            playTurn();
        }
        boolean completed = isGameOver();
        if (!completed) {
            log.warn("Turn cap of {} reached without a player emptying their nertz pile.", maxTurns);
        }
        finishGame();
        List<Integer> finalScores = new ArrayList<>(state.getPlayerCount());
        for (PlayerState player : state.getPlayers()) {
            finalScores.add(player.getScore());
        }
        double durationSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        return new GameResult(
                GameResult.winnerOf(finalScores),
                turnNumber,
                finalScores,
                state.getFoundationCount(),
                durationSeconds,
                completed);
    }

    /**
     * Returns true if any player's nertz pile is empty.
     */
    public boolean isGameOver() {
        for (PlayerState player : state.getPlayers()) {
            if (player.getPiles().nertzCount() == 0) {
                return true;
            }
        }
        return false;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Returns true once the final scores have been applied.
     */
    public boolean isScored() {
        return scored;
    }

    public GameState getState() {
        return state;
    }

    /**
     * Returns a read-only copy of the current table.
     */
    public GameSnapshot snapshot() {
        return GameSnapshot.of(state, turnNumber, isGameOver());
    }

    private List<List<Move>> generateAll(MoveContext context) {
        IntStream players = IntStream.range(0, state.getPlayerCount());
        if (parallelGeneration) {
            players = players.parallel();
        }
        // Encounter order is kept, so the result is indexed by player even when generated in parallel.
        return players
                .mapToObj(player -> generator.legalMoves(player, context))
                .collect(Collectors.toList());
    }

    /**
     * Picks the move with the highest {@link Move#selectionScore()}; the earliest move wins ties.
     */
    private Move choose(List<Move> moves) {
        if (moves.isEmpty()) {
            return null;
        }
        int player = moves.get(0).getPlayer();
        log.info("Player {} has {} legal moves.", player, moves.size());
        if (log.isDebugEnabled()) {
            log.debug("Player {} piles: {}", player, state.getPlayer(player).getPiles().describe());
        }
        Move best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Move move : moves) {
            if (log.isDebugEnabled()) {
                log.debug("  {} priority={} distance={}", move,
                        String.format("%.2f", move.getPriority()), String.format("%.2f", move.getDistance()));
            }
            if (move.selectionScore() > bestScore) {
                bestScore = move.selectionScore();
                best = move;
            }
        }
        log.info("Player {} chose {} (priority={}, distance={})", player, best,
                String.format("%.2f", best.getPriority()), String.format("%.2f", best.getDistance()));
        return best;
    }

    private void finishGame() {
        if (scored) {
            return;
        }
        scoring.apply(state);
        scored = true;
    }
}
