package games.nertz.layout;

import games.nertz.engine.EngineLog;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Spatial layout of the table in a normalised unit square.
 * <p>
 * Players sit on a circle of radius {@value #PLAYER_RADIUS} around the centre (0.5, 0.5), evenly
 * spaced by player count, starting at angle 0 for player 0. Foundations are placed near the
 * centre by rejection sampling so they keep a minimum spacing. Distances between these points are
 * the cost heuristic used when scoring moves.
 * <p>
 * The layout holds spatial data only; pile contents live in the game state and are looked up by
 * the same identifiers. Reported positions are rounded to four decimal digits so that distances
 * recomputed from them compare reproducibly.
 */
public class TableLayout {
    public static final double PLAYER_RADIUS = 0.48;
    public static final Point CENTER = new Point(0.5, 0.5);

    static final double INITIAL_JITTER = 0.05;
    static final double JITTER_STEP = 0.01;
    static final double MIN_FOUNDATION_SPACING = 0.1;
    static final int MAX_PLACEMENT_ATTEMPTS = 100;

    private final int playerCount;
    private final Random random;
    private final EngineLog log;
    private final Map<Integer, Point> playerPositions = new HashMap<>();
    private final Map<String, Point> foundationPositions = new LinkedHashMap<>();
    private final Map<String, Point> reservedPositions = new LinkedHashMap<>();

    /**
     * Creates a layout and fixes every player's position.
     *
     * @param playerCount the number of players; positions degenerate for counts below 2
     * @param random random source for foundation jitter
     * @param engineLog logging handle
     */
    public TableLayout(int playerCount, Random random, EngineLog engineLog) {
        this.playerCount = playerCount;
        this.random = random;
        this.log = engineLog.forComponent(TableLayout.class);
        initializePlayerPositions();
    }

    private void initializePlayerPositions() {
        double angleIncrement = 2 * Math.PI / playerCount;
        for (int i = 0; i < playerCount; i++) {
            double angle = i * angleIncrement;
            double x = CENTER.x() + PLAYER_RADIUS * Math.cos(angle);
            double y = CENTER.y() + PLAYER_RADIUS * Math.sin(angle);
            playerPositions.put(i, new Point(x, y));
        }
    }

    /**
     * Euclidean distance between two points.
     */
    public double distanceBetween(Point p, Point q) {
        return p.distanceTo(q);
    }

    /**
     * Places a foundation near the centre and records its position.
     * <p>
     * If a position was reserved for {@code foundationId}, that position is claimed unchanged.
     * Otherwise a fresh one is sampled the way {@link #reserveFoundation(String)} samples.
     * <p>
     * Not idempotent: calling this again for the same identifier re-samples and overwrites the
     * stored position. Call it once per foundation, when the foundation is created.
     *
     * @param foundationId the identifier of the foundation being created
     * @return the placed position, rounded to four decimal digits
     */
    public Point placeFoundation(String foundationId) {
        Point position = reservedPositions.remove(foundationId);
        if (position == null) {
            position = sample(foundationId);
        }
        foundationPositions.put(foundationId, position);
        return position.rounded();
    }

    /**
     * Reserves a position for a foundation that does not exist yet.
     * <p>
     * Each attempt samples a point uniformly within a square jitter radius that starts at 0.05 and
     * grows by 0.01 per attempt, clamped to the unit square. The first point at least 0.1 away from
     * every placed or reserved foundation wins. After 100 failed attempts the last point is accepted
     * anyway and a warning is logged.
     * <p>
     * Idempotent: a foundation that is already reserved or placed keeps its position and no random
     * numbers are drawn.
     *
     * @param foundationId the identifier of the foundation an Ace would start
     * @return the reserved position, rounded to four decimal digits
     */
    public Point reserveFoundation(String foundationId) {
        Point position = foundationPositions.get(foundationId);
        if (position == null) {
            position = reservedPositions.get(foundationId);
        }
        if (position == null) {
            position = sample(foundationId);
            reservedPositions.put(foundationId, position);
        }
        return position.rounded();
    }

    private Point sample(String foundationId) {
        Point candidate = CENTER;
        for (int attempt = 0; attempt < MAX_PLACEMENT_ATTEMPTS; attempt++) {
            double radius = INITIAL_JITTER + attempt * JITTER_STEP;
            double x = clamp(CENTER.x() + uniform(-radius, radius));
            double y = clamp(CENTER.y() + uniform(-radius, radius));
            candidate = new Point(x, y);
            if (isClearOfFoundations(candidate)) {
                log.debug("Placed {} at {} after {} tries", foundationId, candidate, attempt);
                return candidate;
            }
        }
        log.warn("Could not place {} without overlap after {} tries; using {}",
                foundationId, MAX_PLACEMENT_ATTEMPTS, candidate);
        return candidate;
    }

    private boolean isClearOfFoundations(Point candidate) {
        for (Point existing : foundationPositions.values()) {
            if (candidate.distanceTo(existing) < MIN_FOUNDATION_SPACING) {
                return false;
            }
        }
        for (Point reserved : reservedPositions.values()) {
            if (candidate.distanceTo(reserved) < MIN_FOUNDATION_SPACING) {
                return false;
            }
        }
        return true;
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Returns a player's fixed position, rounded to four decimal digits.
     *
     * @throws IllegalArgumentException if the index is outside the player range
     */
    public Point getPlayerPosition(int playerIndex) {
        Point p = playerPositions.get(playerIndex);
        if (p == null) {
            throw new IllegalArgumentException("Unknown player index: " + playerIndex);
        }
        return p.rounded();
    }

    /**
     * Returns a foundation's placed position, rounded to four decimal digits.
     *
     * @return the position, or {@code null} if the foundation has not been placed
     */
    public Point getFoundationPosition(String foundationId) {
        Point p = foundationPositions.get(foundationId);
        return p == null ? null : p.rounded();
    }

    public boolean hasFoundationPosition(String foundationId) {
        return foundationPositions.containsKey(foundationId);
    }

    /**
     * Returns a reserved, not yet placed, foundation position (rounded), or {@code null}.
     */
    public Point getReservedPosition(String foundationId) {
        Point p = reservedPositions.get(foundationId);
        return p == null ? null : p.rounded();
    }

    /**
     * Returns every reserved, not yet placed, foundation position (rounded), in reservation order.
     */
    public Map<String, Point> getReservedPositions() {
        Map<String, Point> rounded = new LinkedHashMap<>();
        reservedPositions.forEach((id, p) -> rounded.put(id, p.rounded()));
        return Collections.unmodifiableMap(rounded);
    }

    /**
     * Returns every placed foundation position (rounded), in placement order.
     */
    public Map<String, Point> getFoundationPositions() {
        Map<String, Point> rounded = new LinkedHashMap<>();
        foundationPositions.forEach((id, p) -> rounded.put(id, p.rounded()));
        return Collections.unmodifiableMap(rounded);
    }

    public int getPlayerCount() {
        return playerCount;
    }
}
