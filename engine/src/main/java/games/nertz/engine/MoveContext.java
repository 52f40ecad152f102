package games.nertz.engine;

import games.nertz.game.Foundation;
import games.nertz.game.Suit;
import games.nertz.layout.Point;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the shared foundations, taken once at the start of a turn.
 *
 * <p>Move generation and move priority only ever look at this snapshot, never at the live
 * foundations, so no player's generation can observe another player's move from the same turn
 * and generation for different players can run concurrently.</p>
 */
public final class MoveContext {
    private static final MoveContext EMPTY = new MoveContext(Collections.emptyMap());

    private final Map<String, FoundationSummary> foundations;
    private final Map<String, Point> reservedPositions;

    public MoveContext(Map<String, FoundationSummary> foundations) {
        this(foundations, Collections.emptyMap());
    }

    /**
     * @param foundations the existing foundations, by identifier
     * @param reservedPositions positions reserved for foundations an Ace may start this turn
     */
    public MoveContext(Map<String, FoundationSummary> foundations, Map<String, Point> reservedPositions) {
        this.foundations = Collections.unmodifiableMap(new LinkedHashMap<>(foundations));
        this.reservedPositions = Collections.unmodifiableMap(new LinkedHashMap<>(reservedPositions));
    }

    public static MoveContext empty() {
        return EMPTY;
    }

    /**
     * Captures the current foundations of {@code state}, keeping creation order, together with
     * the layout's reserved foundation positions.
     */
    public static MoveContext from(GameState state) {
        Map<String, FoundationSummary> summaries = new LinkedHashMap<>();
        for (Foundation foundation : state.getFoundations()) {
            String id = foundation.getIdentifier();
            summaries.put(id, FoundationSummary.of(foundation, state.getLayout().getFoundationPosition(id)));
        }
        return new MoveContext(summaries, state.getLayout().getReservedPositions());
    }

    public Collection<FoundationSummary> getFoundations() {
        return foundations.values();
    }

    /**
     * Returns the position reserved for a foundation that does not exist yet, or {@code null}.
     */
    public Point getReservedPosition(String identifier) {
        return reservedPositions.get(identifier);
    }

    /**
     * Returns true if any foundation of {@code suit} other than {@code excludedId} exists.
     */
    public boolean hasOtherFoundationOfSuit(Suit suit, String excludedId) {
        for (FoundationSummary summary : foundations.values()) {
            if (summary.suit() == suit && !summary.identifier().equals(excludedId)) {
                return true;
            }
        }
        return false;
    }
}
