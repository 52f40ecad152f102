package games.nertz.engine;

import games.nertz.game.Card;
import games.nertz.game.Rank;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One candidate state transition for one player, together with its heuristic priority.
 *
 * <p>Moves are built fresh every turn by the {@link MoveGenerator}, consumed by selection,
 * conflict resolution and execution, and then discarded. Construction validates that every
 * field the pile combination needs is present:
 * <ul>
 *   <li>a foundation destination needs a foundation identifier;</li>
 *   <li>a river source needs a source slot;</li>
 *   <li>a river destination needs a destination slot.</li>
 * </ul>
 *
 * <p><b>Priority model:</b>
 * {@code priority = baseWeight(kind) × (1 − distance × 0.3) + strategicBonus}. The strategic
 * bonus applies only to nertz→foundation moves whose suit has no other foundation in play:
 * {@code (rankIndex + 1) / 13 × 20}, so higher nertz cards earn more.</p>
 */
public final class Move {

    /** Weight used for any kind without an explicit entry. */
    static final double DEFAULT_WEIGHT = 0.5;
    /** Largest fraction of the base weight that distance can remove. */
    static final double MAX_DISTANCE_PENALTY_FACTOR = 0.3;
    static final double NERTZ_UNIQUE_FOUNDATION_BONUS_MULTIPLIER = 20.0;

    private static final Map<MoveKind, Double> BASE_WEIGHTS = initBaseWeights();

    private final int player;
    private final PileKind source;
    private final Integer sourceSlot;
    private final PileKind destination;
    private final Integer destinationSlot;
    private final String foundationId;
    private final Card card;
    private final double distance;
    private final MoveKind kind;
    private final double priority;

    private Move(Builder b, MoveContext context) {
        this.player = b.player;
        this.source = Objects.requireNonNull(b.source, "source");
        this.sourceSlot = b.sourceSlot;
        this.destination = Objects.requireNonNull(b.destination, "destination");
        this.destinationSlot = b.destinationSlot;
        this.foundationId = b.foundationId;
        this.card = b.card;
        this.distance = b.distance;
        this.kind = b.kind != null ? b.kind : MoveKind.of(source, destination);
        validateFields();
        this.priority = calculatePriority(Objects.requireNonNull(context, "context"));
    }

    public static Builder builder(int player) {
        return new Builder(player);
    }

    /**
     * The deck→stream flip: no card, no distance.
     */
    public static Move flip(int player, MoveContext context) {
        return builder(player).from(PileKind.DECK).to(PileKind.DECK).kind(MoveKind.DECK_FLIP).build(context);
    }

    private void validateFields() {
        if (destination == PileKind.FOUNDATION && (foundationId == null || foundationId.isEmpty())) {
            throw new MoveValidationException("foundation identifier must be provided for FoundationPile moves", player);
        }
        if (source == PileKind.RIVER && sourceSlot == null) {
            throw new MoveValidationException("river source slot must be provided for RiverPile source moves", player);
        }
        if (destination == PileKind.RIVER && destinationSlot == null) {
            throw new MoveValidationException("river destination slot must be provided for RiverPile destination moves", player);
        }
        if (kind != MoveKind.DECK_FLIP && card == null) {
            throw new MoveValidationException("card must be provided for " + kind + " moves", player);
        }
    }

    private double calculatePriority(MoveContext context) {
        double baseWeight = baseWeight(kind);
        double distanceFactor = 1.0 - distance * MAX_DISTANCE_PENALTY_FACTOR;
        return baseWeight * distanceFactor + strategicBonus(context);
    }

    private double strategicBonus(MoveContext context) {
        if (card == null || source != PileKind.NERTZ || destination != PileKind.FOUNDATION) {
            return 0.0;
        }
        if (context.hasOtherFoundationOfSuit(card.getSuit(), foundationId)) {
            return 0.0;
        }
        // A high nertz card is hard to unload when its foundation is the only one of the suit.
        double rankWeight = (card.getRank().getIndex() + 1) / (double) Rank.COUNT;
        return rankWeight * NERTZ_UNIQUE_FOUNDATION_BONUS_MULTIPLIER;
    }

    /**
     * Returns the base weight for a move kind (0.5 if the kind has no explicit weight).
     */
    public static double baseWeight(MoveKind kind) {
        return BASE_WEIGHTS.getOrDefault(kind, DEFAULT_WEIGHT);
    }

    public int getPlayer() {
        return player;
    }

    public PileKind getSource() {
        return source;
    }

    /**
     * Returns the river slot the card leaves, or {@code null} for non-river sources.
     */
    public Integer getSourceSlot() {
        return sourceSlot;
    }

    public PileKind getDestination() {
        return destination;
    }

    /**
     * Returns the river slot the card lands on, or {@code null} for non-river destinations.
     */
    public Integer getDestinationSlot() {
        return destinationSlot;
    }

    /**
     * Returns the target foundation identifier, or {@code null} for non-foundation moves.
     */
    public String getFoundationId() {
        return foundationId;
    }

    /**
     * Returns the moving card; {@code null} only for {@link MoveKind#DECK_FLIP}.
     */
    public Card getCard() {
        return card;
    }

    public double getDistance() {
        return distance;
    }

    public MoveKind getKind() {
        return kind;
    }

    public double getPriority() {
        return priority;
    }

    /**
     * The value the engine maximises when picking a player's move: {@code priority + distance}.
     */
    public double selectionScore() {
        return priority + distance;
    }

    public boolean isFlip() {
        return kind == MoveKind.DECK_FLIP;
    }

    public boolean targetsFoundation() {
        return destination == PileKind.FOUNDATION;
    }

    /**
     * True for a foundation move carrying an Ace, which always starts a new foundation.
     */
    public boolean startsFoundation() {
        return targetsFoundation() && card != null && card.isAce();
    }

    /**
     * True for a whole-slot river transfer.
     */
    public boolean isRiverToRiver() {
        return source == PileKind.RIVER && destination == PileKind.RIVER;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("P").append(player).append(' ');
        sb.append(card == null ? "flip" : card.shortName()).append(' ');
        sb.append(source);
        if (sourceSlot != null) {
            sb.append('[').append(sourceSlot).append(']');
        }
        sb.append(" -> ").append(destination);
        if (destinationSlot != null) {
            sb.append('[').append(destinationSlot).append(']');
        }
        if (foundationId != null) {
            sb.append('[').append(foundationId).append(']');
        }
        sb.append(String.format(" (priority=%.2f, distance=%.2f)", priority, distance));
        return sb.toString();
    }

    private static Map<MoveKind, Double> initBaseWeights() {
        Map<MoveKind, Double> weights = new EnumMap<>(MoveKind.class);
        weights.put(MoveKind.NERTZ_TO_FOUNDATION, 1.0);
        weights.put(MoveKind.NERTZ_TO_RIVER, 0.9);
        weights.put(MoveKind.RIVER_TO_FOUNDATION, 0.5);
        weights.put(MoveKind.DECK_TO_FOUNDATION, 0.4);
        weights.put(MoveKind.DECK_TO_RIVER, 0.3);
        weights.put(MoveKind.RIVER_TO_RIVER, 0.3);
        weights.put(MoveKind.DECK_FLIP, 0.1);
        return Collections.unmodifiableMap(weights);
    }

    /**
     * Fluent builder; {@link #build(MoveContext)} validates and computes the priority.
     */
    public static final class Builder {
        private final int player;
        private PileKind source;
        private Integer sourceSlot;
        private PileKind destination;
        private Integer destinationSlot;
        private String foundationId;
        private Card card;
        private double distance;
        private MoveKind kind;

        private Builder(int player) {
            this.player = player;
        }

        public Builder from(PileKind source) {
            this.source = source;
            return this;
        }

        public Builder fromRiver(Integer slot) {
            this.source = PileKind.RIVER;
            this.sourceSlot = slot;
            return this;
        }

        public Builder to(PileKind destination) {
            this.destination = destination;
            return this;
        }

        public Builder toRiver(Integer slot) {
            this.destination = PileKind.RIVER;
            this.destinationSlot = slot;
            return this;
        }

        public Builder toFoundation(String foundationId) {
            this.destination = PileKind.FOUNDATION;
            this.foundationId = foundationId;
            return this;
        }

        public Builder card(Card card) {
            this.card = card;
            return this;
        }

        public Builder distance(double distance) {
            this.distance = distance;
            return this;
        }

        /**
         * Overrides the kind derived from the source/destination pair.
         */
        public Builder kind(MoveKind kind) {
            this.kind = kind;
            return this;
        }

        /**
         * Builds the move.
         *
         * @param context the turn's foundation snapshot, used for the strategic bonus
         * @throws MoveValidationException if a required field is missing
         */
        public Move build(MoveContext context) {
            return new Move(this, context);
        }
    }
}
