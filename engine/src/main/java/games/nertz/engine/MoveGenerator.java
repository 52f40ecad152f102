package games.nertz.engine;

import games.nertz.game.Card;
import games.nertz.game.Foundation;
import games.nertz.game.PileSet;
import games.nertz.layout.Point;
import games.nertz.layout.TableLayout;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes every legal move for one player.
 * <p>
 * Moves are gathered in four categories, always in this order:
 * <ol>
 *   <li><b>Nertz:</b> the top nertz card to a foundation, otherwise to a river slot (at most one move).</li>
 *   <li><b>River → foundation:</b> each slot's top card, at most one move per slot.</li>
 *   <li><b>River → river:</b> whole-slot transfers led by the source slot's bottom card.</li>
 *   <li><b>Deck:</b> the flip move (always), plus the top stream card to a river slot, otherwise to a
 *       foundation.</li>
 * </ol>
 * <p>
 * Generation reads the player's own piles and the turn's {@link MoveContext}; it never reads or
 * writes the live foundations or the layout's foundation positions. An Ace bound for a foundation
 * measures its distance to the position reserved for that foundation by
 * {@link #reserveAcePositions(int)}, which is where the foundation is placed once the move
 * executes. Without a reservation the table centre stands in.
 * <p>
 * River moves and the flip are modelled as co-located with the player, so their distance is the
 * player's distance to itself (0.0).
 */
public class MoveGenerator {
    private final GameState state;
    private final EngineLog log;

    public MoveGenerator(GameState state, EngineLog engineLog) {
        this.state = state;
        this.log = engineLog.forComponent(MoveGenerator.class);
    }

    /**
     * Returns all legal moves for {@code player} against the current foundations.
     */
    public List<Move> legalMoves(int player) {
        return legalMoves(player, MoveContext.from(state));
    }

    /**
     * Returns all legal moves for {@code player} against a turn-start foundation snapshot.
     *
     * @param player the player index
     * @param context the foundation snapshot shared by every player this turn
     * @return the legal moves in category order; never empty, the flip is always legal
     */
    public List<Move> legalMoves(int player, MoveContext context) {
        List<Move> moves = new ArrayList<>();
        addNertzMoves(player, context, moves);
        addRiverToFoundationMoves(player, context, moves);
        addRiverToRiverMoves(player, context, moves);
        addDeckMoves(player, context, moves);
        return moves;
    }

    /**
     * Reserves a foundation position for every Ace on top of one of the player's visible piles.
     * <p>
     * Mutates the layout, so it must run on one thread, before the turn's {@link MoveContext} is
     * taken. Positions already reserved or placed are left as they are.
     */
    public void reserveAcePositions(int player) {
        PileSet piles = piles(player);
        reserveIfAce(player, piles.topNertzCard());
        for (int slot = 0; slot < PileSet.RIVER_SLOT_COUNT; slot++) {
            reserveIfAce(player, piles.riverTop(slot));
        }
        reserveIfAce(player, piles.topStreamCard());
    }

    private void reserveIfAce(int player, Card card) {
        if (card != null && card.isAce()) {
            layout().reserveFoundation(Foundation.identifierFor(player, card.getSuit()));
        }
    }

    private void addNertzMoves(int player, MoveContext context, List<Move> out) {
        Card nertzCard = piles(player).topNertzCard();
        if (nertzCard == null) {
            return;
        }
        Move move = foundationMove(player, nertzCard, PileKind.NERTZ, null, context);
        if (move == null) {
            move = riverMove(player, nertzCard, PileKind.NERTZ, context);
        }
        if (move != null) {
            out.add(move);
        }
    }

    private void addRiverToFoundationMoves(int player, MoveContext context, List<Move> out) {
        PileSet piles = piles(player);
        for (int slot = 0; slot < PileSet.RIVER_SLOT_COUNT; slot++) {
            Card top = piles.riverTop(slot);
            if (top == null) {
                continue;
            }
            Move move = foundationMove(player, top, PileKind.RIVER, slot, context);
            if (move != null) {
                out.add(move);
            }
        }
    }

    private void addRiverToRiverMoves(int player, MoveContext context, List<Move> out) {
        PileSet piles = piles(player);
        for (int from = 0; from < PileSet.RIVER_SLOT_COUNT; from++) {
            Card bottom = piles.riverBottom(from);
            if (bottom == null) {
                continue;
            }
            for (int to = 0; to < PileSet.RIVER_SLOT_COUNT; to++) {
                if (to == from) {
                    continue;
                }
                Card target = piles.riverTop(to);
                if (target == null || !isSolitaireAdjacent(bottom, target)) {
                    continue;
                }
                log.debug("Legal RiverToRiver move: player={} card={} from_slot={} to_slot={}",
                        player, bottom, from, to);
                out.add(Move.builder(player)
                        .fromRiver(from)
                        .toRiver(to)
                        .card(bottom)
                        .distance(distancePlayerToRiver(player))
                        .build(context));
            }
        }
    }

    private void addDeckMoves(int player, MoveContext context, List<Move> out) {
        out.add(Move.flip(player, context));

        Card streamCard = piles(player).topStreamCard();
        if (streamCard == null) {
            return;
        }
        Move move = riverMove(player, streamCard, PileKind.DECK, context);
        if (move == null) {
            move = foundationMove(player, streamCard, PileKind.DECK, null, context);
        }
        if (move != null) {
            out.add(move);
        }
    }

    /**
     * Builds a move placing {@code card} on the first river slot that accepts it: an empty slot,
     * or one whose top card it fits under by solitaire adjacency.
     *
     * @return the move, or {@code null} if no slot accepts the card
     * @throws InvalidPileException if {@code source} is the river (use a whole-slot move instead)
     */
    Move riverMove(int player, Card card, PileKind source, MoveContext context) {
        if (source == PileKind.RIVER) {
            throw new InvalidPileException(source.getLabel(),
                    "single cards are not moved between river slots", player);
        }
        PileSet piles = piles(player);
        for (int slot = 0; slot < PileSet.RIVER_SLOT_COUNT; slot++) {
            Card top = piles.riverTop(slot);
            if (top == null || isSolitaireAdjacent(card, top)) {
                return Move.builder(player)
                        .from(source)
                        .toRiver(slot)
                        .card(card)
                        .distance(distancePlayerToRiver(player))
                        .build(context);
            }
        }
        return null;
    }

    /**
     * Builds a move placing {@code card} on a foundation.
     * <p>
     * An Ace always starts the player's own new foundation. Any other card goes to the first
     * foundation, in creation order, of its suit whose top is exactly one rank below it.
     *
     * @return the move, or {@code null} if no foundation accepts the card
     */
    Move foundationMove(int player, Card card, PileKind source, Integer riverSlot, MoveContext context) {
        Point playerPosition = layout().getPlayerPosition(player);
        if (card.isAce()) {
            String id = Foundation.identifierFor(player, card.getSuit());
            Point target = context.getReservedPosition(id);
            if (target == null) {
                target = TableLayout.CENTER;
            }
            return buildFoundationMove(player, card, source, riverSlot, id,
                    layout().distanceBetween(playerPosition, target), context);
        }
        for (FoundationSummary foundation : context.getFoundations()) {
            if (foundation.suit() == card.getSuit() && foundation.nextRank() == card.getRank()) {
                return buildFoundationMove(player, card, source, riverSlot, foundation.identifier(),
                        layout().distanceBetween(playerPosition, foundation.position()), context);
            }
        }
        return null;
    }

    private Move buildFoundationMove(
            int player, Card card, PileKind source, Integer riverSlot, String foundationId,
            double distance, MoveContext context) {
        Move.Builder builder = Move.builder(player)
                .toFoundation(foundationId)
                .card(card)
                .distance(distance);
        if (source == PileKind.RIVER) {
            builder.fromRiver(riverSlot);
        } else {
            builder.from(source);
        }
        return builder.build(context);
    }

    /**
     * Solitaire adjacency: {@code source} may sit on {@code dest} when the colours differ and
     * {@code source} is exactly one rank below {@code dest}.
     */
    public static boolean isSolitaireAdjacent(Card source, Card dest) {
        return source.isRed() != dest.isRed() && source.getRank().next() == dest.getRank();
    }

    private double distancePlayerToRiver(int player) {
        Point position = layout().getPlayerPosition(player);
        return layout().distanceBetween(position, position);
    }

    private PileSet piles(int player) {
        return state.getPlayer(player).getPiles();
    }

    private TableLayout layout() {
        return state.getLayout();
    }
}
