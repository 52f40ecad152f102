package games.nertz.unit.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import games.nertz.engine.ConflictResolver;
import games.nertz.engine.EngineLog;
import games.nertz.engine.Move;
import games.nertz.engine.MoveContext;
import games.nertz.engine.PileKind;
import games.nertz.game.Card;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Cross-player conflict resolution.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>nonFoundationMovesPassThroughInOrder</b> - river moves and flips never conflict</li>
 *   <li><b>acesNeverConflict</b> - two Aces of the same suit start two foundations</li>
 *   <li><b>higherPriorityWins</b> - the best priority keeps the foundation</li>
 *   <li><b>closerPlayerWinsAmongSameKind</b> - distance erodes priority, so the closest player wins</li>
 *   <li><b>lowestPlayerBreaksFullTie</b> - then the lowest index</li>
 *   <li><b>outputIsIndependentOfInputOrder</b> - every permutation yields the same winner</li>
 * </ul>
 */
class ConflictResolverTest {
    private static final String HEARTS = "foundation_3_hearts";

    private final ConflictResolver resolver = new ConflictResolver(EngineLog.of(ConflictResolverTest.class, false));

    @Test
    void nonFoundationMovesPassThroughInOrder() {
        Move flip = Move.flip(0, MoveContext.empty());
        Move river = Move.builder(1).from(PileKind.NERTZ).toRiver(2)
                .card(Card.parse("7♦", 1)).build(MoveContext.empty());
        Move transfer = Move.builder(2).fromRiver(0).toRiver(1)
                .card(Card.parse("7♦", 2)).build(MoveContext.empty());

        assertEquals(List.of(flip, river, transfer), resolver.resolve(List.of(flip, river, transfer)));
    }

    @Test
    void acesNeverConflict() {
        Move first = Move.builder(0).from(PileKind.NERTZ).toFoundation("foundation_0_hearts")
                .card(Card.parse("A♥", 0)).build(MoveContext.empty());
        Move second = Move.builder(1).from(PileKind.DECK).toFoundation("foundation_1_hearts")
                .card(Card.parse("A♥", 1)).build(MoveContext.empty());

        assertEquals(List.of(first, second), resolver.resolve(List.of(first, second)));
    }

    @Test
    void higherPriorityWins() {
        Move deck = toHearts(0, PileKind.DECK, 0.1);
        Move nertz = toHearts(1, PileKind.NERTZ, 0.9);

        List<Move> resolved = resolver.resolve(List.of(deck, nertz));

        assertEquals(1, resolved.size());
        assertSame(nertz, resolved.get(0));
    }

    @Test
    void closerPlayerWinsAmongSameKind() {
        Move far = toHearts(0, PileKind.DECK, 0.5);
        Move near = toHearts(1, PileKind.DECK, 0.2);

        assertSame(near, resolver.resolve(List.of(far, near)).get(0));
    }

    @Test
    void lowestPlayerBreaksFullTie() {
        Move two = toHearts(2, PileKind.DECK, 0.3);
        Move one = toHearts(1, PileKind.DECK, 0.3);

        assertSame(one, resolver.resolve(List.of(two, one)).get(0));
    }

    @Test
    void outputIsIndependentOfInputOrder() {
        List<Move> moves = new ArrayList<>(List.of(
                toHearts(0, PileKind.DECK, 0.3),
                toHearts(1, PileKind.DECK, 0.3),
                toHearts(2, PileKind.NERTZ, 0.6),
                toHearts(3, PileKind.NERTZ, 0.6)));
        Move expected = moves.get(2);
        for (int seed = 0; seed < 20; seed++) {
            Collections.shuffle(moves, new Random(seed));
            List<Move> resolved = resolver.resolve(moves);
            assertEquals(1, resolved.size());
            assertSame(expected, resolved.get(0));
        }
    }

    @Test
    void unchallengedFoundationMovesFollowNonConflictingOnes() {
        Move hearts = toHearts(0, PileKind.DECK, 0.3);
        Move flip = Move.flip(1, MoveContext.empty());

        assertEquals(List.of(flip, hearts), resolver.resolve(List.of(hearts, flip)));
    }

    private static Move toHearts(int player, PileKind source, double distance) {
        return Move.builder(player).from(source).toFoundation(HEARTS)
                .card(Card.parse("5♥", player)).distance(distance).build(MoveContext.empty());
    }
}
