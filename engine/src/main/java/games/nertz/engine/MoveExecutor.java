package games.nertz.engine;

import games.nertz.game.Card;
import games.nertz.game.Foundation;
import games.nertz.game.PileSet;
import java.util.List;

/**
 * Applies moves to the game state.
 *
 * <p>The flip simply delegates to {@link PileSet#flipIntoStream()}. Every other move checks that
 * its source still holds exactly the card the move was computed for, places the card at its
 * destination and then removes it from the source. The check runs before any pile changes, so a
 * failed move leaves the player's piles untouched. A whole-slot river transfer is checked against
 * the source slot's bottom card and then moves the entire slot, bottom first.</p>
 *
 * <p>Foundations are trusted: the executor appends without re-checking rank adjacency, because
 * the generator only ever offers the next rank of the suit.</p>
 */
public class MoveExecutor {
    private final GameState state;
    private final EngineLog log;

    public MoveExecutor(GameState state, EngineLog engineLog) {
        this.state = state;
        this.log = engineLog.forComponent(MoveExecutor.class);
    }

    /**
     * Executes a single move against the current state.
     *
     * @param move the move to apply
     * @throws CardMismatchException if the source no longer holds the move's card
     * @throws InvalidPileException if the target foundation does not exist
     * @throws MoveValidationException if a river move lacks its slot index
     */
    public void execute(Move move) {
        log.info("Executing move: player={} card={} from={} to={}",
                move.getPlayer(), move.getCard(), move.getSource(), move.getDestination());
        PileSet piles = state.getPlayer(move.getPlayer()).getPiles();

        if (move.isFlip()) {
            piles.flipIntoStream();
            log.info("Player {} flipped cards into stream.", move.getPlayer());
            return;
        }
        if (move.isRiverToRiver()) {
            transferRiverSlot(move, piles);
            log.debug("Move executed successfully.");
            return;
        }

        verifySource(move, piles);
        applyDestinationEffects(move, piles);
        applySourceEffects(move, piles);
        log.debug("Move executed successfully.");
    }

    private void applyDestinationEffects(Move move, PileSet piles) {
        switch (move.getDestination()) {
            case FOUNDATION -> placeOnFoundation(move, piles);
            case RIVER -> piles.pushRiver(requireDestinationSlot(move), move.getCard());
            // Deck and nertz are never destinations of a card move.
            default -> throw new InvalidPileException(move.getDestination().getLabel(),
                    "is not a valid destination", move.getPlayer());
        }
    }

    private void placeOnFoundation(Move move, PileSet piles) {
        Card card = move.getCard();
        if (card.isAce()) {
            Foundation created = state.createFoundation(card, move.getPlayer());
            log.debug("Created {} at {}", created.getIdentifier(),
                    state.getLayout().getFoundationPosition(created.getIdentifier()));
        } else {
            Foundation foundation = state.getFoundation(move.getFoundationId());
            if (foundation == null) {
                throw new InvalidPileException(move.getFoundationId(), "does not exist", move.getPlayer());
            }
            foundation.addCard(card);
        }
        piles.addToLake(card);
    }

    private void verifySource(Move move, PileSet piles) {
        switch (move.getSource()) {
            case NERTZ -> verify(move, piles.topNertzCard(), PileKind.NERTZ.getLabel());
            case DECK -> verify(move, piles.topStreamCard(), "DeckPile (stream)");
            case RIVER -> {
                int slot = requireSourceSlot(move);
                verify(move, piles.riverTop(slot), "RiverPile (slot " + slot + ", top)");
            }
            default -> throw new InvalidPileException(move.getSource().getLabel(),
                    "is not a valid source", move.getPlayer());
        }
    }

    private void applySourceEffects(Move move, PileSet piles) {
        switch (move.getSource()) {
            case NERTZ -> piles.popNertz();
            case DECK -> piles.popStream();
            case RIVER -> piles.popRiverTop(move.getSourceSlot());
            default -> throw new IllegalStateException("Unverified source " + move.getSource());
        }
    }

    private void transferRiverSlot(Move move, PileSet piles) {
        int from = requireSourceSlot(move);
        int to = requireDestinationSlot(move);
        if (log.isDebugEnabled()) {
            log.debug("Moving river slot {} onto slot {} for player {}: {}",
                    from, to, move.getPlayer(), piles.getRiverSlot(from));
        }
        verify(move, piles.riverBottom(from), "RiverPile (slot " + from + ", bottom)");
        List<Card> run = piles.getRiverSlot(from);
        for (int i = 0; i < run.size(); i++) {
            piles.pushRiver(to, piles.popRiverBottom(from));
        }
    }

    private void verify(Move move, Card actual, String pileName) {
        if (!move.getCard().isSameCard(actual)) {
            throw new CardMismatchException(move.getCard(), actual, pileName, move.getPlayer());
        }
    }

    private static int requireSourceSlot(Move move) {
        if (move.getSourceSlot() == null) {
            throw new MoveValidationException(
                    "River slot source index must be specified for RiverPile moves.", move.getPlayer());
        }
        return move.getSourceSlot();
    }

    private static int requireDestinationSlot(Move move) {
        if (move.getDestinationSlot() == null) {
            throw new MoveValidationException(
                    "River slot destination index must be specified for RiverPile moves.", move.getPlayer());
        }
        return move.getDestinationSlot();
    }
}
