package games.nertz.engine;

import games.nertz.game.Card;
import games.nertz.game.Foundation;
import games.nertz.game.PileSet;
import games.nertz.game.Suit;
import games.nertz.layout.Point;
import games.nertz.layout.TableLayout;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a game for renderers and reports. Holds copies only; nothing here reaches back
 * into the live state.
 *
 * @param turnNumber turns played so far
 * @param gameOver whether any nertz pile is empty
 * @param players per-player pile summaries, by index
 * @param foundations foundations in creation order
 */
public record GameSnapshot(
        int turnNumber,
        boolean gameOver,
        List<PlayerSnapshot> players,
        List<FoundationSnapshot> foundations) {

    public GameSnapshot {
        players = List.copyOf(players);
        foundations = List.copyOf(foundations);
    }

    static GameSnapshot of(GameState state, int turnNumber, boolean gameOver) {
        TableLayout layout = state.getLayout();
        List<PlayerSnapshot> players = new ArrayList<>(state.getPlayerCount());
        for (PlayerState player : state.getPlayers()) {
            players.add(PlayerSnapshot.of(player, layout.getPlayerPosition(player.getIndex())));
        }
        List<FoundationSnapshot> foundations = new ArrayList<>(state.getFoundationCount());
        for (Foundation foundation : state.getFoundations()) {
            foundations.add(new FoundationSnapshot(
                    foundation.getIdentifier(),
                    foundation.getSuit(),
                    foundation.top(),
                    foundation.size(),
                    layout.getFoundationPosition(foundation.getIdentifier())));
        }
        return new GameSnapshot(turnNumber, gameOver, players, foundations);
    }

    /**
     * One player's visible piles.
     *
     * @param nertzTop top nertz card, or {@code null} when the pile is empty
     * @param streamTop top stream card, or {@code null} when the stream is empty
     * @param river full contents of each river slot, bottom to top
     */
    public record PlayerSnapshot(
            int index,
            Point position,
            Card nertzTop,
            int nertzCount,
            Card streamTop,
            int deckCount,
            List<List<Card>> river,
            int lakeCount,
            int score) {

        public PlayerSnapshot {
            river = List.copyOf(river);
        }

        static PlayerSnapshot of(PlayerState player, Point position) {
            PileSet piles = player.getPiles();
            return new PlayerSnapshot(
                    player.getIndex(),
                    position,
                    piles.topNertzCard(),
                    piles.nertzCount(),
                    piles.topStreamCard(),
                    piles.getDeck().size(),
                    piles.getRiver(),
                    piles.lakeCount(),
                    player.getScore());
        }
    }

    /**
     * One foundation on the table.
     */
    public record FoundationSnapshot(String identifier, Suit suit, Card top, int size, Point position) {
    }
}
