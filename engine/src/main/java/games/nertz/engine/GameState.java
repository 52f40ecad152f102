package games.nertz.engine;

import games.nertz.game.Card;
import games.nertz.game.Foundation;
import games.nertz.game.PileSet;
import games.nertz.layout.TableLayout;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Shared state of one Nertz game: the seated players, the foundations in creation order, and the
 * table layout.
 */
public class GameState {
    private final List<PlayerState> players;
    private final Map<String, Foundation> foundations = new LinkedHashMap<>();
    private final TableLayout layout;

    /**
     * Creates a state from already-dealt players.
     *
     * @param players the players, where element {@code i} must have index {@code i}
     * @param layout the table layout for the same player count
     */
    public GameState(List<PlayerState> players, TableLayout layout) {
        Objects.requireNonNull(players, "players");
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Player at position " + i + " has index " + players.get(i).getIndex());
            }
        }
        this.players = Collections.unmodifiableList(new ArrayList<>(players));
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * Seats {@code playerCount} players and deals each of them a fresh shuffled deck.
     *
     * @param playerCount number of players
     * @param random random source for shuffles and foundation jitter
     * @param engineLog logging handle handed to the layout
     * @return the dealt state
     */
    public static GameState deal(int playerCount, Random random, EngineLog engineLog) {
        List<PlayerState> players = new ArrayList<>(playerCount);
        for (int i = 0; i < playerCount; i++) {
            players.add(new PlayerState(i, PileSet.dealStartingHand(i, random)));
        }
        return new GameState(players, new TableLayout(playerCount, random, engineLog));
    }

    /**
     * Starts a foundation with {@code ace} on behalf of {@code owner} and places it on the table.
     *
     * @param ace the Ace starting the foundation
     * @param owner the creating player
     * @return the new foundation
     * @throws IllegalArgumentException if {@code ace} is not an Ace
     * @throws InvalidPileException if a foundation with the same identifier already exists
     */
    public Foundation createFoundation(Card ace, int owner) {
        Foundation foundation = Foundation.create(ace, owner);
        String id = foundation.getIdentifier();
        if (foundations.containsKey(id)) {
            throw new InvalidPileException(id, "already exists", owner);
        }
        foundations.put(id, foundation);
        layout.placeFoundation(id);
        return foundation;
    }

    /**
     * Returns the foundation with {@code identifier}, or {@code null} if none exists.
     */
    public Foundation getFoundation(String identifier) {
        return foundations.get(identifier);
    }

    /**
     * Returns all foundations in creation order.
     */
    public Collection<Foundation> getFoundations() {
        return Collections.unmodifiableCollection(foundations.values());
    }

    public int getFoundationCount() {
        return foundations.size();
    }

    public List<PlayerState> getPlayers() {
        return players;
    }

    public PlayerState getPlayer(int index) {
        return players.get(index);
    }

    public int getPlayerCount() {
        return players.size();
    }

    public TableLayout getLayout() {
        return layout;
    }
}
