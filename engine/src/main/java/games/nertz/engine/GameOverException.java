package games.nertz.engine;

/**
 * Raised when a turn is requested after a player's nertz pile has emptied.
 */
public class GameOverException extends NertzEngineException {

    public GameOverException() {
        super("Game is over. Cannot play further turns.");
    }
}
