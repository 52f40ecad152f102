package games.nertz.engine;

/**
 * Raised when a turn is requested before {@link NertzEngine#startNewGame()}.
 */
public class GameNotStartedException extends NertzEngineException {

    public GameNotStartedException() {
        super("Game has not been started.");
    }
}
