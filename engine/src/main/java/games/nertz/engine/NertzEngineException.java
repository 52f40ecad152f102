package games.nertz.engine;

/**
 * Base exception for all Nertz engine errors.
 */
public class NertzEngineException extends RuntimeException {

    public NertzEngineException(String message) {
        super(message);
    }
}
