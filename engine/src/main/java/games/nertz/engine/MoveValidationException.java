package games.nertz.engine;

/**
 * Raised when a {@link Move} is built without a field its pile combination requires.
 * Always a defect in move generation.
 */
public class MoveValidationException extends InvalidMoveException {

    public MoveValidationException(String message, Integer playerIndex) {
        super(message, playerIndex);
    }
}
