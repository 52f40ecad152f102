package games.nertz.engine;

/**
 * Raised when a move references a pile that does not exist (or cannot be used the way the
 * move requires).
 */
public class InvalidPileException extends InvalidMoveException {
    private final String pileName;

    public InvalidPileException(String pileName, String reason, Integer playerIndex) {
        super("Invalid pile '" + pileName + "': " + reason, playerIndex);
        this.pileName = pileName;
    }

    public String getPileName() {
        return pileName;
    }
}
