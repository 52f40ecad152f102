package games.nertz.engine;

/**
 * Raised when a move violates game rules or cannot be applied to the current piles.
 * <p>
 * When the offending player is known, the message is prefixed with {@code "Player N: "}.
 */
public class InvalidMoveException extends NertzEngineException {
    private final Integer playerIndex;

    public InvalidMoveException(String message, Integer playerIndex) {
        super(playerIndex != null ? "Player " + playerIndex + ": " + message : message);
        this.playerIndex = playerIndex;
    }

    /**
     * Returns the player whose move failed, or {@code null} if unknown.
     */
    public Integer getPlayerIndex() {
        return playerIndex;
    }
}
