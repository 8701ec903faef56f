package max.shogi.engine.game;

/**
 * Thrown when a position handed to the engine cannot be searched: malformed SFEN,
 * missing king, pieces that can never move again, two pawns on a file...
 */
public class InvalidPositionException extends IllegalArgumentException {
    public InvalidPositionException(String message) {
        super(message);
    }

    public InvalidPositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
