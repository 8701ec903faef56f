package max.shogi.engine.utils.notations;

import max.shogi.engine.game.Game;
import max.shogi.engine.movegen.Move;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

// USI move notation: "7g7f", "8h2b+", "G*5b"
public final class MoveIOUtils {
    private MoveIOUtils() {}

    public static String writeUsi(int move) {
        if (move == Move.NONE) {
            return "none";
        }
        if (Move.isDrop(move)) {
            return PieceUtils.toPieceType(Move.getPieceType(move)).letter + "*" + writeSquare(Move.getTo(move));
        }
        String usi = writeSquare(Move.getFrom(move)) + writeSquare(Move.getTo(move));
        return Move.isPromotion(move) ? usi + "+" : usi;
    }

    public static String writeLine(int[] moves) {
        StringBuilder sb = new StringBuilder();
        for (int move : moves) {
            if (!sb.isEmpty()) sb.append(' ');
            sb.append(writeUsi(move));
        }
        return sb.toString();
    }

    public static String writeSquare(int square) {
        return "" + SquareUtils.file(square) + (char) ('a' + SquareUtils.rank(square) - 1);
    }

    public static int parseSquare(String square) {
        if (square.length() != 2) {
            throw new IllegalArgumentException("square should be format '7g'");
        }
        int file = square.charAt(0) - '0';
        int rank = square.charAt(1) - 'a' + 1;
        if (!SquareUtils.isOnBoard(file, rank)) {
            throw new IllegalArgumentException("square should be in [1-9][a-i], got " + square);
        }
        return SquareUtils.square(file, rank);
    }

    /**
     * Resolves a USI move against the legal moves of the position, so the returned int
     * carries the moving piece and the captured piece.
     */
    public static int parseUsi(Game game, String usi) {
        int[] legalMoves = game.getLegalMoves();
        for (int move : legalMoves) {
            if (writeUsi(move).equals(usi)) {
                return move;
            }
        }
        throw new IllegalArgumentException("Move " + usi + " is not legal in " + SfenUtils.getSfenFromGame(game));
    }
}
