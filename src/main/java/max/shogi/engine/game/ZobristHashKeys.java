package max.shogi.engine.game;

import max.shogi.engine.game.board.Board;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

import java.util.SplittableRandom;

/**
 * Zobrist keys for shogi positions.
 * Pieces are keyed by their board code ({@code type | color << 4}), hands by their count.
 */
public final class ZobristHashKeys {
    private static final long SEED = 0x5EED_0F_5106L;
    private static final int MAX_HAND_COUNT = 18;

    private static final long[][] PIECE_SQUARE = new long[32][SquareUtils.SQUARES];
    // HAND[color][type][count], count 0 hashes to 0
    private static final long[][][] HAND = new long[2][PieceUtils.KING][MAX_HAND_COUNT + 1];
    private static final long WHITE_TO_MOVE;

    static {
        SplittableRandom random = new SplittableRandom(SEED);
        for (int code = 0; code < PIECE_SQUARE.length; code++) {
            for (int sq = 0; sq < SquareUtils.SQUARES; sq++) {
                PIECE_SQUARE[code][sq] = random.nextLong();
            }
        }
        for (int color = 0; color < 2; color++) {
            for (int type = PieceUtils.PAWN; type < PieceUtils.KING; type++) {
                for (int count = 1; count <= MAX_HAND_COUNT; count++) {
                    HAND[color][type][count] = random.nextLong();
                }
            }
        }
        WHITE_TO_MOVE = random.nextLong();
    }

    private ZobristHashKeys() {}

    public static long pieceSquare(int pieceCode, int square) {
        return PIECE_SQUARE[pieceCode][square];
    }

    public static long hand(int color, int type, int count) {
        return HAND[color][type][count];
    }

    public static long changeHand(long key, int color, int type, int oldCount, int newCount) {
        return key ^ HAND[color][type][oldCount] ^ HAND[color][type][newCount];
    }

    public static long sideToMove(int color) {
        return ColorUtils.isWhite(color) ? WHITE_TO_MOVE : 0L;
    }

    // Full recomputation, incremental updates live in Board
    public static long getBoardKey(Board board) {
        long key = 0L;
        for (int sq = 0; sq < SquareUtils.SQUARES; sq++) {
            byte code = board.getPieceAt(sq);
            if (!PieceUtils.isEmpty(code)) {
                key ^= PIECE_SQUARE[code][sq];
            }
        }
        for (int color = 0; color < 2; color++) {
            for (int type = PieceUtils.PAWN; type < PieceUtils.KING; type++) {
                key ^= hand(color, type, board.handCount(color, type));
            }
        }
        return key;
    }

    public static long getHashKey(Game game) {
        return getBoardKey(game.board()) ^ sideToMove(game.currentPlayer);
    }

    public static String print(long key) {
        return String.format("%016x", key);
    }
}
