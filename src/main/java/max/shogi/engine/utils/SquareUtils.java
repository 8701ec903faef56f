package max.shogi.engine.utils;

/**
 * Squares are packed in [0, 80]: {@code (rank - 1) * 9 + (file - 1)}.
 * Files are numbered 1..9 from black's right, ranks 1..9 from white's side.
 */
public final class SquareUtils {
    public static final int SIZE = 9;
    public static final int SQUARES = 81;

    private SquareUtils() {}

    public static int square(int file, int rank) {
        return (rank - 1) * SIZE + (file - 1);
    }

    public static int file(int square) {
        return square % SIZE + 1;
    }

    public static int rank(int square) {
        return square / SIZE + 1;
    }

    public static boolean isOnBoard(int file, int rank) {
        return file >= 1 && file <= SIZE && rank >= 1 && rank <= SIZE;
    }

    // Rank counted from the color's own side: 1 is the farthest rank
    public static int relativeRank(int square, int color) {
        int rank = rank(square);
        return ColorUtils.isBlack(color) ? rank : SIZE + 1 - rank;
    }

    public static boolean isInPromotionZone(int square, int color) {
        return relativeRank(square, color) <= 3;
    }

    public static boolean isLastRank(int square, int color) {
        return relativeRank(square, color) == 1;
    }

    public static boolean isLastTwoRanks(int square, int color) {
        return relativeRank(square, color) <= 2;
    }

    public static int distance(int a, int b) {
        return Math.max(Math.abs(file(a) - file(b)), Math.abs(rank(a) - rank(b)));
    }

    // Rank/file direction a color advances in
    public static int forward(int color) {
        return ColorUtils.isBlack(color) ? -1 : 1;
    }
}
