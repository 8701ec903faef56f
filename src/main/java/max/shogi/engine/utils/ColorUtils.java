package max.shogi.engine.utils;

// Black (sente) moves first and advances toward rank 1
public final class ColorUtils {
    public static final int BLACK = 0;
    public static final int WHITE = 1;

    private ColorUtils() {}

    public static int switchColor(int color) {
        return color ^ 1;
    }

    public static boolean isBlack(int color) {
        return color == BLACK;
    }

    public static boolean isWhite(int color) {
        return color == WHITE;
    }

    public static String name(int color) {
        return isBlack(color) ? "black" : "white";
    }
}
