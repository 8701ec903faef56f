package max.shogi.engine.movegen.utils;

import max.shogi.engine.game.board.Board;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;

public final class CheckUtils {
    public static long ATTACK_QUERIES = 0;

    private CheckUtils() {}

    /**
     * Scans outward from {@code square}: the first piece met in each direction attacks it if it steps
     * (when adjacent) or slides back toward the square. Knights are looked up separately.
     */
    public static boolean isSquareAttacked(Board board, int square, int byColor) {
        ATTACK_QUERIES++;
        for (int dir = 0; dir < AttackTables.DIRECTIONS; dir++) {
            int back = AttackTables.OPPOSITE[dir];
            int sq = AttackTables.NEIGHBOR[square][dir];
            boolean adjacent = true;
            while (sq != -1) {
                byte code = board.getPieceAt(sq);
                if (code != 0) {
                    if (PieceUtils.toColor(code) == byColor
                            && (AttackTables.slides(code, back) || (adjacent && AttackTables.steps(code, back)))) {
                        return true;
                    }
                    break;
                }
                adjacent = false;
                sq = AttackTables.NEIGHBOR[sq][dir];
            }
        }

        // A knight of byColor lands here from the squares it would jump to as the other color
        byte knight = PieceUtils.encode(PieceUtils.KNIGHT, byColor);
        for (int from : AttackTables.KNIGHT_JUMPS[ColorUtils.switchColor(byColor)][square]) {
            if (board.getPieceAt(from) == knight) return true;
        }
        return false;
    }

    public static boolean isKingInCheck(Board board, int color) {
        int king = board.getKingSquare(color);
        return king != -1 && isSquareAttacked(board, king, ColorUtils.switchColor(color));
    }

    public static void printChecksReport() {
        System.out.println("*************************");
        System.out.println("CHECK REPORT");
        System.out.println("ATTACK QUERIES: " + ATTACK_QUERIES);
        System.out.println("*************************");
    }
}
