package max.shogi.engine.search;

import max.shogi.engine.game.Game;
import max.shogi.engine.movegen.Move;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

/**
 * Static, allocation-free ordering for both sides of the mate search.
 * Sorting is a stable insertion sort so equal scores keep generation order.
 */
final class MoveOrdering {

    private MoveOrdering() {}

    /**
     * Checks most likely to mate first: captures by value, promotions, then the closer to the
     * defending king the better. Board moves beat drops on ties to keep the hand for later.
     */
    static void orderAttacks(Game g, int[] moves, int n, int[] scores) {
        final int king = g.board().getKingSquare(ColorUtils.switchColor(g.currentPlayer));
        for (int i = 0; i < n; i++) {
            final int m = moves[i];
            int s = PieceUtils.value(Move.getCaptured(m)) * 16;
            if (Move.isPromotion(m)) s += 8;
            s += (SquareUtils.SIZE - SquareUtils.distance(Move.getTo(m), king)) * 2;
            if (!Move.isDrop(m)) s += 1;
            scores[i] = s;
        }
        sort(moves, scores, n);
    }

    /**
     * Defences most likely to refute first: king escapes, captures of the checker, interpositions
     * by a board piece, drops last.
     */
    static void orderDefenses(int[] moves, int n, int[] scores) {
        for (int i = 0; i < n; i++) {
            final int m = moves[i];
            int s;
            if (Move.isDrop(m)) {
                s = 0;
            } else if (Move.getPieceType(m) == PieceUtils.KING) {
                s = 300 + PieceUtils.value(Move.getCaptured(m));
            } else if (Move.isCapture(m)) {
                s = 200 + PieceUtils.value(Move.getCaptured(m));
            } else {
                s = 100;
            }
            scores[i] = s;
        }
        sort(moves, scores, n);
    }

    // insertion sort by score desc on [0..n)
    private static void sort(int[] moves, int[] scores, int n) {
        for (int i = 1; i < n; i++) {
            int m = moves[i], s = scores[i], j = i - 1;
            while (j >= 0 && scores[j] < s) {
                moves[j + 1] = moves[j];
                scores[j + 1] = scores[j];
                j--;
            }
            moves[j + 1] = m;
            scores[j + 1] = s;
        }
    }
}
