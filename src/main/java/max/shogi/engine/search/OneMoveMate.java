package max.shogi.engine.search;

import max.shogi.engine.game.Game;
import max.shogi.engine.movegen.Move;
import max.shogi.engine.movegen.MoveGenerator;

/**
 * Single-move mate scan for the side to move. Checking moves are tried in generation order and
 * the first one leaving the defender without a legal reply wins. The game is restored on return.
 */
public final class OneMoveMate {
    private OneMoveMate() {}

    public static int find(Game game) {
        return find(game, new int[SearchConstants.MAX_MOVES], new int[SearchConstants.MAX_MOVES]);
    }

    static int find(Game game, int[] moves, int[] replies) {
        int n = game.getCheckingMoves(moves);
        for (int i = 0; i < n; i++) {
            if (isMatingMove(game, moves[i], replies)) {
                return moves[i];
            }
        }
        return Move.NONE;
    }

    // checkingMove must give check, only the lack of replies is tested here
    static boolean isMatingMove(Game game, int checkingMove, int[] replies) {
        game.playMove(checkingMove);
        boolean mate = !MoveGenerator.hasLegalMove(game, replies);
        game.undoMove(checkingMove);
        return mate;
    }
}
