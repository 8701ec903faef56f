package max.shogi.engine.search;

import max.shogi.engine.game.Game;

/**
 * Replays a mating line on a copy of the game: every move legal, every attacker move a check,
 * odd length, and the defender mated at the end.
 */
public final class PrincipalVariation {
    private PrincipalVariation() {}

    public static boolean isSoundMate(Game game, int[] line) {
        if (line.length % 2 == 0) {
            return false;
        }
        Game replay = new Game(game);
        int[] buf = new int[SearchConstants.MAX_MOVES];
        for (int i = 0; i < line.length; i++) {
            int mv = line[i];
            boolean attackerPly = i % 2 == 0;
            int n = attackerPly ? replay.getCheckingMoves(buf) : replay.getLegalMoves(buf);
            boolean ok = false;
            for (int j = 0; j < n; j++) if (buf[j] == mv) { ok = true; break; }
            if (!ok) return false;
            replay.playMove(mv);
        }
        return replay.isCheckmate();
    }
}
