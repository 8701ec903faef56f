package max.shogi.engine.search;

import max.shogi.engine.game.Game;

/**
 * Depth-bounded AND/OR proof search.
 * OR nodes (attacker to move) try checking moves only and need one proven child.
 * AND nodes (defender to move) try every legal reply and need all of them proven.
 * {@code remaining} counts the plies still allowed, the move about to be played included.
 */
final class MateSearch {
    private MateSearch() {}

    static boolean orNode(Game game, SearchContext ctx, int ply, int remaining) {
        ctx.nodes++;
        ctx.pvLen[ply] = ply;
        if (TimeControl.aborted(ctx)) return false;

        long key = 0L;
        if (ctx.tt != null) {
            key = game.zobristKey();
            if (ctx.tt.isDisproven(key, remaining)) return false;
        }

        final int[] moves = ctx.moveBuf[ply];
        final int[] replies = ctx.moveBuf[ply + 1];
        final int n = game.getCheckingMoves(moves);
        if (ctx.cfg.orderMoves) {
            MoveOrdering.orderAttacks(game, moves, n, ctx.scoreBuf[ply]);
        }

        for (int i = 0; i < n; i++) {
            final int move = moves[i];
            boolean proven;
            if (OneMoveMate.isMatingMove(game, move, replies)) {
                ctx.pvLen[ply + 1] = ply + 1;
                proven = true;
            } else if (remaining >= 3) {
                game.playMove(move);
                proven = andNode(game, ctx, ply + 1, remaining - 1);
                game.undoMove(move);
            } else {
                proven = false;
            }
            if (ctx.aborted) return false;
            if (proven) {
                updatePV(ctx, ply, move);
                return true;
            }
        }

        // only complete subtrees get here, aborted ones returned above
        if (ctx.tt != null) {
            ctx.tt.storeDisproof(key, remaining);
        }
        return false;
    }

    static boolean andNode(Game game, SearchContext ctx, int ply, int remaining) {
        ctx.nodes++;
        ctx.pvLen[ply] = ply;
        if (TimeControl.aborted(ctx)) return false;

        final int[] moves = ctx.moveBuf[ply];
        final int n = game.getLegalMoves(moves);
        // n == 0 is a mate already detected by the parent
        if (ctx.cfg.orderMoves) {
            MoveOrdering.orderDefenses(moves, n, ctx.scoreBuf[ply]);
        }

        int longest = -1;
        for (int i = 0; i < n; i++) {
            final int move = moves[i];
            game.playMove(move);
            boolean proven = orNode(game, ctx, ply + 1, remaining - 1);
            game.undoMove(move);
            if (!proven) return false;

            // report the most stubborn defence
            int length = ctx.pvLen[ply + 1] - (ply + 1);
            if (length > longest) {
                longest = length;
                updatePV(ctx, ply, move);
            }
        }
        return true;
    }

    private static void updatePV(SearchContext ctx, int ply, int move) {
        ctx.pv[ply][ply] = move;
        int childLen = ctx.pvLen[ply + 1];
        System.arraycopy(ctx.pv[ply + 1], ply + 1, ctx.pv[ply], ply + 1, childLen - (ply + 1));
        ctx.pvLen[ply] = childLen;
    }
}
