package max.shogi.engine.search;

import max.shogi.engine.game.Game;

import java.util.function.Consumer;

final class IterativeDeepening {
    private IterativeDeepening() {}

    // Odd depths only: a mating line always ends on an attacker move
    static SearchResult run(Game game, SearchContext ctx, int maxDepth, Consumer<String> out) {
        for (ctx.currentDepth = 1; ctx.currentDepth <= maxDepth; ctx.currentDepth += 2) {
            boolean mate = MateSearch.orNode(game, ctx, 0, ctx.currentDepth);
            if (ctx.aborted) break;
            out.accept(ctx.toUCIInfo(ctx.currentDepth));
            if (mate) {
                SearchResult result = new SearchResult(true, ctx.principalVariation(), ctx.nodes,
                        TimeControl.elapsedMs(ctx.startNs), false);
                out.accept(result.toInfo());
                return result;
            }
        }
        if (ctx.tt != null) {
            out.accept(ctx.tt.toUCIInfo());
        }
        SearchResult result = SearchResult.noMate(ctx.nodes, TimeControl.elapsedMs(ctx.startNs), ctx.aborted);
        out.accept(result.toInfo());
        return result;
    }
}
