package max.shogi.engine.search;

import max.shogi.engine.game.Game;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.notations.SfenUtils;

import java.util.function.Consumer;

/**
 * Entry point of the mate solver. Holds configuration only: every call works on its own copy of
 * the game and its own {@link SearchContext}, so the caller's game is never touched.
 *
 * <p>Mate, no mate and timeout are all returned as {@link SearchResult}. Positions that cannot be
 * searched (no king, two pawns on a file...) raise
 * {@link max.shogi.engine.game.InvalidPositionException} before any node is expanded.
 */
public final class MateSearchService {

    private final SearchConfig cfg;
    private final Consumer<String> out;

    public MateSearchService() {
        this(new SearchConfig.Builder().build());
    }

    public MateSearchService(SearchConfig cfg) {
        this(cfg, info -> {});
    }

    public MateSearchService(SearchConfig cfg, Consumer<String> out) {
        this.cfg = cfg;
        this.out = out;
    }

    public SearchResult search(Game game, int attacker) {
        return search(game, attacker, cfg.defaultOptions());
    }

    // The side to move attacks
    public SearchResult search(Game game, SearchOptions options) {
        return search(game, game.currentPlayer, options);
    }

    public SearchResult search(Game game, int attacker, SearchOptions options) {
        final long start = System.nanoTime();
        final Game root = prepare(game, attacker);
        out.accept("info string mate search " + ColorUtils.name(attacker) + " depth " + options.maxDepth()
                + " timeout " + options.timeoutMs() + " sfen " + SfenUtils.getSfenFromGame(root));

        final SearchContext ctx = new SearchContext(cfg, start, options.timeoutMs());
        final long keyBefore = root.zobristKey();
        final String sfenBefore = cfg.debug ? SfenUtils.getSfenFromGame(root) : null;

        SearchResult result = IterativeDeepening.run(root, ctx, options.maxDepth(), out);

        if (cfg.debug) {
            DebugChecks.assertPositionRestored(root, keyBefore, sfenBefore);
            DebugChecks.assertSoundMate(root, result);
        }
        return result;
    }

    public static SearchResult findCheckmate(Game game, int attacker) {
        return findCheckmate(game, attacker, SearchConstants.DEFAULT_MAX_DEPTH);
    }

    public static SearchResult findCheckmate(Game game, int attacker, int maxDepth) {
        return new MateSearchService().search(game, attacker, SearchOptions.ofDepth(maxDepth));
    }

    /**
     * @return a move mating at once, or {@link max.shogi.engine.movegen.Move#NONE}
     */
    public static int findOneMoveCheckmate(Game game, int attacker) {
        return OneMoveMate.find(prepare(game, attacker));
    }

    private static Game prepare(Game game, int attacker) {
        if (attacker != ColorUtils.BLACK && attacker != ColorUtils.WHITE) {
            throw new IllegalArgumentException("Unknown attacker color " + attacker);
        }
        Game root = new Game(game);
        root.setCurrentPlayer(attacker);
        root.validate();
        return root;
    }
}
