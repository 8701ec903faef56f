package max.shogi;

import max.shogi.engine.game.Game;
import max.shogi.engine.search.MateSearchBenchmark;
import max.shogi.engine.search.MateSearchService;
import max.shogi.engine.search.SearchConfig;
import max.shogi.engine.search.SearchConstants;
import max.shogi.engine.search.SearchOptions;
import max.shogi.engine.search.SearchResult;
import max.shogi.engine.utils.notations.SfenUtils;

// Usage: Main "<sfen>" [maxDepth] [timeoutMs], no argument runs the benchmark
public class Main {
    public static void main(String[] args) {
        if (args.length == 0) {
            int failures = MateSearchBenchmark.run(System.out::println);
            if (failures != 0) System.exit(1);
            return;
        }
        try {
            Game game = SfenUtils.getGameFrom(args[0]);
            int maxDepth = args.length > 1 ? Integer.parseInt(args[1]) : SearchConstants.DEFAULT_MAX_DEPTH;
            long timeoutMs = args.length > 2 ? Long.parseLong(args[2]) : SearchConstants.DEFAULT_TIMEOUT_MS;
            System.out.print(game.board().print());
            MateSearchService service = new MateSearchService(new SearchConfig.Builder().build(), System.out::println);
            SearchResult result = service.search(game, new SearchOptions(maxDepth, timeoutMs));
            System.out.println(result);
        } catch (IllegalArgumentException e) {
            System.err.println("Cannot search: " + e.getMessage());
            System.exit(2);
        }
    }
}
