package max.shogi.engine.search;

import max.shogi.engine.game.Game;
import max.shogi.engine.utils.notations.SfenUtils;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fixed set of mate problems, each solved from scratch. Reports nodes, time and speed per problem
 * and flags any problem whose mate length differs from the expected one.
 */
public final class MateSearchBenchmark {

    /** @param expectedMate mate length in plies, 0 when no mate exists within maxDepth */
    public record Problem(String name, String sfen, int maxDepth, int expectedMate) {}

    public static final List<Problem> PROBLEMS = List.of(
            new Problem("head gold drop", "7lk/7p1/8P/9/9/9/9/9/K8 b G 1", 1, 1),
            new Problem("rook to the back rank", "4k4/3ppp3/9/9/9/9/9/9/K7R b - 1", 3, 1),
            new Problem("gold drop on a pinned file", "4k4/9/4R4/9/9/9/9/9/K8 b G 1", 3, 1),
            new Problem("rook drop, no interposition", "8k/9/8G/9/6N2/9/9/9/K8 b R 1", 3, 1),
            new Problem("rook drop met by a pawn interposition", "8k/9/8G/9/6N2/9/9/9/K8 b Rp 1", 5, 3),
            new Problem("rook and two golds in hand", "8k/9/9/9/9/9/9/9/K8 b RGG 1", 5, 5),
            new Problem("pawn drop mate forbidden", "8k/6S2/7G1/9/9/9/9/9/K8 b P 1", 1, 0),
            new Problem("king in the open", "9/9/9/9/4k4/9/9/9/K8 b G 1", 3, 0),
            new Problem("bare kings", "4k4/9/9/9/9/9/9/9/4K4 b - 1", 5, 0)
    );

    private MateSearchBenchmark() {}

    /** @return the number of problems whose result did not match */
    public static int run(Consumer<String> out) {
        MateSearchService service = new MateSearchService();
        int failures = 0;
        long totalNodes = 0;
        long totalMs = 0;
        for (Problem problem : PROBLEMS) {
            Game game = SfenUtils.getGameFrom(problem.sfen());
            SearchResult result = service.search(game, new SearchOptions(problem.maxDepth(), SearchConstants.DEFAULT_TIMEOUT_MS));
            int found = result.isMate() ? result.mateLength() : 0;
            boolean ok = found == problem.expectedMate() && !result.timedOut();
            if (!ok) failures++;
            totalNodes += result.nodeCount();
            totalMs += result.elapsedMs();
            out.accept(String.format("%-42s %-8s nodes %8d time %6d ms nps %10d%s",
                    problem.name(), found == 0 ? "no mate" : "mate " + found,
                    result.nodeCount(), result.elapsedMs(), result.nps(),
                    ok ? "" : " UNEXPECTED (expected " + problem.expectedMate() + ")"));
        }
        out.accept(String.format("total nodes %d time %d ms nps %d failures %d",
                totalNodes, totalMs, totalMs == 0 ? totalNodes * 1000 : totalNodes * 1000 / totalMs, failures));
        return failures;
    }
}
