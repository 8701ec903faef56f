package max.shogi.engine.search;

/**
 * @param maxDepth  plies examined from the root, the attacker's first move being ply 1
 * @param timeoutMs wall-clock budget, 0 for none
 */
public record SearchOptions(int maxDepth, long timeoutMs) {
    public SearchOptions {
        if (maxDepth < 1 || maxDepth >= SearchConstants.MAX_PLY) {
            throw new IllegalArgumentException("maxDepth should be in [1, " + (SearchConstants.MAX_PLY - 1) + "], got " + maxDepth);
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs should be positive or 0, got " + timeoutMs);
        }
    }

    public static SearchOptions ofDepth(int maxDepth) {
        return new SearchOptions(maxDepth, SearchConstants.DEFAULT_TIMEOUT_MS);
    }
}
