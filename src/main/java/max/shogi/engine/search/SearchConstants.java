package max.shogi.engine.search;

public class SearchConstants {
    // Bound for principal variation and per-ply buffers, maxDepth must stay below it
    public static final int MAX_PLY = 128;

    // Shogi positions peak below 600 legal moves, pseudo-legal drops included we stay under this
    public static final int MAX_MOVES = 1024;

    public static final int DEFAULT_MAX_DEPTH = 7;
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
}
