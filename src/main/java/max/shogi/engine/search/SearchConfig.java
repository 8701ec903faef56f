package max.shogi.engine.search;

public final class SearchConfig {

    public final boolean debug;

    // Disproof table
    public final boolean useTT;
    public final int ttMaxEntries;

    public final boolean orderMoves;

    // Defaults used when the caller gives no options
    public final int defaultMaxDepth;
    public final long defaultTimeoutMs;

    private SearchConfig(Builder b) {
        debug = b.debug;
        useTT = b.useTT;
        ttMaxEntries = b.ttMaxEntries;
        orderMoves = b.orderMoves;
        defaultMaxDepth = b.defaultMaxDepth;
        defaultTimeoutMs = b.defaultTimeoutMs;
    }

    public SearchOptions defaultOptions() {
        return new SearchOptions(defaultMaxDepth, defaultTimeoutMs);
    }

    public static class Builder {
        private boolean debug = false;

        private boolean useTT = true;
        private int ttMaxEntries = 1 << 20;

        private boolean orderMoves = true;

        private int defaultMaxDepth = SearchConstants.DEFAULT_MAX_DEPTH;
        private long defaultTimeoutMs = SearchConstants.DEFAULT_TIMEOUT_MS;

        public Builder debug(boolean v){debug=v;return this;}

        public Builder useTT(boolean v){useTT=v;return this;}
        public Builder ttMaxEntries(int v){ttMaxEntries=v;return this;}

        public Builder orderMoves(boolean v){orderMoves=v;return this;}

        public Builder defaultMaxDepth(int v){defaultMaxDepth=v;return this;}
        public Builder defaultTimeoutMs(long v){defaultTimeoutMs=v;return this;}
        public SearchConfig build(){return new SearchConfig(this);}
    }
}
