package max.shogi.engine.search;

final class TimeControl {
    private TimeControl() {}

    private static final long MAX_TIMEOUT_MS = Long.MAX_VALUE / 1_000_000L;

    // 0 means unbounded, and so does any timeout too long to be counted in nanoseconds
    static long budgetNs(long timeoutMs) {
        return timeoutMs == 0 || timeoutMs >= MAX_TIMEOUT_MS ? 0L : timeoutMs * 1_000_000L;
    }

    // Latches ctx.aborted once the budget is spent so callers can unwind without asking the clock again
    static boolean aborted(SearchContext ctx) {
        if (ctx.aborted) return true;
        if (ctx.budgetNs != 0 && System.nanoTime() - ctx.startNs >= ctx.budgetNs) {
            ctx.aborted = true;
        }
        return ctx.aborted;
    }

    static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
