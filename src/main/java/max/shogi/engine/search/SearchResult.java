package max.shogi.engine.search;

import max.shogi.engine.utils.notations.MoveIOUtils;

import java.util.Arrays;

/**
 * Outcome of a mate search. {@code moves} is the proven mating line, empty when no mate was proven.
 * {@code timedOut} tells an exhausted clock apart from a proven absence of mate within the depth.
 * The line is copied in and out, so results compare by content and cannot be altered by callers.
 */
public record SearchResult(boolean isMate, int[] moves, long nodeCount, long elapsedMs, boolean timedOut) {
    public SearchResult {
        moves = moves.clone();
    }

    static SearchResult noMate(long nodeCount, long elapsedMs, boolean timedOut) {
        return new SearchResult(false, new int[0], nodeCount, elapsedMs, timedOut);
    }

    @Override
    public int[] moves() {
        return moves.clone();
    }

    public int mateLength() {
        return moves.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchResult other)) return false;
        return isMate == other.isMate && nodeCount == other.nodeCount && elapsedMs == other.elapsedMs
            && timedOut == other.timedOut && Arrays.equals(moves, other.moves);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(moves);
        result = 31 * result + Boolean.hashCode(isMate);
        result = 31 * result + Long.hashCode(nodeCount);
        result = 31 * result + Long.hashCode(elapsedMs);
        return 31 * result + Boolean.hashCode(timedOut);
    }

    public long nps() {
        return elapsedMs == 0 ? nodeCount * 1000 : nodeCount * 1000 / elapsedMs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("mate: ").append(isMate ? "in " + moves.length : timedOut ? "unknown (timed out)" : "none").append("\n")
            .append("search time (ms): ").append(elapsedMs).append("\n")
            .append("nodes: ").append(nodeCount).append("\n")
            .append("nodes/sec: ").append(nps()).append("\n")
            .append("PV: ").append(MoveIOUtils.writeLine(moves));
        return sb.toString();
    }

    public String toInfo() {
        StringBuilder sb = new StringBuilder("info")
            .append(" time ").append(elapsedMs)
            .append(" nodes ").append(nodeCount)
            .append(" nps ").append(nps());
        if (isMate) {
            sb.append(" score mate ").append(moves.length)
                .append(" pv ").append(MoveIOUtils.writeLine(moves));
        } else {
            sb.append(timedOut ? " string timeout" : " string nomate");
        }
        return sb.toString();
    }
}
