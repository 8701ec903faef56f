package max.shogi.engine.search;

import max.shogi.engine.search.transpositiontable.MateTable;

public final class SearchContext {
    // Buffers per ply, ply p + 1 doubles as scratch space for the mate test after a move at ply p
    public final int[][] moveBuf  = new int[SearchConstants.MAX_PLY + 1][SearchConstants.MAX_MOVES];
    public final int[][] scoreBuf = new int[SearchConstants.MAX_PLY][SearchConstants.MAX_MOVES];

    // Triangular PV: pv[ply][ply..pvLen[ply]) is the line found from ply
    public final int[][] pv = new int[SearchConstants.MAX_PLY + 1][SearchConstants.MAX_PLY + 1];
    public final int[] pvLen = new int[SearchConstants.MAX_PLY + 1];

    // Counters
    public long nodes;
    public int currentDepth;

    // Clock
    public final long startNs;
    public final long budgetNs;
    public boolean aborted;

    // TT
    public final MateTable tt; // nullable if disabled

    // Config
    public final SearchConfig cfg;

    public SearchContext(SearchConfig cfg, long startNs, long timeoutMs) {
        this.cfg = cfg;
        this.startNs = startNs;
        this.budgetNs = TimeControl.budgetNs(timeoutMs);
        this.tt = cfg.useTT ? new MateTable(cfg.ttMaxEntries) : null;
    }

    int[] principalVariation() {
        int[] line = new int[pvLen[0]];
        System.arraycopy(pv[0], 0, line, 0, line.length);
        return line;
    }

    public String toUCIInfo(int depth) {
        return String.format("info string depth %d nodes %d time %d", depth, nodes, TimeControl.elapsedMs(startNs));
    }
}
