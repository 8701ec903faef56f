package max.shogi.engine.search.transpositiontable;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Attacker-to-move positions known to have no mate: key -> largest remaining depth disproven.
 * A disproof at depth d also holds for every shallower depth. Lives for a single search.
 */
public final class MateTable {
    private final Long2IntOpenHashMap disproofs;
    private final int maxEntries;

    // ----- metrics -----
    public long probes, hits, stores, clears;

    public MateTable(int maxEntries) {
        this.maxEntries = maxEntries;
        this.disproofs = new Long2IntOpenHashMap(Math.min(maxEntries, 1 << 16));
        this.disproofs.defaultReturnValue(0);
    }

    public boolean isDisproven(long key, int remainingDepth) {
        probes++;
        if (disproofs.get(key) >= remainingDepth) {
            hits++;
            return true;
        }
        return false;
    }

    public void storeDisproof(long key, int remainingDepth) {
        if (disproofs.size() >= maxEntries) {
            disproofs.clear();
            clears++;
        }
        if (disproofs.get(key) < remainingDepth) {
            disproofs.put(key, remainingDepth);
        }
        stores++;
    }

    public int size() {
        return disproofs.size();
    }

    public String toUCIInfo() {
        return String.format("info string tt entries %d probes %d hits %d stores %d clears %d",
                disproofs.size(), probes, hits, stores, clears);
    }
}
