package org.ergoplatform.ergoscript.eval;

/** Running cost total checked against a limit after every addition. */
public final class CostAccumulator {
    private final long limit;
    private long total;

    public CostAccumulator(long initialCost, long limit) {
        this.total = initialCost;
        this.limit = limit;
    }

    public void add(long cost) {
        total = Math.addExact(total, cost);
        if (total > limit) {
            throw new CostLimitException(total, limit);
        }
    }

    public long totalCost() {
        return total;
    }

    public long limit() {
        return limit;
    }
}
