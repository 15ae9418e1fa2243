package org.ergoplatform.ergoscript.eval;

/** Accumulated cost went over the context's limit. */
public class CostLimitException extends EvaluationException {
    private final long estimatedCost;
    private final long limit;

    public CostLimitException(long estimatedCost, long limit) {
        super("Estimated execution cost " + estimatedCost + " exceeds the limit " + limit);
        this.estimatedCost = estimatedCost;
        this.limit = limit;
    }

    public long estimatedCost() {
        return estimatedCost;
    }

    public long limit() {
        return limit;
    }
}
