package org.ergoplatform.ergoscript.eval;

import java.util.List;

/** Everything a script can read while it is evaluated. */
public record ErgoLikeContext(
    PreHeader preHeader,
    List<ErgoBox> dataBoxes,
    List<ErgoBox> boxesToSpend,
    ErgoLikeTransaction spendingTransaction,
    int selfIndex,
    long costLimit,
    long initCost,
    byte activatedScriptVersion,
    byte ergoTreeVersion
) {
    public static final long DEFAULT_COST_LIMIT = 1_000_000L;
    public static final byte DEFAULT_ACTIVATED_VERSION = 3;

    public ErgoLikeContext {
        dataBoxes = List.copyOf(dataBoxes);
        boxesToSpend = List.copyOf(boxesToSpend);
        if (selfIndex < 0 || selfIndex >= boxesToSpend.size()) {
            throw new IllegalArgumentException("Self index " + selfIndex + " is outside of " + boxesToSpend.size() + " inputs");
        }
    }

    public ErgoBox self() {
        return boxesToSpend.get(selfIndex);
    }

    public ErgoLikeContext withErgoTreeVersion(byte version) {
        return new ErgoLikeContext(preHeader, dataBoxes, boxesToSpend, spendingTransaction, selfIndex, costLimit,
            initCost, activatedScriptVersion, version);
    }

    public ErgoLikeContext withCostLimit(long limit) {
        return new ErgoLikeContext(preHeader, dataBoxes, boxesToSpend, spendingTransaction, selfIndex, limit,
            initCost, activatedScriptVersion, ergoTreeVersion);
    }
}
