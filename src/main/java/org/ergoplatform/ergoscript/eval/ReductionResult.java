package org.ergoplatform.ergoscript.eval;

import org.ergoplatform.ergoscript.data.SigmaBoolean;

/** Proposition left after evaluating a guard script, with the cost spent. */
public record ReductionResult(SigmaBoolean value, long cost) {
    public boolean isTrue() {
        return value == SigmaBoolean.TrivialProp.TRUE;
    }
}
