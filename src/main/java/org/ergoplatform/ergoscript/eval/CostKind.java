package org.ergoplatform.ergoscript.eval;

import org.ergoplatform.ergoscript.lang.SType;

/** How an operation is charged. */
public interface CostKind {

    /** Same cost on every execution. */
    record FixedCost(long cost) implements CostKind {
    }

    /** Base cost plus a cost for every started chunk of items. */
    record PerItemCost(long baseCost, long perChunkCost, int chunkSize) implements CostKind {
        public long cost(int nItems) {
            int chunks = (nItems - 1) / chunkSize + 1;
            return baseCost + perChunkCost * chunks;
        }
    }

    /** Cost depending on the operand type. */
    record TypeBasedCost(long primitiveCost, long bigIntCost, long otherCost) implements CostKind {
        public long costFor(SType type) {
            if (SType.BIGINT.equals(type)) {
                return bigIntCost;
            }
            if (SType.isNumeric(type) || SType.BOOLEAN.equals(type)) {
                return primitiveCost;
            }
            return otherCost;
        }
    }
}
