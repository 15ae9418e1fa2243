package org.ergoplatform.ergoscript.eval;

import org.ergoplatform.ergoscript.lang.SType;

/** One entry of the evaluator's cost trace. */
public interface CostItem {
    String opName();

    long cost();

    record FixedCostItem(String opName, CostKind.FixedCost costKind) implements CostItem {
        @Override
        public long cost() {
            return costKind.cost();
        }
    }

    record TypeBasedCostItem(String opName, CostKind.TypeBasedCost costKind, SType type) implements CostItem {
        @Override
        public long cost() {
            return costKind.costFor(type);
        }
    }

    record SeqCostItem(String opName, CostKind.PerItemCost costKind, int nItems) implements CostItem {
        @Override
        public long cost() {
            return costKind.cost(nItems);
        }
    }
}
