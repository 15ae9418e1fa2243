package org.ergoplatform.ergoscript.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Sigma proposition a spending transaction has to prove. Conjunctions and disjunctions are reduced
 * as trivial parts become known.
 */
public interface SigmaBoolean {

    static SigmaBoolean of(boolean value) {
        return value ? TrivialProp.TRUE : TrivialProp.FALSE;
    }

    static SigmaBoolean and(List<SigmaBoolean> items) {
        var remaining = new ArrayList<SigmaBoolean>();
        for (var item : items) {
            if (item == TrivialProp.FALSE) {
                return TrivialProp.FALSE;
            }
            if (item != TrivialProp.TRUE) {
                remaining.add(item);
            }
        }
        if (remaining.isEmpty()) {
            return TrivialProp.TRUE;
        }
        return remaining.size() == 1 ? remaining.get(0) : new CAnd(remaining);
    }

    static SigmaBoolean or(List<SigmaBoolean> items) {
        var remaining = new ArrayList<SigmaBoolean>();
        for (var item : items) {
            if (item == TrivialProp.TRUE) {
                return TrivialProp.TRUE;
            }
            if (item != TrivialProp.FALSE) {
                remaining.add(item);
            }
        }
        if (remaining.isEmpty()) {
            return TrivialProp.FALSE;
        }
        return remaining.size() == 1 ? remaining.get(0) : new COr(remaining);
    }

    enum TrivialProp implements SigmaBoolean {
        TRUE, FALSE
    }

    record ProveDlog(GroupElement value) implements SigmaBoolean {
    }

    record CAnd(List<SigmaBoolean> children) implements SigmaBoolean {
        public CAnd {
            children = List.copyOf(children);
        }
    }

    record COr(List<SigmaBoolean> children) implements SigmaBoolean {
        public COr {
            children = List.copyOf(children);
        }
    }
}
