package org.ergoplatform.ergoscript.eval;

import java.util.Map;
import org.ergoplatform.ergoscript.lang.Expr;

/** Function value together with the environment it was created in. */
public record Closure(Expr.FuncValue func, Map<Integer, Object> env) {
    public Closure {
        env = Map.copyOf(env);
    }
}
