package org.ergoplatform.ergoscript.eval;

/** @param costTracingEnabled record every cost item in the evaluator's trace buffer */
public record EvalSettings(boolean costTracingEnabled) {
    public static final EvalSettings DEFAULT = new EvalSettings(false);
    public static final EvalSettings TRACING = new EvalSettings(true);
}
