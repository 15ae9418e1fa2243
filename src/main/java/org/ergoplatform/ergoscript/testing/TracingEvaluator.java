package org.ergoplatform.ergoscript.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.ergoplatform.ergoscript.data.SigmaBoolean;
import org.ergoplatform.ergoscript.eval.CostItem;
import org.ergoplatform.ergoscript.eval.ErgoLikeContext;
import org.ergoplatform.ergoscript.eval.ErgoTreeEvaluator;
import org.ergoplatform.ergoscript.eval.EvalSettings;
import org.ergoplatform.ergoscript.lang.ErgoTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a compiled tree with cost tracing on, walks the tree for the values of the visited
 * nodes and merges both into a {@link TracedEvaluation}.
 *
 * <p>A failing evaluation carries the exception in {@link TracedEvaluation#error()} and a root value
 * naming it; entries captured before the failure are kept.
 */
public final class TracingEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(TracingEvaluator.class);

    private final ErgoLikeContext context;
    private final ErgoTree ergoTree;
    private final Optional<SourcePositionMap> sourceMap;

    public TracingEvaluator(ErgoLikeContext context, ErgoTree ergoTree, Optional<SourcePositionMap> sourceMap) {
        this.context = Objects.requireNonNull(context, "context");
        this.ergoTree = Objects.requireNonNull(ergoTree, "ergoTree");
        this.sourceMap = Objects.requireNonNull(sourceMap, "sourceMap");
    }

    public static TracedEvaluation evaluate(ErgoLikeContext context, ErgoTree ergoTree, Optional<SourcePositionMap> sourceMap) {
        return new TracingEvaluator(context, ergoTree, sourceMap).evaluateWithTrace();
    }

    public TracedEvaluation evaluateWithTrace() {
        var evaluator = ErgoTreeEvaluator.forTree(context, ergoTree, EvalSettings.TRACING);
        evaluator.clearTrace();
        boolean result;
        String resultValue;
        Optional<RuntimeException> error = Optional.empty();
        try {
            var reduced = evaluator.reduce(ergoTree).value();
            result = reduced != SigmaBoolean.TrivialProp.FALSE;
            resultValue = ValueFormatter.formatSigmaProp(reduced);
        } catch (RuntimeException e) {
            logger.debug("Traced evaluation failed", e);
            result = false;
            resultValue = "Error: " + e.getClass().getSimpleName() + ": " + e.getMessage();
            error = Optional.of(e);
        }
        List<CostItem> costItems = evaluator.costTrace();

        var walker = new ValueWalker(context, ergoTree.constants());
        var values = new ArrayList<>(walker.walk(ergoTree.root()));
        values.addAll(walker.contextValues());

        var root = TraceMerger.merge(costItems, values, resultValue, sourceMap.orElseGet(SourcePositionMap::empty));
        logger.debug("Traced {} operations, total cost {}", costItems.size(), evaluator.accumulatedCost());
        return new TracedEvaluation(result, root, evaluator.accumulatedCost(), costItems.size(), error);
    }
}
