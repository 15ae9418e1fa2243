package org.ergoplatform.ergoscript.testing;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of an evaluation trace.
 *
 * @param id sequence number within one evaluation, not derived from content
 * @param operation evaluator operation name, e.g. {@code GT} or {@code Fold}
 * @param cost cost charged for the operation itself; for the synthetic root the sum of its children
 * @param loopIterations per-element traces of a collection operation, when they were captured
 */
public record TracedNode(
    int id,
    String operation,
    String operationDesc,
    Object value,
    String valueStr,
    Optional<String> valueType,
    long cost,
    Optional<SourcePosition> sourcePos,
    List<TracedNode> children,
    boolean isLoop,
    Optional<List<TracedNode>> loopIterations
) {
    public TracedNode {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(valueStr, "valueStr");
        Objects.requireNonNull(valueType, "valueType");
        Objects.requireNonNull(sourcePos, "sourcePos");
        Objects.requireNonNull(loopIterations, "loopIterations");
        children = List.copyOf(children);
        loopIterations = loopIterations.map(List::copyOf);
    }

    public static TracedNode leaf(int id, String operation, String operationDesc, String valueStr) {
        return new TracedNode(id, operation, operationDesc, valueStr, valueStr, Optional.empty(), 0, Optional.empty(),
            List.of(), false, Optional.empty());
    }
}
