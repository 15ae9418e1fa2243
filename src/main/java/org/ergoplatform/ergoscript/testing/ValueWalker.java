package org.ergoplatform.ergoscript.testing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.ergoplatform.ergoscript.data.Coll;
import org.ergoplatform.ergoscript.eval.Closure;
import org.ergoplatform.ergoscript.eval.CostAccumulator;
import org.ergoplatform.ergoscript.eval.ErgoLikeContext;
import org.ergoplatform.ergoscript.eval.ErgoTreeEvaluator;
import org.ergoplatform.ergoscript.eval.EvalSettings;
import org.ergoplatform.ergoscript.lang.Expr;
import org.ergoplatform.ergoscript.lang.OpCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the value of every node the evaluator visits, in the order the evaluator charges them:
 * operands first, then the node. Each node is evaluated on its own with the environment in effect
 * at that point. Only the operand of {@code &&}/{@code ||} that is actually needed and the taken
 * branch of {@code if} are visited; function bodies are visited where they are applied.
 *
 * <p>The walk stops at the first node that fails to evaluate, as the evaluation itself would.
 */
final class ValueWalker {
    private static final Logger logger = LoggerFactory.getLogger(ValueWalker.class);

    private final ErgoLikeContext context;
    private final List<Expr.Constant> constants;
    private final List<ValueTraceEntry> entries = new ArrayList<>();
    private final Deque<List<ValueTraceEntry>> iterationSinks = new ArrayDeque<>();
    private int nextId;

    ValueWalker(ErgoLikeContext context, List<Expr.Constant> constants) {
        this.context = context;
        this.constants = constants;
    }

    List<ValueTraceEntry> walk(Expr root) {
        try {
            walk(Map.of(), root);
        } catch (WalkStopped e) {
            logger.debug("Value walk stopped at {}: {}", e.operation, e.getCause().getMessage());
        }
        return entries;
    }

    /** Well-known context values, appended after the walked entries. */
    List<ValueTraceEntry> contextValues() {
        var values = new ArrayList<ValueTraceEntry>();
        values.add(contextEntry(OpCode.HEIGHT, context.preHeader().height()));
        values.add(contextEntry(OpCode.SELF, context.self()));
        values.add(contextEntry(OpCode.INPUTS, Coll.of(context.boxesToSpend())));
        values.add(contextEntry(OpCode.OUTPUTS, Coll.of(context.spendingTransaction().outputCandidates())));
        return values;
    }

    private ValueTraceEntry contextEntry(OpCode op, Object value) {
        return new ValueTraceEntry(++nextId, op.opName(), value, ValueFormatter.format(value), 0, 0, List.of(), List.of());
    }

    private Object walk(Map<Integer, Object> env, Expr node) {
        var inputs = new ArrayList<Object>();
        if (node instanceof Expr.BlockValue block) {
            var scope = new HashMap<>(env);
            for (var item : block.items()) {
                scope.put(item.id(), walk(scope, item));
            }
            inputs.add(walk(scope, block.result()));
            return record(env, node, inputs, List.of());
        }
        if (node instanceof Expr.FuncValue) {
            return record(env, node, inputs, List.of());
        }
        if (node instanceof Expr.BinaryOp binary && (binary.op() == OpCode.BIN_AND || binary.op() == OpCode.BIN_OR)) {
            var left = walk(env, binary.left());
            inputs.add(left);
            boolean decided = binary.op() == OpCode.BIN_AND ? Boolean.FALSE.equals(left) : Boolean.TRUE.equals(left);
            if (!decided) {
                inputs.add(walk(env, binary.right()));
            }
            return record(env, node, inputs, List.of());
        }
        if (node instanceof Expr.If conditional) {
            var condition = walk(env, conditional.condition());
            inputs.add(condition);
            inputs.add(walk(env, Boolean.TRUE.equals(condition) ? conditional.thenBranch() : conditional.elseBranch()));
            return record(env, node, inputs, List.of());
        }
        if (node instanceof Expr.Apply apply) {
            var function = walk(env, apply.func());
            var args = new ArrayList<Object>();
            for (var arg : apply.args()) {
                args.add(walk(env, arg));
            }
            inputs.add(function);
            inputs.addAll(args);
            if (function instanceof Closure closure) {
                walkBody(closure, args);
            }
            return record(env, node, inputs, List.of());
        }
        if (node instanceof Expr.CollectionOp op) {
            return walkCollectionOp(env, op);
        }
        for (var child : node.children()) {
            inputs.add(walk(env, child));
        }
        return record(env, node, inputs, List.of());
    }

    private Object walkCollectionOp(Map<Integer, Object> env, Expr.CollectionOp op) {
        var inputs = new ArrayList<Object>();
        var input = walk(env, op.input());
        inputs.add(input);
        Object accumulated = null;
        if (op.zero().isPresent()) {
            accumulated = walk(env, op.zero().get());
            inputs.add(accumulated);
        }
        var function = walk(env, op.func());
        inputs.add(function);
        var iterations = new ArrayList<ValueTraceEntry.LoopIteration>();
        if (input instanceof Coll coll && function instanceof Closure closure) {
            for (int i = 0; i < coll.size(); i++) {
                var item = coll.get(i);
                var sink = new ArrayList<ValueTraceEntry>();
                iterationSinks.push(sink);
                Object result;
                try {
                    result = walkBody(closure, op.op() == OpCode.FOLD ? List.of(accumulated, item) : List.of(item));
                } finally {
                    iterationSinks.pop();
                }
                iterations.add(new ValueTraceEntry.LoopIteration(i, ValueFormatter.format(item),
                    ValueFormatter.format(result), sink));
                if (op.op() == OpCode.FOLD) {
                    accumulated = result;
                }
                if (op.op() == OpCode.EXISTS && Boolean.TRUE.equals(result)
                    || op.op() == OpCode.FOR_ALL && Boolean.FALSE.equals(result)) {
                    break;
                }
            }
        }
        return record(env, op, inputs, iterations);
    }

    private Object walkBody(Closure closure, List<Object> args) {
        var params = closure.func().args();
        var scope = new HashMap<>(closure.env());
        for (int i = 0; i < params.size() && i < args.size(); i++) {
            scope.put(params.get(i).id(), args.get(i));
        }
        return walk(scope, closure.func().body());
    }

    private Object record(Map<Integer, Object> env, Expr node, List<Object> inputs,
                          List<ValueTraceEntry.LoopIteration> iterations) {
        Object value = null;
        String valueStr = "?";
        RuntimeException failure = null;
        try {
            value = isolatedEvaluator().eval(env, node);
            valueStr = ValueFormatter.format(value);
        } catch (RuntimeException e) {
            failure = e;
        }
        int line = node.source().map(s -> s.line()).orElse(0);
        int column = node.source().map(s -> s.column()).orElse(0);
        var entry = new ValueTraceEntry(++nextId, node.opName(), value, valueStr, line, column, inputs, iterations);
        entries.add(entry);
        for (var sink : iterationSinks) {
            sink.add(entry);
        }
        if (failure != null) {
            throw new WalkStopped(node.opName(), failure);
        }
        return value;
    }

    private ErgoTreeEvaluator isolatedEvaluator() {
        return new ErgoTreeEvaluator(context, constants, new CostAccumulator(0, Long.MAX_VALUE), EvalSettings.DEFAULT);
    }

    private static final class WalkStopped extends RuntimeException {
        private final String operation;

        WalkStopped(String operation, RuntimeException cause) {
            super(cause);
            this.operation = operation;
        }
    }
}
