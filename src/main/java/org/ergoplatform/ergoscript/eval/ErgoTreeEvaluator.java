package org.ergoplatform.ergoscript.eval;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.ergoplatform.ergoscript.data.Coll;
import org.ergoplatform.ergoscript.data.GroupElement;
import org.ergoplatform.ergoscript.data.Pair;
import org.ergoplatform.ergoscript.data.SigmaBoolean;
import org.ergoplatform.ergoscript.lang.ErgoTree;
import org.ergoplatform.ergoscript.lang.Expr;
import org.ergoplatform.ergoscript.lang.Numerics;
import org.ergoplatform.ergoscript.lang.OpCode;
import org.ergoplatform.ergoscript.lang.SType;

/**
 * Direct interpreter of typed trees. The cost of a node is charged after its children have been
 * evaluated, so the cost trace is in post-order. {@code &&} and {@code ||} charge after the right
 * operand, or right after the left one when it decides the result.
 */
public final class ErgoTreeEvaluator {
    private final ErgoLikeContext context;
    private final List<Expr.Constant> constants;
    private final CostAccumulator accumulator;
    private final EvalSettings settings;
    private final List<CostItem> costTrace = new ArrayList<>();

    public ErgoTreeEvaluator(ErgoLikeContext context, List<Expr.Constant> constants, CostAccumulator accumulator,
                             EvalSettings settings) {
        this.context = Objects.requireNonNull(context, "context");
        this.constants = List.copyOf(constants);
        this.accumulator = accumulator;
        this.settings = settings;
    }

    public static ErgoTreeEvaluator forTree(ErgoLikeContext context, ErgoTree tree, EvalSettings settings) {
        return new ErgoTreeEvaluator(context, tree.constants(),
            new CostAccumulator(context.initCost(), context.costLimit()), settings);
    }

    /** Reduces a tree to its sigma proposition inside a version scope. */
    public static ReductionResult evalToCrypto(ErgoLikeContext context, ErgoTree tree, EvalSettings settings) {
        return forTree(context, tree, settings).reduce(tree);
    }

    public ReductionResult reduce(ErgoTree tree) {
        return VersionContext.withVersions(context.activatedScriptVersion(), tree.version(), () -> {
            checkVersions();
            var value = eval(Map.of(), tree.root());
            if (!(value instanceof SigmaBoolean sigma)) {
                throw new EvaluationException("Script reduced to " + value + " instead of a SigmaProp");
            }
            return new ReductionResult(sigma, accumulator.totalCost());
        });
    }

    private static void checkVersions() {
        var versions = VersionContext.current();
        if (versions.ergoTreeVersion() > versions.activatedVersion()) {
            throw new EvaluationException("ErgoTree version " + versions.ergoTreeVersion()
                + " is higher than the activated script version " + versions.activatedVersion());
        }
    }

    public List<CostItem> costTrace() {
        return List.copyOf(costTrace);
    }

    public void clearTrace() {
        costTrace.clear();
    }

    public long accumulatedCost() {
        return accumulator.totalCost();
    }

    public Object eval(Map<Integer, Object> env, Expr expr) {
        if (expr instanceof Expr.Constant constant) {
            addCost(expr, expr.type(), 0);
            return constant.value();
        }
        if (expr instanceof Expr.ConstantPlaceholder placeholder) {
            addCost(expr, expr.type(), 0);
            return placeholderValue(placeholder);
        }
        if (expr instanceof Expr.ValUse use) {
            if (!env.containsKey(use.id())) {
                throw new EvaluationException("Variable '" + use.name() + "' is not defined in the environment");
            }
            addCost(expr, expr.type(), 0);
            return env.get(use.id());
        }
        if (expr instanceof Expr.BlockValue block) {
            return evalBlock(env, block);
        }
        if (expr instanceof Expr.ValDef valDef) {
            var value = eval(env, valDef.rhs());
            addCost(expr, expr.type(), 0);
            return value;
        }
        if (expr instanceof Expr.FuncValue func) {
            addCost(expr, expr.type(), 0);
            return new Closure(func, env);
        }
        if (expr instanceof Expr.Apply apply) {
            var closure = asClosure(eval(env, apply.func()));
            var args = new ArrayList<Object>();
            for (var arg : apply.args()) {
                args.add(eval(env, arg));
            }
            var result = applyClosure(closure, args);
            addCost(expr, expr.type(), 0);
            return result;
        }
        if (expr instanceof Expr.If conditional) {
            boolean condition = (Boolean) eval(env, conditional.condition());
            var result = eval(env, condition ? conditional.thenBranch() : conditional.elseBranch());
            addCost(expr, expr.type(), 0);
            return result;
        }
        if (expr instanceof Expr.ContextProperty) {
            var value = contextValue(expr.op());
            addCost(expr, expr.type(), 0);
            return value;
        }
        if (expr instanceof Expr.BinaryOp binary) {
            return evalBinary(env, binary);
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return evalUnary(env, unary);
        }
        if (expr instanceof Expr.ExtractRegisterAs extract) {
            var box = (ErgoBox) eval(env, extract.box());
            var value = register(box, extract);
            addCost(expr, expr.type(), 0);
            return value;
        }
        if (expr instanceof Expr.SelectField select) {
            var tuple = (Pair) eval(env, select.input());
            addCost(expr, expr.type(), 0);
            return tuple.field(select.index());
        }
        if (expr instanceof Expr.PropertyCall call) {
            var preHeader = (PreHeader) eval(env, call.input());
            addCost(expr, expr.type(), 0);
            return preHeader.property(call.property());
        }
        if (expr instanceof Expr.TupleExpr tuple) {
            var first = eval(env, tuple.first());
            var second = eval(env, tuple.second());
            addCost(expr, expr.type(), 0);
            return new Pair(first, second);
        }
        if (expr instanceof Expr.ConcreteCollection collection) {
            var items = new ArrayList<Object>();
            for (var item : collection.items()) {
                items.add(eval(env, item));
            }
            addCost(expr, expr.type(), items.size());
            return new Coll(items);
        }
        if (expr instanceof Expr.CollectionOp op) {
            return evalCollectionOp(env, op);
        }
        throw new EvaluationException("Unsupported operation " + expr.opName());
    }

    private Object placeholderValue(Expr.ConstantPlaceholder placeholder) {
        if (placeholder.index() >= constants.size()) {
            throw new EvaluationException("No constant for placeholder #" + placeholder.index());
        }
        var value = constants.get(placeholder.index()).value();
        if (value == null) {
            throw new EvaluationException("Template parameter #" + placeholder.index() + " has no value");
        }
        return value;
    }

    private Object evalBlock(Map<Integer, Object> env, Expr.BlockValue block) {
        var scope = new HashMap<>(env);
        for (var item : block.items()) {
            scope.put(item.id(), eval(scope, item));
        }
        var result = eval(scope, block.result());
        addCost(block, block.type(), block.items().size());
        return result;
    }

    /** Runs a closure body with its arguments bound; charges nothing for the call itself. */
    public Object applyClosure(Closure closure, List<Object> args) {
        var params = closure.func().args();
        if (params.size() != args.size()) {
            throw new EvaluationException("Function expects " + params.size() + " arguments, got " + args.size());
        }
        var scope = new HashMap<>(closure.env());
        for (int i = 0; i < params.size(); i++) {
            scope.put(params.get(i).id(), args.get(i));
        }
        return eval(scope, closure.func().body());
    }

    private static Closure asClosure(Object value) {
        if (value instanceof Closure closure) {
            return closure;
        }
        throw new EvaluationException("Value " + value + " is not a function");
    }

    private Object contextValue(OpCode op) {
        return switch (op) {
            case HEIGHT -> context.preHeader().height();
            case SELF -> context.self();
            case INPUTS -> Coll.of(context.boxesToSpend());
            case OUTPUTS -> Coll.of(context.spendingTransaction().outputCandidates());
            case DATA_INPUTS -> Coll.of(context.dataBoxes());
            case PRE_HEADER -> context.preHeader();
            default -> throw new EvaluationException("Not a context property: " + op.opName());
        };
    }

    private Object evalBinary(Map<Integer, Object> env, Expr.BinaryOp binary) {
        var op = binary.op();
        if (op == OpCode.BIN_AND || op == OpCode.BIN_OR) {
            boolean left = (Boolean) eval(env, binary.left());
            boolean decided = op == OpCode.BIN_AND ? !left : left;
            if (decided) {
                addCost(binary, SType.BOOLEAN, 0);
                return left;
            }
            boolean right = (Boolean) eval(env, binary.right());
            addCost(binary, SType.BOOLEAN, 0);
            return right;
        }
        var left = eval(env, binary.left());
        var right = eval(env, binary.right());
        Object result;
        try {
            result = switch (op) {
                case GT -> Numerics.compare(left, right) > 0;
                case GE -> Numerics.compare(left, right) >= 0;
                case LT -> Numerics.compare(left, right) < 0;
                case LE -> Numerics.compare(left, right) <= 0;
                case EQ -> Objects.equals(left, right);
                case NEQ -> !Objects.equals(left, right);
                case PLUS, MINUS, MULTIPLY, DIVISION, MODULO -> Numerics.arithmetic(op, left, right, binary.type());
                case SIGMA_AND -> SigmaBoolean.and(List.of((SigmaBoolean) left, (SigmaBoolean) right));
                case SIGMA_OR -> SigmaBoolean.or(List.of((SigmaBoolean) left, (SigmaBoolean) right));
                case OPTION_GET_OR_ELSE -> ((Optional<?>) left).map(v -> (Object) v).orElse(right);
                case BY_INDEX -> byIndex((Coll) left, (Integer) right);
                default -> throw new EvaluationException("Unsupported binary operation " + op.opName());
            };
        } catch (ArithmeticException e) {
            throw new EvaluationException(e.getMessage(), e);
        }
        addCost(binary, binary.left().type(), op == OpCode.SIGMA_AND || op == OpCode.SIGMA_OR ? 2 : 0);
        return result;
    }

    private static Object byIndex(Coll coll, int index) {
        if (index < 0 || index >= coll.size()) {
            throw new EvaluationException("Index " + index + " is out of bounds for collection of size " + coll.size());
        }
        return coll.get(index);
    }

    private Object evalUnary(Map<Integer, Object> env, Expr.UnaryOp unary) {
        var input = eval(env, unary.input());
        int nItems = 0;
        Object result;
        try {
            switch (unary.op()) {
                case LOGICAL_NOT -> result = !(Boolean) input;
                case NEGATION -> result = Numerics.negate(input, unary.type());
                case BOOL_TO_SIGMA_PROP -> result = SigmaBoolean.of((Boolean) input);
                case UPCAST, DOWNCAST -> result = Numerics.convert(input, unary.type());
                case EXTRACT_AMOUNT -> result = ((ErgoBox) input).value();
                case EXTRACT_ID -> result = Coll.fromHex(((ErgoBox) input).id());
                case EXTRACT_CREATION_INFO -> result = creationInfo((ErgoBox) input);
                case TOKENS -> result = tokens((ErgoBox) input);
                case SIZE_OF -> result = ((Coll) input).size();
                case OPTION_GET -> result = ((Optional<?>) input).orElseThrow(
                    () -> new EvaluationException("Option.get on an empty Option"));
                case OPTION_IS_DEFINED -> result = ((Optional<?>) input).isPresent();
                case AND, OR -> {
                    var items = ((Coll) input).items();
                    nItems = items.size();
                    result = unary.op() == OpCode.AND
                        ? items.stream().allMatch(Boolean.TRUE::equals)
                        : items.stream().anyMatch(Boolean.TRUE::equals);
                }
                case DECODE_POINT -> result = GroupElement.decode((Coll) input);
                case PROVE_DLOG -> result = new SigmaBoolean.ProveDlog((GroupElement) input);
                default -> throw new EvaluationException("Unsupported unary operation " + unary.opName());
            }
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new EvaluationException(unary.opName() + " failed: " + e.getMessage(), e);
        }
        addCost(unary, unary.input().type(), nItems);
        return result;
    }

    private static Pair creationInfo(ErgoBox box) {
        var reference = ByteBuffer.allocate(box.transactionId().length() / 2 + 2)
            .put(HexFormat.of().parseHex(box.transactionId()))
            .putShort(box.index())
            .array();
        return new Pair(box.creationHeight(), Coll.ofBytes(reference));
    }

    private static Coll tokens(ErgoBox box) {
        var items = new ArrayList<Object>();
        for (var token : box.tokens()) {
            items.add(new Pair(Coll.fromHex(token.id()), token.amount()));
        }
        return new Coll(items);
    }

    private static Optional<Object> register(ErgoBox box, Expr.ExtractRegisterAs extract) {
        var stored = box.register(RegisterId.of(extract.register()));
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        var constant = stored.get();
        if (!constant.type().equals(extract.elemType())) {
            throw new EvaluationException("Register R" + extract.register() + " holds " + constant.type()
                + " but " + extract.elemType() + " was requested");
        }
        return Optional.of(constant.value());
    }

    private Object evalCollectionOp(Map<Integer, Object> env, Expr.CollectionOp op) {
        var input = (Coll) eval(env, op.input());
        Object zero = op.zero().isPresent() ? eval(env, op.zero().get()) : null;
        var closure = asClosure(eval(env, op.func()));
        Object result;
        switch (op.op()) {
            case MAP -> {
                var mapped = new ArrayList<Object>();
                for (var item : input.items()) {
                    mapped.add(applyClosure(closure, List.of(item)));
                }
                result = new Coll(mapped);
            }
            case FILTER -> {
                var kept = new ArrayList<Object>();
                for (var item : input.items()) {
                    if ((Boolean) applyClosure(closure, List.of(item))) {
                        kept.add(item);
                    }
                }
                result = new Coll(kept);
            }
            case EXISTS -> {
                boolean found = false;
                for (var item : input.items()) {
                    if ((Boolean) applyClosure(closure, List.of(item))) {
                        found = true;
                        break;
                    }
                }
                result = found;
            }
            case FOR_ALL -> {
                boolean all = true;
                for (var item : input.items()) {
                    if (!(Boolean) applyClosure(closure, List.of(item))) {
                        all = false;
                        break;
                    }
                }
                result = all;
            }
            case FLAT_MAP -> {
                var flattened = new ArrayList<Object>();
                for (var item : input.items()) {
                    flattened.addAll(((Coll) applyClosure(closure, List.of(item))).items());
                }
                result = new Coll(flattened);
            }
            case FOLD -> {
                var accumulated = zero;
                for (var item : input.items()) {
                    accumulated = applyClosure(closure, List.of(accumulated, item));
                }
                result = accumulated;
            }
            default -> throw new EvaluationException("Unsupported collection operation " + op.opName());
        }
        addCost(op, op.input().type(), input.size());
        return result;
    }

    private void addCost(Expr node, SType operandType, int nItems) {
        var kind = CostTable.costKind(node.op());
        CostItem item;
        if (kind instanceof CostKind.FixedCost fixed) {
            item = new CostItem.FixedCostItem(node.opName(), fixed);
        } else if (kind instanceof CostKind.TypeBasedCost typeBased) {
            item = new CostItem.TypeBasedCostItem(node.opName(), typeBased, operandType);
        } else {
            item = new CostItem.SeqCostItem(node.opName(), (CostKind.PerItemCost) kind, nItems);
        }
        if (settings.costTracingEnabled()) {
            costTrace.add(item);
        }
        accumulator.add(item.cost());
    }
}
