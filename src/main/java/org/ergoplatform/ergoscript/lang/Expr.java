package org.ergoplatform.ergoscript.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed expression tree produced by {@link Parser}. Each node carries its op code, static type and
 * the position it was parsed from. {@link #children()} lists sub-expressions in evaluation order.
 */
public abstract class Expr {
    private final OpCode op;
    private final SType type;
    private final SourceContext source;

    protected Expr(OpCode op, SType type, SourceContext source) {
        this.op = Objects.requireNonNull(op, "op");
        this.type = Objects.requireNonNull(type, "type");
        this.source = source;
    }

    public OpCode op() {
        return op;
    }

    public String opName() {
        return op.opName();
    }

    public SType type() {
        return type;
    }

    public Optional<SourceContext> source() {
        return Optional.ofNullable(source);
    }

    public abstract List<Expr> children();

    @Override
    public String toString() {
        var children = children();
        if (children.isEmpty()) {
            return opName();
        }
        var joined = new StringBuilder(opName()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                joined.append(", ");
            }
            joined.append(children.get(i));
        }
        return joined.append(')').toString();
    }

    public static final class Constant extends Expr {
        private final Object value;

        public Constant(SType type, Object value, SourceContext source) {
            super(OpCode.CONSTANT, type, source);
            this.value = value;
        }

        public Object value() {
            return value;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return "Constant(" + value + ": " + type() + ")";
        }
    }

    public static final class ConstantPlaceholder extends Expr {
        private final int index;

        public ConstantPlaceholder(int index, SType type, SourceContext source) {
            super(OpCode.CONSTANT_PLACEHOLDER, type, source);
            this.index = index;
        }

        public int index() {
            return index;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    public static final class ValUse extends Expr {
        private final int id;
        private final String name;

        public ValUse(int id, String name, SType type, SourceContext source) {
            super(OpCode.VAL_USE, type, source);
            this.id = id;
            this.name = name;
        }

        public int id() {
            return id;
        }

        public String name() {
            return name;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return "ValUse(" + name + ")";
        }
    }

    public static final class ValDef extends Expr {
        private final int id;
        private final String name;
        private final Expr rhs;

        public ValDef(int id, String name, Expr rhs, SourceContext source) {
            super(OpCode.VAL_DEF, rhs.type(), source);
            this.id = id;
            this.name = name;
            this.rhs = rhs;
        }

        public int id() {
            return id;
        }

        public String name() {
            return name;
        }

        public Expr rhs() {
            return rhs;
        }

        @Override
        public List<Expr> children() {
            return List.of(rhs);
        }
    }

    public static final class BlockValue extends Expr {
        private final List<ValDef> items;
        private final Expr result;

        public BlockValue(List<ValDef> items, Expr result, SourceContext source) {
            super(OpCode.BLOCK, result.type(), source);
            this.items = List.copyOf(items);
            this.result = result;
        }

        public List<ValDef> items() {
            return items;
        }

        public Expr result() {
            return result;
        }

        @Override
        public List<Expr> children() {
            var all = new ArrayList<Expr>(items);
            all.add(result);
            return all;
        }
    }

    public record FuncArg(int id, String name, SType type) {
    }

    public static final class FuncValue extends Expr {
        private final List<FuncArg> args;
        private final Expr body;

        public FuncValue(List<FuncArg> args, Expr body, SourceContext source) {
            super(OpCode.FUNC_VALUE, new SType.SFunc(args.stream().map(FuncArg::type).toList(), body.type()), source);
            this.args = List.copyOf(args);
            this.body = body;
        }

        public List<FuncArg> args() {
            return args;
        }

        public Expr body() {
            return body;
        }

        @Override
        public List<Expr> children() {
            return List.of(body);
        }
    }

    public static final class Apply extends Expr {
        private final Expr func;
        private final List<Expr> args;

        public Apply(Expr func, List<Expr> args, SType type, SourceContext source) {
            super(OpCode.APPLY, type, source);
            this.func = func;
            this.args = List.copyOf(args);
        }

        public Expr func() {
            return func;
        }

        public List<Expr> args() {
            return args;
        }

        @Override
        public List<Expr> children() {
            var all = new ArrayList<Expr>();
            all.add(func);
            all.addAll(args);
            return all;
        }
    }

    public static final class If extends Expr {
        private final Expr condition;
        private final Expr thenBranch;
        private final Expr elseBranch;

        public If(Expr condition, Expr thenBranch, Expr elseBranch, SType type, SourceContext source) {
            super(OpCode.IF, type, source);
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public Expr condition() {
            return condition;
        }

        public Expr thenBranch() {
            return thenBranch;
        }

        public Expr elseBranch() {
            return elseBranch;
        }

        @Override
        public List<Expr> children() {
            return List.of(condition, thenBranch, elseBranch);
        }
    }

    /** Leaf reading a context-level value such as HEIGHT or SELF. */
    public static final class ContextProperty extends Expr {
        public ContextProperty(OpCode op, SType type, SourceContext source) {
            super(op, type, source);
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    public static final class BinaryOp extends Expr {
        private final Expr left;
        private final Expr right;

        public BinaryOp(OpCode op, Expr left, Expr right, SType type, SourceContext source) {
            super(op, type, source);
            this.left = left;
            this.right = right;
        }

        public Expr left() {
            return left;
        }

        public Expr right() {
            return right;
        }

        @Override
        public List<Expr> children() {
            return List.of(left, right);
        }
    }

    public static final class UnaryOp extends Expr {
        private final Expr input;

        public UnaryOp(OpCode op, Expr input, SType type, SourceContext source) {
            super(op, type, source);
            this.input = input;
        }

        public Expr input() {
            return input;
        }

        @Override
        public List<Expr> children() {
            return List.of(input);
        }
    }

    public static final class ExtractRegisterAs extends Expr {
        private final Expr box;
        private final int register;
        private final SType elemType;

        public ExtractRegisterAs(Expr box, int register, SType elemType, SourceContext source) {
            super(OpCode.EXTRACT_REGISTER_AS, new SType.SOption(elemType), source);
            this.box = box;
            this.register = register;
            this.elemType = elemType;
        }

        public Expr box() {
            return box;
        }

        /** Register number, 4 to 9. */
        public int register() {
            return register;
        }

        public SType elemType() {
            return elemType;
        }

        @Override
        public List<Expr> children() {
            return List.of(box);
        }
    }

    public static final class SelectField extends Expr {
        private final Expr input;
        private final int index;

        public SelectField(Expr input, int index, SType type, SourceContext source) {
            super(OpCode.SELECT_FIELD, type, source);
            this.input = input;
            this.index = index;
        }

        public Expr input() {
            return input;
        }

        /** 1-based field index. */
        public int index() {
            return index;
        }

        @Override
        public List<Expr> children() {
            return List.of(input);
        }
    }

    public static final class PropertyCall extends Expr {
        private final Expr input;
        private final String property;

        public PropertyCall(Expr input, String property, SType type, SourceContext source) {
            super(OpCode.PROPERTY_CALL, type, source);
            this.input = input;
            this.property = property;
        }

        public Expr input() {
            return input;
        }

        public String property() {
            return property;
        }

        @Override
        public List<Expr> children() {
            return List.of(input);
        }
    }

    public static final class TupleExpr extends Expr {
        private final Expr first;
        private final Expr second;

        public TupleExpr(Expr first, Expr second, SourceContext source) {
            super(OpCode.TUPLE, new SType.STuple(first.type(), second.type()), source);
            this.first = first;
            this.second = second;
        }

        public Expr first() {
            return first;
        }

        public Expr second() {
            return second;
        }

        @Override
        public List<Expr> children() {
            return List.of(first, second);
        }
    }

    public static final class ConcreteCollection extends Expr {
        private final List<Expr> items;

        public ConcreteCollection(List<Expr> items, SType elemType, SourceContext source) {
            super(OpCode.CONCRETE_COLLECTION, new SType.SColl(elemType), source);
            this.items = List.copyOf(items);
        }

        public List<Expr> items() {
            return items;
        }

        @Override
        public List<Expr> children() {
            return items;
        }
    }

    /** map, filter, exists, forall, flatMap and fold over a collection. */
    public static final class CollectionOp extends Expr {
        private final Expr input;
        private final Expr zero;
        private final Expr func;

        public CollectionOp(OpCode op, Expr input, Expr zero, Expr func, SType type, SourceContext source) {
            super(op, type, source);
            this.input = input;
            this.zero = zero;
            this.func = func;
        }

        public Expr input() {
            return input;
        }

        /** Initial accumulator; only present for fold. */
        public Optional<Expr> zero() {
            return Optional.ofNullable(zero);
        }

        public Expr func() {
            return func;
        }

        @Override
        public List<Expr> children() {
            return zero == null ? List.of(input, func) : List.of(input, zero, func);
        }
    }
}
