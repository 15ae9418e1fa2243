package org.ergoplatform.ergoscript.lang;

import java.math.BigInteger;

/** Conversions between the numeric runtime representations. */
public final class Numerics {
    private static final BigInteger BIGINT_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
    private static final BigInteger BIGINT_MIN = BigInteger.ONE.shiftLeft(255).negate();

    private Numerics() {
    }

    public static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        throw new IllegalArgumentException("Not a numeric value: " + value);
    }

    /**
     * Converts {@code value} to the representation of {@code target}; narrowing conversions fail
     * with {@link ArithmeticException} when the value does not fit.
     */
    public static Object convert(Object value, SType target) {
        var big = toBigInteger(value);
        if (SType.BYTE.equals(target)) {
            return big.byteValueExact();
        }
        if (SType.INT.equals(target)) {
            return big.intValueExact();
        }
        if (SType.LONG.equals(target)) {
            return big.longValueExact();
        }
        if (SType.BIGINT.equals(target)) {
            return checkBigInt(big);
        }
        throw new IllegalArgumentException("Not a numeric type: " + target);
    }

    public static BigInteger checkBigInt(BigInteger value) {
        if (value.compareTo(BIGINT_MAX) > 0 || value.compareTo(BIGINT_MIN) < 0) {
            throw new ArithmeticException("BigInt overflow: value does not fit in 256 bits");
        }
        return value;
    }

    /** Exact arithmetic in the representation of {@code type}. */
    public static Object arithmetic(OpCode op, Object left, Object right, SType type) {
        var a = toBigInteger(left);
        var b = toBigInteger(right);
        var result = switch (op) {
            case PLUS -> a.add(b);
            case MINUS -> a.subtract(b);
            case MULTIPLY -> a.multiply(b);
            case DIVISION -> {
                if (b.signum() == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                yield a.divide(b);
            }
            case MODULO -> {
                if (b.signum() == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                yield a.remainder(b);
            }
            default -> throw new IllegalArgumentException("Not an arithmetic operation: " + op);
        };
        try {
            return convert(result, type);
        } catch (ArithmeticException e) {
            throw new ArithmeticException(type.name() + " overflow in " + op.opName());
        }
    }

    public static int compare(Object left, Object right) {
        return toBigInteger(left).compareTo(toBigInteger(right));
    }

    public static Object negate(Object value, SType type) {
        return arithmetic(OpCode.MINUS, 0, value, type);
    }
}
