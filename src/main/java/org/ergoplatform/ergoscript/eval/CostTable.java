package org.ergoplatform.ergoscript.eval;

import org.ergoplatform.ergoscript.lang.OpCode;

/**
 * Cost kind of every operation. These are the bundled evaluator's own units: deterministic and
 * ordered the way on-chain costs are, but not the values the node's JIT interpreter charges.
 */
public final class CostTable {
    private static final CostKind.TypeBasedCost COMPARISON = new CostKind.TypeBasedCost(20, 30, 40);
    private static final CostKind.TypeBasedCost ARITHMETIC = new CostKind.TypeBasedCost(15, 30, 15);
    private static final CostKind.TypeBasedCost NUMERIC_CAST = new CostKind.TypeBasedCost(10, 30, 10);

    private CostTable() {
    }

    public static CostKind costKind(OpCode op) {
        return switch (op) {
            case CONSTANT -> fixed(5);
            case CONSTANT_PLACEHOLDER -> fixed(1);
            case VAL_USE -> fixed(5);
            case VAL_DEF -> fixed(1);
            case BLOCK -> perItem(1, 1, 10);
            case FUNC_VALUE -> fixed(5);
            case APPLY -> fixed(30);
            case IF -> fixed(10);
            case HEIGHT -> fixed(26);
            case SELF, INPUTS, OUTPUTS -> fixed(10);
            case DATA_INPUTS, PRE_HEADER -> fixed(15);
            case GT, LT, GE, LE, EQ, NEQ -> COMPARISON;
            case PLUS, MINUS, MULTIPLY, DIVISION, MODULO, NEGATION -> ARITHMETIC;
            case UPCAST, DOWNCAST -> NUMERIC_CAST;
            case BIN_AND, BIN_OR -> fixed(20);
            case SIGMA_AND, SIGMA_OR -> perItem(10, 2, 1);
            case LOGICAL_NOT, BOOL_TO_SIGMA_PROP, OPTION_GET, TOKENS, TUPLE -> fixed(15);
            case EXTRACT_AMOUNT -> fixed(8);
            case EXTRACT_ID -> fixed(12);
            case EXTRACT_CREATION_INFO -> fixed(16);
            case EXTRACT_REGISTER_AS -> fixed(50);
            case SIZE_OF -> fixed(14);
            case BY_INDEX -> fixed(30);
            case OPTION_IS_DEFINED, SELECT_FIELD, PROPERTY_CALL, PROVE_DLOG -> fixed(10);
            case OPTION_GET_OR_ELSE -> fixed(20);
            case CONCRETE_COLLECTION -> perItem(20, 1, 1);
            case MAP, FILTER -> perItem(20, 1, 10);
            case EXISTS, FOR_ALL -> perItem(20, 5, 10);
            case FLAT_MAP -> perItem(60, 10, 8);
            case FOLD -> perItem(3, 1, 10);
            case AND, OR -> perItem(10, 5, 32);
            case DECODE_POINT -> fixed(300);
        };
    }

    private static CostKind.FixedCost fixed(long cost) {
        return new CostKind.FixedCost(cost);
    }

    private static CostKind.PerItemCost perItem(long base, long perChunk, int chunkSize) {
        return new CostKind.PerItemCost(base, perChunk, chunkSize);
    }
}
