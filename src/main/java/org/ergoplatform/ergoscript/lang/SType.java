package org.ergoplatform.ergoscript.lang;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Static types of the supported ErgoScript subset.
 */
public interface SType {
    SPrimitive BOOLEAN = new SPrimitive("Boolean");
    SPrimitive BYTE = new SPrimitive("Byte");
    SPrimitive INT = new SPrimitive("Int");
    SPrimitive LONG = new SPrimitive("Long");
    SPrimitive BIGINT = new SPrimitive("BigInt");
    SPrimitive BOX = new SPrimitive("Box");
    SPrimitive SIGMA_PROP = new SPrimitive("SigmaProp");
    SPrimitive GROUP_ELEMENT = new SPrimitive("GroupElement");
    SPrimitive PRE_HEADER = new SPrimitive("PreHeader");
    SPrimitive CONTEXT = new SPrimitive("Context");
    SPrimitive STRING = new SPrimitive("String");
    SPrimitive ANY = new SPrimitive("Any");

    SColl BYTES = new SColl(BYTE);

    String name();

    static boolean isNumeric(SType type) {
        return numericRank(type) >= 0;
    }

    /** Widening order used for implicit upcasts; -1 for non-numeric types. */
    static int numericRank(SType type) {
        if (BYTE.equals(type)) {
            return 0;
        }
        if (INT.equals(type)) {
            return 1;
        }
        if (LONG.equals(type)) {
            return 2;
        }
        if (BIGINT.equals(type)) {
            return 3;
        }
        return -1;
    }

    static SType widest(SType left, SType right) {
        return numericRank(left) >= numericRank(right) ? left : right;
    }

    static SType byName(String name) {
        return switch (name) {
            case "Boolean" -> BOOLEAN;
            case "Byte" -> BYTE;
            case "Int" -> INT;
            case "Long" -> LONG;
            case "BigInt" -> BIGINT;
            case "Box" -> BOX;
            case "SigmaProp" -> SIGMA_PROP;
            case "GroupElement" -> GROUP_ELEMENT;
            case "PreHeader" -> PRE_HEADER;
            case "Context" -> CONTEXT;
            default -> null;
        };
    }

    record SPrimitive(String name) implements SType {
        @Override
        public String toString() {
            return name;
        }
    }

    record SColl(SType elem) implements SType {
        @Override
        public String name() {
            return "Coll[" + elem.name() + "]";
        }

        @Override
        public String toString() {
            return name();
        }
    }

    record SOption(SType elem) implements SType {
        @Override
        public String name() {
            return "Option[" + elem.name() + "]";
        }

        @Override
        public String toString() {
            return name();
        }
    }

    record STuple(SType first, SType second) implements SType {
        @Override
        public String name() {
            return "(" + first.name() + ", " + second.name() + ")";
        }

        @Override
        public String toString() {
            return name();
        }
    }

    record SFunc(List<SType> args, SType result) implements SType {
        public SFunc {
            args = List.copyOf(args);
        }

        @Override
        public String name() {
            return args.stream().map(SType::name).collect(Collectors.joining(", ", "(", ")")) + " => " + result.name();
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
