package org.ergoplatform.ergoscript.lang;

import java.util.List;
import org.ergoplatform.ergoscript.data.SigmaBoolean;

/**
 * Compiled guard script: a SigmaProp-typed root plus the segregated constants referenced by its
 * {@link Expr.ConstantPlaceholder} nodes.
 */
public record ErgoTree(byte version, Expr root, List<Expr.Constant> constants) {
    public static final byte DEFAULT_VERSION = 0;
    public static final byte MAX_VERSION = 3;

    public ErgoTree {
        if (version < 0 || version > MAX_VERSION) {
            throw new IllegalArgumentException("Unsupported ErgoTree version " + version);
        }
        if (!SType.SIGMA_PROP.equals(root.type())) {
            throw new IllegalArgumentException("ErgoTree root must be SigmaProp, got " + root.type());
        }
        constants = List.copyOf(constants);
    }

    public static ErgoTree fromProposition(byte version, Expr proposition) {
        return new ErgoTree(version, proposition, List.of());
    }

    /** Guard that is always satisfied. */
    public static ErgoTree trueTree() {
        return fromProposition(DEFAULT_VERSION, new Expr.Constant(SType.SIGMA_PROP, SigmaBoolean.TrivialProp.TRUE, null));
    }

    public ErgoTree withConstants(List<Expr.Constant> replacement) {
        return new ErgoTree(version, root, replacement);
    }
}
