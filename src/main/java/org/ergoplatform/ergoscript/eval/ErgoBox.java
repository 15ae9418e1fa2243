package org.ergoplatform.ergoscript.eval;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.ergoplatform.ergoscript.lang.ErgoTree;
import org.ergoplatform.ergoscript.lang.Expr;

/**
 * On-chain box as seen by a script. {@code id} and {@code transactionId} are hex encoded.
 */
public record ErgoBox(
    String id,
    long value,
    ErgoTree ergoTree,
    int creationHeight,
    List<ErgoToken> tokens,
    Map<RegisterId, Expr.Constant> registers,
    String transactionId,
    short index
) {
    public ErgoBox {
        tokens = List.copyOf(tokens);
        var copy = new EnumMap<RegisterId, Expr.Constant>(RegisterId.class);
        copy.putAll(registers);
        registers = Collections.unmodifiableMap(copy);
    }

    public Optional<Expr.Constant> register(RegisterId id) {
        return Optional.ofNullable(registers.get(id));
    }
}
