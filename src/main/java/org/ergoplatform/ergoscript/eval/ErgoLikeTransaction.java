package org.ergoplatform.ergoscript.eval;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/** Spending transaction reduced to what scripts can observe. */
public record ErgoLikeTransaction(List<String> inputIds, List<String> dataInputIds, List<ErgoBox> outputCandidates) {
    public ErgoLikeTransaction {
        inputIds = List.copyOf(inputIds);
        dataInputIds = List.copyOf(dataInputIds);
        outputCandidates = List.copyOf(outputCandidates);
    }

    /** Hex id derived from the referenced box ids. */
    public String id() {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            for (var input : inputIds) {
                digest.update(input.getBytes(StandardCharsets.UTF_8));
            }
            digest.update((byte) '|');
            for (var dataInput : dataInputIds) {
                digest.update(dataInput.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
