package org.ergoplatform.ergoscript.eval;

/** Token held by a box; {@code id} is hex encoded. */
public record ErgoToken(String id, long amount) {
}
