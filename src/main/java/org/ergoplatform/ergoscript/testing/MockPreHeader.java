package org.ergoplatform.ergoscript.testing;

/**
 * Pre-header declared with {@code PREHEADER = PreHeader { ... }}. Byte fields are hex encoded.
 */
public record MockPreHeader(
    byte version,
    String parentId,
    long timestamp,
    long nBits,
    int height,
    String minerPk,
    String votes
) {
    public static final byte DEFAULT_VERSION = 2;
    public static final long DEFAULT_N_BITS = 117_440_512L;
    public static final String DEFAULT_PARENT_ID = "00".repeat(32);
    public static final String DEFAULT_MINER_PK = "02".repeat(33);
    public static final String DEFAULT_VOTES = "000000";
}
