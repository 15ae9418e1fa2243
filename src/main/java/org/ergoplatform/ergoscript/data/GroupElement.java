package org.ergoplatform.ergoscript.data;

import java.util.HexFormat;

/**
 * Compressed secp256k1 point kept in its 33-byte encoding. Point arithmetic is out of scope; only
 * the encoding is validated.
 */
public record GroupElement(String hex) {
    public static final int ENCODED_SIZE = 33;

    public GroupElement {
        var bytes = HexFormat.of().parseHex(hex);
        if (bytes.length != ENCODED_SIZE) {
            throw new IllegalArgumentException("Group element must be " + ENCODED_SIZE + " bytes, got " + bytes.length);
        }
        boolean identity = true;
        for (byte b : bytes) {
            identity &= b == 0;
        }
        if (!identity && bytes[0] != 0x02 && bytes[0] != 0x03) {
            throw new IllegalArgumentException("Invalid point encoding prefix " + String.format("%02x", bytes[0]));
        }
        hex = hex.toLowerCase();
    }

    public static GroupElement decode(Coll bytes) {
        return new GroupElement(bytes.toHex());
    }

    public Coll encoded() {
        return Coll.fromHex(hex);
    }
}
