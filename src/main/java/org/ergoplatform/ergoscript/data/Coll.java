package org.ergoplatform.ergoscript.data;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/** Immutable runtime collection. Byte collections hold {@link Byte} items. */
public record Coll(List<Object> items) {
    public Coll {
        items = List.copyOf(items);
    }

    public static Coll of(List<?> items) {
        return new Coll(new ArrayList<Object>(items));
    }

    public static Coll empty() {
        return new Coll(List.of());
    }

    public static Coll ofBytes(byte[] bytes) {
        var items = new ArrayList<Object>(bytes.length);
        for (byte b : bytes) {
            items.add(b);
        }
        return new Coll(items);
    }

    public static Coll fromHex(String hex) {
        return ofBytes(HexFormat.of().parseHex(hex));
    }

    public int size() {
        return items.size();
    }

    public Object get(int index) {
        return items.get(index);
    }

    public byte[] toBytes() {
        var bytes = new byte[items.size()];
        for (int i = 0; i < bytes.length; i++) {
            if (!(items.get(i) instanceof Byte b)) {
                throw new IllegalStateException("Collection item " + i + " is not a byte");
            }
            bytes[i] = b;
        }
        return bytes;
    }

    public String toHex() {
        return HexFormat.of().formatHex(toBytes());
    }
}
