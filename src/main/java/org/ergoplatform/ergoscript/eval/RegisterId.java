package org.ergoplatform.ergoscript.eval;

/** Non-mandatory box registers. */
public enum RegisterId {
    R4(4), R5(5), R6(6), R7(7), R8(8), R9(9);

    private final int number;

    RegisterId(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public static RegisterId of(int number) {
        for (var id : values()) {
            if (id.number == number) {
                return id;
            }
        }
        throw new IllegalArgumentException("No register R" + number);
    }

    public static RegisterId parse(String name) {
        if (name == null || !name.matches("R[4-9]")) {
            throw new IllegalArgumentException("Invalid register name: " + name);
        }
        return of(name.charAt(1) - '0');
    }
}
