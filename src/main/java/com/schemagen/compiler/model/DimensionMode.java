package com.schemagen.compiler.model;

/**
 * How the length of one array dimension is known.
 * The codes take part in both hash algorithms; changing them breaks compatibility.
 */
public enum DimensionMode {
    /**
     * Fixed at compile time, from a literal or a {@code const} member.
     */
    CONST(0),

    /**
     * Read at runtime from an earlier integer field of the same struct.
     */
    VAR(1);

    private final int code;

    DimensionMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
