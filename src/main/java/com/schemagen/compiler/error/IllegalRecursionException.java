package com.schemagen.compiler.error;

import java.util.List;

import com.schemagen.compiler.model.SourcePosition;

/**
 * A struct contains itself through fixed-size fields only, which would need
 * infinite storage.
 */
public class IllegalRecursionException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public IllegalRecursionException(List<String> cycle, SourcePosition position) {
        super(position, "illegal fixed-size recursion: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Qualified type names along the cycle; the first name is repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
