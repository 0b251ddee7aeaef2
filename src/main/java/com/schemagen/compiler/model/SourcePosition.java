package com.schemagen.compiler.model;

import lombok.Value;

/**
 * A place in a schema file. Lines start at 1, columns at 0.
 */
@Value
public class SourcePosition {
    String file;
    int line;
    int column;

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
