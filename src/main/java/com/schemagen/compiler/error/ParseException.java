package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

/**
 * The parser found a token it did not expect. Parsing stops at the first one.
 */
public class ParseException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public ParseException(SourcePosition position, String expected, String found) {
        super(position, "expected " + expected + " but found " + found);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
