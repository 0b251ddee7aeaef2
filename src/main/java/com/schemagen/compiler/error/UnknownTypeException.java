package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

public class UnknownTypeException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final String reference;
    private final String usedIn;

    public UnknownTypeException(String reference, String usedIn, SourcePosition position) {
        super(position, "unknown type '" + reference + "' used in '" + usedIn + "'");
        this.reference = reference;
        this.usedIn = usedIn;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Qualified name of the struct holding the offending field.
     */
    public String getUsedIn() {
        return usedIn;
    }
}
