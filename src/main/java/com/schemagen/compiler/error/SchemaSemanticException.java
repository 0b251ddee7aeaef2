package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

/**
 * The source parsed, but what it says is illegal: duplicate member names,
 * repeated enum ordinals, constants out of range, empty arrays.
 */
public class SchemaSemanticException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    public SchemaSemanticException(SourcePosition position, String detail) {
        super(position, detail);
    }
}
