package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

/**
 * An array dimension names something that cannot size the array: an unknown
 * member, one declared after the array, or one of the wrong type.
 */
public class UnknownDimensionFieldException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final String structName;
    private final String reason;

    public UnknownDimensionFieldException(String fieldName, String structName, String reason, SourcePosition position) {
        super(position, "array dimension '" + fieldName + "' in '" + structName + "': " + reason);
        this.fieldName = fieldName;
        this.structName = structName;
        this.reason = reason;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getStructName() {
        return structName;
    }

    public String getReason() {
        return reason;
    }
}
