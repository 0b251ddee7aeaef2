package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

public class DuplicateTypeException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final String qualifiedName;
    private final transient SourcePosition firstDeclaredAt;

    public DuplicateTypeException(String qualifiedName, SourcePosition position, SourcePosition firstDeclaredAt) {
        super(position, "duplicate type '" + qualifiedName + "', previously declared at " + firstDeclaredAt);
        this.qualifiedName = qualifiedName;
        this.firstDeclaredAt = firstDeclaredAt;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public SourcePosition getFirstDeclaredAt() {
        return firstDeclaredAt;
    }
}
