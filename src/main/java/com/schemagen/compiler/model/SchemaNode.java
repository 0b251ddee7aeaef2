package com.schemagen.compiler.model;

import lombok.Getter;

/**
 * Base class for all schema AST nodes.
 */
@Getter
public abstract class SchemaNode {
    protected final String name;
    protected final String comment;
    protected final SourcePosition position;

    protected SchemaNode(String name, String comment, SourcePosition position) {
        this.name = name;
        this.comment = comment;
        this.position = position;
    }

    public abstract void accept(SchemaNodeVisitor visitor);

    public boolean hasComment() {
        return comment != null;
    }
}
