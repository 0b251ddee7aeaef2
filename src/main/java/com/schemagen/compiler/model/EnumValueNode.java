package com.schemagen.compiler.model;

import lombok.Builder;

public class EnumValueNode extends SchemaNode {
    private final int ordinal;
    private final boolean explicitOrdinal;

    @Builder
    public EnumValueNode(String name, int ordinal, boolean explicitOrdinal, String comment,
                         SourcePosition position) {
        super(name, comment, position);
        this.ordinal = ordinal;
        this.explicitOrdinal = explicitOrdinal;
    }

    public int getOrdinal() {
        return ordinal;
    }

    /**
     * False when the ordinal was assigned as previous + 1.
     */
    public boolean isExplicitOrdinal() {
        return explicitOrdinal;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor) {
        visitor.visit(this);
    }
}
