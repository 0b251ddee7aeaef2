package com.schemagen.compiler.model;

import lombok.Builder;

/**
 * An inline {@code const} member of a struct. The value is kept as written.
 */
public class ConstantNode extends SchemaNode {
    private final PrimitiveType type;
    private final String value;
    private int memberIndex = -1;

    @Builder
    public ConstantNode(String name, PrimitiveType type, String value, String comment, SourcePosition position) {
        super(name, comment, position);
        this.type = type;
        this.value = value;
    }

    public PrimitiveType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getMemberIndex() {
        return memberIndex;
    }

    void setMemberIndex(int memberIndex) {
        this.memberIndex = memberIndex;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor) {
        visitor.visit(this);
    }
}
