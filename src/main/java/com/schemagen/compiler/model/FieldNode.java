package com.schemagen.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Builder;

/**
 * A struct field: name, declared type and zero or more array dimensions.
 */
public class FieldNode extends SchemaNode {
    private final TypeReference type;
    private final List<Dimension> dimensions;
    private int memberIndex = -1;

    @Builder
    public FieldNode(String name, TypeReference type, List<Dimension> dimensions, String comment,
                     SourcePosition position) {
        super(name, comment, position);
        this.type = type;
        this.dimensions = dimensions != null ? new ArrayList<>(dimensions) : new ArrayList<>();
    }

    public TypeReference getType() {
        return type;
    }

    public List<Dimension> getDimensions() {
        return Collections.unmodifiableList(dimensions);
    }

    public void addDimension(Dimension dimension) {
        dimensions.add(dimension);
    }

    public boolean isScalar() {
        return dimensions.isEmpty();
    }

    /**
     * True when at least one dimension is read from another field at runtime.
     */
    public boolean isDynamic() {
        return dimensions.stream().anyMatch(Dimension::isDynamic);
    }

    /**
     * Position among all members (fields and constants) of the owning struct.
     */
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

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.getDisplayName()).append(' ').append(name);
        dimensions.forEach(sb::append);
        return sb.toString();
    }
}
