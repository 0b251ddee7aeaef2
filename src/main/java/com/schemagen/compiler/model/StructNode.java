package com.schemagen.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Builder;

/**
 * A struct declaration: ordered fields plus inline constants.
 * Fields and constants share one namespace and one declaration order.
 */
public class StructNode extends TypeDeclaration {
    private final List<FieldNode> fields = new ArrayList<>();
    private final List<ConstantNode> constants = new ArrayList<>();
    private int memberCount;

    @Builder
    public StructNode(String name, String packageName, String comment, SourcePosition position) {
        super(name, packageName, comment, position);
    }

    public void addField(FieldNode field) {
        field.setMemberIndex(memberCount++);
        fields.add(field);
    }

    public void addConstant(ConstantNode constant) {
        constant.setMemberIndex(memberCount++);
        constants.add(constant);
    }

    public List<FieldNode> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<ConstantNode> getConstants() {
        return Collections.unmodifiableList(constants);
    }

    public Optional<FieldNode> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    public Optional<ConstantNode> findConstant(String constantName) {
        return constants.stream().filter(c -> c.getName().equals(constantName)).findFirst();
    }

    public boolean hasMember(String memberName) {
        return findField(memberName).isPresent() || findConstant(memberName).isPresent();
    }

    @Override
    public String getKeyword() {
        return "struct";
    }

    @Override
    public void accept(SchemaNodeVisitor visitor) {
        visitor.visit(this);
    }
}
