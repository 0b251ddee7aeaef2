package com.schemagen.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Builder;

public class EnumNode extends TypeDeclaration {
    private final List<EnumValueNode> values = new ArrayList<>();

    @Builder
    public EnumNode(String name, String packageName, String comment, SourcePosition position) {
        super(name, packageName, comment, position);
    }

    public void addValue(EnumValueNode value) {
        values.add(value);
    }

    public List<EnumValueNode> getValues() {
        return Collections.unmodifiableList(values);
    }

    public Optional<EnumValueNode> findValue(String valueName) {
        return values.stream().filter(v -> v.getName().equals(valueName)).findFirst();
    }

    public Optional<EnumValueNode> findByOrdinal(int ordinal) {
        return values.stream().filter(v -> v.getOrdinal() == ordinal).findFirst();
    }

    @Override
    public String getKeyword() {
        return "enum";
    }

    @Override
    public void accept(SchemaNodeVisitor visitor) {
        visitor.visit(this);
    }
}
