package com.schemagen.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A package as seen in one file. The empty name is the default package.
 * Declarations accumulate when a file reopens the package.
 */
public class PackageNode extends SchemaNode {
    private final List<TypeDeclaration> declarations = new ArrayList<>();
    private String fileComment;

    public PackageNode(String name, String comment, SourcePosition position) {
        super(name, null, position);
        this.fileComment = comment;
    }

    public void addDeclaration(TypeDeclaration declaration) {
        declarations.add(declaration);
    }

    public void appendComment(String more) {
        if (more == null) {
            return;
        }
        fileComment = fileComment == null ? more : fileComment + "\n" + more;
    }

    public List<TypeDeclaration> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public boolean isDefaultPackage() {
        return name.isEmpty();
    }

    /**
     * The comment written before the {@code package} statement.
     */
    @Override
    public String getComment() {
        return fileComment;
    }

    @Override
    public boolean hasComment() {
        return fileComment != null;
    }

    @Override
    public void accept(SchemaNodeVisitor visitor) {
        visitor.visit(this);
    }
}
