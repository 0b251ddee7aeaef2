package com.schemagen.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

/**
 * The parse result of one schema file.
 */
@Getter
@Builder
public class SchemaFile {
    @NonNull
    private final String fileName;

    /** Packages in order of first appearance in the file. */
    @Singular("packageNode")
    private final List<PackageNode> packages;

    /** All declarations in source order, across packages. */
    @Singular
    private final List<TypeDeclaration> declarations;

    public List<StructNode> getStructs() {
        return declarations.stream()
                .filter(StructNode.class::isInstance)
                .map(StructNode.class::cast)
                .toList();
    }

    public boolean isEmpty() {
        return declarations.isEmpty() && packages.isEmpty();
    }
}
