package com.schemagen.compiler.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.schemagen.compiler.model.EnumNode;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;

import lombok.Builder;
import lombok.Value;

/**
 * A fully resolved compilation unit: every type reference bound, every array
 * dimension bound, no fixed-size recursion. This is what code emitters consume.
 */
@Value
@Builder
public class ResolvedUnit {

    /** Declarations by qualified name, sorted. */
    Map<String, TypeDeclaration> types;

    /** Parsed files in input order. */
    List<SchemaFile> files;

    TypeGraph graph;

    public Optional<TypeDeclaration> findType(String qualifiedName) {
        return Optional.ofNullable(types.get(qualifiedName));
    }

    public List<TypeDeclaration> getDeclarations() {
        return List.copyOf(types.values());
    }

    public List<StructNode> getStructs() {
        return types.values().stream()
                .filter(StructNode.class::isInstance)
                .map(StructNode.class::cast)
                .toList();
    }

    public List<EnumNode> getEnums() {
        return types.values().stream()
                .filter(EnumNode.class::isInstance)
                .map(EnumNode.class::cast)
                .toList();
    }

    /**
     * Declarations grouped by package name, both levels sorted.
     */
    public Map<String, List<TypeDeclaration>> getPackages() {
        Map<String, List<TypeDeclaration>> byPackage = new TreeMap<>();
        for (TypeDeclaration declaration : types.values()) {
            byPackage.computeIfAbsent(declaration.getPackageName(), p -> new ArrayList<>()).add(declaration);
        }
        return byPackage;
    }

    /**
     * @throws IllegalArgumentException if no such type exists
     * @throws IllegalStateException if the unit has not been hashed yet
     */
    public long getHash(String qualifiedName) {
        return findType(qualifiedName)
                .orElseThrow(() -> new IllegalArgumentException("unknown type: " + qualifiedName))
                .getHash();
    }

    public int size() {
        return types.size();
    }
}
