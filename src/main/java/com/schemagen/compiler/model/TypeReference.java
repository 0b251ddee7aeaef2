package com.schemagen.compiler.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lombok.Getter;

/**
 * The declared type of a field.
 *
 * A reference is either a primitive, a resolved handle to a declaration, or an
 * unresolved name. The only state change is unresolved to declared, done once by
 * the resolver. The handle does not own the declaration; its package does.
 */
@Getter
public class TypeReference {

    public enum Kind {
        PRIMITIVE,
        DECLARED,
        UNRESOLVED
    }

    private Kind kind;
    private final String rawName;
    private final String contextPackage;
    private final SourcePosition position;
    private final PrimitiveType primitive;
    private TypeDeclaration declaration;

    private TypeReference(Kind kind, String rawName, String contextPackage, SourcePosition position,
                          PrimitiveType primitive) {
        this.kind = kind;
        this.rawName = rawName;
        this.contextPackage = contextPackage == null ? "" : contextPackage;
        this.position = position;
        this.primitive = primitive;
    }

    public static TypeReference primitive(PrimitiveType primitive, SourcePosition position) {
        return new TypeReference(Kind.PRIMITIVE, primitive.getTypeName(), "", position, primitive);
    }

    public static TypeReference unresolved(String rawName, String contextPackage, SourcePosition position) {
        return new TypeReference(Kind.UNRESOLVED, rawName, contextPackage, position, null);
    }

    public void resolveTo(TypeDeclaration target) {
        Objects.requireNonNull(target, "target");
        if (kind != Kind.UNRESOLVED) {
            throw new IllegalStateException("type reference '" + rawName + "' is already " + kind);
        }
        this.declaration = target;
        this.kind = Kind.DECLARED;
    }

    public boolean isPrimitive() {
        return kind == Kind.PRIMITIVE;
    }

    public boolean isDeclared() {
        return kind == Kind.DECLARED;
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }

    /**
     * Qualified names to try, in order. A simple name written inside a package
     * names a type of that package only. A dotted name is taken as written first,
     * then relative to the package it was written in.
     */
    public List<String> candidateNames() {
        List<String> candidates = new ArrayList<>();
        if (contextPackage.isEmpty()) {
            candidates.add(rawName);
        } else if (!rawName.contains(".")) {
            candidates.add(contextPackage + "." + rawName);
        } else {
            candidates.add(rawName);
            candidates.add(contextPackage + "." + rawName);
        }
        return candidates;
    }

    /**
     * Name used by the dumps. Unresolved dotted names are shown as written;
     * unresolved simple names are assumed to live in the current package.
     */
    public String getDisplayName() {
        return switch (kind) {
            case PRIMITIVE -> primitive.getTypeName();
            case DECLARED -> declaration.getQualifiedName();
            case UNRESOLVED -> rawName.contains(".") || contextPackage.isEmpty()
                    ? rawName
                    : contextPackage + "." + rawName;
        };
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
