package com.schemagen.compiler.hash;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.model.Dimension;
import com.schemagen.compiler.model.DimensionMode;
import com.schemagen.compiler.model.EnumNode;
import com.schemagen.compiler.model.EnumValueNode;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;
import com.schemagen.compiler.model.TypeReference;
import com.schemagen.compiler.resolve.ResolvedUnit;
import com.schemagen.compiler.resolve.TypeGraph;
import com.schemagen.compiler.resolve.TypeGraph.EdgeKind;

/**
 * Computes the 64-bit structural fingerprint of resolved types.
 *
 * The fingerprint depends on the type's simple name, its members' names, array
 * shapes and (recursively) member types, but never on declaration order or on
 * which file a type came from. Peers compare fingerprints on the wire, so the
 * mixing steps below must not change.
 *
 * A type that is reached again while its own fingerprint is being computed
 * contributes 0. Such re-entry is only legal through a runtime-sized field; the
 * resolver rejects fixed-size recursion before hashing.
 */
public class TypeHashEngine {
    private static final Logger log = LoggerFactory.getLogger(TypeHashEngine.class);

    public static final long SEED = 0x12345678L;

    private final TypeGraph graph;

    private final Map<TypeDeclaration, Long> memo = new IdentityHashMap<>();

    // declarations currently being hashed, outermost first
    private final List<TypeDeclaration> inProgress = new ArrayList<>();
    // kind of the edge from inProgress[i] to inProgress[i + 1]
    private final List<EdgeKind> pathKinds = new ArrayList<>();

    /**
     * @param graph used to decide which results are safe to memoize; null
     *              disables memoization
     */
    public TypeHashEngine(TypeGraph graph) {
        this.graph = graph;
    }

    /**
     * Hashes every type of the unit, attaches each fingerprint to its
     * declaration and returns them by qualified name, sorted.
     */
    public static Map<String, Long> hashAll(ResolvedUnit unit) {
        TypeHashEngine engine = new TypeHashEngine(unit.getGraph());
        Map<String, Long> hashes = new TreeMap<>();
        for (TypeDeclaration declaration : unit.getDeclarations()) {
            long hash = engine.hash(declaration);
            declaration.setHash(hash);
            hashes.put(declaration.getQualifiedName(), hash);
            log.debug("{} {} -> 0x{}", declaration.getKeyword(), declaration.getQualifiedName(),
                    String.format("%016x", hash));
        }
        return hashes;
    }

    /**
     * Fingerprint of one declaration, computed from an empty recursion guard.
     *
     * @throws IllegalStateException if a field type is unresolved, a dimension is
     *                               unbound, or the type contains itself with fixed
     *                               size
     */
    public long hash(TypeDeclaration declaration) {
        inProgress.clear();
        pathKinds.clear();
        return compute(declaration);
    }

    private long compute(TypeDeclaration declaration) {
        Long cached = memo.get(declaration);
        if (cached != null) {
            return cached;
        }

        int index = indexInProgress(declaration);
        if (index >= 0) {
            checkReentryIsDynamic(declaration, index);
            return 0L;
        }

        inProgress.add(declaration);
        long acc = mixBytes(SEED, declaration.getName());

        if (declaration instanceof StructNode struct) {
            for (FieldNode field : struct.getFields()) {
                acc = mixField(acc, field);
            }
        } else if (declaration instanceof EnumNode enumNode) {
            for (EnumValueNode value : enumNode.getValues()) {
                acc = mixBytes(acc, value.getName());
            }
        }

        inProgress.remove(inProgress.size() - 1);
        long result = Long.rotateLeft(acc, 1);

        if (graph != null && !graph.isOnCycle(declaration)) {
            memo.put(declaration, result);
        }
        return result;
    }

    private long mixField(long acc, FieldNode field) {
        acc = mixBytes(acc, field.getName());
        acc = mixWord(acc, field.getDimensions().size());

        for (Dimension dimension : field.getDimensions()) {
            if (!dimension.isBound()) {
                throw new IllegalStateException("unbound array dimension '" + dimension.getSize() + "' on field "
                        + field.getName());
            }
            acc = mixByte(acc, dimension.getMode().getCode());
            if (dimension.getMode() == DimensionMode.CONST) {
                acc = mixWord(acc, dimension.getConstantValue());
            }
        }

        EdgeKind kind = field.isDynamic() ? EdgeKind.DYNAMIC : EdgeKind.FIXED;
        return mixWord(acc, contribution(field.getType(), kind));
    }

    private long contribution(TypeReference type, EdgeKind kind) {
        if (type.isPrimitive()) {
            return mixBytes(SEED, type.getPrimitive().getTypeName());
        }
        if (!type.isDeclared()) {
            throw new IllegalStateException("unresolved type '" + type.getRawName() + "' at " + type.getPosition());
        }

        pathKinds.add(kind);
        try {
            return compute(type.getDeclaration());
        } finally {
            pathKinds.remove(pathKinds.size() - 1);
        }
    }

    private void checkReentryIsDynamic(TypeDeclaration declaration, int index) {
        for (int i = index; i < pathKinds.size(); i++) {
            if (pathKinds.get(i) == EdgeKind.DYNAMIC) {
                return;
            }
        }
        throw new IllegalStateException("fixed-size recursion through " + declaration.getQualifiedName()
                + " reached the hash engine");
    }

    private int indexInProgress(TypeDeclaration declaration) {
        for (int i = 0; i < inProgress.size(); i++) {
            if (inProgress.get(i) == declaration) {
                return i;
            }
        }
        return -1;
    }

    static long mixByte(long acc, int b) {
        return Long.rotateLeft(acc, 8) ^ (b & 0xFF);
    }

    static long mixBytes(long acc, String text) {
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            acc = mixByte(acc, b);
        }
        return acc;
    }

    static long mixWord(long acc, long value) {
        for (int shift = 56; shift >= 0; shift -= 8) {
            acc = mixByte(acc, (int) (value >>> shift));
        }
        return acc;
    }
}
