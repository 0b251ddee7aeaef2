package com.schemagen.compiler.resolve;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.error.DuplicateTypeException;
import com.schemagen.compiler.error.IllegalRecursionException;
import com.schemagen.compiler.error.UnknownDimensionFieldException;
import com.schemagen.compiler.error.UnknownTypeException;
import com.schemagen.compiler.model.ConstantNode;
import com.schemagen.compiler.model.Dimension;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;
import com.schemagen.compiler.model.TypeReference;
import com.schemagen.compiler.parser.NumericLiterals;

/**
 * Merges the parsed files of one compilation unit and binds every name in them.
 *
 * Steps, each failing fast:
 * - symbol table over all declarations
 * - field types, exact qualified name first, then the field's own package
 * - symbolic array sizes, against earlier constants and integer fields
 * - fixed-size recursion check on the containment graph
 */
public class SchemaResolver {
    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    static final String REASON_UNKNOWN = "no field or constant with that name";
    static final String REASON_DECLARED_LATER = "must be declared before the array";
    static final String REASON_NOT_SCALAR_INTEGER = "length field must be a scalar int8_t, int16_t, int32_t or int64_t";
    static final String REASON_CONSTANT_NOT_INTEGER = "constant used as array size must have an integer type";
    static final String REASON_CONSTANT_NOT_POSITIVE = "constant used as array size must be greater than zero";

    /**
     * @throws DuplicateTypeException if two declarations share a qualified name
     * @throws UnknownTypeException if a field type names no declaration
     * @throws UnknownDimensionFieldException if a symbolic array size cannot be bound
     * @throws IllegalRecursionException if a type contains itself with fixed size
     */
    public ResolvedUnit resolve(List<SchemaFile> files) {
        Objects.requireNonNull(files, "files");

        Map<String, TypeDeclaration> symbols = buildSymbolTable(files);

        for (SchemaFile file : files) {
            for (StructNode struct : file.getStructs()) {
                resolveFieldTypes(struct, symbols);
            }
            bindDimensions(file);
        }

        TypeGraph graph = new TypeGraph(symbols.values());
        graph.checkNoFixedCycles();

        log.info("Resolved {} types from {} files", symbols.size(), files.size());

        return ResolvedUnit.builder()
                .types(new TreeMap<>(symbols))
                .files(List.copyOf(files))
                .graph(graph)
                .build();
    }

    /**
     * Binds the symbolic array sizes of every struct in one file. Dimensions that
     * are already bound are left alone, so calling this again is harmless.
     */
    public void bindDimensions(SchemaFile file) {
        for (StructNode struct : file.getStructs()) {
            bindDimensions(struct);
        }
    }

    private Map<String, TypeDeclaration> buildSymbolTable(List<SchemaFile> files) {
        Map<String, TypeDeclaration> symbols = new LinkedHashMap<>();
        for (SchemaFile file : files) {
            for (TypeDeclaration declaration : file.getDeclarations()) {
                String name = declaration.getQualifiedName();
                TypeDeclaration first = symbols.putIfAbsent(name, declaration);
                if (first != null) {
                    throw new DuplicateTypeException(name, declaration.getPosition(), first.getPosition());
                }
            }
        }
        return symbols;
    }

    private void resolveFieldTypes(StructNode struct, Map<String, TypeDeclaration> symbols) {
        for (FieldNode field : struct.getFields()) {
            TypeReference type = field.getType();
            if (type.isResolved()) {
                continue;
            }

            TypeDeclaration target = type.candidateNames().stream()
                    .map(symbols::get)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElseThrow(() -> new UnknownTypeException(type.getRawName(), struct.getQualifiedName(),
                            type.getPosition()));

            type.resolveTo(target);
            log.debug("Resolved {}.{} -> {}", struct.getQualifiedName(), field.getName(), target.getQualifiedName());
        }
    }

    private void bindDimensions(StructNode struct) {
        for (FieldNode field : struct.getFields()) {
            for (Dimension dimension : field.getDimensions()) {
                if (!dimension.isBound()) {
                    bindDimension(struct, field, dimension);
                }
            }
        }
    }

    private void bindDimension(StructNode struct, FieldNode array, Dimension dimension) {
        String sizeName = dimension.getSize();

        Optional<ConstantNode> constant = struct.findConstant(sizeName);
        if (constant.isPresent()) {
            ConstantNode c = constant.get();
            if (c.getMemberIndex() > array.getMemberIndex()) {
                throw dimensionError(sizeName, struct, REASON_DECLARED_LATER, dimension);
            }
            if (!c.getType().isIntegral()) {
                throw dimensionError(sizeName, struct, REASON_CONSTANT_NOT_INTEGER, dimension);
            }
            BigInteger value = NumericLiterals.parseInteger(c.getValue());
            if (value.signum() <= 0) {
                throw dimensionError(sizeName, struct, REASON_CONSTANT_NOT_POSITIVE, dimension);
            }
            dimension.bindToConstant(c, value.longValue());
            return;
        }

        FieldNode lengthField = struct.findField(sizeName)
                .orElseThrow(() -> dimensionError(sizeName, struct, REASON_UNKNOWN, dimension));

        if (lengthField.getMemberIndex() >= array.getMemberIndex()) {
            throw dimensionError(sizeName, struct, REASON_DECLARED_LATER, dimension);
        }
        TypeReference lengthType = lengthField.getType();
        if (!lengthType.isPrimitive() || !lengthType.getPrimitive().isIntegral() || !lengthField.isScalar()) {
            throw dimensionError(sizeName, struct, REASON_NOT_SCALAR_INTEGER, dimension);
        }
        dimension.bindToField(lengthField);
    }

    private static UnknownDimensionFieldException dimensionError(String sizeName, StructNode struct, String reason,
                                                                 Dimension dimension) {
        return new UnknownDimensionFieldException(sizeName, struct.getQualifiedName(), reason,
                dimension.getPosition());
    }
}
