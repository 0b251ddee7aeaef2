package com.schemagen.compiler.model;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Built-in types of the schema language. There are no unsigned types.
 */
public enum PrimitiveType {
    INT8("int8_t", 8),
    INT16("int16_t", 16),
    INT32("int32_t", 32),
    INT64("int64_t", 64),
    BYTE("byte", 0),
    FLOAT("float", 0),
    DOUBLE("double", 0),
    STRING("string", 0),
    BOOLEAN("boolean", 0);

    private static final Map<String, PrimitiveType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(PrimitiveType::getTypeName, Function.identity()));

    private final String typeName;
    private final int integerBits;

    PrimitiveType(String typeName, int integerBits) {
        this.typeName = typeName;
        this.integerBits = integerBits;
    }

    public static Optional<PrimitiveType> fromTypeName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * Signed integer types; the only ones usable as array lengths.
     */
    public boolean isIntegral() {
        return integerBits > 0;
    }

    /**
     * Types a {@code const} member may have.
     */
    public boolean isConstantType() {
        return isIntegral() || this == FLOAT || this == DOUBLE;
    }

    public boolean inRange(BigInteger value) {
        if (!isIntegral()) {
            throw new IllegalStateException(typeName + " is not an integer type");
        }
        BigInteger max = BigInteger.ONE.shiftLeft(integerBits - 1).subtract(BigInteger.ONE);
        BigInteger min = BigInteger.ONE.shiftLeft(integerBits - 1).negate();
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
