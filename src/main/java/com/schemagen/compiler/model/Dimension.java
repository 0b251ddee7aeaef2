package com.schemagen.compiler.model;

import lombok.Getter;

/**
 * One bracketed array dimension of a field. Literal sizes are bound at parse
 * time; a symbolic size stays unbound until the resolver finds the constant or
 * length field it names.
 */
@Getter
public class Dimension {
    /** The size exactly as written: digits or an identifier. */
    private final String size;
    private final boolean symbolic;
    private final SourcePosition position;

    private DimensionMode mode;
    private String resolvedSize;
    private long constantValue;
    private FieldNode lengthField;
    private ConstantNode constant;

    private Dimension(String size, boolean symbolic, SourcePosition position) {
        this.size = size;
        this.symbolic = symbolic;
        this.position = position;
    }

    public static Dimension literal(String digits, long value, SourcePosition position) {
        Dimension dimension = new Dimension(digits, false, position);
        dimension.mode = DimensionMode.CONST;
        dimension.resolvedSize = digits;
        dimension.constantValue = value;
        return dimension;
    }

    public static Dimension symbolic(String name, SourcePosition position) {
        return new Dimension(name, true, position);
    }

    public void bindToConstant(ConstantNode constant, long value) {
        requireUnbound();
        this.constant = constant;
        this.mode = DimensionMode.CONST;
        this.resolvedSize = constant.getValue();
        this.constantValue = value;
    }

    public void bindToField(FieldNode lengthField) {
        requireUnbound();
        this.lengthField = lengthField;
        this.mode = DimensionMode.VAR;
        this.resolvedSize = size;
    }

    public boolean isBound() {
        return mode != null;
    }

    public boolean isDynamic() {
        return mode == DimensionMode.VAR;
    }

    /**
     * The size text after binding: the constant's value for a constant
     * reference, otherwise the size as written.
     */
    public String getSizeText() {
        return resolvedSize != null ? resolvedSize : size;
    }

    private void requireUnbound() {
        if (mode != null) {
            throw new IllegalStateException("dimension '" + size + "' is already bound");
        }
    }

    @Override
    public String toString() {
        return "[" + getSizeText() + "]";
    }
}
