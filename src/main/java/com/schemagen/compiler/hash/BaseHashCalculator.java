package com.schemagen.compiler.hash;

import com.schemagen.compiler.model.Dimension;
import com.schemagen.compiler.model.EnumNode;
import com.schemagen.compiler.model.EnumValueNode;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;

import lombok.experimental.UtilityClass;

/**
 * The per-declaration base hash shown by the structure dump.
 *
 * Unlike the fingerprint it does not follow member types: a declared member type
 * contributes nothing, and the declaration's own name is left out so that a
 * type can be renamed without changing its base hash. Dimensions must be bound.
 */
@UtilityClass
public class BaseHashCalculator {

    public static final long SEED = 0x12345678L;

    public static long compute(TypeDeclaration declaration) {
        if (declaration instanceof StructNode struct) {
            return compute(struct);
        }
        if (declaration instanceof EnumNode enumNode) {
            return compute(enumNode);
        }
        throw new IllegalArgumentException("unsupported declaration: " + declaration);
    }

    public static long compute(StructNode struct) {
        long v = SEED;
        for (FieldNode field : struct.getFields()) {
            v = updateString(v, field.getName());

            if (field.getType().isPrimitive()) {
                v = updateString(v, field.getType().getPrimitive().getTypeName());
            }

            v = update(v, field.getDimensions().size());
            for (Dimension dimension : field.getDimensions()) {
                v = update(v, dimension.getMode().getCode());
                v = updateString(v, dimension.getSizeText());
            }
        }
        return v;
    }

    public static long compute(EnumNode enumNode) {
        long v = SEED;
        for (EnumValueNode value : enumNode.getValues()) {
            v = updateString(v, value.getName());
            v = update(v, value.getOrdinal());
        }
        return v;
    }

    static long update(long v, long c) {
        return ((v << 8) ^ (v >> 55)) + c;
    }

    static long updateString(long v, String s) {
        v = update(v, s.codePointCount(0, s.length()));
        for (int cp : s.codePoints().toArray()) {
            v = update(v, cp);
        }
        return v;
    }
}
