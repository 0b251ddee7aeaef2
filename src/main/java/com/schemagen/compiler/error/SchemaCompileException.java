package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

/**
 * Base class for every error the compiler reports against schema source.
 * The message is always prefixed with the source position, so a single
 * {@link #getMessage()} line is enough for the command line front end.
 */
public class SchemaCompileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient SourcePosition position;
    private final String detail;

    public SchemaCompileException(SourcePosition position, String detail) {
        super(position + ": " + detail);
        this.position = position;
        this.detail = detail;
    }

    public SchemaCompileException(SourcePosition position, String detail, Throwable cause) {
        super(position + ": " + detail, cause);
        this.position = position;
        this.detail = detail;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /**
     * The message without the position prefix.
     */
    public String getDetail() {
        return detail;
    }
}
