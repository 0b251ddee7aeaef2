package com.schemagen.compiler.context;

import java.util.ArrayList;
import java.util.List;

import com.schemagen.compiler.error.SchemaCompileException;
import com.schemagen.compiler.model.SourcePosition;

import lombok.Getter;

/**
 * Errors and warnings accumulated during a compiler run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class CompileDiagnostics {
    private final List<SchemaCompileException> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addError(SchemaCompileException error) {
        errors.add(error);
    }

    public void addWarning(SourcePosition position, String message) {
        warnings.add(position + ": warning: " + message);
    }

    /**
     * Appends everything recorded in {@code other}, keeping its order.
     */
    public void merge(CompileDiagnostics other) {
        errors.addAll(other.getErrors());
        warnings.addAll(other.getWarnings());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
