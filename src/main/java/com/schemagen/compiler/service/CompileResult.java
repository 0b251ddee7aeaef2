package com.schemagen.compiler.service;

import java.util.Map;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.resolve.ResolvedUnit;

import lombok.Builder;
import lombok.Data;

/**
 * Result of compiling one unit.
 */
@Data
@Builder
public class CompileResult {
    private boolean success;
    private String errorMessage;

    private ResolvedUnit unit;

    /** Fingerprints by qualified name, sorted. */
    private Map<String, Long> hashes;

    private int filesParsed;
    private int typesResolved;

    private CompileDiagnostics diagnostics;

    public static CompileResult failure(CompileDiagnostics diagnostics) {
        String message = diagnostics.getErrors().isEmpty()
                ? "compilation failed"
                : diagnostics.getErrors().get(0).getMessage();
        return CompileResult.builder()
                .success(false)
                .errorMessage(message)
                .diagnostics(diagnostics)
                .build();
    }
}
