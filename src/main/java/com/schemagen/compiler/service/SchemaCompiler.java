package com.schemagen.compiler.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.context.CompilerConfig;
import com.schemagen.compiler.error.SchemaCompileException;
import com.schemagen.compiler.hash.TypeHashEngine;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.resolve.ResolvedUnit;
import com.schemagen.compiler.resolve.SchemaResolver;

/**
 * Compiler front end: parse all files, resolve them as one unit, fingerprint
 * every type.
 *
 * Parse errors are collected one per file; resolution stops at the first error.
 * Internal faults from the hash engine are not caught here.
 */
public class SchemaCompiler {
    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    private final CompilerConfig config;
    private final SchemaLoadingService loadingService;
    private final SchemaResolver resolver;

    public SchemaCompiler(CompilerConfig config) {
        this.config = config;
        this.loadingService = new SchemaLoadingService(new SchemaParserService(config), config);
        this.resolver = new SchemaResolver();
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public CompileResult compile(List<Path> paths) {
        CompileDiagnostics diagnostics = new CompileDiagnostics();
        List<SchemaFile> files = loadingService.loadAll(paths, diagnostics);
        return compileFiles(files, diagnostics);
    }

    /**
     * Compiles in-memory sources keyed by file name, in iteration order.
     */
    public CompileResult compileSources(Map<String, String> sources) {
        CompileDiagnostics diagnostics = new CompileDiagnostics();
        List<SchemaFile> files = loadingService.loadSources(sources, diagnostics);
        return compileFiles(files, diagnostics);
    }

    public CompileResult compileFiles(List<SchemaFile> files, CompileDiagnostics diagnostics) {
        if (diagnostics.hasErrors()) {
            log.debug("{} file(s) failed to parse", diagnostics.getErrors().size());
            return CompileResult.failure(diagnostics);
        }

        ResolvedUnit unit;
        try {
            unit = resolver.resolve(files);
        } catch (SchemaCompileException e) {
            diagnostics.addError(e);
            return CompileResult.failure(diagnostics);
        }

        Map<String, Long> hashes = TypeHashEngine.hashAll(unit);

        return CompileResult.builder()
                .success(true)
                .unit(unit)
                .hashes(hashes)
                .filesParsed(files.size())
                .typesResolved(unit.size())
                .diagnostics(diagnostics)
                .build();
    }
}
