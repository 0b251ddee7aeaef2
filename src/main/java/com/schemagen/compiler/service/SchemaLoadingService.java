package com.schemagen.compiler.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.context.CompilerConfig;
import com.schemagen.compiler.error.SchemaCompileException;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.SourcePosition;

import lombok.RequiredArgsConstructor;

/**
 * Parses every file of a compilation unit.
 *
 * Each file is parsed in isolation with its own diagnostics, optionally on the
 * common fork-join pool. Results and diagnostics are joined back in input order,
 * so the outcome does not depend on scheduling. A file that fails contributes
 * its one error and no AST.
 */
@RequiredArgsConstructor
public class SchemaLoadingService {
    private static final Logger log = LoggerFactory.getLogger(SchemaLoadingService.class);

    private final SchemaParserService parserService;
    private final CompilerConfig config;

    private static class FileOutcome {
        private final CompileDiagnostics diagnostics = new CompileDiagnostics();
        private SchemaFile file;
    }

    public List<SchemaFile> loadAll(List<Path> paths, CompileDiagnostics diagnostics) {
        Stream<Path> stream = config.isParallelParse() ? paths.parallelStream() : paths.stream();
        List<FileOutcome> outcomes = stream.map(this::load).toList();
        return join(outcomes, diagnostics);
    }

    /**
     * Same as {@link #loadAll(List, CompileDiagnostics)} for in-memory sources,
     * keyed by file name in iteration order.
     */
    public List<SchemaFile> loadSources(Map<String, String> sources, CompileDiagnostics diagnostics) {
        List<Map.Entry<String, String>> entries = new ArrayList<>(sources.entrySet());
        Stream<Map.Entry<String, String>> stream = config.isParallelParse() ? entries.parallelStream() : entries.stream();
        List<FileOutcome> outcomes = stream.map(e -> load(e.getKey(), e.getValue())).toList();
        return join(outcomes, diagnostics);
    }

    private FileOutcome load(Path path) {
        FileOutcome outcome = new FileOutcome();
        try {
            outcome.file = parserService.parse(path, outcome.diagnostics);
        } catch (IOException e) {
            log.error("Failed to read schema: {}", path, e);
            outcome.diagnostics.addError(new SchemaCompileException(new SourcePosition(path.toString(), 0, 0),
                    "cannot read file (" + e.getMessage() + ")", e));
        } catch (SchemaCompileException e) {
            log.debug("Failed to parse schema: {}", path, e);
            outcome.diagnostics.addError(e);
        }
        return outcome;
    }

    private FileOutcome load(String fileName, String content) {
        FileOutcome outcome = new FileOutcome();
        try {
            outcome.file = parserService.parse(content, fileName, outcome.diagnostics);
        } catch (SchemaCompileException e) {
            log.debug("Failed to parse schema: {}", fileName, e);
            outcome.diagnostics.addError(e);
        }
        return outcome;
    }

    private static List<SchemaFile> join(List<FileOutcome> outcomes, CompileDiagnostics diagnostics) {
        List<SchemaFile> files = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            diagnostics.merge(outcome.diagnostics);
            if (outcome.file != null) {
                files.add(outcome.file);
            }
        }
        return files;
    }
}
