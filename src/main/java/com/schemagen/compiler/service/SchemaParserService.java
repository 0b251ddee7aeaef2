package com.schemagen.compiler.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.context.CompilerConfig;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.parser.SchemaParser;
import com.schemagen.compiler.parser.SchemaToken;
import com.schemagen.compiler.parser.SchemaTokenizer;

import lombok.RequiredArgsConstructor;

/**
 * Reads, tokenizes and parses a single schema file. Holds no state between
 * calls, so one instance can serve several threads.
 */
@RequiredArgsConstructor
public class SchemaParserService {
    private static final Logger log = LoggerFactory.getLogger(SchemaParserService.class);

    private final CompilerConfig config;

    public SchemaFile parse(Path path, CompileDiagnostics diagnostics) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return parse(content, path.toString(), diagnostics);
    }

    public SchemaFile parse(String content, String fileName, CompileDiagnostics diagnostics) {
        log.info("Parsing schema: {}", fileName);

        SchemaTokenizer tokenizer = new SchemaTokenizer(content, fileName);
        List<SchemaToken> tokens = tokenizer.tokenize();

        SchemaParser parser = new SchemaParser(tokens, fileName, config.getPackagePrefix());
        SchemaFile file = parser.parse(diagnostics);

        log.debug("Parsed schema: {} ({} declarations)", fileName, file.getDeclarations().size());
        return file;
    }
}
