package com.schemagen.compiler.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.cli.model.ValidatedCompileOptions;
import com.schemagen.compiler.error.SchemaCompileException;
import com.schemagen.compiler.model.TypeDeclaration;
import com.schemagen.compiler.service.CompileResult;

/**
 * Responsible only for printing CLI output for the schemagen command.
 * No validation, no execution.
 *
 * The summary and error lines are program output and go to the command's
 * writers; everything else is logged.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("Schema Compiler");
        log.info("=================================================");
        log.info("Mode: {}", v.getMode());
        log.info("Input Files: {}", v.getInputFiles().size());
        log.info("Package Prefix: {}", v.getConfig().hasPackagePrefix() ? v.getConfig().getPackagePrefix() : "None");
        log.info("Parallel Parse: {}", v.getConfig().isParallelParse());
        log.info("=================================================");
    }

    /**
     * One line per type, sorted by qualified name:
     * {@code struct geo.Point 0x1a2b3c4d5e6f7081}.
     */
    public void printSummary(PrintWriter out, CompileResult result) {
        Map<String, TypeDeclaration> types = result.getUnit().getTypes();
        for (Map.Entry<String, Long> entry : result.getHashes().entrySet()) {
            TypeDeclaration declaration = types.get(entry.getKey());
            out.print(String.format("%s %s 0x%016x", declaration.getKeyword(), entry.getKey(), entry.getValue()));
            out.print('\n');
        }
        out.flush();

        log.info("");
        log.info("=================================================");
        log.info("COMPILATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Files Parsed: {}", result.getFilesParsed());
        log.info("Types Resolved: {}", result.getTypesResolved());
        log.info("Warnings: {}", result.getDiagnostics().getWarnings().size());
    }

    public void printErrors(PrintWriter err, List<SchemaCompileException> errors) {
        for (SchemaCompileException e : errors) {
            printError(err, e.getMessage());
            log.debug("Compile error", e);
        }
    }

    public void printError(PrintWriter err, String message) {
        err.print("error: " + message);
        err.print('\n');
        err.flush();
    }
}
