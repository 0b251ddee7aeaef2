package com.schemagen.compiler.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.cli.exception.OptionsValidationException;
import com.schemagen.compiler.cli.model.CompileOptions;
import com.schemagen.compiler.cli.model.ValidatedCompileOptions;
import com.schemagen.compiler.cli.output.CompileResultsPrinter;
import com.schemagen.compiler.cli.validation.CompileOptionsValidator;
import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.diagnostics.StructureDumpPrinter;
import com.schemagen.compiler.diagnostics.TokenStreamPrinter;
import com.schemagen.compiler.error.SchemaCompileException;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.parser.SchemaTokenizer;
import com.schemagen.compiler.resolve.SchemaResolver;
import com.schemagen.compiler.service.CompileResult;
import com.schemagen.compiler.service.SchemaCompiler;
import com.schemagen.compiler.service.SchemaLoadingService;
import com.schemagen.compiler.service.SchemaParserService;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that parses, resolves and fingerprints a set of schema files, or
 * dumps their tokens or parsed structure.
 *
 * Exit codes: 0 on success, 1 when a schema is rejected, 2 for usage errors.
 */
@Command(
        name = "schemagen",
        mixinStandardHelpOptions = true,
        version = "schemagen 1.0.0",
        description = "Parses message schema files, resolves them as one unit and prints each type's fingerprint."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_REJECTED = 1;

    @Mixin
    private CompileOptions options;

    @Spec
    private CommandSpec spec;

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableVerboseLogging();
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.debug(e.getMessage());
            e.getErrors().forEach(message -> printer.printError(err, message));
            return CommandLine.ExitCode.USAGE;
        }

        printer.printBanner(validated);

        try {
            return switch (validated.getMode()) {
                case TOKENIZE -> tokenize(validated, out, err);
                case DEBUG -> dumpStructure(validated, out, err);
                case COMPILE -> compile(validated, out, err);
            };
        } catch (SchemaCompileException e) {
            log.debug("Schema rejected", e);
            printer.printError(err, e.getMessage());
            return EXIT_REJECTED;
        } catch (IOException e) {
            log.error("Failed to read input", e);
            printer.printError(err, "cannot read input (" + e.getMessage() + ")");
            return EXIT_REJECTED;
        }
    }

    private int tokenize(ValidatedCompileOptions v, PrintWriter out, PrintWriter err) throws IOException {
        TokenStreamPrinter tokenPrinter = new TokenStreamPrinter(out, options.isShowKinds());
        CompileDiagnostics diagnostics = new CompileDiagnostics();

        for (Path file : v.getInputFiles()) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            SchemaTokenizer tokenizer = new SchemaTokenizer(content, file.toString());
            if (v.getConfig().isKeepGoing()) {
                tokenPrinter.printRecovering(tokenizer, diagnostics);
            } else {
                tokenPrinter.print(tokenizer);
            }
        }

        if (diagnostics.hasErrors()) {
            printer.printErrors(err, diagnostics.getErrors());
            return EXIT_REJECTED;
        }
        return CommandLine.ExitCode.OK;
    }

    private int dumpStructure(ValidatedCompileOptions v, PrintWriter out, PrintWriter err) {
        CompileDiagnostics diagnostics = new CompileDiagnostics();
        SchemaLoadingService loadingService = new SchemaLoadingService(new SchemaParserService(v.getConfig()),
                v.getConfig());
        List<SchemaFile> files = loadingService.loadAll(v.getInputFiles(), diagnostics);

        if (diagnostics.hasErrors()) {
            printer.printErrors(err, diagnostics.getErrors());
            return EXIT_REJECTED;
        }

        SchemaResolver resolver = new SchemaResolver();
        files.forEach(resolver::bindDimensions);

        new StructureDumpPrinter(out).print(files);
        return CommandLine.ExitCode.OK;
    }

    private int compile(ValidatedCompileOptions v, PrintWriter out, PrintWriter err) {
        CompileResult result = new SchemaCompiler(v.getConfig()).compile(v.getInputFiles());

        if (!result.isSuccess()) {
            log.debug("Compilation failed: {}", result.getErrorMessage());
            printer.printErrors(err, result.getDiagnostics().getErrors());
            return EXIT_REJECTED;
        }

        printer.printSummary(out, result);
        return CommandLine.ExitCode.OK;
    }

    private static void enableVerboseLogging() {
        Logger root = LoggerFactory.getLogger("com.schemagen");
        if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
