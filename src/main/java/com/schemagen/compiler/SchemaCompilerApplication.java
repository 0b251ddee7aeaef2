package com.schemagen.compiler;

import com.schemagen.compiler.cli.CompileCommand;

import picocli.CommandLine;

/**
 * Main entry point for the schema compiler.
 * Parses message schema files, checks them as one compilation unit and prints
 * the structural fingerprint of every declared type.
 */
public class SchemaCompilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand()).execute(args);
        System.exit(exitCode);
    }
}
