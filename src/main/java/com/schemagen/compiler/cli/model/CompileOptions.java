package com.schemagen.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of the schemagen command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

	@Parameters(arity = "1..*", paramLabel = "FILE", description = "Schema files making up one compilation unit")
	private List<Path> inputFiles;

	@Option(names = { "--tokenize", "-t" }, description = "Print the token stream of each file and stop")
	private boolean tokenize;

	@Option(names = { "--debug", "-d" }, description = "Print the parsed structure of each file and stop")
	private boolean debug;

	@Option(names = { "--show-kinds" }, description = "Add a token kind column to the --tokenize output")
	private boolean showKinds;

	@Option(names = {
			"--keep-going" }, description = "With --tokenize, skip unrecognized characters instead of stopping at the first")
	private boolean keepGoing;

	@Option(names = {
			"--package-prefix" }, defaultValue = "", description = "Prefix prepended to every package name (e.g. com.example)")
	private String packagePrefix;

	@Option(names = { "--parallel" }, description = "Parse input files in parallel")
	private boolean parallel;

	@Option(names = { "--verbose", "-v" }, description = "Log progress and resolution details to stderr")
	private boolean verbose;
}
