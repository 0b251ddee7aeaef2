package com.schemagen.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.schemagen.compiler.cli.exception.OptionsValidationException;
import com.schemagen.compiler.cli.model.CompileOptions;
import com.schemagen.compiler.cli.model.ValidatedCompileOptions;
import com.schemagen.compiler.cli.model.ValidatedCompileOptions.Mode;
import com.schemagen.compiler.context.CompilerConfig;

public class CompileOptionsValidator {

	private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> files = o.getInputFiles() == null ? List.of() : o.getInputFiles();
		if (files.isEmpty()) {
			errors.add("At least one schema file is required.");
		}
		for (Path file : files) {
			if (!Files.exists(file)) {
				errors.add("Schema file does not exist: " + file);
			} else if (!Files.isRegularFile(file)) {
				errors.add("Schema file is not a regular file: " + file);
			}
		}

		if (o.isTokenize() && o.isDebug()) {
			errors.add("--tokenize and --debug cannot be used together.");
		}
		if (o.isKeepGoing() && !o.isTokenize()) {
			errors.add("--keep-going only applies to --tokenize.");
		}
		if (o.isShowKinds() && !o.isTokenize()) {
			errors.add("--show-kinds only applies to --tokenize.");
		}

		String prefix = o.getPackagePrefix() == null ? "" : o.getPackagePrefix().trim();
		if (!prefix.isEmpty() && !DOTTED_NAME.matcher(prefix).matches()) {
			errors.add("Package prefix must be a dotted name such as com.example. Got: " + prefix);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		CompilerConfig config = CompilerConfig.builder()
				.packagePrefix(prefix)
				.parallelParse(o.isParallel())
				.keepGoing(o.isKeepGoing())
				.build();

		return new ValidatedCompileOptions(modeOf(o), List.copyOf(files), config);
	}

	private static Mode modeOf(CompileOptions o) {
		if (o.isTokenize()) {
			return Mode.TOKENIZE;
		}
		if (o.isDebug()) {
			return Mode.DEBUG;
		}
		return Mode.COMPILE;
	}
}
