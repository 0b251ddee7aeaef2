package com.schemagen.compiler.cli.exception;

import java.util.List;

/**
 * Every problem found in one schemagen command line. The command prints each
 * entry as its own {@code error:} line and exits with the usage code.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(summarize(errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	private static String summarize(List<String> errors) {
		StringBuilder sb = new StringBuilder("invalid schemagen options (")
				.append(errors.size())
				.append(errors.size() == 1 ? " problem)" : " problems)");
		for (String error : errors) {
			sb.append("\n  ").append(error);
		}
		return sb.toString();
	}
}
