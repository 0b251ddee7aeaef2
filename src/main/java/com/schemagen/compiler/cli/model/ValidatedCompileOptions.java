package com.schemagen.compiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.schemagen.compiler.context.CompilerConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {

    public enum Mode {
        TOKENIZE,
        DEBUG,
        COMPILE
    }

    Mode mode;
    List<Path> inputFiles;
    CompilerConfig config;
}
