package com.schemagen.compiler.context;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for one compiler run.
 *
 * There are no configuration files or environment variables; the command line
 * builds this after validating its options.
 */
@Data
@Builder
public class CompilerConfig {

    /**
     * Prepended to every package name and to every dotted type reference.
     * Empty for none.
     */
    @Builder.Default
    private String packagePrefix = "";

    /**
     * Whether files are parsed on a worker pool. Results are joined in input
     * order before resolution either way.
     */
    private boolean parallelParse;

    /**
     * Whether the token dump skips unrecognized characters instead of stopping.
     */
    private boolean keepGoing;

    public static CompilerConfig defaults() {
        return CompilerConfig.builder().build();
    }

    public boolean hasPackagePrefix() {
        return packagePrefix != null && !packagePrefix.isEmpty();
    }
}
