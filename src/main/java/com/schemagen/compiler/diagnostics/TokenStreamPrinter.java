package com.schemagen.compiler.diagnostics;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.error.LexException;
import com.schemagen.compiler.parser.SchemaToken;
import com.schemagen.compiler.parser.SchemaTokenizer;

/**
 * Writes the token dump: one header line, then one line per token with its
 * index, line and column. Comments are listed; the end-of-input token is not.
 *
 * Lines end with '\n' on every platform so dumps can be compared byte for byte.
 */
public class TokenStreamPrinter {
    private static final Logger log = LoggerFactory.getLogger(TokenStreamPrinter.class);

    private final PrintWriter out;
    private final boolean showKinds;

    public TokenStreamPrinter(PrintWriter out, boolean showKinds) {
        this.out = out;
        this.showKinds = showKinds;
    }

    public void printHeader() {
        if (showKinds) {
            out.print(String.format("%-6s %-6s %-6s %-16s: token", "tok#", "line", "col", "kind"));
        } else {
            out.print(String.format("%-6s %-6s %-6s: token", "tok#", "line", "col"));
        }
        out.print('\n');
    }

    public void printToken(int index, SchemaToken token) {
        if (showKinds) {
            out.print(String.format("%6d %6d %6d %-16s: %s", index, token.getLine(), token.getColumn(),
                    token.getType(), token.getText()));
        } else {
            out.print(String.format("%6d %6d %6d: %s", index, token.getLine(), token.getColumn(), token.getText()));
        }
        out.print('\n');
    }

    /**
     * Prints the header and every token. Tokens are written as they are scanned,
     * so a {@link LexException} leaves everything before it in the output.
     *
     * @return number of tokens printed
     */
    public int print(Iterable<SchemaToken> tokens) {
        printHeader();
        int count = 0;
        try {
            for (SchemaToken token : tokens) {
                if (token.isEof()) {
                    break;
                }
                printToken(count++, token);
            }
        } finally {
            out.flush();
        }
        return count;
    }

    /**
     * Like {@link #print(Iterable)} but records each lexical error and carries on
     * after the offending character.
     */
    public int printRecovering(SchemaTokenizer tokenizer, CompileDiagnostics diagnostics) {
        printHeader();
        tokenizer.reset();
        int count = 0;
        while (true) {
            SchemaToken token;
            try {
                token = tokenizer.nextToken();
            } catch (LexException e) {
                log.debug("Recovered from lexical error: {}", e.getMessage());
                diagnostics.addError(e);
                continue;
            }
            if (token.isEof()) {
                break;
            }
            printToken(count++, token);
        }
        out.flush();
        return count;
    }
}
