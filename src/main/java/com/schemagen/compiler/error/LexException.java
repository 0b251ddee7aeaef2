package com.schemagen.compiler.error;

import com.schemagen.compiler.model.SourcePosition;

/**
 * Raised by the tokenizer for a character it cannot place in any token, or for a
 * literal or comment that runs into the end of the input.
 */
public class LexException extends SchemaCompileException {

    private static final long serialVersionUID = 1L;

    private final int codePoint;

    public LexException(SourcePosition position, int codePoint) {
        this(position, codePoint, "unrecognized character " + printable(codePoint));
    }

    private LexException(SourcePosition position, int codePoint, String detail) {
        super(position, detail);
        this.codePoint = codePoint;
    }

    public static LexException unterminated(SourcePosition position, char opening, String what) {
        return new LexException(position, opening, "unterminated " + what);
    }

    public int getCodePoint() {
        return codePoint;
    }

    private static String printable(int c) {
        if (Character.isISOControl(c)) {
            return String.format("U+%04X", c);
        }
        return "'" + Character.toString(c) + "'";
    }
}
