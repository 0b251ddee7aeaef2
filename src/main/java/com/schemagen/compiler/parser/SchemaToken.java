package com.schemagen.compiler.parser;

import com.schemagen.compiler.model.SourcePosition;

import lombok.Value;

/**
 * Represents a token from the schema tokenizer. Immutable.
 */
@Value
public class SchemaToken {
    TokenType type;
    String text;
    String file;
    int line;
    int column;

    public enum TokenType {
        IDENTIFIER,
        KEYWORD,
        INTEGER_LITERAL,
        FLOAT_LITERAL,
        STRING_LITERAL,
        CHAR_LITERAL,
        PUNCTUATION,
        COMMENT,
        EOF
    }

    public SourcePosition getPosition() {
        return new SourcePosition(file, line, column);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isPunctuation(String symbol) {
        return type == TokenType.PUNCTUATION && text.equals(symbol);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    /**
     * Short form for error messages.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of file";
        }
        if (type == TokenType.COMMENT) {
            return "comment";
        }
        return "'" + text + "'";
    }
}
