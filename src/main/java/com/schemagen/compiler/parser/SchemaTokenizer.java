package com.schemagen.compiler.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.error.LexException;
import com.schemagen.compiler.model.SourcePosition;
import com.schemagen.compiler.parser.SchemaToken.TokenType;

/**
 * Tokenizer for schema source files.
 *
 * Works as a cursor ({@link #nextToken()}, {@link #peekToken()}) and as an
 * {@link Iterable} whose every iterator is a fresh scan from the first character.
 * Comments are returned as tokens; the parser decides which ones to keep.
 *
 * Input is read by code point. Lines are counted from 1 and columns from 0, one
 * column per code point.
 */
public class SchemaTokenizer implements Iterable<SchemaToken> {
    private static final Logger log = LoggerFactory.getLogger(SchemaTokenizer.class);

    private static final Set<String> KEYWORDS = Set.of("package", "struct", "enum", "const");

    private static final String OPERATOR_CHARS = "!~<>=&|^%*+";

    // no '.' so that dotted names stay one token
    private static final String SINGLE_CHAR_TOKENS = "();,:[]{}";

    private static final int END = -1;

    private final String source;
    private final String fileName;

    private int pos = 0;
    private int line = 1;
    private int column = 0;

    // position and width in chars of the code point returned by the last read()
    private int charLine = 1;
    private int charColumn = 0;
    private int charWidth = 0;

    private SchemaToken peeked;

    public SchemaTokenizer(String source, String fileName) {
        this.source = normalizeNewlines(source);
        this.fileName = fileName;
    }

    private static String normalizeNewlines(String src) {
        if (src.indexOf('\r') < 0) {
            return src;
        }
        return src.replace("\r\n", "\n").replace('\r', '\n');
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Tokenize the entire source. The list ends with exactly one EOF token.
     *
     * @throws LexException on the first character that starts no token
     */
    public List<SchemaToken> tokenize() {
        reset();
        List<SchemaToken> tokens = new ArrayList<>();
        SchemaToken token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.isEof());
        return tokens;
    }

    /**
     * Tokenize the entire source, recording each lexical error in the diagnostics
     * and continuing after the offending character.
     */
    public List<SchemaToken> tokenizeRecovering(CompileDiagnostics diagnostics) {
        reset();
        List<SchemaToken> tokens = new ArrayList<>();
        while (true) {
            try {
                SchemaToken token = nextToken();
                tokens.add(token);
                if (token.isEof()) {
                    return tokens;
                }
            } catch (LexException e) {
                log.warn("Skipping input after lexical error: {}", e.getMessage());
                diagnostics.addError(e);
            }
        }
    }

    /**
     * Rewind to the first character.
     */
    public void reset() {
        pos = 0;
        line = 1;
        column = 0;
        charLine = 1;
        charColumn = 0;
        charWidth = 0;
        peeked = null;
    }

    public SchemaToken peekToken() {
        if (peeked == null) {
            peeked = scan();
        }
        return peeked;
    }

    /**
     * Returns the next token. Once the input is exhausted every call returns an
     * EOF token. A {@link LexException} leaves the cursor after the offending
     * character, so scanning may continue.
     */
    public SchemaToken nextToken() {
        if (peeked != null) {
            SchemaToken token = peeked;
            peeked = null;
            return token;
        }
        return scan();
    }

    @Override
    public Iterator<SchemaToken> iterator() {
        SchemaTokenizer cursor = new SchemaTokenizer(source, fileName);
        return new Iterator<>() {
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public SchemaToken next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                SchemaToken token = cursor.nextToken();
                done = token.isEof();
                return token;
            }
        };
    }

    private SchemaToken scan() {
        int c = read();
        while (c != END && Character.isWhitespace(c)) {
            c = read();
        }
        if (c == END) {
            return new SchemaToken(TokenType.EOF, "", fileName, line, column);
        }

        int startLine = charLine;
        int startCol = charColumn;

        if (c == '\'') {
            return readCharLiteral(startLine, startCol);
        }
        if (c == '"') {
            return readStringLiteral(startLine, startCol);
        }
        if (isOperatorChar(c)) {
            return readOperator(c, startLine, startCol);
        }
        if (c == '/') {
            return readSlash(startLine, startCol);
        }
        if (isSingleCharToken(c)) {
            return token(TokenType.PUNCTUATION, Character.toString(c), startLine, startCol);
        }
        if (isWordChar(c)) {
            return readWord(c, startLine, startCol);
        }

        // already consumed, so the caller can carry on after it
        throw new LexException(position(startLine, startCol), c);
    }

    private SchemaToken readCharLiteral(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder("'");
        int c = read();
        if (c == '\\') {
            sb.append('\\');
            c = read();
        }
        if (c == END) {
            throw LexException.unterminated(position(startLine, startCol), '\'', "character literal");
        }
        sb.appendCodePoint(c);

        c = read();
        if (c != '\'') {
            throw LexException.unterminated(position(startLine, startCol), '\'', "character literal");
        }
        sb.append('\'');
        return token(TokenType.CHAR_LITERAL, sb.toString(), startLine, startCol);
    }

    private SchemaToken readStringLiteral(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder("\"");
        boolean escapeNext = false;

        while (true) {
            int c = read();
            if (c == END) {
                throw LexException.unterminated(position(startLine, startCol), '"', "string literal");
            }
            sb.appendCodePoint(c);

            if (escapeNext) {
                escapeNext = false;
            } else if (c == '\\') {
                escapeNext = true;
            } else if (c == '"') {
                return token(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
            }
        }
    }

    private SchemaToken readOperator(int first, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        int c = first;
        while (isOperatorChar(c)) {
            sb.append((char) c);
            c = read();
        }
        unread(c);
        return token(TokenType.PUNCTUATION, sb.toString(), startLine, startCol);
    }

    private SchemaToken readSlash(int startLine, int startCol) {
        int c = read();
        if (c == '*') {
            return readBlockComment(startLine, startCol);
        }
        if (c == '/') {
            return readLineComment(startLine, startCol);
        }
        unread(c);
        return token(TokenType.PUNCTUATION, "/", startLine, startCol);
    }

    private SchemaToken readLineComment(int startLine, int startCol) {
        int c = read();
        while (c == '/') {
            c = read();
        }
        while (c == ' ') {
            c = read();
        }

        StringBuilder sb = new StringBuilder();
        while (c != END && c != '\n') {
            sb.appendCodePoint(c);
            c = read();
        }
        unread(c);
        return token(TokenType.COMMENT, sb.toString(), startLine, startCol);
    }

    /**
     * Block comment after the opening slash-star. On every line, leading blanks
     * followed by asterisks are dropped along with one space after them. Content
     * lines keep their newline; the closing asterisk is not part of the text.
     */
    private SchemaToken readBlockComment(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean finished = false;

        while (!finished) {
            int lineStart = sb.length();

            int c = read();
            while (c == ' ' || c == '\t') {
                sb.append((char) c);
                c = read();
            }

            boolean gotAsterisk = false;
            while (c == '*') {
                sb.append('*');
                gotAsterisk = true;
                c = read();
            }

            if (gotAsterisk) {
                sb.setLength(lineStart);
                if (c == '/') {
                    break;
                }
                if (c == ' ') {
                    c = read();
                }
            }

            while (c != END && c != '\n') {
                int last = c;
                sb.appendCodePoint(c);
                c = read();
                if (last == '*' && c == '/') {
                    sb.setLength(sb.length() - 1);
                    finished = true;
                    break;
                }
            }

            if (!finished) {
                if (c == END) {
                    throw LexException.unterminated(position(startLine, startCol), '/', "block comment");
                }
                if (lineStart != sb.length()) {
                    sb.append('\n');
                }
            }
        }

        return token(TokenType.COMMENT, sb.toString(), startLine, startCol);
    }

    /**
     * A word ends at the first character that cannot be part of it. That character
     * is left for the next scan, which fails on it if it starts no token.
     */
    private SchemaToken readWord(int first, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        sb.appendCodePoint(first);

        int c = read();
        while (isWordChar(c)) {
            sb.appendCodePoint(c);
            c = read();
        }
        unread(c);

        String text = sb.toString();
        return token(classifyWord(text), text, startLine, startCol);
    }

    private static TokenType classifyWord(String text) {
        if (KEYWORDS.contains(text)) {
            return TokenType.KEYWORD;
        }
        if (NumericLiterals.isInteger(text)) {
            return TokenType.INTEGER_LITERAL;
        }
        if (NumericLiterals.isFloat(text)) {
            return TokenType.FLOAT_LITERAL;
        }
        return TokenType.IDENTIFIER;
    }

    private static boolean isWordChar(int c) {
        return c != END && (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-');
    }

    private static boolean isOperatorChar(int c) {
        return c != END && OPERATOR_CHARS.indexOf(c) >= 0;
    }

    private static boolean isSingleCharToken(int c) {
        return c != END && SINGLE_CHAR_TOKENS.indexOf(c) >= 0;
    }

    private int read() {
        if (pos >= source.length()) {
            charLine = line;
            charColumn = column;
            return END;
        }
        int c = source.codePointAt(pos);
        charWidth = Character.charCount(c);
        pos += charWidth;
        charLine = line;
        charColumn = column;
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    /**
     * Push back the character returned by the last {@link #read()}.
     */
    private void unread(int c) {
        if (c == END) {
            return;
        }
        pos -= charWidth;
        line = charLine;
        column = charColumn;
    }

    private SchemaToken token(TokenType type, String text, int tokenLine, int tokenColumn) {
        return new SchemaToken(type, text, fileName, tokenLine, tokenColumn);
    }

    private SourcePosition position(int tokenLine, int tokenColumn) {
        return new SourcePosition(fileName, tokenLine, tokenColumn);
    }
}
