package com.schemagen.compiler.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemagen.compiler.context.CompileDiagnostics;
import com.schemagen.compiler.error.ParseException;
import com.schemagen.compiler.error.SchemaSemanticException;
import com.schemagen.compiler.model.ConstantNode;
import com.schemagen.compiler.model.Dimension;
import com.schemagen.compiler.model.EnumNode;
import com.schemagen.compiler.model.EnumValueNode;
import com.schemagen.compiler.model.FieldNode;
import com.schemagen.compiler.model.PackageNode;
import com.schemagen.compiler.model.PrimitiveType;
import com.schemagen.compiler.model.SchemaFile;
import com.schemagen.compiler.model.SourcePosition;
import com.schemagen.compiler.model.StructNode;
import com.schemagen.compiler.model.TypeDeclaration;
import com.schemagen.compiler.model.TypeReference;
import com.schemagen.compiler.parser.SchemaToken.TokenType;

/**
 * Recursive descent parser for one schema file.
 *
 * Parsing only:
 * - Builds the per-file AST
 * - Attaches leading comments to packages, declarations and members
 * - Reports the legacy {@code int} warning
 *
 * It does NOT resolve type names or symbolic array sizes; that is the
 * resolver's job. The first error ends the file.
 */
public class SchemaParser {
    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    private static final String INT_WARNING = "int type should probably be int8_t, int16_t, int32_t, or int64_t";

    private final List<SchemaToken> tokens;
    private final String fileName;
    private final String packagePrefix;
    private int pos = 0;

    private final Map<String, PackageNode> packages = new LinkedHashMap<>();
    private final List<TypeDeclaration> declarations = new ArrayList<>();
    private PackageNode currentPackage;

    public SchemaParser(List<SchemaToken> tokens, String fileName) {
        this(tokens, fileName, "");
    }

    public SchemaParser(List<SchemaToken> tokens, String fileName, String packagePrefix) {
        this.tokens = tokens;
        this.fileName = fileName;
        this.packagePrefix = packagePrefix == null ? "" : packagePrefix;
    }

    /**
     * @throws ParseException on the first unexpected token
     * @throws SchemaSemanticException for input that parses but is not legal
     */
    public SchemaFile parse(CompileDiagnostics diagnostics) {
        while (true) {
            String comment = collectComments();
            SchemaToken token = peek();

            if (token.isEof()) {
                break;
            }
            if (token.isKeyword("package")) {
                parsePackage(comment);
            } else if (token.isKeyword("struct")) {
                addDeclaration(parseStruct(comment, diagnostics));
            } else if (token.isKeyword("enum")) {
                addDeclaration(parseEnum(comment));
            } else {
                throw unexpected("'package', 'struct' or 'enum'");
            }
        }

        return SchemaFile.builder()
                .fileName(fileName)
                .packages(packages.values())
                .declarations(declarations)
                .build();
    }

    // ---------------------------------------------------------------
    // Packages and declarations
    // ---------------------------------------------------------------

    private void parsePackage(String comment) {
        SchemaToken keyword = expectKeyword("package");
        String name = expectName("package name", true);
        expectPunctuation(";");

        String qualified = applyPrefix(name);
        PackageNode existing = packages.get(qualified);
        if (existing != null) {
            existing.appendComment(comment);
            currentPackage = existing;
        } else {
            currentPackage = new PackageNode(qualified, comment, keyword.getPosition());
            packages.put(qualified, currentPackage);
        }
        log.debug("Package {} at line {}", qualified, keyword.getLine());
    }

    private void addDeclaration(TypeDeclaration declaration) {
        packageForDeclarations().addDeclaration(declaration);
        declarations.add(declaration);
        log.debug("Parsed {} {} at line {}", declaration.getKeyword(), declaration.getQualifiedName(),
                declaration.getPosition().getLine());
    }

    private PackageNode packageForDeclarations() {
        if (currentPackage == null) {
            String defaultName = packagePrefix;
            currentPackage = packages.computeIfAbsent(defaultName,
                    n -> new PackageNode(n, null, new SourcePosition(fileName, 1, 0)));
        }
        return currentPackage;
    }

    private String currentPackageName() {
        return currentPackage != null ? currentPackage.getName() : packagePrefix;
    }

    private String applyPrefix(String name) {
        return packagePrefix.isEmpty() ? name : packagePrefix + "." + name;
    }

    // ---------------------------------------------------------------
    // Structs
    // ---------------------------------------------------------------

    private StructNode parseStruct(String comment, CompileDiagnostics diagnostics) {
        SchemaToken keyword = expectKeyword("struct");
        String name = expectName("struct name", false);

        StructNode struct = StructNode.builder()
                .name(name)
                .packageName(currentPackageName())
                .comment(comment)
                .position(keyword.getPosition())
                .build();

        expectPunctuation("{");

        while (true) {
            String memberComment = collectComments();
            SchemaToken token = peek();

            if (token.isPunctuation("}")) {
                advance();
                break;
            }
            if (token.isKeyword("const")) {
                parseConstants(struct, memberComment);
            } else if (token.isKeyword("struct") || token.isKeyword("enum")) {
                throw new ParseException(token.getPosition(), "field or constant declaration",
                        "nested " + token.getText() + " declaration (not supported)");
            } else if (token.is(TokenType.IDENTIFIER)) {
                parseFields(struct, memberComment, diagnostics);
            } else {
                throw unexpected("field, constant or '}'");
            }
        }
        return struct;
    }

    private void parseFields(StructNode struct, String comment, CompileDiagnostics diagnostics) {
        SchemaToken typeToken = advance();
        String typeName = typeToken.getText();
        checkTypeName(typeToken);

        if (typeName.equals("int")) {
            log.warn("{}: {}", typeToken.getPosition(), INT_WARNING);
            diagnostics.addWarning(typeToken.getPosition(), INT_WARNING);
        }

        boolean first = true;
        do {
            SchemaToken nameToken = peek();
            String fieldName = expectName("field name", false);
            checkUniqueMember(struct, fieldName, nameToken.getPosition());

            FieldNode field = FieldNode.builder()
                    .name(fieldName)
                    .type(typeReference(typeToken))
                    .comment(first ? comment : null)
                    .position(nameToken.getPosition())
                    .build();

            while (checkPunctuation("[")) {
                field.addDimension(parseDimension());
            }

            struct.addField(field);
            first = false;
        } while (matchPunctuation(","));

        expectPunctuation(";");
    }

    private TypeReference typeReference(SchemaToken typeToken) {
        String typeName = typeToken.getText();
        Optional<PrimitiveType> primitive = PrimitiveType.fromTypeName(typeName);
        if (primitive.isPresent()) {
            return TypeReference.primitive(primitive.get(), typeToken.getPosition());
        }
        String raw = typeName.contains(".") ? applyPrefix(typeName) : typeName;
        return TypeReference.unresolved(raw, currentPackageName(), typeToken.getPosition());
    }

    private Dimension parseDimension() {
        SchemaToken open = expectPunctuation("[");
        SchemaToken sizeToken = peek();

        if (sizeToken.isPunctuation("]")) {
            throw new SchemaSemanticException(open.getPosition(), "array size must be provided");
        }

        Dimension dimension;
        if (sizeToken.is(TokenType.INTEGER_LITERAL)) {
            advance();
            String digits = sizeToken.getText();
            if (!NumericLiterals.isDecimalDigits(digits)) {
                throw new SchemaSemanticException(sizeToken.getPosition(),
                        "array size must be a decimal integer, got '" + digits + "'");
            }
            BigInteger value = new BigInteger(digits);
            if (value.signum() <= 0 || value.bitLength() > 63) {
                throw new SchemaSemanticException(sizeToken.getPosition(),
                        "array size must be greater than zero and fit in 64 bits, got " + digits);
            }
            dimension = Dimension.literal(digits, value.longValue(), sizeToken.getPosition());
        } else if (sizeToken.is(TokenType.IDENTIFIER)) {
            String name = expectName("array size", false);
            dimension = Dimension.symbolic(name, sizeToken.getPosition());
        } else {
            throw unexpected("array size");
        }

        expectPunctuation("]");
        return dimension;
    }

    private void parseConstants(StructNode struct, String comment) {
        expectKeyword("const");
        SchemaToken typeToken = peek();
        if (!typeToken.is(TokenType.IDENTIFIER)) {
            throw unexpected("constant type");
        }
        advance();

        PrimitiveType type = PrimitiveType.fromTypeName(typeToken.getText())
                .filter(PrimitiveType::isConstantType)
                .orElseThrow(() -> new SchemaSemanticException(typeToken.getPosition(),
                        "invalid type for const: " + typeToken.getText()));

        boolean first = true;
        do {
            SchemaToken nameToken = peek();
            String constName = expectName("constant name", false);
            checkUniqueMember(struct, constName, nameToken.getPosition());
            expectPunctuation("=");
            String value = parseConstantValue(type);

            struct.addConstant(ConstantNode.builder()
                    .name(constName)
                    .type(type)
                    .value(value)
                    .comment(first ? comment : null)
                    .position(nameToken.getPosition())
                    .build());
            first = false;
        } while (matchPunctuation(","));

        expectPunctuation(";");
    }

    private String parseConstantValue(PrimitiveType type) {
        SchemaToken valueToken = peek();

        if (type.isIntegral()) {
            if (!valueToken.is(TokenType.INTEGER_LITERAL)) {
                throw unexpected("integer value");
            }
            advance();
            BigInteger value = NumericLiterals.parseInteger(valueToken.getText());
            if (!type.inRange(value)) {
                throw new SchemaSemanticException(valueToken.getPosition(),
                        "integer value out of bounds for " + type.getTypeName() + ": " + valueToken.getText());
            }
            return valueToken.getText();
        }

        if (!valueToken.is(TokenType.INTEGER_LITERAL) && !valueToken.is(TokenType.FLOAT_LITERAL)) {
            throw unexpected("floating point value");
        }
        try {
            Double.parseDouble(valueToken.getText());
        } catch (NumberFormatException e) {
            throw unexpected("floating point value");
        }
        advance();
        return valueToken.getText();
    }

    private void checkUniqueMember(StructNode struct, String memberName, SourcePosition position) {
        if (struct.hasMember(memberName)) {
            throw new SchemaSemanticException(position,
                    "duplicate member name '" + memberName + "' in struct " + struct.getQualifiedName());
        }
    }

    // ---------------------------------------------------------------
    // Enums
    // ---------------------------------------------------------------

    private EnumNode parseEnum(String comment) {
        SchemaToken keyword = expectKeyword("enum");
        String name = expectName("enum name", false);

        EnumNode enumNode = EnumNode.builder()
                .name(name)
                .packageName(currentPackageName())
                .comment(comment)
                .position(keyword.getPosition())
                .build();

        expectPunctuation("{");

        long nextOrdinal = 0;
        do {
            String valueComment = collectComments();
            if (checkPunctuation("}") && !enumNode.getValues().isEmpty()) {
                break;
            }

            SchemaToken nameToken = peek();
            String valueName = expectName("enum value name", false);

            int ordinal;
            boolean explicit = false;
            if (matchPunctuation("=")) {
                ordinal = parseOrdinal();
                explicit = true;
            } else if (nextOrdinal > Integer.MAX_VALUE) {
                throw new SchemaSemanticException(nameToken.getPosition(),
                        "enum value out of bounds for int32_t: " + nextOrdinal);
            } else {
                ordinal = (int) nextOrdinal;
            }

            if (enumNode.findValue(valueName).isPresent()) {
                throw new SchemaSemanticException(nameToken.getPosition(),
                        "duplicate enum value name '" + valueName + "' in enum " + enumNode.getQualifiedName());
            }
            if (enumNode.findByOrdinal(ordinal).isPresent()) {
                throw new SchemaSemanticException(nameToken.getPosition(),
                        "duplicate enum ordinal " + ordinal + " in enum " + enumNode.getQualifiedName());
            }

            enumNode.addValue(EnumValueNode.builder()
                    .name(valueName)
                    .ordinal(ordinal)
                    .explicitOrdinal(explicit)
                    .comment(valueComment)
                    .position(nameToken.getPosition())
                    .build());
            nextOrdinal = (long) ordinal + 1;
        } while (matchPunctuation(","));

        expectPunctuation("}");
        return enumNode;
    }

    private int parseOrdinal() {
        SchemaToken token = peek();
        if (!token.is(TokenType.INTEGER_LITERAL)) {
            throw unexpected("integer value");
        }
        advance();
        BigInteger value = NumericLiterals.parseInteger(token.getText());
        if (!PrimitiveType.INT32.inRange(value)) {
            throw new SchemaSemanticException(token.getPosition(),
                    "enum value out of bounds for int32_t: " + token.getText());
        }
        return value.intValue();
    }

    // ---------------------------------------------------------------
    // Names and comments
    // ---------------------------------------------------------------

    private String expectName(String what, boolean allowDots) {
        SchemaToken token = peek();
        if (!token.is(TokenType.IDENTIFIER) || !isValidName(token.getText(), allowDots)) {
            throw unexpected(what);
        }
        advance();
        return token.getText();
    }

    private void checkTypeName(SchemaToken typeToken) {
        if (!isValidName(typeToken.getText(), true)) {
            throw new ParseException(typeToken.getPosition(), "type name", typeToken.describe());
        }
    }

    private static boolean isValidName(String text, boolean allowDots) {
        String[] parts = allowDots ? text.split("\\.", -1) : new String[] { text };
        for (String part : parts) {
            if (part.isEmpty()) {
                return false;
            }
            int first = part.codePointAt(0);
            if (!Character.isLetter(first) && first != '_') {
                return false;
            }
            boolean rest = part.codePoints()
                    .skip(1)
                    .allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
            if (!rest) {
                return false;
            }
        }
        return true;
    }

    /**
     * Consumes consecutive comment tokens and joins them with newlines.
     * Returns null when there are none.
     */
    private String collectComments() {
        StringBuilder sb = null;
        while (pos < tokens.size() && tokens.get(pos).is(TokenType.COMMENT)) {
            String text = tokens.get(pos).getText();
            if (sb == null) {
                sb = new StringBuilder(text);
            } else {
                sb.append('\n').append(text);
            }
            pos++;
        }
        return sb == null ? null : sb.toString();
    }

    private void skipComments() {
        while (pos < tokens.size() && tokens.get(pos).is(TokenType.COMMENT)) {
            pos++;
        }
    }

    // ---------------------------------------------------------------
    // Token helpers
    // ---------------------------------------------------------------

    private SchemaToken peek() {
        skipComments();
        if (pos >= tokens.size()) {
            SchemaToken last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            if (last != null && last.isEof()) {
                return last;
            }
            return new SchemaToken(TokenType.EOF, "", fileName,
                    last != null ? last.getLine() : 1, last != null ? last.getColumn() : 0);
        }
        return tokens.get(pos);
    }

    private SchemaToken advance() {
        SchemaToken token = peek();
        if (!token.isEof()) {
            pos++;
        }
        return token;
    }

    private boolean checkPunctuation(String symbol) {
        return peek().isPunctuation(symbol);
    }

    private boolean matchPunctuation(String symbol) {
        if (checkPunctuation(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private SchemaToken expectPunctuation(String symbol) {
        if (checkPunctuation(symbol)) {
            return advance();
        }
        throw unexpected("'" + symbol + "'");
    }

    private SchemaToken expectKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            return advance();
        }
        throw unexpected("'" + keyword + "'");
    }

    private ParseException unexpected(String expected) {
        SchemaToken found = peek();
        return new ParseException(found.getPosition(), expected, found.describe());
    }
}
