package com.schemagen.compiler.parser;

import java.math.BigInteger;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Recognizes and converts the numeric literal forms the tokenizer accepts.
 */
@UtilityClass
public class NumericLiterals {

    private static final Pattern INTEGER = Pattern.compile("-?(0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+|[0-9]+)");
    private static final Pattern FLOAT = Pattern.compile("-?([0-9]+\\.[0-9]*|\\.[0-9]+|[0-9]+)([eE]-?[0-9]+)?");
    private static final Pattern DECIMAL_DIGITS = Pattern.compile("[0-9]+");

    public static boolean isInteger(String text) {
        return INTEGER.matcher(text).matches();
    }

    public static boolean isFloat(String text) {
        return !isInteger(text) && FLOAT.matcher(text).matches();
    }

    public static boolean isDecimalDigits(String text) {
        return DECIMAL_DIGITS.matcher(text).matches();
    }

    /**
     * Parses decimal, {@code 0x}, {@code 0o} and {@code 0b} integers with an
     * optional leading minus.
     *
     * @throws NumberFormatException if the text is not an integer literal
     */
    public static BigInteger parseInteger(String text) {
        if (!isInteger(text)) {
            throw new NumberFormatException("not an integer literal: " + text);
        }
        boolean negative = text.startsWith("-");
        String digits = negative ? text.substring(1) : text;
        int radix = 10;
        if (digits.length() > 2 && digits.charAt(0) == '0') {
            switch (Character.toLowerCase(digits.charAt(1))) {
                case 'x' -> radix = 16;
                case 'o' -> radix = 8;
                case 'b' -> radix = 2;
                default -> radix = 10;
            }
            if (radix != 10) {
                digits = digits.substring(2);
            }
        }
        BigInteger value = new BigInteger(digits, radix);
        return negative ? value.negate() : value;
    }
}
