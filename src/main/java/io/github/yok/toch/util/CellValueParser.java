package io.github.yok.toch.util;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Parse rules shared by type inference and value coercion.
 *
 * <p>
 * Every method trims its input and returns {@code null} when the text does not parse; no method
 * throws for bad input.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class CellValueParser {

    // Decimal floating literal: optional sign, digits with optional fraction, optional exponent
    private static final Pattern FLOAT_LITERAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final DateParser dateParser;

    /**
     * Creates a parser using the given date parser.
     *
     * @param dateParser date parser
     */
    public CellValueParser(DateParser dateParser) {
        this.dateParser = dateParser;
    }

    /**
     * Parses a base-10 signed 64-bit integer.
     *
     * @param text cell text
     * @return value, or {@code null}
     */
    public Long parseInt64(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a decimal floating-point literal. Hexadecimal forms, {@code NaN} and
     * {@code Infinity} are rejected.
     *
     * @param text cell text
     * @return value, or {@code null}
     */
    public Double parseFloat64(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (!FLOAT_LITERAL.matcher(t).matches()) {
            return null;
        }
        double value = Double.parseDouble(t);
        return Double.isInfinite(value) ? null : value;
    }

    /**
     * Parses a date.
     *
     * @param text cell text
     * @return value, or {@code null}
     */
    public LocalDate parseDate(String text) {
        return text == null ? null : dateParser.parse(text.trim());
    }
}
