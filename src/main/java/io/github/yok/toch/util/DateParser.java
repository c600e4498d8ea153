package io.github.yok.toch.util;

import io.github.yok.toch.exception.ConfigurationException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses date cells into {@link LocalDate}.
 *
 * <p>
 * When a pattern is configured, only that pattern is used. Otherwise the following patterns are
 * tried in order:
 * </p>
 * <ul>
 * <li>{@code uuuu-MM-dd}, {@code uuuu/M/d}, {@code uuuu-M-d}, {@code uuuuMMdd}</li>
 * <li>{@code MM/dd/uuuu}, {@code M/d/uuuu}</li>
 * <li>{@code MMM d uuuu}, {@code MMM d, uuuu}, {@code MMMM d, uuuu}</li>
 * </ul>
 *
 * <p>
 * Month names are matched case-insensitively in English. Resolution is strict: a day outside its
 * month ({@code 2023-02-30}) does not parse. Because strict resolution needs a proleptic year, the
 * year-of-era letter {@code y} of a configured pattern is read as {@code u}. Instances are
 * immutable and thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DateParser {

    /**
     * Patterns tried when no explicit pattern is configured.
     */
    public static final List<String> DEFAULT_PATTERNS =
            List.of("uuuu-MM-dd", "uuuu/M/d", "uuuu-M-d", "uuuuMMdd", "MM/dd/uuuu", "M/d/uuuu",
                    "MMM d uuuu", "MMM d, uuuu", "MMMM d, uuuu");

    private final List<DateTimeFormatter> formatters;

    /**
     * Creates a parser.
     *
     * @param pattern explicit pattern, or {@code null}/blank for the default pattern list
     * @throws ConfigurationException if the pattern is invalid
     */
    public DateParser(String pattern) {
        List<String> patterns =
                StringUtils.isBlank(pattern) ? DEFAULT_PATTERNS : List.of(pattern.trim());
        List<DateTimeFormatter> list = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            try {
                list.add(new DateTimeFormatterBuilder().parseCaseInsensitive()
                        .appendPattern(prolepticYear(p)).toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid date pattern: " + p, e);
            }
        }
        this.formatters = Collections.unmodifiableList(list);
    }

    /**
     * Parses the given text.
     *
     * @param text trimmed cell text
     * @return parsed date, or {@code null} if no pattern matches
     */
    public LocalDate parse(String text) {
        if (StringUtils.isEmpty(text)) {
            return null;
        }
        for (DateTimeFormatter formatter : formatters) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                // try next pattern
            }
        }
        return null;
    }

    // Replaces y with u outside quoted literals
    static String prolepticYear(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            sb.append(!quoted && c == 'y' ? 'u' : c);
        }
        return sb.toString();
    }
}
