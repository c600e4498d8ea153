package io.github.yok.toch.schema;

import io.github.yok.toch.exception.ConfigurationException;
import java.time.LocalDate;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Column value types supported by the destination.
 *
 * <p>
 * Each type carries its command-line token, the ClickHouse type name used in DDL and the fixed
 * illegal-value sentinel substituted for empty or unparseable cells.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ColumnType {

    STRING("s", "String", "!"),

    INT64("i", "Int64", Long.MAX_VALUE),

    FLOAT64("f", "Float64", Double.MAX_VALUE),

    DATE("d", "Date", LocalDate.of(1970, 1, 1));

    // Command-line token
    private final String token;

    // ClickHouse type name
    private final String clickHouseType;

    // Sentinel value for empty or unparseable cells
    private final Object illegalValue;

    /**
     * Resolves a command-line type token ({@code s}, {@code i}, {@code f}, {@code d}).
     *
     * @param token token, case-insensitive, surrounding spaces ignored
     * @return column type
     * @throws ConfigurationException for an unknown token
     */
    public static ColumnType fromToken(String token) {
        String t = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.token.equals(t)) {
                return type;
            }
        }
        throw new ConfigurationException(
                "invalid field type: '" + token + "' (expected one of s, i, f, d)");
    }
}
