package io.github.yok.toch.config;

import io.github.yok.toch.exception.ConfigurationException;
import io.github.yok.toch.exception.SchemaMismatchException;
import io.github.yok.toch.schema.ColumnType;
import io.github.yok.toch.source.CellRange;
import io.github.yok.toch.source.SourceFormat;
import io.github.yok.toch.source.SourceSpec;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses and validates the command-line arguments into {@link IngestOptions}.
 *
 * <p>
 * Flags may be written with one or two leading dashes, and a value may be attached with
 * {@code =} ({@code -type=csv}). {@code --source} is an alias of {@code -s}. Every check happens
 * here, before the source or the destination is touched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CommandLineParser {

    /**
     * Usage text printed for {@code -help} and configuration errors.
     */
    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: toch -s <source> -type <text|csv|xlsx|xls> -table <table> [options]",
            "",
            "Required arguments:",
            "   -s, --source    source of data: a file path or an http(s) address",
            "   -type           type of data: text (tab delimited), csv, xlsx, xls",
            "   -table          destination ClickHouse table",
            "",
            "Optional arguments:",
            "   -host           ClickHouse host (default: clickhouse.host)",
            "   -user           ClickHouse user (default: clickhouse.user)",
            "   -password       ClickHouse password (default: clickhouse.password)",
            "   -c Y|N          convert field names to camel case (default: N)",
            "   -i Y|N          skip rows that cannot be read or written (default: N)",
            "   -q <char>       quote character of delimited text; empty disables (default: \")",
            "   -skip <n>       number of leading rows to skip (default: 0)",
            "   -h 'f1,f2,...'  field names; default: read from the first row",
            "   -t 't1,t2,...'  field types; default: inferred from the data",
            "                   s = String, i = Int64, f = Float64, d = Date",
            "   -sheet <name>   sheet of an Excel source (default: first sheet)",
            "   -rows <S:E>     0-based row range of an Excel source; E=0 means to the end",
            "   -cols <S:E>     0-based column range of an Excel source; E=0 means to the end",
            "   -batch <n>      rows per insert batch; 0 = single batch (default: toch.batch-size)",
            "   -date <pattern> date pattern, e.g. yyyy-MM-dd (default: built-in patterns)",
            "   -help           print this help",
            "",
            "Notes:",
            "  - if -h or -t is supplied, it must list every field; -h and -t are independent.",
            "  - -skip is applied within the -rows range for Excel sources.",
            "  - carriage returns in delimited data are ignored.");

    // Flags that take a value, with their aliases resolved
    private static final Set<String> VALUE_FLAGS = Set.of("s", "type", "table", "host", "user",
            "password", "c", "i", "skip", "q", "h", "t", "sheet", "rows", "cols", "batch", "date");

    private static final Map<String, String> ALIASES = Map.of("source", "s");

    /**
     * Parses the arguments.
     *
     * @param args command-line arguments
     * @return validated options; {@link IngestOptions#isHelp()} is set when help was requested
     * @throws ConfigurationException on any invalid, missing or unknown argument
     * @throws SchemaMismatchException when {@code -h} and {@code -t} differ in length
     */
    public IngestOptions parse(String... args) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
                throw new ConfigurationException("unexpected argument: " + arg);
            }
            String name = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            name = ALIASES.getOrDefault(name, name);
            if ("help".equals(name)) {
                return IngestOptions.builder().help(true).build();
            }
            if (!VALUE_FLAGS.contains(name)) {
                throw new ConfigurationException("unknown flag: " + arg);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("flag needs an argument: " + arg);
                }
                value = args[++i];
            }
            values.put(name, value);
        }
        return build(values);
    }

    private IngestOptions build(Map<String, String> values) {
        if (StringUtils.isBlank(values.get("type"))) {
            throw new ConfigurationException("-type is required (" + SourceFormat.tokens() + ")");
        }
        SourceFormat format = SourceFormat.fromToken(values.get("type"));

        String source = StringUtils.trimToNull(values.get("s"));
        if (source == null) {
            throw new ConfigurationException("-s (source) is required");
        }
        String table = StringUtils.trimToNull(values.get("table"));
        if (table == null) {
            throw new ConfigurationException("-table is required");
        }

        boolean camel = yesNo("c", values.getOrDefault("c", "N"));
        boolean ignore = yesNo("i", values.getOrDefault("i", "N"));
        Character quote = quote(values.getOrDefault("q", "\""));
        int skip = nonNegative("skip", values.getOrDefault("skip", "0"));
        Integer batch =
                values.containsKey("batch") ? nonNegative("batch", values.get("batch")) : null;
        CellRange range = CellRange.parse(values.getOrDefault("rows", "0:0"),
                values.getOrDefault("cols", "0:0"));

        if (!format.isSpreadsheet() && quote != null && quote == format.getSeparator()) {
            throw new ConfigurationException("-q must differ from the field separator");
        }

        List<String> headers = list(values.get("h"));
        if (headers.stream().anyMatch(String::isEmpty)) {
            throw new ConfigurationException("-h contains an empty field name");
        }
        Set<String> seen = new HashSet<>();
        for (String name : headers) {
            if (!seen.add(name)) {
                throw new ConfigurationException("-h contains a duplicate field name: " + name);
            }
        }
        List<ColumnType> types = list(values.get("t")).stream()
                .map(t -> ColumnType.fromToken(t.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
        if (!headers.isEmpty() && !types.isEmpty() && headers.size() != types.size()) {
            throw new SchemaMismatchException("-h field names (" + headers.size()
                    + ") and -t field types (" + types.size() + ") must have the same length");
        }

        SourceSpec spec = SourceSpec.builder().identifier(source).format(format).quote(quote)
                .skip(skip).range(range).sheetName(StringUtils.trimToNull(values.get("sheet")))
                .build();
        IngestOptions options = IngestOptions.builder().source(spec).table(table)
                .headerNames(headers).types(types).camelCase(camel).tolerateRowErrors(ignore)
                .datePattern(StringUtils.trimToNull(values.get("date"))).batchSize(batch)
                .host(StringUtils.trimToNull(values.get("host"))).user(values.get("user"))
                .password(values.get("password")).build();
        log.debug("Parsed options: source={}, type={}, table={}", source, format.getToken(), table);
        return options;
    }

    private static boolean yesNo(String flag, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("y".equals(v)) {
            return true;
        }
        if ("n".equals(v)) {
            return false;
        }
        throw new ConfigurationException("-" + flag + " option is Y or N: " + value);
    }

    private static Character quote(String value) {
        if (value.isEmpty()) {
            return null;
        }
        if (value.length() > 1) {
            throw new ConfigurationException("-q option is a single character: " + value);
        }
        return value.charAt(0);
    }

    private static int nonNegative(String flag, String value) {
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("-" + flag + " must be an integer: " + value, e);
        }
        if (n < 0) {
            throw new ConfigurationException("-" + flag + " value must be non-negative: " + value);
        }
        return n;
    }

    // Splits 'a,b,c', dropping spaces and single quotes
    private static List<String> list(String value) {
        if (StringUtils.isBlank(value)) {
            return Collections.emptyList();
        }
        String cleaned = StringUtils.remove(StringUtils.deleteWhitespace(value), '\'');
        return Arrays.asList(cleaned.split(",", -1));
    }
}
