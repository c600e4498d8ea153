package io.github.yok.toch.schema;

import io.github.yok.toch.config.IngestConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns header cells into destination column names.
 *
 * <p>
 * <strong>Rules, applied in order to each (trimmed) header cell:</strong>
 * </p>
 * <ol>
 * <li>Optional camel case: spaces become {@code _}, the name is lower-cased and every {@code _} or
 * {@code .} is removed together with the following character, which is upper-cased
 * ({@code "Loan Amount"} becomes {@code "loanAmount"}). A trailing separator is dropped.</li>
 * <li>When {@code toch.naming.lower-case-names} is set, the name is lower-cased.</li>
 * <li>A name whose lower-cased form is a reserved name gets {@code 1} appended
 * ({@code "Index"} becomes {@code "Index1"}).</li>
 * <li>An empty name becomes {@code col<N>} (1-based position) and a repeated name gets a
 * {@code _<n>} suffix, so that names stay unique.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ColumnNamePolicy {

    private final boolean camelCase;
    private final boolean lowerCaseNames;
    private final Set<String> reservedNames;

    /**
     * Creates a policy.
     *
     * @param camelCase whether to convert names to camel case
     * @param naming naming configuration ({@code toch.naming})
     */
    public ColumnNamePolicy(boolean camelCase, IngestConfig.Naming naming) {
        this.camelCase = camelCase;
        this.lowerCaseNames = naming.isLowerCaseNames();
        this.reservedNames = naming.getReservedNames().stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    /**
     * Applies the naming rules to a header row.
     *
     * @param header header cells
     * @return final column names, same length and order
     */
    public List<String> apply(List<String> header) {
        List<String> names = new ArrayList<>(header.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String original = header.get(i);
            String name = rename(StringUtils.trimToEmpty(original));
            if (name.isEmpty()) {
                name = "col" + (i + 1);
            }
            if (used.contains(name)) {
                int n = 2;
                while (used.contains(name + "_" + n)) {
                    n++;
                }
                name = name + "_" + n;
            }
            used.add(name);
            if (!name.equals(original)) {
                log.debug("Column {} renamed: '{}' -> '{}'", i + 1, original, name);
            }
            names.add(name);
        }
        return names;
    }

    /**
     * Applies the camel case, lower case and reserved-name rules to a single name.
     *
     * @param name header cell
     * @return renamed column
     */
    public String rename(String name) {
        String result = camelCase ? toCamel(name) : name;
        if (lowerCaseNames) {
            result = result.toLowerCase(Locale.ROOT);
        }
        if (reservedNames.contains(result.toLowerCase(Locale.ROOT))) {
            result = result + "1";
        }
        return result;
    }

    /**
     * Converts a snake case or dotted name to camel case.
     *
     * @param name source name
     * @return camel case name
     */
    static String toCamel(String name) {
        String s = name.replace(' ', '_').toLowerCase(Locale.ROOT);
        int ind = StringUtils.indexOfAny(s, '_', '.');
        while (ind >= 0) {
            if (ind + 1 < s.length()) {
                s = s.substring(0, ind) + s.substring(ind + 1, ind + 2).toUpperCase(Locale.ROOT)
                        + s.substring(ind + 2);
            } else {
                s = s.substring(0, ind);
            }
            ind = StringUtils.indexOfAny(s, '_', '.');
        }
        return s;
    }
}
