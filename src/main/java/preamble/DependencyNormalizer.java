package preamble;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites dependency values: one token per entry, canonical operators and spacing,
 * unified pkgconfig naming and optional conversion of bare package names into
 * {@code pkgconfig(...)}, {@code perl(...)}, {@code tex(...)} or {@code cmake(...)}
 * capabilities.
 */
public class DependencyNormalizer {

    private static final Pattern RPM_COMMAND = Pattern.compile("%\\(\\s*(rpm|echo\\s+`rpm)\\s*(.*)\\)");
    private static final Pattern OPERATOR = Pattern.compile("([<>]=?|=)");
    private static final Pattern NAME_AND_VERSION = Pattern.compile("(\\S+)(.*)");
    private static final String PKGCONFIG = "pkgconfig";

    private final CleanerOptions options;

    public DependencyNormalizer(CleanerOptions options) {
        this.options = options;
    }

    public NormalizedDependencies normalize(String value, Category category) {
        if (RPM_COMMAND.matcher(value).find()) {
            return NormalizedDependencies.verbatim(value);
        }

        List<String> expanded = new ArrayList<>();
        for (String raw : DependencyTokenizer.tokenize(value)) {
            String token = raw.replace("=<", "<=").replace("=>", ">=");
            // macros and rich dependencies cannot be split safely
            if (token.startsWith("%") || token.startsWith("(")) {
                expanded.add(token);
                continue;
            }
            token = StringUtils.deleteWhitespace(token);
            token = OPERATOR.matcher(token).replaceAll(" $1 ").trim();
            if (token.isEmpty()) {
                continue;
            }
            token = unifyPkgconfigName(token);
            if (category == Category.PREREQ || category == Category.REQUIRES_PHASE) {
                // scriptlet dependencies are needed by name at install time
                expanded.add(token);
            } else {
                expanded.addAll(convert(token));
            }
        }
        Collections.sort(expanded);
        return NormalizedDependencies.of(expanded);
    }

    static String unifyPkgconfigName(String token) {
        String[] parts = splitNameAndVersion(token);
        if ("pkgconfig(pkg-config)".equals(parts[0]) || "pkg-config".equals(parts[0])) {
            return PKGCONFIG + parts[1];
        }
        return token;
    }

    private List<String> convert(String token) {
        String[] parts = splitNameAndVersion(token);
        if (PKGCONFIG.equals(parts[0])) {
            return List.of(token);
        }
        for (Ecosystem ecosystem : Ecosystem.values()) {
            if (!options.isEnabled(ecosystem)) {
                continue;
            }
            Map<String, List<String>> table = options.conversionsFor(ecosystem);
            List<String> names = table.get(parts[0]);
            if (names != null && !names.isEmpty()) {
                List<String> converted = new ArrayList<>(names.size());
                for (String name : names) {
                    converted.add(ecosystem.wrap(name) + parts[1]);
                }
                return converted;
            }
        }
        return List.of(token);
    }

    /**
     * @return package name and the rest of the token (including its leading space)
     */
    private static String[] splitNameAndVersion(String token) {
        Matcher matcher = NAME_AND_VERSION.matcher(token);
        if (!matcher.matches()) {
            return new String[]{token, StringUtils.EMPTY};
        }
        return new String[]{matcher.group(1), matcher.group(2)};
    }
}
