package preamble;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes a {@code License:} expression: upper-case operators, one space between
 * atoms, and every license name replaced through the conversion table.
 */
public class LicenseFixer {

    private static final Pattern SEPARATOR = Pattern.compile("\\(|\\)|;|\\s+(?:and|or|with)\\s+", Pattern.CASE_INSENSITIVE);

    private final Map<String, String> conversions;

    public LicenseFixer(Map<String, String> conversions) {
        this.conversions = conversions;
    }

    public String fix(String value) {
        if (StringUtils.isBlank(value)) {
            return StringUtils.EMPTY;
        }
        List<String> parts = new ArrayList<>();
        Matcher matcher = SEPARATOR.matcher(value);
        int start = 0;
        while (matcher.find()) {
            addLicense(parts, value.substring(start, matcher.start()));
            parts.add(operator(matcher.group()));
            start = matcher.end();
        }
        addLicense(parts, value.substring(start));

        return String.join(" ", parts)
                .replace("( ", "(")
                .replace(" )", ")");
    }

    private void addLicense(List<String> parts, String raw) {
        String license = raw.trim();
        if (!license.isEmpty()) {
            parts.add(conversions.getOrDefault(license, license));
        }
    }

    private static String operator(String separator) {
        String op = separator.trim();
        if (";".equals(op)) {
            return "AND";
        }
        return op.toUpperCase(Locale.ROOT);
    }
}
