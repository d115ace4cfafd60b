package preamble;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@link CleanerOptions} from YAML.
 * <pre>
 * pkgconfig: true
 * keep_space: false
 * allowed_groups:
 *   - Development/Libraries/C and C++
 * license_conversions:
 *   GPLv2+: GPL-2.0-or-later
 * conversions:
 *   pkgconfig:
 *     glib2-devel: glib-2.0 gobject-2.0
 * </pre>
 */
public final class CleanerOptionsLoader {

    public static final String DEFAULT_RESOURCE = "/preamble-cleaner.yml";

    private CleanerOptionsLoader() {
    }

    public static CleanerOptions loadDefaults() {
        try (InputStream in = CleanerOptionsLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return CleanerOptions.defaults();
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static CleanerOptions load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration " + path, e);
        }
    }

    public static CleanerOptions load(Reader reader) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(reader);
        if (root == null) {
            return CleanerOptions.defaults();
        }
        Map<String, Object> config = asMap(root, "configuration root");

        return CleanerOptions.builder()
                .pkgconfig(getBoolean(config, "pkgconfig", false))
                .perl(getBoolean(config, "perl", false))
                .cmake(getBoolean(config, "cmake", false))
                .tex(getBoolean(config, "tex", false))
                .minimal(getBoolean(config, "minimal", false))
                .keepSpace(getBoolean(config, "keep_space", false))
                .subpackageLicense(getBoolean(config, "subpackage_license", false))
                .allowedGroups(getStringSet(config, "allowed_groups"))
                .licenseConversions(getStringMap(config, "license_conversions"))
                .conversions(getConversions(config))
                .build();
    }

    private static boolean getBoolean(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("'" + key + "' must be a boolean, got: " + value);
    }

    private static Set<String> getStringSet(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return Collections.unmodifiableSet(result);
    }

    private static Map<String, String> getStringMap(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : asMap(value, key).entrySet()) {
            result.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<Ecosystem, Map<String, List<String>>> getConversions(Map<String, Object> config) {
        Object value = config.get("conversions");
        if (value == null) {
            return Map.of();
        }
        Map<Ecosystem, Map<String, List<String>>> result = new EnumMap<>(Ecosystem.class);
        for (Map.Entry<String, Object> entry : asMap(value, "conversions").entrySet()) {
            Ecosystem ecosystem = toEcosystem(entry.getKey());
            Map<String, List<String>> table = new LinkedHashMap<>();
            if (entry.getValue() != null) {
                for (Map.Entry<String, Object> row : asMap(entry.getValue(), "conversions." + entry.getKey()).entrySet()) {
                    table.put(row.getKey(), toNames(row.getKey(), row.getValue()));
                }
            }
            result.put(ecosystem, Collections.unmodifiableMap(table));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Ecosystem toEcosystem(String key) {
        try {
            return Ecosystem.valueOf(key.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown conversion table '" + key + "'", e);
        }
    }

    private static List<String> toNames(String key, Object value) {
        if (value instanceof List) {
            List<String> names = new ArrayList<>();
            for (Object item : (List<?>) value) {
                names.add(String.valueOf(item));
            }
            return List.copyOf(names);
        }
        if (value instanceof String) {
            String names = ((String) value).trim();
            if (!names.isEmpty()) {
                return List.copyOf(Arrays.asList(names.split("\\s+")));
            }
        }
        throw new IllegalArgumentException("Conversion of '" + key + "' must be a list or a non-empty string");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(what + " must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }
}
