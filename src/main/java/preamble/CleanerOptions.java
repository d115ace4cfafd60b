package preamble;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only configuration of one cleaning run.
 */
@Value
@Builder(toBuilder = true)
public class CleanerOptions {

    boolean pkgconfig;
    boolean perl;
    boolean cmake;
    boolean tex;

    /** Only reformat, skip the advisory FIXME comments and dead code pruning. */
    boolean minimal;

    /** Keep (collapsed) blank lines instead of dropping them. */
    boolean keepSpace;

    /** Keep {@code License:} in subpackage preambles. */
    boolean subpackageLicense;

    @Builder.Default
    Set<String> allowedGroups = Set.of();

    @Builder.Default
    Map<String, String> licenseConversions = Map.of();

    @Builder.Default
    Map<Ecosystem, Map<String, List<String>>> conversions = Map.of();

    public boolean isEnabled(Ecosystem ecosystem) {
        switch (ecosystem) {
            case PKGCONFIG:
                return pkgconfig;
            case PERL:
                return perl;
            case TEX:
                return tex;
            case CMAKE:
                return cmake;
            default:
                return false;
        }
    }

    public Map<String, List<String>> conversionsFor(Ecosystem ecosystem) {
        return conversions.getOrDefault(ecosystem, Map.of());
    }

    public static CleanerOptions defaults() {
        return CleanerOptions.builder().build();
    }
}
