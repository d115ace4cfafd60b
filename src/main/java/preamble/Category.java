package preamble;

import org.apache.commons.lang3.StringUtils;

/**
 * Buckets of the preamble. The declaration order is the output order.
 */
public enum Category {
    DEFINE(null, false),
    BCONDS(null, false),
    BCOND_CONDITIONS(null, false),
    NAME("Name", false),
    VERSION("Version", false),
    RELEASE("Release", false),
    SUMMARY("Summary", false),
    SUMMARY_LOCALIZED(null, false),
    LICENSE("License", false),
    GROUP("Group", false),
    URL("URL", false),
    SOURCE(null, false),
    NOSOURCE("NoSource", false),
    PATCH(null, false),
    BUILD_CONDITIONS(null, false),
    BUILDREQUIRES("BuildRequires", true),
    REQUIRES("Requires", true),
    REQUIRES_EQ("%requires_eq", true),
    REQUIRES_PHASE(null, true),
    // renders as Requires(pre), so it has to sit next to the other phases
    PREREQ("Requires(pre)", true),
    RECOMMENDS("Recommends", true),
    SUGGESTS("Suggests", true),
    ENHANCES("Enhances", true),
    SUPPLEMENTS("Supplements", true),
    CONFLICTS("Conflicts", true),
    PROVIDES_OBSOLETES(null, true),
    BUILDROOT("BuildRoot", false),
    BUILDARCH("BuildArch", false),
    EXCLUDEARCH("ExcludeArch", false),
    EXCLUSIVEARCH("ExclusiveArch", false),
    MISC(null, false),
    CONDITIONS(null, false);

    /** Column at which values of key-value lines start. */
    static final int VALUE_COLUMN = 16;

    private final String key;
    private final boolean tokenBearing;

    Category(String key, boolean tokenBearing) {
        this.key = key;
        this.tokenBearing = tokenBearing;
    }

    /**
     * Whether values of this category are dependency lists that go through the
     * {@link DependencyNormalizer}.
     */
    public boolean isTokenBearing() {
        return tokenBearing;
    }

    /**
     * Builds the aligned line prefix for a value of this category.
     *
     * @param explicitKey key to use instead of the category key, e.g. {@code Source1}
     *                    or {@code Provides}; may be null
     */
    public String prefix(String explicitKey) {
        String tag = explicitKey != null ? explicitKey : key;
        if (tag == null) {
            throw new IllegalArgumentException("Category " + name() + " needs an explicit key");
        }
        if (this == REQUIRES_EQ) {
            return tag + " ";
        }
        String head = tag + ":";
        if (head.length() < VALUE_COLUMN) {
            return StringUtils.rightPad(head, VALUE_COLUMN);
        }
        return head + " ";
    }
}
