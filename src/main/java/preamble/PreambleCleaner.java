package preamble;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans the preamble of a spec file.
 * <p>
 * Only keeps one empty line for many consecutive ones (and only when blank lines are
 * kept at all), puts one dependency per line, fixes licenses, standardizes BuildRoot
 * and reorders declarations into the canonical {@link Category} order.
 * <p>
 * Comment lines are attached to the declaration that follows them, so they move with
 * it. {@code %if}/{@code %else}/{@code %endif} blocks are reordered internally and then
 * moved as a whole, see {@link ConditionalStack}.
 */
@Slf4j
public class PreambleCleaner implements SectionCleaner {

    static final String BUILDROOT_VALUE = "%{_tmppath}/%{name}-%{version}-build";
    static final String GROUP_FIXME = "# FIXME: use correct group, see \"https://en.opensuse.org/openSUSE:Package_group_guidelines\"";
    static final String REQUIRES_EQ_FIXME = "# FIXME: Use %requires_eq macro instead";

    private static final Pattern RELEASE_KEPT = Pattern.compile("[a-zA-Z\\s]");

    private final CleanerOptions options;
    private final PreambleScope scope;
    private final PreambleLineClassifier classifier = new PreambleLineClassifier();
    private final DependencyNormalizer normalizer;
    private final LicenseFixer licenseFixer;
    private final ConditionalStack conditionals;

    private PreambleParagraph paragraph = new PreambleParagraph();
    private LineMode mode = LineMode.DECLARATION;
    private String previousLine = StringUtils.EMPTY;

    public PreambleCleaner(CleanerOptions options) {
        this(options, PreambleScope.PACKAGE);
    }

    public PreambleCleaner(CleanerOptions options, PreambleScope scope) {
        this.options = options;
        this.scope = scope;
        this.normalizer = new DependencyNormalizer(options);
        this.licenseFixer = new LicenseFixer(options.getLicenseConversions());
        this.conditionals = new ConditionalStack(options.isMinimal());
    }

    @Override
    public void add(String rawLine) {
        String line = StringUtils.stripEnd(rawLine == null ? "" : rawLine, null);

        if (line.isEmpty() && !options.isKeepSpace()) {
            return;
        }

        if (mode == LineMode.DEFINE_CONTINUATION) {
            seal(Category.DEFINE, line);
            if (!line.endsWith("\\")) {
                mode = LineMode.DECLARATION;
            }
            return;
        }

        ClassifiedLine classified = classifier.classify(line);
        switch (classified.getKind()) {
            case CONDITION_OPEN:
                seal(Category.CONDITIONS, line);
                paragraph = conditionals.open(paragraph, line);
                break;
            case CONDITION_ELSE:
                conditionals.ensureOpen(line);
                seal(Category.CONDITIONS, line);
                paragraph = conditionals.branch(paragraph, line);
                break;
            case CONDITION_CLOSE:
                conditionals.ensureOpen(line);
                seal(Category.CONDITIONS, line);
                paragraph = conditionals.close(paragraph, line);
                break;
            case COMMENT:
                addComment(line);
                break;
            case SOURCE:
                addValue(Category.SOURCE, classified.group(2), "Source" + sourceIndex(classified.group(1)));
                break;
            case PATCH:
                addValue(Category.PATCH, classified.group(2), "Patch" + sourceIndex(classified.group(1)));
                break;
            case BCOND:
                seal(Category.BCONDS, line);
                break;
            case DEFINE:
                addDefine(line);
                break;
            case REQUIRES_EQ:
                addValue(Category.REQUIRES_EQ, classified.group(1), null);
                break;
            case PREREQ:
                addValue(Category.PREREQ, classified.group(1), null);
                break;
            case REQUIRES_PHASE:
                addValue(Category.REQUIRES_PHASE, classified.group(2), "Requires" + classified.group(1));
                break;
            case PROVIDES:
                addValue(Category.PROVIDES_OBSOLETES, classified.group(1), "Provides");
                break;
            case OBSOLETES:
                addValue(Category.PROVIDES_OBSOLETES, classified.group(1), "Obsoletes");
                break;
            case BUILDROOT:
                addBuildRoot(line);
                break;
            case LICENSE:
                addLicense(classified.lastGroup());
                break;
            case RELEASE:
                addRelease(classified.group(1));
                break;
            case SUMMARY_LOCALIZED:
                addValue(Category.SUMMARY_LOCALIZED, classified.group(2), "Summary" + classified.group(1));
                break;
            case GROUP:
                addGroup(classified.group(1));
                break;
            case DEPRECATED:
                log.debug("Dropping deprecated declaration: {}", line);
                break;
            case SIMPLE:
                addValue(classified.getCategory(), classified.lastGroup(), null);
                break;
            case MISC:
            default:
                seal(Category.MISC, line);
                break;
        }
    }

    @Override
    public List<String> finish() {
        if (conditionals.isOpen()) {
            throw new PreambleStructureException(conditionals.depth() + " conditional block(s) not closed at the end of the preamble");
        }
        return paragraph.flatten();
    }

    private void addComment(String line) {
        // blank lines are collapsed and never lead a section
        if (!line.isEmpty() || !previousLine.isEmpty()) {
            paragraph.addComment(line);
            previousLine = line;
        }
    }

    private void addDefine(String line) {
        if (line.endsWith("\\")) {
            mode = LineMode.DEFINE_CONTINUATION;
        }
        // kernel module macros must come after all other declarations
        if (mode == LineMode.DECLARATION && line.contains("kernel_module")) {
            seal(Category.MISC, line);
        } else {
            seal(Category.DEFINE, line);
        }
    }

    private void addBuildRoot(String line) {
        if (paragraph.size(Category.BUILDROOT) == 0) {
            addValue(Category.BUILDROOT, BUILDROOT_VALUE, null);
        } else {
            log.debug("Dropping duplicate BuildRoot: {}", line);
        }
    }

    private void addLicense(String value) {
        String license = licenseFixer.fix(value);
        if (scope == PreambleScope.SUBPACKAGE && !options.isSubpackageLicense()) {
            log.debug("Dropping subpackage license: {}", license);
            return;
        }
        addValue(Category.LICENSE, license, null);
    }

    private void addRelease(String value) {
        if (RELEASE_KEPT.matcher(value).find()) {
            addValue(Category.RELEASE, value, null);
        } else {
            addValue(Category.RELEASE, "0", null);
        }
    }

    private void addGroup(String value) {
        if (!options.isMinimal()
                && !previousLine.startsWith("# FIXME")
                && !options.getAllowedGroups().contains(value)) {
            paragraph.addComment(GROUP_FIXME);
        }
        addValue(Category.GROUP, value, null);
    }

    /**
     * Seals a key-value declaration, splitting dependency lists into one line per entry.
     *
     * @param key explicit key when the category has none or it must be preserved
     *            (Provides vs. Obsoletes, source numbers, scriptlet phases)
     */
    private void addValue(Category category, String value, String key) {
        String prefix = category.prefix(key);
        List<String> values;
        if (category.isTokenBearing()) {
            NormalizedDependencies dependencies = normalizer.normalize(value, category);
            if (dependencies.isRpmQuery() && !options.isMinimal() && !previousLine.startsWith("#")) {
                paragraph.addComment(REQUIRES_EQ_FIXME);
            }
            values = dependencies.getValues();
        } else {
            values = List.of(value);
        }
        for (String item : values) {
            seal(category, prefix + item);
        }
    }

    private void seal(Category category, String line) {
        paragraph.seal(category, line);
        previousLine = line;
    }

    private static String sourceIndex(String index) {
        return index.isEmpty() ? "0" : index;
    }
}
