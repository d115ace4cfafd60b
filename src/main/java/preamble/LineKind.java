package preamble;

/**
 * Shapes of preamble lines recognized by {@link PreambleLineClassifier}.
 */
public enum LineKind {
    CONDITION_OPEN,
    CONDITION_ELSE,
    CONDITION_CLOSE,
    COMMENT,
    SOURCE,
    PATCH,
    BCOND,
    DEFINE,
    REQUIRES_EQ,
    PREREQ,
    REQUIRES_PHASE,
    PROVIDES,
    OBSOLETES,
    BUILDROOT,
    LICENSE,
    RELEASE,
    SUMMARY_LOCALIZED,
    GROUP,
    DEPRECATED,
    SIMPLE,
    MISC
}
