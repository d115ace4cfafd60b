package preamble;

/**
 * How the next line is read.
 */
enum LineMode {
    /** Classify the line on its own. */
    DECLARATION,
    /** The previous macro definition ended with a backslash; the line belongs to it. */
    DEFINE_CONTINUATION
}
