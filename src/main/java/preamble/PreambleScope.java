package preamble;

/**
 * Which preamble is being cleaned: the main package or a {@code %package} subpackage.
 */
public enum PreambleScope {
    PACKAGE,
    SUBPACKAGE
}
