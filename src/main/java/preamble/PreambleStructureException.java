package preamble;

/**
 * Raised when the conditional directives of a preamble are not balanced.
 */
public class PreambleStructureException extends IllegalStateException {

    public PreambleStructureException(String message) {
        super(message);
    }
}
