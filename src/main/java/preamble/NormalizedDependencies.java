package preamble;

import lombok.Value;

import java.util.List;

/**
 * Result of normalizing one dependency value.
 */
@Value
public class NormalizedDependencies {

    /** One entry per output line, without the key. */
    List<String> values;

    /** The value queries rpm itself and was left untouched. */
    boolean rpmQuery;

    static NormalizedDependencies of(List<String> values) {
        return new NormalizedDependencies(List.copyOf(values), false);
    }

    static NormalizedDependencies verbatim(String value) {
        return new NormalizedDependencies(List.of(value), true);
    }
}
