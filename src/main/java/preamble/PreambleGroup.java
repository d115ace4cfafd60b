package preamble;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Comment lines followed by the payload they describe. The comments move together
 * with the payload whenever the preamble is reordered.
 */
final class PreambleGroup {

    private final List<String> comments;
    private final List<String> payload;

    private PreambleGroup(List<String> comments, List<String> payload) {
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.payload = Collections.unmodifiableList(new ArrayList<>(payload));
    }

    static PreambleGroup of(List<String> comments, String line) {
        return new PreambleGroup(comments, List.of(line));
    }

    /**
     * A group whose payload is an already flattened block, such as a folded conditional.
     */
    static PreambleGroup block(List<String> lines) {
        return new PreambleGroup(List.of(), lines);
    }

    List<String> getComments() {
        return comments;
    }

    List<String> getPayload() {
        return payload;
    }

    List<String> lines() {
        List<String> lines = new ArrayList<>(comments.size() + payload.size());
        lines.addAll(comments);
        lines.addAll(payload);
        return lines;
    }
}
