package preamble;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * All categories of one nesting level of the preamble.
 * <p>
 * Comment lines are buffered in the current group until a payload line is sealed
 * into a category; the payload then takes the buffered comments with it.
 */
final class PreambleParagraph {

    private final Map<Category, List<PreambleGroup>> items = new EnumMap<>(Category.class);
    private final List<String> currentGroup = new ArrayList<>();

    PreambleParagraph() {
        for (Category category : Category.values()) {
            items.put(category, new ArrayList<>());
        }
    }

    void addComment(String line) {
        currentGroup.add(line);
    }

    List<String> getCurrentGroup() {
        return Collections.unmodifiableList(currentGroup);
    }

    void seal(Category category, String line) {
        items.get(category).add(PreambleGroup.of(currentGroup, line));
        currentGroup.clear();
    }

    void appendBlock(Category category, List<String> lines) {
        if (!lines.isEmpty()) {
            items.get(category).add(PreambleGroup.block(lines));
        }
    }

    int size(Category category) {
        return items.get(category).size();
    }

    List<String> lines(Category category) {
        List<String> lines = new ArrayList<>();
        for (PreambleGroup group : items.get(category)) {
            lines.addAll(group.lines());
        }
        return lines;
    }

    void clear(Category category) {
        items.get(category).clear();
    }

    /**
     * Moves every group of {@code from} to the end of {@code to}, keeping their order.
     */
    void moveAll(Category from, Category to) {
        List<PreambleGroup> source = items.get(from);
        items.get(to).addAll(source);
        source.clear();
    }

    /**
     * Renders the categories in canonical order. Comments that never got a payload
     * come last.
     */
    List<String> flatten() {
        List<String> lines = new ArrayList<>();
        for (Category category : Category.values()) {
            lines.addAll(lines(category));
        }
        lines.addAll(currentGroup);
        return lines;
    }
}
