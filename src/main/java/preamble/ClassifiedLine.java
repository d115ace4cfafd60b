package preamble;

import lombok.Value;

import java.util.List;

/**
 * A line together with the rule that matched it and the groups that rule captured.
 */
@Value
public class ClassifiedLine {

    LineKind kind;

    /** Target category of {@link LineKind#SIMPLE} lines, null otherwise. */
    Category category;

    /** Captured groups, group 1 first; unmatched optional groups are empty strings. */
    List<String> groups;

    public String group(int index) {
        return groups.get(index - 1);
    }

    public String lastGroup() {
        return groups.isEmpty() ? "" : groups.get(groups.size() - 1);
    }
}
