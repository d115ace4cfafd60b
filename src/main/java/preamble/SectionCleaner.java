package preamble;

import java.util.List;

/**
 * A cleaner for one section of a spec file. Lines are fed one at a time and the
 * cleaned section is returned once the last line has been added.
 */
public interface SectionCleaner {

    void add(String line);

    List<String> finish();

    default List<String> clean(List<String> lines) {
        for (String line : lines) {
            add(line);
        }
        return finish();
    }
}
