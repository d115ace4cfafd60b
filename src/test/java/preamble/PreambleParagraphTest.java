package preamble;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreambleParagraphTest {

    @Test
    void flatten_followsCategoryOrder() {
        var paragraph = new PreambleParagraph();
        paragraph.seal(Category.MISC, "AutoReq: no");
        paragraph.seal(Category.REQUIRES, "Requires:       b");
        paragraph.seal(Category.NAME, "Name:           a");
        paragraph.seal(Category.DEFINE, "%define x 1");
        assertEquals(List.of("%define x 1", "Name:           a", "Requires:       b", "AutoReq: no"), paragraph.flatten());
    }

    @Test
    void seal_attachesPendingComments() {
        var paragraph = new PreambleParagraph();
        paragraph.addComment("# one");
        paragraph.addComment("# two");
        paragraph.seal(Category.REQUIRES, "Requires:       x");
        paragraph.seal(Category.REQUIRES, "Requires:       y");

        assertTrue(paragraph.getCurrentGroup().isEmpty());
        assertEquals(2, paragraph.size(Category.REQUIRES));
        assertEquals(List.of("# one", "# two", "Requires:       x", "Requires:       y"), paragraph.lines(Category.REQUIRES));
    }

    @Test
    void flatten_keepsSealingOrderWithinCategory() {
        var paragraph = new PreambleParagraph();
        paragraph.seal(Category.BUILDREQUIRES, "BuildRequires:  zzz");
        paragraph.seal(Category.BUILDREQUIRES, "BuildRequires:  aaa");
        assertEquals(List.of("BuildRequires:  zzz", "BuildRequires:  aaa"), paragraph.flatten());
    }

    @Test
    void moveAll_appendsToTarget() {
        var paragraph = new PreambleParagraph();
        paragraph.seal(Category.BUILD_CONDITIONS, "%if a");
        paragraph.seal(Category.CONDITIONS, "%if b");
        paragraph.appendBlock(Category.CONDITIONS, List.of("Requires:       c", "%endif"));
        paragraph.moveAll(Category.CONDITIONS, Category.BUILD_CONDITIONS);

        assertEquals(0, paragraph.size(Category.CONDITIONS));
        assertEquals(List.of("%if a", "%if b", "Requires:       c", "%endif"), paragraph.lines(Category.BUILD_CONDITIONS));
    }

    @Test
    void flatten_pendingCommentsLast() {
        var paragraph = new PreambleParagraph();
        paragraph.seal(Category.NAME, "Name:           a");
        paragraph.addComment("# dangling");
        assertEquals(List.of("Name:           a", "# dangling"), paragraph.flatten());
    }

    @Test
    void group_keepsCommentsBeforePayload() {
        var group = PreambleGroup.of(List.of("# c"), "Name:           a");
        assertEquals(List.of("# c"), group.getComments());
        assertEquals(List.of("Name:           a"), group.getPayload());
        assertEquals(List.of("# c", "Name:           a"), group.lines());
    }

    @Test
    void prefix_alignsValuesAtColumnSixteen() {
        assertEquals("Name:           ", Category.NAME.prefix(null));
        assertEquals("BuildRequires:  ", Category.BUILDREQUIRES.prefix(null));
        assertEquals("Requires(postun): ", Category.REQUIRES_PHASE.prefix("Requires(postun)"));
        assertEquals("%requires_eq ", Category.REQUIRES_EQ.prefix(null));
        assertEquals("Source3:        ", Category.SOURCE.prefix("Source3"));
    }
}
