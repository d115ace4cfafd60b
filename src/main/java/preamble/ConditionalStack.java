package preamble;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Nesting of {@code %if}/{@code %else}/{@code %endif} blocks.
 * <p>
 * Every open block gets a fresh {@link PreambleParagraph}; the enclosing one is kept
 * in a frame until the block closes. On close the block is folded into the parent's
 * {@link Category#CONDITIONS} bucket and then moved to the bucket it renders from:
 * blocks carrying macro or bcond definitions are hoisted in front of everything that
 * may depend on them, the rest lands in {@link Category#BUILD_CONDITIONS}.
 */
@Slf4j
final class ConditionalStack {

    static final String PPC_BUG_MARKER = "# bug437293";

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final boolean minimal;
    private boolean defineBearing;
    private boolean bcondHint;

    ConditionalStack(boolean minimal) {
        this.minimal = minimal;
    }

    int depth() {
        return frames.size();
    }

    boolean isOpen() {
        return !frames.isEmpty();
    }

    boolean isBcondHint() {
        return bcondHint;
    }

    /**
     * Starts a block. The opener line must already be sealed into {@code current}.
     *
     * @return the paragraph collecting the block body
     */
    PreambleParagraph open(PreambleParagraph current, String opener) {
        if (opener.contains("%{with") || opener.contains("%{without")) {
            bcondHint = true;
        }
        frames.push(new Frame(current));
        return new PreambleParagraph();
    }

    void ensureOpen(String line) {
        if (frames.isEmpty()) {
            throw new PreambleStructureException("'" + line + "' without an open conditional");
        }
    }

    /**
     * Ends the current branch and starts a sibling one at the same depth.
     */
    PreambleParagraph branch(PreambleParagraph body, String line) {
        ensureOpen(line);
        Frame frame = frames.peek();
        fold(frame, body);
        return new PreambleParagraph();
    }

    /**
     * Ends the block, folds it into the enclosing paragraph and decides where it renders.
     *
     * @return the enclosing paragraph
     */
    PreambleParagraph close(PreambleParagraph body, String line) {
        ensureOpen(line);
        Frame frame = frames.pop();
        fold(frame, body);
        PreambleParagraph parent = frame.parent;

        if (!minimal && isObsoletePpcBlock(parent.lines(Category.CONDITIONS))) {
            log.debug("Dropping obsolete ppc64 block: {}", parent.lines(Category.CONDITIONS));
            parent.clear(Category.CONDITIONS);
        }

        Category target;
        if (defineBearing) {
            if (bcondHint) {
                target = Category.BCOND_CONDITIONS;
            } else if (frame.defines == 0) {
                target = Category.BCONDS;
            } else {
                target = Category.DEFINE;
            }
            // enclosing blocks inherit the flag, the outermost one clears it
            if (frames.isEmpty()) {
                defineBearing = false;
            }
        } else {
            target = Category.BUILD_CONDITIONS;
        }
        log.debug("Conditional block closed at depth {} goes to {}", frames.size(), target);
        parent.moveAll(Category.CONDITIONS, target);

        if (frames.isEmpty()) {
            bcondHint = false;
        }
        return parent;
    }

    private void fold(Frame frame, PreambleParagraph body) {
        int defines = body.size(Category.DEFINE);
        if (defines > 0 || body.size(Category.BCONDS) > 0) {
            defineBearing = true;
        }
        frame.defines += defines;
        frame.parent.appendBlock(Category.CONDITIONS, body.flatten());
    }

    /**
     * Blocks guarding the retired ppc64 "64bit" packages: opener, marker comment,
     * one declaration ending with {@code 64bit} and the closer.
     */
    static boolean isObsoletePpcBlock(List<String> lines) {
        return lines.size() == 4
                && (PPC_BUG_MARKER.equals(lines.get(0)) || PPC_BUG_MARKER.equals(lines.get(1)))
                && lines.get(2).endsWith("64bit");
    }

    private static final class Frame {
        final PreambleParagraph parent;
        int defines;

        Frame(PreambleParagraph parent) {
            this.parent = parent;
        }
    }
}
