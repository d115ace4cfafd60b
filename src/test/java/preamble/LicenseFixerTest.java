package preamble;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LicenseFixerTest {

    private final LicenseFixer fixer = new LicenseFixer(Map.of(
            "GPLv2+", "GPL-2.0-or-later",
            "Apache 2.0", "Apache-2.0"));

    @Test
    void fix_convertsKnownNames() {
        assertEquals("GPL-2.0-or-later", fixer.fix("GPLv2+"));
        assertEquals("Apache-2.0", fixer.fix("  Apache 2.0 "));
    }

    @Test
    void fix_uppercasesOperators() {
        assertEquals("GPL-2.0-or-later AND MIT", fixer.fix("GPLv2+ and MIT"));
        assertEquals("MIT OR BSD-3-Clause", fixer.fix("MIT Or BSD-3-Clause"));
        assertEquals("GPL-2.0-only WITH Linux-syscall-note", fixer.fix("GPL-2.0-only with Linux-syscall-note"));
    }

    @Test
    void fix_semicolonMeansAnd() {
        assertEquals("GPL-2.0-or-later AND MIT", fixer.fix("GPLv2+; MIT"));
    }

    @Test
    void fix_parenthesesWithoutInnerSpaces() {
        assertEquals("(MIT OR Apache-2.0) AND GPL-2.0-or-later", fixer.fix("( MIT or Apache 2.0 ) and GPLv2+"));
    }

    @Test
    void fix_leavesNamesContainingOperatorWords() {
        assertEquals("Sendmail", fixer.fix("Sendmail"));
        assertEquals("Unicode-DFS-2016 OR Zlib", fixer.fix("Unicode-DFS-2016 or Zlib"));
    }

    @Test
    void fix_blankValue() {
        assertEquals("", fixer.fix("  "));
    }
}
