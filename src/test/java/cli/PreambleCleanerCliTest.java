package cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreambleCleanerCliTest {

    @TempDir
    Path tempDir;

    @Test
    void call_writesCleanedPreamble() throws Exception {
        var input = tempDir.resolve("foo.preamble");
        var output = tempDir.resolve("foo.out");
        Files.writeString(input, "BuildRequires: foo >= 1.0, bar\nName: foo\nPatch: fix.patch\n");

        int exitCode = new CommandLine(new PreambleCleanerCli()).execute(input.toString(), "-o", output.toString());

        assertEquals(0, exitCode);
        assertEquals("Name:           foo\n"
                + "Patch0:         fix.patch\n"
                + "BuildRequires:  bar\n"
                + "BuildRequires:  foo >= 1.0\n", Files.readString(output));
    }

    @Test
    void call_pkgconfigFlagUsesBundledTables() throws Exception {
        var input = tempDir.resolve("foo.preamble");
        var output = tempDir.resolve("foo.out");
        Files.writeString(input, "BuildRequires: zlib-devel\n");

        int exitCode = new CommandLine(new PreambleCleanerCli()).execute("--pkgconfig", input.toString(), "-o", output.toString());

        assertEquals(0, exitCode);
        assertEquals("BuildRequires:  pkgconfig(zlib)\n", Files.readString(output));
    }

    @Test
    void call_subpackageDropsLicenseUnlessKept() throws Exception {
        var input = tempDir.resolve("sub.preamble");
        var output = tempDir.resolve("sub.out");
        Files.writeString(input, "License: MIT\nSummary: Sub tool\n");

        int exitCode = new CommandLine(new PreambleCleanerCli()).execute("--subpackage", input.toString(), "-o", output.toString());
        assertEquals(0, exitCode);
        assertEquals("Summary:        Sub tool\n", Files.readString(output));

        exitCode = new CommandLine(new PreambleCleanerCli())
                .execute("--subpackage", "--subpackage-license", input.toString(), "-o", output.toString());
        assertEquals(0, exitCode);
        assertEquals("Summary:        Sub tool\nLicense:        MIT\n", Files.readString(output));
    }

    @Test
    void call_unbalancedConditionalFails() throws Exception {
        var input = tempDir.resolve("broken.preamble");
        var output = tempDir.resolve("broken.out");
        Files.writeString(input, "Name: foo\n%if 0%{?suse_version}\nRequires: bar\n");

        int exitCode = new CommandLine(new PreambleCleanerCli()).execute(input.toString(), "-o", output.toString());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(output));
    }

    @Test
    void buildOptions_flagsOverrideConfiguration() throws Exception {
        var config = tempDir.resolve("cleaner.yml");
        Files.writeString(config, "perl: true\n");
        var cli = new PreambleCleanerCli();
        new CommandLine(cli).parseArgs("--config-file", config.toString(), "--minimal", "--keep-space", "in.spec");

        var options = cli.buildOptions();

        assertTrue(options.isPerl());
        assertTrue(options.isMinimal());
        assertTrue(options.isKeepSpace());
        assertFalse(options.isPkgconfig());
    }
}
