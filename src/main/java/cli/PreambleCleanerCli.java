package cli;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import preamble.CleanerOptions;
import preamble.CleanerOptionsLoader;
import preamble.PreambleCleaner;
import preamble.PreambleScope;
import preamble.PreambleStructureException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 * <p>
 * Usage:
 * java -jar preamble-cleaner.jar [options] &lt;file&gt;
 * <p>
 * Flags only switch options on; everything else comes from the configuration file
 * (or the bundled defaults).
 */
@Slf4j
@Command(name = "preamble-cleaner", mixinStandardHelpOptions = true, version = "preamble-cleaner 1.0",
        description = "Normalizes the preamble of an RPM spec file")
@SuppressWarnings("java:S106")
public class PreambleCleanerCli implements Callable<Integer> {

    @Parameters(index = "0", description = "Preamble to clean", paramLabel = "<file>")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Write the result here instead of stdout", paramLabel = "<file>")
    private Path output;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = {"-m", "--minimal"}, description = "Only reorder and reformat, add no FIXME comments")
    private boolean minimal;

    @Option(names = "--keep-space", description = "Keep blank lines (collapsed to one)")
    private boolean keepSpace;

    @Option(names = {"-p", "--pkgconfig"}, description = "Convert -devel dependencies to pkgconfig()")
    private boolean pkgconfig;

    @Option(names = "--perl", description = "Convert perl dependencies to perl()")
    private boolean perl;

    @Option(names = "--cmake", description = "Convert cmake dependencies to cmake()")
    private boolean cmake;

    @Option(names = "--tex", description = "Convert texlive dependencies to tex()")
    private boolean tex;

    @Option(names = "--subpackage", description = "Clean the preamble of a subpackage")
    private boolean subpackage;

    @Option(names = "--subpackage-license", description = "Keep License: in subpackages")
    private boolean subpackageLicense;

    @Override
    public Integer call() throws IOException {
        CleanerOptions options = buildOptions();
        List<String> lines = Files.readAllLines(input, StandardCharsets.UTF_8);
        PreambleScope scope = subpackage ? PreambleScope.SUBPACKAGE : PreambleScope.PACKAGE;

        List<String> cleaned;
        try {
            cleaned = new PreambleCleaner(options, scope).clean(lines);
        } catch (PreambleStructureException e) {
            System.err.println("Error: " + input + ": " + e.getMessage());
            return 1;
        }

        String text = cleaned.isEmpty() ? "" : String.join("\n", cleaned) + "\n";
        if (output != null) {
            Files.writeString(output, text, StandardCharsets.UTF_8);
        } else {
            System.out.print(text);
        }
        log.info("Cleaned {} ({} lines in, {} lines out)", input, lines.size(), cleaned.size());
        return 0;
    }

    CleanerOptions buildOptions() {
        CleanerOptions base = configFile != null
                ? CleanerOptionsLoader.load(configFile)
                : CleanerOptionsLoader.loadDefaults();
        return base.toBuilder()
                .minimal(base.isMinimal() || minimal)
                .keepSpace(base.isKeepSpace() || keepSpace)
                .pkgconfig(base.isPkgconfig() || pkgconfig)
                .perl(base.isPerl() || perl)
                .cmake(base.isCmake() || cmake)
                .tex(base.isTex() || tex)
                .subpackageLicense(base.isSubpackageLicense() || subpackageLicense)
                .build();
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new PreambleCleanerCli()).execute(args));
    }
}
