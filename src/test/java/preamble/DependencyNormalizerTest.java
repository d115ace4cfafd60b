package preamble;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyNormalizerTest {

    private static final CleanerOptions ALL_TABLES = CleanerOptions.builder()
            .pkgconfig(true)
            .perl(true)
            .tex(true)
            .cmake(true)
            .conversions(Map.of(
                    Ecosystem.PKGCONFIG, Map.of("libxml2-devel", List.of("libxml-2.0")),
                    Ecosystem.PERL, Map.of("perl-URI", List.of("URI"), "libxml2-devel", List.of("XML::LibXML")),
                    Ecosystem.TEX, Map.of("texlive-latex", List.of("latex")),
                    Ecosystem.CMAKE, Map.of("extra-cmake-modules", List.of("ECM"))))
            .build();

    @Test
    void normalize_sortsAndSpaces() {
        var result = new DependencyNormalizer(CleanerOptions.defaults())
                .normalize("zlib-devel,foo>=1 bar", Category.BUILDREQUIRES);
        assertEquals(List.of("bar", "foo >= 1", "zlib-devel"), result.getValues());
        assertFalse(result.isRpmQuery());
    }

    @Test
    void normalize_fixesReversedOperators() {
        var result = new DependencyNormalizer(CleanerOptions.defaults())
                .normalize("a => 1 b =< 2", Category.REQUIRES);
        assertEquals(List.of("a >= 1", "b <= 2"), result.getValues());
    }

    @Test
    void normalize_macrosAndRichDependenciesUntouched() {
        var result = new DependencyNormalizer(ALL_TABLES)
                .normalize("%{name} = %{version} (foo if bar)", Category.REQUIRES);
        assertEquals(List.of("%{name} = %{version}", "(foo if bar)"), result.getValues());
    }

    @Test
    void normalize_rpmQueryKeptVerbatim() {
        var value = "%(rpm -q --qf '%%{version}' kernel)";
        var result = new DependencyNormalizer(ALL_TABLES).normalize(value, Category.REQUIRES);
        assertEquals(List.of(value), result.getValues());
        assertTrue(result.isRpmQuery());
    }

    @Test
    void normalize_pkgConfigSelfReferenceUnified() {
        var result = new DependencyNormalizer(CleanerOptions.defaults())
                .normalize("pkgconfig(pkg-config) >= 0.28", Category.BUILDREQUIRES);
        assertEquals(List.of("pkgconfig >= 0.28"), result.getValues());
        assertEquals("pkgconfig", DependencyNormalizer.unifyPkgconfigName("pkg-config"));
        assertEquals("pkg-configure", DependencyNormalizer.unifyPkgconfigName("pkg-configure"));
    }

    @Test
    void normalize_firstEcosystemWins() {
        var result = new DependencyNormalizer(ALL_TABLES)
                .normalize("libxml2-devel perl-URI texlive-latex extra-cmake-modules >= 5", Category.BUILDREQUIRES);
        assertEquals(List.of("cmake(ECM) >= 5", "perl(URI)", "pkgconfig(libxml-2.0)", "tex(latex)"), result.getValues());
    }

    @Test
    void normalize_disabledEcosystemSkipped() {
        var perlOnly = ALL_TABLES.toBuilder().pkgconfig(false).build();
        var result = new DependencyNormalizer(perlOnly).normalize("libxml2-devel", Category.BUILDREQUIRES);
        assertEquals(List.of("perl(XML::LibXML)"), result.getValues());
    }

    @Test
    void normalize_scriptletDependenciesNotConverted() {
        var normalizer = new DependencyNormalizer(ALL_TABLES);
        assertEquals(List.of("perl-URI"), normalizer.normalize("perl-URI", Category.PREREQ).getValues());
        assertEquals(List.of("perl-URI"), normalizer.normalize("perl-URI", Category.REQUIRES_PHASE).getValues());
    }
}
