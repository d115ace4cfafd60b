package preamble;

/**
 * Dependency namespaces with a name conversion table, in lookup priority order.
 */
public enum Ecosystem {
    PKGCONFIG("pkgconfig"),
    PERL("perl"),
    TEX("tex"),
    CMAKE("cmake");

    private final String prefix;

    Ecosystem(String prefix) {
        this.prefix = prefix;
    }

    public String wrap(String name) {
        return prefix + "(" + name + ")";
    }
}
