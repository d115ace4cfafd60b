package preamble;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the value of a dependency declaration into {@code name [op version]} tokens.
 * <p>
 * Entries are separated by whitespace or commas. Anything inside brackets
 * ({@code %{...}}, {@code %(...)}, {@code pkgconfig(...)}, rich dependencies) is kept
 * as part of the surrounding atom.
 */
final class DependencyTokenizer {

    private DependencyTokenizer() {
    }

    static List<String> tokenize(String value) {
        List<Atom> atoms = scan(value == null ? "" : value);
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < atoms.size()) {
            Atom atom = atoms.get(i);
            if (atom.operator) {
                // operator without a package in front of it, keep it visible
                tokens.add(atom.text);
                i++;
                continue;
            }
            if (i + 2 < atoms.size() && atoms.get(i + 1).operator && !atoms.get(i + 2).operator) {
                tokens.add(atom.text + " " + atoms.get(i + 1).text + " " + atoms.get(i + 2).text);
                i += 3;
            } else if (i + 1 < atoms.size() && atoms.get(i + 1).operator) {
                tokens.add(atom.text + " " + atoms.get(i + 1).text);
                i += 2;
            } else {
                tokens.add(atom.text);
                i++;
            }
        }
        return tokens;
    }

    private static List<Atom> scan(String value) {
        List<Atom> atoms = new ArrayList<>();
        int pos = 0;
        int length = value.length();
        while (pos < length) {
            char c = value.charAt(pos);
            if (isSeparator(c)) {
                pos++;
            } else if (isOperator(c)) {
                int start = pos;
                while (pos < length && isOperator(value.charAt(pos))) {
                    pos++;
                }
                atoms.add(new Atom(value.substring(start, pos), true));
            } else {
                int start = pos;
                int depth = 0;
                while (pos < length) {
                    char ch = value.charAt(pos);
                    if (depth == 0 && (isSeparator(ch) || isOperator(ch))) {
                        break;
                    }
                    if (ch == '(' || ch == '{' || ch == '[') {
                        depth++;
                    } else if ((ch == ')' || ch == '}' || ch == ']') && depth > 0) {
                        depth--;
                    }
                    pos++;
                }
                atoms.add(new Atom(value.substring(start, pos), false));
            }
        }
        return atoms;
    }

    private static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || c == ',';
    }

    private static boolean isOperator(char c) {
        return c == '<' || c == '>' || c == '=';
    }

    private static final class Atom {
        final String text;
        final boolean operator;

        Atom(String text, boolean operator) {
            this.text = text;
            this.operator = operator;
        }
    }
}
