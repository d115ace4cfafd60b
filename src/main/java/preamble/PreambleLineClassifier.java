package preamble;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a preamble line to its {@link LineKind}.
 * <p>
 * Rules are tried in list order and the first one matching at the start of the line
 * wins. Several patterns overlap on purpose (a {@code # MANUAL BEGIN} marker is also a
 * comment, {@code Requires(pre):} also starts with {@code Requires}), so the order
 * is part of the contract.
 */
public class PreambleLineClassifier {

    private static final List<Rule> RULES = List.of(
            rule("\\s*%\\{?if", LineKind.CONDITION_OPEN),
            rule("\\s*(### COMMON-([a-zA-Z0-9]+)-BEGIN ###|# MANUAL BEGIN|# PACKAGE-BEGIN)", LineKind.CONDITION_OPEN),
            rule("\\s*%(else|elif)", LineKind.CONDITION_ELSE),
            rule("\\s*%endif", LineKind.CONDITION_CLOSE),
            rule("\\s*(### COMMON-([a-zA-Z0-9]+)-END ###|# MANUAL END|# PACKAGE-END)", LineKind.CONDITION_CLOSE),
            rule("(?:$|\\s*#)", LineKind.COMMENT),
            rule("\\s*Source(\\d*)\\s*:\\s*(.*)", LineKind.SOURCE),
            rule("\\s*Patch(\\d*)\\s*:\\s*(\\S*)", LineKind.PATCH),
            rule("\\s*%bcond(?:_with|_without)?\\s", LineKind.BCOND),
            rule("\\s*%define\\s", LineKind.DEFINE),
            rule("\\s*%global\\s", LineKind.DEFINE),
            rule("\\s*%\\{!?[^?]*\\?[^:]+:[^}]+}", LineKind.DEFINE),
            rule("\\s*%requires_eq\\s+(.*)", LineKind.REQUIRES_EQ),
            rule("\\s*PreReq\\s*:\\s*(.*)", LineKind.PREREQ),
            rule("\\s*Requires(\\([^)]+\\))\\s*:\\s*(.*)", LineKind.REQUIRES_PHASE),
            rule("\\s*Provides\\s*:\\s*(.*)", LineKind.PROVIDES),
            rule("\\s*Obsoletes\\s*:\\s*(.*)", LineKind.OBSOLETES),
            rule("\\s*BuildRoot\\s*:\\s*(.*)", LineKind.BUILDROOT),
            rule("\\s*License\\s*:\\s*(.*)", LineKind.LICENSE),
            rule("\\s*Release\\s*:\\s*(.*)", LineKind.RELEASE),
            rule("\\s*Summary(\\(\\S+\\))\\s*:\\s*(.*)", LineKind.SUMMARY_LOCALIZED),
            rule("\\s*Group\\s*:\\s*(.*)", LineKind.GROUP),
            rule("\\s*(Vendor|AutoReqProv|Epoch|Icon|Copyright|Packager|Prefix)\\s*:", LineKind.DEPRECATED),
            rule("\\s*%debug_package", LineKind.DEPRECATED),
            simple("\\s*Name\\s*:\\s*(\\S*)", Category.NAME),
            simple("\\s*Version\\s*:\\s*(\\S*)", Category.VERSION),
            simple("\\s*Summary\\s*:\\s*(.*)", Category.SUMMARY),
            simple("\\s*Url\\s*:\\s*(\\S*)", Category.URL),
            simple("\\s*NoSource\\s*:\\s*(.*)", Category.NOSOURCE),
            simple("\\s*BuildRequires\\s*:\\s*(.*)", Category.BUILDREQUIRES),
            simple("\\s*Conflicts\\s*:\\s*(.*)", Category.CONFLICTS),
            simple("\\s*Requires\\s*:\\s*(.*)", Category.REQUIRES),
            simple("\\s*Recommends\\s*:\\s*(.*)", Category.RECOMMENDS),
            simple("\\s*Suggests\\s*:\\s*(.*)", Category.SUGGESTS),
            simple("\\s*Enhances\\s*:\\s*(.*)", Category.ENHANCES),
            simple("\\s*Supplements\\s*:\\s*(.*)", Category.SUPPLEMENTS),
            simple("\\s*BuildArch(itectures)?\\s*:\\s*(.*)", Category.BUILDARCH),
            simple("\\s*ExcludeArch\\s*:\\s*(.*)", Category.EXCLUDEARCH),
            simple("\\s*ExclusiveArch\\s*:\\s*(.*)", Category.EXCLUSIVEARCH)
    );

    public ClassifiedLine classify(String line) {
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern.matcher(line);
            if (matcher.lookingAt()) {
                return new ClassifiedLine(rule.kind, rule.category, captured(matcher));
            }
        }
        return new ClassifiedLine(LineKind.MISC, null, List.of());
    }

    private static List<String> captured(Matcher matcher) {
        List<String> groups = new ArrayList<>(matcher.groupCount());
        for (int i = 1; i <= matcher.groupCount(); i++) {
            String group = matcher.group(i);
            groups.add(group == null ? "" : group);
        }
        return groups;
    }

    private static Rule rule(String regex, LineKind kind) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), kind, null);
    }

    private static Rule simple(String regex, Category category) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), LineKind.SIMPLE, category);
    }

    private static final class Rule {
        final Pattern pattern;
        final LineKind kind;
        final Category category;

        Rule(Pattern pattern, LineKind kind, Category category) {
            this.pattern = pattern;
            this.kind = kind;
            this.category = category;
        }
    }
}
