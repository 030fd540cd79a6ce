package work.lcod.dispatch.alias;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-backed {@link AliasMatcher}, anchored at the start of the input and case-insensitive.
 */
public final class AliasPattern implements AliasMatcher {
    private final String source;
    private final Pattern pattern;

    private AliasPattern(String source, Pattern pattern) {
        this.source = source;
        this.pattern = pattern;
    }

    /**
     * Matches the literal word {@code alias} followed by whitespace or the end of the input.
     */
    public static AliasPattern of(String alias) {
        Objects.requireNonNull(alias, "alias");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias must not be blank");
        }
        return regex(Pattern.quote(alias.trim()) + "(?=\\s|$)");
    }

    public static AliasPattern regex(String regex) {
        Objects.requireNonNull(regex, "regex");
        var compiled = Pattern.compile("^\\s*(?:" + regex + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new AliasPattern(regex, compiled);
    }

    @Override
    public boolean matches(String input) {
        return input != null && pattern.matcher(input).lookingAt();
    }

    @Override
    public String removeMatched(String input) {
        if (input == null) {
            return null;
        }
        Matcher m = pattern.matcher(input);
        if (!m.lookingAt()) {
            return input;
        }
        return input.substring(m.end()).trim();
    }

    @Override
    public String toString() {
        return "AliasPattern[" + source + "]";
    }
}
