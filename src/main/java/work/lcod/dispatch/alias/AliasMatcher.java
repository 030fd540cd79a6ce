package work.lcod.dispatch.alias;

/**
 * Decides whether a line of input selects a command (or subcommand) and strips the selecting text.
 */
public interface AliasMatcher {
    boolean matches(String input);

    /**
     * Returns {@code input} without the matched alias and the whitespace that follows it. Input that
     * does not match is returned unchanged.
     */
    String removeMatched(String input);
}
