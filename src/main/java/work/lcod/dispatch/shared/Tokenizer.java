package work.lcod.dispatch.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits argument text on whitespace. "Double quoted" and 'single quoted' runs stay one token,
 * without their quotes.
 */
public final class Tokenizer {
    private static final Pattern TOKENS = Pattern.compile("\"([^\"]*)\"|'([^']*)'|\\S+");

    private Tokenizer() {}

    public static List<String> split(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        Matcher m = TOKENS.matcher(text);
        while (m.find()) {
            String dq = m.group(1);
            String sq = m.group(2);
            tokens.add(dq != null ? dq : (sq != null ? sq : m.group()));
        }
        return tokens;
    }
}
