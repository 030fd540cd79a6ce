package work.lcod.dispatch.alias;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AliasPatternTest {
    @Test
    void matchesWholeWordPrefixIgnoringCase() {
        var alias = AliasPattern.of("echo");
        assertTrue(alias.matches("echo hello"));
        assertTrue(alias.matches("ECHO"));
        assertFalse(alias.matches("echoes hello"));
        assertFalse(alias.matches("say echo"));
    }

    @Test
    void removesAliasAndFollowingWhitespace() {
        var alias = AliasPattern.of("echo");
        assertEquals("hello world", alias.removeMatched("Echo   hello world"));
        assertEquals("", alias.removeMatched("echo"));
        assertEquals("other", alias.removeMatched("other"));
    }

    @Test
    void regexAliasesAreAnchored() {
        var alias = AliasPattern.regex("g(et)?");
        assertTrue(alias.matches("get x"));
        assertTrue(alias.matches("g x"));
        assertFalse(alias.matches("forget x"));
        assertEquals("x", alias.removeMatched("get x"));
    }

    @Test
    void literalAliasesEscapeRegexCharacters() {
        var alias = AliasPattern.of("a.b");
        assertTrue(alias.matches("a.b 1"));
        assertFalse(alias.matches("axb 1"));
    }

    @Test
    void rejectsBlankAlias() {
        assertThrows(IllegalArgumentException.class, () -> AliasPattern.of(" "));
    }
}
