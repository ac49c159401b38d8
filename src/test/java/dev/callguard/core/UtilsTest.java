package dev.callguard.core;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void globToRegex_starAndQuestionMark() {
        Pattern p = Utils.globToRegex("user:*");
        assertTrue(p.matcher("user:").matches());
        assertTrue(p.matcher("user:42:profile").matches());
        assertFalse(p.matcher("xuser:1").matches());

        Pattern q = Utils.globToRegex("order:??");
        assertTrue(q.matcher("order:12").matches());
        assertFalse(q.matcher("order:1").matches());
        assertFalse(q.matcher("order:123").matches());
    }

    @Test
    void globToRegex_quotesEverythingElse() {
        Pattern p = Utils.globToRegex("a.b+(c)[d]$*");
        assertTrue(p.matcher("a.b+(c)[d]$").matches());
        assertTrue(p.matcher("a.b+(c)[d]$tail").matches());
        assertFalse(p.matcher("aXb+(c)[d]$").matches());
    }

    @Test
    void globToRegex_starMatchesNewlines() {
        assertTrue(Utils.globToRegex("k*").matcher("k\nv").matches());
    }

    @Test
    void mask_keepsLastFourCharacters() {
        assertEquals("****cdef", Utils.mask("sk-abcdef"));
        assertEquals("****", Utils.mask("abcd"));
        assertEquals("****", Utils.mask(null));
    }
}
