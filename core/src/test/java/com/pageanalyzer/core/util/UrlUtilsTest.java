package com.pageanalyzer.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    static final URI BASE = URI.create("https://example.com/dir/page");

    @Test
    void normalize_lowercases_and_drops_default_port_and_fragment() {
        assertEquals("https://example.com/a/b",
                UrlUtils.normalize(URI.create("HTTPS://Example.COM:443//a//b#frag")).toString());
        assertEquals("http://example.com/", UrlUtils.normalize(URI.create("http://example.com")).toString());
        assertEquals("http://example.com:8080/x?q=1",
                UrlUtils.normalize(URI.create("http://example.com:8080/x?q=1")).toString());
    }

    @Test
    void parseHttp_accepts_only_absolute_http() {
        assertNotNull(UrlUtils.parseHttp("https://example.com/a b"));
        assertNull(UrlUtils.parseHttp("ftp://example.com/file"));
        assertNull(UrlUtils.parseHttp("not a url"));
        assertNull(UrlUtils.parseHttp("   "));
        assertNull(UrlUtils.parseHttp(null));
    }

    @Test
    void resolve_relative_and_skips_non_navigable() {
        assertEquals(URI.create("https://example.com/x"), UrlUtils.resolve(BASE, "../x#y"));
        assertEquals(URI.create("https://example.com/dir/other"), UrlUtils.resolve(BASE, "other"));
        assertEquals(URI.create("https://cdn.example.net/a.js"), UrlUtils.resolve(BASE, "//cdn.example.net/a.js"));
        assertNull(UrlUtils.resolve(BASE, "#top"));
        assertNull(UrlUtils.resolve(BASE, "mailto:me@example.com"));
        assertNull(UrlUtils.resolve(BASE, "JavaScript:void(0)"));
        assertNull(UrlUtils.resolve(BASE, ""));
    }

    @Test
    void same_domain_ignores_www_only() {
        assertTrue(UrlUtils.sameDomain(URI.create("https://www.example.com/a"), URI.create("http://EXAMPLE.com/b")));
        assertFalse(UrlUtils.sameDomain(URI.create("https://blog.example.com/"), URI.create("https://example.com/")));
        assertFalse(UrlUtils.sameDomain(null, BASE));
    }

    @Test
    void dedupe_key_treats_trailing_slash_and_fragment_as_same() {
        assertEquals(UrlUtils.dedupeKey(URI.create("https://Example.com/a/")),
                UrlUtils.dedupeKey(URI.create("https://example.com/a#x")));
        assertEquals(UrlUtils.dedupeKey(URI.create("https://example.com:443/")),
                UrlUtils.dedupeKey(URI.create("https://example.com")));
        assertNotEquals(UrlUtils.dedupeKey(URI.create("https://example.com/a?p=1")),
                UrlUtils.dedupeKey(URI.create("https://example.com/a?p=2")));
    }

    @Test
    void dedupe_key_ignores_leading_www() {
        assertEquals(UrlUtils.dedupeKey(URI.create("https://www.example.com/feed")),
                UrlUtils.dedupeKey(URI.create("https://example.com/feed")));
        assertEquals("https://example.com/feed", UrlUtils.dedupeKey(URI.create("https://WWW.Example.com/feed/")));
        assertNotEquals(UrlUtils.dedupeKey(URI.create("https://www2.example.com/feed")),
                UrlUtils.dedupeKey(URI.create("https://example.com/feed")));
    }
}
