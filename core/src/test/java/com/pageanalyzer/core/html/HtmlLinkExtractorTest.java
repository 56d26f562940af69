package com.pageanalyzer.core.html;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HtmlLinkExtractorTest {

    static final URI BASE = URI.create("https://www.example.com/dir/page");

    static final Document DOC = Jsoup.parse("""
            <html><body>
              <a href="https://example.com/x">same site (no www)</a>
              <a href="other">relative</a>
              <a href="https://news.other.org/a#frag">external</a>
              <a href="https://news.other.org/a">external dup</a>
              <a href="mailto:me@example.com">mail</a>
              <a href="javascript:void(0)">js</a>
              <a href="#top">top</a>
              <img src="/i.png"><img data-src="lazy.jpg"><img src="data:image/png;base64,AAAA">
            </body></html>
            """);

    @Test
    void external_links_deduplicated_in_document_order() {
        List<URI> links = HtmlLinkExtractor.links(DOC, BASE, false, 50);

        assertThat(links).containsExactly(URI.create("https://news.other.org/a"));
    }

    @Test
    void same_origin_links_when_requested() {
        List<URI> links = HtmlLinkExtractor.links(DOC, BASE, true, 50);

        assertThat(links).containsExactly(
                URI.create("https://example.com/x"),
                URI.create("https://www.example.com/dir/other"),
                URI.create("https://news.other.org/a"));
        assertEquals(1, HtmlLinkExtractor.links(DOC, BASE, true, 1).size());
    }

    @Test
    void images_resolve_src_and_lazy_src() {
        assertThat(HtmlLinkExtractor.images(DOC, BASE, 20)).containsExactly(
                URI.create("https://www.example.com/i.png"),
                URI.create("https://www.example.com/dir/lazy.jpg"));
    }

    @Test
    void same_site_pages_are_normalized() {
        assertThat(HtmlLinkExtractor.sameSitePages(DOC, BASE)).containsExactly(
                URI.create("https://example.com/x"),
                URI.create("https://www.example.com/dir/other"));
    }
}
