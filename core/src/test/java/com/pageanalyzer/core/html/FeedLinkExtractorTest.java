package com.pageanalyzer.core.html;

import com.pageanalyzer.core.model.FeedType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FeedLinkExtractorTest {

    static final URI BASE = URI.create("https://blog.example.com/posts/");

    @Test
    void declared_links_come_before_anchors() {
        Document doc = Jsoup.parse("""
                <html><head>
                  <link rel="alternate" type="application/atom+xml" href="/atom.xml">
                  <link rel="alternate" type="text/html" hreflang="de" href="/de/">
                  <link rel="stylesheet" href="/style.css">
                </head><body>
                  <a href="rss">RSS</a>
                  <a href="/feedback">Feedback</a>
                  <a href="https://blog.example.com/atom.xml#top">dup</a>
                </body></html>
                """, BASE.toString());

        List<FeedLinkExtractor.Candidate> c = FeedLinkExtractor.extract(doc, BASE, true);

        assertThat(c).extracting(FeedLinkExtractor.Candidate::uri).containsExactly(
                URI.create("https://blog.example.com/atom.xml"),
                URI.create("https://blog.example.com/posts/rss"));
        assertEquals(FeedLinkExtractor.Source.DECLARED, c.get(0).source());
        assertEquals(FeedType.ATOM, c.get(0).typeGuess());
        assertEquals(FeedLinkExtractor.Source.ANCHOR, c.get(1).source());
    }

    @Test
    void common_paths_only_when_requested_and_nothing_found() {
        Document empty = Jsoup.parse("<html><body><p>nothing</p></body></html>");

        assertTrue(FeedLinkExtractor.extract(empty, BASE, false).isEmpty());

        List<FeedLinkExtractor.Candidate> guessed = FeedLinkExtractor.extract(empty, BASE, true);
        assertEquals(FeedLinkExtractor.COMMON_PATHS.size(), guessed.size());
        assertEquals(URI.create("https://blog.example.com/feed"), guessed.get(0).uri());
        assertThat(guessed).allMatch(c -> c.source() == FeedLinkExtractor.Source.COMMON_PATH);
    }

    @Test
    void candidates_are_capped() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 30; i++) body.append("<a href=\"/c").append(i).append("/feed\">f</a>");
        Document doc = Jsoup.parse("<html><body>" + body + "</body></html>");

        assertEquals(FeedLinkExtractor.MAX_CANDIDATES, FeedLinkExtractor.extract(doc, BASE, true).size());
    }
}
