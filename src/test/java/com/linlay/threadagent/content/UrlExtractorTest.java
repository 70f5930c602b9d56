package com.linlay.threadagent.content;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlExtractorTest {

    @Test
    void shouldExtractDistinctLinksWithoutTrailingPunctuation() {
        String text = "see https://example.com/a?b=1, and (http://news.example.org/x). again https://example.com/a?b=1";

        assertThat(UrlExtractor.extract(text))
                .containsExactly("https://example.com/a?b=1", "http://news.example.org/x");
    }

    @Test
    void shouldIgnoreTextWithoutLinks() {
        assertThat(UrlExtractor.extract("no links here, just https:// alone")).isEmpty();
        assertThat(UrlExtractor.extract(null)).isEmpty();
    }

    @Test
    void shouldReplaceOnlyLinksWithContent() {
        String text = "summarize https://a.example/page. and keep https://b.example";

        String replaced = UrlExtractor.replaceWithContent(text, Map.of("https://a.example/page", "Page body"));

        assertThat(replaced).isEqualTo("summarize [Web content summary from https://a.example/page]:\n'''\nPage body\n'''\n[END]."
                + " and keep https://b.example");
    }

    @Test
    void shouldNotConfuseLinkSharingPrefix() {
        String text = "https://a.example https://a.example/longer";

        String replaced = UrlExtractor.replaceWithContent(text, Map.of("https://a.example", "short"));

        assertThat(replaced).endsWith(" https://a.example/longer");
        assertThat(replaced).startsWith("[Web content summary from https://a.example]:");
    }
}
