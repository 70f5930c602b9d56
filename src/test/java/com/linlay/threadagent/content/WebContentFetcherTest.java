package com.linlay.threadagent.content;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class WebContentFetcherTest {

    @Test
    void shouldConvertHtmlToText() {
        String html = """
                <!DOCTYPE html>
                <html><head><title>Release notes</title><style>p{color:red}</style></head>
                <body><p>Version 2 ships today.</p><script>track()</script><p>Upgrade soon.</p></body></html>
                """;

        String text = WebContentFetcher.toText(html);

        assertThat(text).isEqualTo("Release notes\n\nVersion 2 ships today. Upgrade soon.");
    }

    @Test
    void shouldKeepPlainTextAndCapLength() {
        AtomicInteger calls = new AtomicInteger();
        WebContentFetcher fetcher = new WebContentFetcher(stub(calls, 0, "plain ".repeat(100)), fetchProperties(50));

        StepVerifier.create(fetcher.fetch("https://example.com/plain"))
                .assertNext(text -> assertThat(text).hasSize(50).startsWith("plain plain"))
                .verifyComplete();
    }

    @Test
    void shouldRetryServerErrors() {
        AtomicInteger calls = new AtomicInteger();
        WebContentFetcher fetcher = new WebContentFetcher(stub(calls, 2, "<html><body><p>ok</p></body></html>"), fetchProperties(1_000));

        StepVerifier.create(fetcher.fetch("https://example.com/flaky"))
                .expectNext("ok")
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        WebContentFetcher fetcher = new WebContentFetcher(stub(calls, 10, "never"), fetchProperties(1_000));

        StepVerifier.create(fetcher.fetch("https://example.com/down"))
                .expectError(WebClientResponseException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void shouldNotRetryClientErrors() {
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
                })
                .build();
        WebContentFetcher fetcher = new WebContentFetcher(webClient, fetchProperties(1_000));

        StepVerifier.create(fetcher.fetch("https://example.com/missing"))
                .expectError(WebClientResponseException.NotFound.class)
                .verify(Duration.ofSeconds(5));
        assertThat(calls.get()).isEqualTo(1);
    }

    private static WebClient stub(AtomicInteger calls, int failuresBeforeSuccess, String body) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    if (calls.incrementAndGet() <= failuresBeforeSuccess) {
                        return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
                    }
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    private static ContentProperties.FetchProperties fetchProperties(int maxChars) {
        ContentProperties.FetchProperties properties = new ContentProperties.FetchProperties();
        properties.setMaxChars(maxChars);
        properties.setMaxAttempts(3);
        properties.setRetryBackoff(Duration.ofMillis(10));
        properties.setTimeout(Duration.ofSeconds(2));
        return properties;
    }
}
