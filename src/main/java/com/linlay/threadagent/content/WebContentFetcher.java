package com.linlay.threadagent.content;

import com.linlay.threadagent.error.RetryableErrors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Locale;

/**
 * Fetches a page over HTTP and reduces HTML to plain text with jsoup. Transient failures are
 * retried with backoff; the text is capped at {@code agent.content.fetch.max-chars}.
 */
public class WebContentFetcher implements ContentFetcher {

    private static final Logger log = LoggerFactory.getLogger(WebContentFetcher.class);

    private final WebClient webClient;
    private final ContentProperties.FetchProperties properties;

    public WebContentFetcher(WebClient webClient, ContentProperties.FetchProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public Mono<String> fetch(String url) {
        return webClient.get()
                .uri(url)
                .header(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .accept(MediaType.TEXT_HTML, MediaType.TEXT_PLAIN, MediaType.ALL)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getTimeout())
                .retryWhen(Retry.backoff(Math.max(properties.getMaxAttempts() - 1, 0), properties.getRetryBackoff())
                        .filter(RetryableErrors::isRetryable)
                        .doBeforeRetry(signal -> log.debug("[fetch:{}] retry #{} after {}",
                                url, signal.totalRetries() + 1, signal.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(body -> cap(toText(body)))
                .doOnNext(text -> log.info("[fetch:{}] {} chars", url, text.length()));
    }

    static String toText(String body) {
        if (!looksLikeHtml(body)) {
            return body.trim();
        }
        Document doc = Jsoup.parse(body);
        doc.select("script, style, noscript, iframe, form, svg").remove();
        String title = doc.title();
        String text = doc.body() == null ? doc.text() : doc.body().text();
        return StringUtils.hasText(title) && !text.startsWith(title) ? title + "\n\n" + text : text;
    }

    private static boolean looksLikeHtml(String input) {
        String lower = input.toLowerCase(Locale.ROOT);
        return lower.contains("<html") || lower.contains("<body")
                || lower.contains("<div") || lower.contains("<p")
                || lower.contains("<!doctype");
    }

    private String cap(String text) {
        int max = properties.getMaxChars();
        return max > 0 && text.length() > max ? text.substring(0, max) : text;
    }
}
