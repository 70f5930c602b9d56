package com.linlay.threadagent.content;

import com.linlay.threadagent.error.PreprocessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bounds external content before it is put into a prompt.
 * <p>
 * Text at or under the chunk threshold is returned as is. Longer text is chunked, every chunk
 * is condensed concurrently, and the condensed chunks are integrated in ordinal order into one
 * article of at most {@code maxSynthesisChars} characters. A failing chunk is replaced by a
 * truncated copy of its raw text and the pipeline carries on; a failing synthesis falls back to
 * the ordered condensed text cut to the bound.
 */
public class ContentPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(ContentPreprocessor.class);
    private static final String SECTION_SEPARATOR = "\n\n";

    private final ContentCondenser condenser;
    private final ArticleSynthesizer synthesizer;
    private final Duration condenseTimeout;

    public ContentPreprocessor(ContentCondenser condenser, ArticleSynthesizer synthesizer, Duration condenseTimeout) {
        this.condenser = condenser;
        this.synthesizer = synthesizer;
        this.condenseTimeout = condenseTimeout;
    }

    public Mono<String> process(String rawText, int singleChunkThreshold, int maxSynthesisChars) {
        return process("inline", rawText, singleChunkThreshold, maxSynthesisChars);
    }

    public Mono<String> process(String sourceId, String rawText, int singleChunkThreshold, int maxSynthesisChars) {
        if (singleChunkThreshold < 1 || maxSynthesisChars < 1) {
            return Mono.error(new IllegalArgumentException("thresholds must be positive"));
        }
        String text = rawText == null ? "" : rawText;
        if (text.length() <= singleChunkThreshold) {
            return Mono.just(text);
        }
        List<ContentChunk> chunks = TextChunker.chunk(sourceId, text, singleChunkThreshold);
        log.info("[content:{}] condensing {} chunks from {} chars", sourceId, chunks.size(), text.length());
        return Flux.fromIterable(chunks)
                .flatMap(chunk -> condense(chunk, maxSynthesisChars), chunks.size())
                .collectSortedList(Comparator.comparingInt(CondensedChunk::ordinal))
                .flatMap(condensed -> synthesize(sourceId, condensed, maxSynthesisChars))
                .map(article -> {
                    log.info("[content:{}] {} -> {} chars{}", sourceId, text.length(), article.text().length(),
                            article.truncated() ? " (cut to bound)" : "");
                    return article.text();
                });
    }

    private Mono<CondensedChunk> condense(ContentChunk chunk, int fallbackChars) {
        return Mono.defer(() -> condenser.condense(chunk.rawText()))
                .timeout(condenseTimeout)
                .map(text -> CondensedChunk.condensed(chunk.ordinal(), text))
                .switchIfEmpty(Mono.error(() -> new PreprocessingException("condenser returned nothing", null)))
                .onErrorResume(ex -> {
                    PreprocessingException failure = new PreprocessingException(
                            "condensing chunk " + chunk.ordinal() + " of " + chunk.sourceId() + " failed", ex);
                    log.warn("[{}] {}, using raw text: {}", failure.kind(), failure.getMessage(), ex.toString());
                    return Mono.just(CondensedChunk.fallback(chunk, fallbackChars));
                });
    }

    private Mono<SynthesizedArticle> synthesize(String sourceId, List<CondensedChunk> condensed, int maxChars) {
        return Mono.defer(() -> synthesizer.synthesize(condensed, maxChars))
                .map(text -> SynthesizedArticle.bounded(text, condensed.size(), maxChars))
                .switchIfEmpty(Mono.error(() -> new PreprocessingException("synthesizer returned nothing", null)))
                .onErrorResume(ex -> {
                    PreprocessingException failure = new PreprocessingException("synthesizing " + sourceId + " failed", ex);
                    log.warn("[{}] {}, using condensed sections: {}", failure.kind(), failure.getMessage(), ex.toString());
                    String joined = condensed.stream()
                            .map(CondensedChunk::condensedText)
                            .collect(Collectors.joining(SECTION_SEPARATOR));
                    return Mono.just(SynthesizedArticle.bounded(joined, condensed.size(), maxChars));
                });
    }
}
