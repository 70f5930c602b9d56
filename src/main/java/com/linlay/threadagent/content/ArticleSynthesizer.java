package com.linlay.threadagent.content;

import reactor.core.publisher.Mono;

import java.util.List;

@FunctionalInterface
public interface ArticleSynthesizer {

    /**
     * Integrates chunks, already sorted by ordinal, into one article of roughly
     * {@code maxChars} characters. The result may overshoot; callers enforce the bound.
     */
    Mono<String> synthesize(List<CondensedChunk> chunks, int maxChars);
}
