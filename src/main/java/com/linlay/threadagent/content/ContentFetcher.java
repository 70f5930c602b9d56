package com.linlay.threadagent.content;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ContentFetcher {

    /**
     * Downloads {@code url} and returns its readable text.
     */
    Mono<String> fetch(String url);
}
