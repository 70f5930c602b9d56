package com.linlay.threadagent.content;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ContentCondenser {

    /**
     * Rewrites one chunk into a shorter passage. Errors are handled by the caller.
     */
    Mono<String> condense(String text);
}
