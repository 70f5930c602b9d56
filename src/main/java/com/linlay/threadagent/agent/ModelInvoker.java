package com.linlay.threadagent.agent;

import reactor.core.publisher.Mono;

/**
 * The language model as seen by the orchestrator: prompt and tools in, reply text out.
 */
@FunctionalInterface
public interface ModelInvoker {

    Mono<String> invoke(ModelInvocation invocation);
}
