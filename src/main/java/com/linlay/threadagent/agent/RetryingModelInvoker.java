package com.linlay.threadagent.agent;

import com.linlay.threadagent.error.ModelInvocationException;
import com.linlay.threadagent.error.RetryableErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retries transient model failures with exponential backoff. Whatever still fails is reported
 * as a {@link ModelInvocationException} that records the attempt count and whether the last
 * error was transient.
 */
public class RetryingModelInvoker implements ModelInvoker {

    private static final Logger log = LoggerFactory.getLogger(RetryingModelInvoker.class);

    private final ModelInvoker delegate;
    private final int maxAttempts;
    private final Duration backoff;

    public RetryingModelInvoker(ModelInvoker delegate, int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @Override
    public Mono<String> invoke(ModelInvocation invocation) {
        AtomicInteger attempts = new AtomicInteger();
        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return delegate.invoke(invocation);
                })
                .retryWhen(Retry.backoff(maxAttempts - 1L, backoff)
                        .filter(RetryableErrors::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Model call failed, retry {}/{}: {}",
                                signal.totalRetries() + 1, maxAttempts - 1, signal.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(ex -> !(ex instanceof ModelInvocationException), ex -> new ModelInvocationException(
                        "model invocation failed after " + attempts.get() + " attempt(s): " + ex.getMessage(),
                        ex,
                        RetryableErrors.isRetryable(ex),
                        attempts.get()
                ));
    }
}
