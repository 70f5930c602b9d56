package com.linlay.threadagent.error;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures of remote calls into transient ones worth retrying and permanent ones.
 * Timeouts, network errors, HTTP 5xx and HTTP 429 are transient, as is any failure whose
 * message mentions a connection or a timeout. The whole cause chain is inspected.
 */
public final class RetryableErrors {

    private static final int MAX_CAUSE_DEPTH = 8;

    private RetryableErrors() {
    }

    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            Boolean verdict = classify(current);
            if (verdict != null) {
                return verdict;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static Boolean classify(Throwable error) {
        if (error instanceof NonTransientAiException) {
            return Boolean.FALSE;
        }
        if (error instanceof TransientAiException
                || error instanceof TimeoutException
                || error instanceof IOException
                || error instanceof WebClientRequestException) {
            return Boolean.TRUE;
        }
        if (error instanceof WebClientResponseException responseException) {
            return retryableStatus(responseException.getStatusCode());
        }
        if (error instanceof RestClientResponseException responseException) {
            return retryableStatus(responseException.getStatusCode());
        }
        String message = error.getMessage();
        if (message != null) {
            String normalized = message.toLowerCase(Locale.ROOT);
            if (normalized.contains("connection") || normalized.contains("timeout") || normalized.contains("timed out")) {
                return Boolean.TRUE;
            }
        }
        return null;
    }

    private static boolean retryableStatus(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}
