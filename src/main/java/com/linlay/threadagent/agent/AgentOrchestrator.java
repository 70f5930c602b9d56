package com.linlay.threadagent.agent;

import com.linlay.threadagent.content.ContentFetcher;
import com.linlay.threadagent.content.ContentPreprocessor;
import com.linlay.threadagent.content.ContentProperties;
import com.linlay.threadagent.content.UrlExtractor;
import com.linlay.threadagent.error.ModelInvocationException;
import com.linlay.threadagent.error.PreprocessingException;
import com.linlay.threadagent.error.RetryableErrors;
import com.linlay.threadagent.memory.ConversationItem;
import com.linlay.threadagent.memory.SessionStore;
import com.linlay.threadagent.memory.ThreadKey;
import com.linlay.threadagent.tool.McpToolCallback;
import com.linlay.threadagent.tool.ToolConnection;
import com.linlay.threadagent.tool.ToolConnectionManager;
import com.linlay.threadagent.tool.ToolProviderCatalog;
import com.linlay.threadagent.tool.ToolProviderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Runs one conversation turn: load thread history, expand linked pages into bounded content,
 * connect the tool providers, call the model, then store the new user and assistant turns.
 * <p>
 * Only the model call can fail a turn. Missing history, unreachable pages, tool providers that
 * do not come up and failed writes all degrade the turn without stopping it. Tool connections
 * opened for a turn are closed when the model call ends, fails or is cancelled.
 */
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final SessionStore sessionStore;
    private final ContentFetcher contentFetcher;
    private final ContentPreprocessor contentPreprocessor;
    private final ToolConnectionManager toolConnectionManager;
    private final ToolProviderCatalog toolCatalog;
    private final ModelInvoker modelInvoker;
    private final ContentProperties contentProperties;
    private final ToolProviderProperties toolProperties;
    private final ModelProperties modelProperties;
    private final Scheduler scheduler;

    public AgentOrchestrator(
            SessionStore sessionStore,
            ContentFetcher contentFetcher,
            ContentPreprocessor contentPreprocessor,
            ToolConnectionManager toolConnectionManager,
            ToolProviderCatalog toolCatalog,
            ModelInvoker modelInvoker,
            ContentProperties contentProperties,
            ToolProviderProperties toolProperties,
            ModelProperties modelProperties
    ) {
        this(sessionStore, contentFetcher, contentPreprocessor, toolConnectionManager, toolCatalog, modelInvoker,
                contentProperties, toolProperties, modelProperties, Schedulers.boundedElastic());
    }

    public AgentOrchestrator(
            SessionStore sessionStore,
            ContentFetcher contentFetcher,
            ContentPreprocessor contentPreprocessor,
            ToolConnectionManager toolConnectionManager,
            ToolProviderCatalog toolCatalog,
            ModelInvoker modelInvoker,
            ContentProperties contentProperties,
            ToolProviderProperties toolProperties,
            ModelProperties modelProperties,
            Scheduler scheduler
    ) {
        this.sessionStore = sessionStore;
        this.contentFetcher = contentFetcher;
        this.contentPreprocessor = contentPreprocessor;
        this.toolConnectionManager = toolConnectionManager;
        this.toolCatalog = toolCatalog;
        this.modelInvoker = modelInvoker;
        this.contentProperties = contentProperties;
        this.toolProperties = toolProperties;
        this.modelProperties = modelProperties;
        this.scheduler = scheduler;
    }

    public Mono<AgentReply> process(TurnRequest request) {
        return Mono.defer(() -> process(request, new TurnRun(request.threadKey().toString())));
    }

    Mono<AgentReply> process(TurnRequest request, TurnRun run) {
        ThreadKey key = request.threadKey();
        return loadHistory(run, key)
                .flatMap(history -> preprocess(run, request.text())
                        .flatMap(prepared -> bindAndRun(run, history, prepared)
                                .flatMap(reply -> persist(run, key, prepared, reply))))
                .doOnNext(reply -> {
                    run.advance(OrchestratorState.DONE);
                    log.info("[turn:{}] done in {}ms, {} chars", run.tag(), run.elapsedMillis(), reply.content().length());
                })
                .doOnError(ex -> {
                    if (run.fail()) {
                        log.warn("[turn:{}] failed after {}ms: {}", run.tag(), run.elapsedMillis(), ex.getMessage());
                    }
                })
                .doOnCancel(() -> {
                    if (run.fail()) {
                        log.info("[turn:{}] cancelled after {}ms", run.tag(), run.elapsedMillis());
                    }
                });
    }

    private Mono<List<ConversationItem>> loadHistory(TurnRun run, ThreadKey key) {
        return Mono.fromCallable(() -> {
                    run.advance(OrchestratorState.LOADING);
                    int limit = modelProperties.getHistoryLimit();
                    return limit > 0 ? sessionStore.loadRecent(key, limit) : sessionStore.load(key);
                })
                .subscribeOn(scheduler);
    }

    private Mono<String> preprocess(TurnRun run, String text) {
        return Mono.defer(() -> {
            run.advance(OrchestratorState.PREPROCESSING);
            List<String> urls = UrlExtractor.extract(text);
            if (urls.isEmpty() || !contentProperties.getFetch().isEnabled()) {
                return Mono.just(text);
            }
            return Flux.fromIterable(urls)
                    .flatMap(url -> expand(run, url).map(content -> Map.entry(url, content)), urls.size())
                    .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                    .map(contentByUrl -> UrlExtractor.replaceWithContent(text, contentByUrl));
        });
    }

    private Mono<String> expand(TurnRun run, String url) {
        int threshold = contentProperties.getSingleChunkThreshold();
        int maxChars = contentProperties.getMaxSynthesisChars();
        return contentFetcher.fetch(url)
                .filter(StringUtils::hasText)
                .flatMap(raw -> contentPreprocessor.process(url, raw, threshold, maxChars)
                        .onErrorResume(ex -> {
                            logPreprocessingFailure(run, url, "falling back to raw text", ex);
                            return Mono.just(truncate(raw, threshold));
                        }))
                .onErrorResume(ex -> {
                    logPreprocessingFailure(run, url, "leaving link as is", ex);
                    return Mono.empty();
                });
    }

    private Mono<AgentReply> bindAndRun(TurnRun run, List<ConversationItem> history, String prepared) {
        return Mono.usingWhen(
                Mono.defer(() -> {
                    run.advance(OrchestratorState.TOOL_BINDING);
                    return toolConnectionManager.connectAll(toolCatalog.specs(), toolProperties.getConnectTimeout());
                }),
                connections -> runModel(run, history, prepared, connections),
                connections -> toolConnectionManager.closeAll(connections, toolProperties.getCleanupTimeout()),
                (connections, ex) -> toolConnectionManager.closeAll(connections, toolProperties.getCleanupTimeout()),
                connections -> toolConnectionManager.closeAll(connections, toolProperties.getCleanupTimeout())
        );
    }

    private Mono<AgentReply> runModel(TurnRun run, List<ConversationItem> history, String prepared, List<ToolConnection> connections) {
        return Mono.defer(() -> {
                    run.advance(OrchestratorState.RUNNING);
                    log.info("[turn:{}] invoking model with {} history items and {} tool providers",
                            run.tag(), history.size(), connections.size());
                    ModelInvocation invocation = new ModelInvocation(
                            modelProperties.getSystemPrompt(),
                            history,
                            prepared,
                            McpToolCallback.fromConnections(connections)
                    );
                    return modelInvoker.invoke(invocation);
                })
                .filter(StringUtils::hasText)
                .switchIfEmpty(Mono.error(() -> new ModelInvocationException("model returned no content", null, false, 1)))
                .map(content -> new AgentReply(content, modelProperties.getReplyTitle()))
                .onErrorMap(ex -> !(ex instanceof ModelInvocationException),
                        ex -> new ModelInvocationException("model invocation failed: " + ex.getMessage(), ex,
                                RetryableErrors.isRetryable(ex), 1));
    }

    private Mono<AgentReply> persist(TurnRun run, ThreadKey key, String prepared, AgentReply reply) {
        return Mono.fromRunnable(() -> {
                    run.advance(OrchestratorState.PERSISTING);
                    sessionStore.appendAndSave(
                            key,
                            List.of(ConversationItem.user(prepared), ConversationItem.assistant(reply.content())),
                            sessionStore.ttl()
                    );
                })
                .subscribeOn(scheduler)
                .onErrorResume(ex -> {
                    log.warn("[turn:{}] persisting failed, reply still returned: {}", run.tag(), ex.toString());
                    return Mono.empty();
                })
                .thenReturn(reply);
    }

    private void logPreprocessingFailure(TurnRun run, String url, String action, Throwable ex) {
        PreprocessingException failure = new PreprocessingException("processing " + url + " failed", ex);
        log.warn("[turn:{}] [{}] {}, {}: {}", run.tag(), failure.kind(), failure.getMessage(), action, ex.toString());
    }

    private static String truncate(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
