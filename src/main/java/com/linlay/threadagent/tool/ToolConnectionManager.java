package com.linlay.threadagent.tool;

import com.linlay.threadagent.error.ToolConnectException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Starts and stops tool providers for a turn. Each provider gets its own connect and cleanup
 * budget and runs on its own worker, so a hanging provider only costs its own timeout and
 * never takes the others down with it.
 */
public class ToolConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ToolConnectionManager.class);

    private final ToolClientFactory clientFactory;
    private final EnvironmentResolver environmentResolver;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Duration shutdownTimeout;
    private final Set<ToolConnection> openConnections = ConcurrentHashMap.newKeySet();

    public ToolConnectionManager(ToolClientFactory clientFactory, EnvironmentResolver environmentResolver, Duration shutdownTimeout) {
        this(clientFactory, environmentResolver, Schedulers.boundedElastic(), Clock.systemUTC(), shutdownTimeout);
    }

    public ToolConnectionManager(
            ToolClientFactory clientFactory,
            EnvironmentResolver environmentResolver,
            Scheduler scheduler,
            Clock clock,
            Duration shutdownTimeout
    ) {
        this.clientFactory = clientFactory;
        this.environmentResolver = environmentResolver;
        this.scheduler = scheduler;
        this.clock = clock;
        this.shutdownTimeout = shutdownTimeout;
    }

    public Mono<List<ToolConnection>> connectAll(List<ToolProviderSpec> specs, Duration connectTimeout) {
        if (specs == null || specs.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> {
            // every connection this call starts, including ones already READY but not yet collected
            Set<ToolConnection> started = ConcurrentHashMap.newKeySet();
            return Flux.fromIterable(specs)
                    .flatMap(spec -> connect(spec, connectTimeout, started), specs.size())
                    .collectList()
                    .doOnNext(connected -> {
                        if (connected.size() != specs.size()) {
                            log.warn("Disabling {} of {} tool providers that failed to connect",
                                    specs.size() - connected.size(), specs.size());
                        }
                    })
                    .doOnCancel(() -> {
                        log.info("Tool binding cancelled, releasing {} started connections", started.size());
                        for (ToolConnection connection : List.copyOf(started)) {
                            scheduler.schedule(() -> abandon(connection));
                        }
                    });
        });
    }

    public Mono<Void> closeAll(Collection<ToolConnection> connections, Duration cleanupTimeout) {
        if (connections == null || connections.isEmpty()) {
            return Mono.empty();
        }
        List<ToolConnection> snapshot = List.copyOf(connections);
        return Flux.fromIterable(snapshot)
                .filter(ToolConnection::isReady)
                .flatMap(connection -> close(connection, cleanupTimeout), snapshot.size())
                .then();
    }

    public int openConnectionCount() {
        return openConnections.size();
    }

    @PreDestroy
    public void closeOpenConnections() {
        if (openConnections.isEmpty()) {
            return;
        }
        log.info("Closing {} tool connections left open at shutdown", openConnections.size());
        closeAll(openConnections, shutdownTimeout).block(shutdownTimeout.plusSeconds(1));
    }

    private Mono<ToolConnection> connect(ToolProviderSpec spec, Duration connectTimeout, Set<ToolConnection> started) {
        ToolConnection connection = new ToolConnection(spec.name());
        started.add(connection);
        return Mono.fromCallable(() -> establish(spec, connection))
                .subscribeOn(scheduler)
                .timeout(connectTimeout)
                .doOnNext(ready -> {
                    openConnections.add(ready);
                    if (!ready.isReady()) {
                        // closed by a concurrent cancel
                        openConnections.remove(ready);
                        return;
                    }
                    log.info("[tool:{}] connected with {} tools", spec.name(), ready.tools().size());
                })
                .onErrorResume(ex -> {
                    ToolConnectException failure = ex instanceof TimeoutException
                            ? ToolConnectException.timeout(spec.name(), connectTimeout)
                            : ToolConnectException.failed(spec.name(), ex);
                    log.warn("[{}] {}", failure.kind(), failure.getMessage());
                    scheduler.schedule(() -> releaseQuietly(connection));
                    return Mono.empty();
                });
    }

    private ToolConnection establish(ToolProviderSpec spec, ToolConnection connection) {
        log.info("[tool:{}] connecting: {} {}", spec.name(), spec.command(), String.join(" ", spec.args()));
        ToolClient client = clientFactory.create(spec, environmentResolver.resolve(spec.env()));
        if (!connection.attach(client)) {
            client.close();
            throw new IllegalStateException("connection attempt abandoned");
        }
        client.initialize();
        List<ToolDescriptor> tools = client.listTools();
        if (!connection.markReady(tools, clock.instant())) {
            client.close();
            throw new IllegalStateException("connection attempt abandoned");
        }
        return connection;
    }

    private Mono<Void> close(ToolConnection connection, Duration cleanupTimeout) {
        return Mono.fromRunnable(() -> {
                    if (connection.close()) {
                        log.info("[tool:{}] closed", connection.providerName());
                    }
                })
                .subscribeOn(scheduler)
                .timeout(cleanupTimeout)
                .onErrorResume(ex -> {
                    if (ex instanceof TimeoutException) {
                        log.warn("[tool:{}] cleanup timed out after {}ms", connection.providerName(), cleanupTimeout.toMillis());
                    } else {
                        log.warn("[tool:{}] cleanup failed: {}", connection.providerName(), ex.getMessage());
                    }
                    return Mono.empty();
                })
                .doFinally(signal -> openConnections.remove(connection))
                .then();
    }

    private void abandon(ToolConnection connection) {
        releaseQuietly(connection);
        try {
            if (connection.close()) {
                log.info("[tool:{}] closed after cancelled binding", connection.providerName());
            }
        } catch (RuntimeException ex) {
            log.warn("[tool:{}] close after cancelled binding failed: {}", connection.providerName(), ex.getMessage());
        } finally {
            openConnections.remove(connection);
        }
    }

    private void releaseQuietly(ToolConnection connection) {
        try {
            connection.fail();
        } catch (RuntimeException ex) {
            log.debug("[tool:{}] release after failed connect raised {}", connection.providerName(), ex.toString());
        }
    }
}
