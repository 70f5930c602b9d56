package com.linlay.threadagent.tool;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class ToolConnectionManagerTest {

    @Test
    void shouldBindOnlyProvidersThatConnectWithinTimeout() {
        Map<String, FakeToolClient> clients = new ConcurrentHashMap<>();
        ToolClientFactory factory = (spec, env) -> clients.computeIfAbsent(spec.name(), name -> switch (name) {
            case "finance-tool" -> new FakeToolClient(Duration.ofSeconds(3), Duration.ZERO,
                    List.of(new ToolDescriptor("quote", "", null)), null, env);
            default -> new FakeToolClient(Duration.ofMillis(100), Duration.ZERO,
                    List.of(new ToolDescriptor("search", "", null)), null, env);
        });
        ToolConnectionManager manager = new ToolConnectionManager(factory, new EnvironmentResolver(), Duration.ofSeconds(1));

        long started = System.nanoTime();
        List<ToolConnection> connections = manager.connectAll(List.of(
                ToolProviderSpec.of("finance-tool", "finance", List.of()),
                ToolProviderSpec.of("search-tool", "search", List.of())
        ), Duration.ofMillis(500)).block(Duration.ofSeconds(5));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertThat(connections).extracting(ToolConnection::providerName).containsExactly("search-tool");
        assertThat(connections.get(0).state()).isEqualTo(ToolConnectionState.READY);
        assertThat(connections.get(0).establishedAt()).isNotNull();
        assertThat(elapsedMillis).isLessThan(2_000);
        assertThat(manager.openConnectionCount()).isEqualTo(1);
    }

    @Test
    void shouldIsolateProviderThatFailsDuringHandshake() {
        ToolClientFactory factory = (spec, env) -> spec.name().equals("broken")
                ? new FakeToolClient(Duration.ZERO, Duration.ZERO, List.of(), new IllegalStateException("exit code 1"), env)
                : FakeToolClient.quick("lookup");
        ToolConnectionManager manager = new ToolConnectionManager(factory, new EnvironmentResolver(), Duration.ofSeconds(1));

        StepVerifier.create(manager.connectAll(List.of(
                        ToolProviderSpec.of("broken", "broken", List.of()),
                        ToolProviderSpec.of("dictionary", "dict", List.of())
                ), Duration.ofSeconds(1)))
                .assertNext(connections -> assertThat(connections)
                        .extracting(ToolConnection::providerName)
                        .containsExactly("dictionary"))
                .verifyComplete();
    }

    @Test
    void shouldTreatFactoryFailureAsDisabledProvider() {
        ToolClientFactory factory = (spec, env) -> {
            throw new IllegalArgumentException("command not found: " + spec.command());
        };
        ToolConnectionManager manager = new ToolConnectionManager(factory, new EnvironmentResolver(), Duration.ofSeconds(1));

        StepVerifier.create(manager.connectAll(List.of(ToolProviderSpec.of("missing", "nope", List.of())), Duration.ofSeconds(1)))
                .assertNext(connections -> assertThat(connections).isEmpty())
                .verifyComplete();
    }

    @Test
    void shouldSubstituteEmptyEnvValuesFromRuntimeEnvironment() {
        Map<String, Map<String, String>> seenEnv = new ConcurrentHashMap<>();
        ToolClientFactory factory = (spec, env) -> {
            seenEnv.put(spec.name(), env);
            return FakeToolClient.quick("scrape");
        };
        EnvironmentResolver resolver = new EnvironmentResolver(Map.of("FIRECRAWL_API_KEY", "fc-secret")::get);
        ToolConnectionManager manager = new ToolConnectionManager(factory, resolver, Duration.ofSeconds(1));

        Map<String, String> env = new java.util.LinkedHashMap<>();
        env.put("FIRECRAWL_API_KEY", "");
        env.put("MISSING_VAR", "");
        env.put("MODE", "fast");
        manager.connectAll(List.of(new ToolProviderSpec("firecrawl", "npx", List.of("-y", "firecrawl-mcp"), env)),
                Duration.ofSeconds(1)).block(Duration.ofSeconds(5));

        assertThat(seenEnv.get("firecrawl"))
                .containsEntry("FIRECRAWL_API_KEY", "fc-secret")
                .containsEntry("MISSING_VAR", "")
                .containsEntry("MODE", "fast");
    }

    @Test
    void shouldCloseConnectionsConcurrentlyWithinOwnBudgets() {
        Map<String, FakeToolClient> clients = new ConcurrentHashMap<>();
        ToolClientFactory factory = (spec, env) -> clients.computeIfAbsent(spec.name(), name -> new FakeToolClient(
                Duration.ZERO,
                name.equals("hanging") ? Duration.ofSeconds(3) : Duration.ofMillis(300),
                List.of(new ToolDescriptor(name + "-tool", "", null)),
                null,
                env
        ));
        ToolConnectionManager manager = new ToolConnectionManager(factory, new EnvironmentResolver(), Duration.ofSeconds(1));
        List<ToolConnection> connections = manager.connectAll(List.of(
                ToolProviderSpec.of("a", "a", List.of()),
                ToolProviderSpec.of("b", "b", List.of()),
                ToolProviderSpec.of("hanging", "h", List.of())
        ), Duration.ofSeconds(1)).block(Duration.ofSeconds(5));
        assertThat(connections).hasSize(3);

        long started = System.nanoTime();
        manager.closeAll(connections, Duration.ofMillis(800)).block(Duration.ofSeconds(5));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertThat(elapsedMillis).isLessThan(1_500);
        assertThat(connections).allSatisfy(connection -> assertThat(connection.state()).isEqualTo(ToolConnectionState.CLOSED));
        assertThat(manager.openConnectionCount()).isZero();
    }

    @Test
    void shouldCloseReadyProvidersWhenBindingIsCancelled() {
        Map<String, FakeToolClient> clients = new ConcurrentHashMap<>();
        ToolClientFactory factory = (spec, env) -> clients.computeIfAbsent(spec.name(), name -> name.equals("finance-tool")
                ? new FakeToolClient(Duration.ofSeconds(5), Duration.ZERO, List.of(new ToolDescriptor("quote", "", null)), null, env)
                : FakeToolClient.quick("search"));
        ToolConnectionManager manager = new ToolConnectionManager(factory, new EnvironmentResolver(), Duration.ofSeconds(1));

        Disposable binding = manager.connectAll(List.of(
                ToolProviderSpec.of("finance-tool", "finance", List.of()),
                ToolProviderSpec.of("search-tool", "search", List.of())
        ), Duration.ofSeconds(30)).subscribe();
        awaitUntil(() -> manager.openConnectionCount() == 1);
        binding.dispose();

        awaitUntil(() -> clients.get("search-tool").closeCount.get() == 1 && manager.openConnectionCount() == 0);
        assertThat(clients.get("search-tool").closeCount.get()).isEqualTo(1);
        assertThat(manager.openConnectionCount()).isZero();
    }

    @Test
    void shouldIgnoreAlreadyClosedConnections() {
        FakeToolClient client = FakeToolClient.quick("echo");
        ToolConnectionManager manager = new ToolConnectionManager((spec, env) -> client, new EnvironmentResolver(), Duration.ofSeconds(1));
        List<ToolConnection> connections = manager.connectAll(List.of(ToolProviderSpec.of("echo", "echo", List.of())),
                Duration.ofSeconds(1)).block(Duration.ofSeconds(5));

        manager.closeAll(connections, Duration.ofSeconds(1)).block(Duration.ofSeconds(5));
        manager.closeAll(connections, Duration.ofSeconds(1)).block(Duration.ofSeconds(5));

        assertThat(client.closeCount.get()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyForNoProviders() {
        ToolConnectionManager manager = new ToolConnectionManager((spec, env) -> FakeToolClient.quick("x"),
                new EnvironmentResolver(), Duration.ofSeconds(1));

        StepVerifier.create(manager.connectAll(List.of(), Duration.ofSeconds(1)))
                .assertNext(connections -> assertThat(connections).isEmpty())
                .verifyComplete();
        StepVerifier.create(manager.closeAll(List.of(), Duration.ofSeconds(1))).verifyComplete();
    }

    @Test
    void shouldCloseConnectionsLeftOpenAtShutdown() {
        FakeToolClient client = FakeToolClient.quick("echo");
        ToolConnectionManager manager = new ToolConnectionManager((spec, env) -> client, new EnvironmentResolver(), Duration.ofSeconds(1));
        manager.connectAll(List.of(ToolProviderSpec.of("echo", "echo", List.of())), Duration.ofSeconds(1)).block(Duration.ofSeconds(5));

        manager.closeOpenConnections();

        assertThat(client.closeCount.get()).isEqualTo(1);
        assertThat(manager.openConnectionCount()).isZero();
    }

    private static void awaitUntil(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted", ex);
            }
        }
    }
}
