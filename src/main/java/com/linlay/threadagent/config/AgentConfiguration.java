package com.linlay.threadagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.threadagent.agent.AgentOrchestrator;
import com.linlay.threadagent.agent.ChatClientModelInvoker;
import com.linlay.threadagent.agent.ModelInvoker;
import com.linlay.threadagent.agent.ModelProperties;
import com.linlay.threadagent.agent.RetryingModelInvoker;
import com.linlay.threadagent.content.ChatClientContentRewriter;
import com.linlay.threadagent.content.ContentFetcher;
import com.linlay.threadagent.content.ContentPreprocessor;
import com.linlay.threadagent.content.ContentProperties;
import com.linlay.threadagent.content.WebContentFetcher;
import com.linlay.threadagent.memory.InMemorySessionBackend;
import com.linlay.threadagent.memory.RedisSessionBackend;
import com.linlay.threadagent.memory.SessionBackend;
import com.linlay.threadagent.memory.SessionStore;
import com.linlay.threadagent.memory.SessionStoreProperties;
import com.linlay.threadagent.tool.EnvironmentResolver;
import com.linlay.threadagent.tool.McpStdioToolClientFactory;
import com.linlay.threadagent.tool.ToolClientFactory;
import com.linlay.threadagent.tool.ToolConnectionManager;
import com.linlay.threadagent.tool.ToolProviderCatalog;
import com.linlay.threadagent.tool.ToolProviderCatalogLoader;
import com.linlay.threadagent.tool.ToolProviderProperties;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties({
        SessionStoreProperties.class,
        ToolProviderProperties.class,
        ContentProperties.class,
        ModelProperties.class
})
public class AgentConfiguration {

    private static final int FETCH_BUFFER_BYTES = 8 * 1024 * 1024;

    @Bean
    @ConditionalOnMissingBean(SessionBackend.class)
    @ConditionalOnProperty(prefix = "agent.session", name = "backend", havingValue = "memory")
    public SessionBackend inMemorySessionBackend() {
        return new InMemorySessionBackend(Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean(SessionBackend.class)
    @ConditionalOnProperty(prefix = "agent.session", name = "backend", havingValue = "redis", matchIfMissing = true)
    public SessionBackend redisSessionBackend(StringRedisTemplate redisTemplate) {
        return new RedisSessionBackend(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStore sessionStore(SessionBackend backend, ObjectMapper objectMapper, SessionStoreProperties properties) {
        return new SessionStore(backend, objectMapper, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolProviderCatalog toolProviderCatalog(ObjectMapper objectMapper, ToolProviderProperties properties) {
        return new ToolProviderCatalogLoader(objectMapper, properties).load();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolClientFactory toolClientFactory(ObjectMapper objectMapper, ToolProviderProperties properties) {
        return new McpStdioToolClientFactory(objectMapper, properties.getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolConnectionManager toolConnectionManager(ToolClientFactory clientFactory, ToolProviderProperties properties) {
        return new ToolConnectionManager(clientFactory, new EnvironmentResolver(), properties.getCleanupTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatClientContentRewriter contentRewriter(ChatClient chatClient) {
        return new ChatClientContentRewriter(chatClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentPreprocessor contentPreprocessor(ChatClientContentRewriter rewriter, ContentProperties properties) {
        return new ContentPreprocessor(rewriter, rewriter, properties.getCondenseTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentFetcher contentFetcher(WebClient.Builder webClientBuilder, ContentProperties properties) {
        WebClient webClient = webClientBuilder.clone()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(FETCH_BUFFER_BYTES))
                .build();
        return new WebContentFetcher(webClient, properties.getFetch());
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelInvoker modelInvoker(ChatClient chatClient, ModelProperties properties) {
        return new RetryingModelInvoker(
                new ChatClientModelInvoker(chatClient),
                properties.getMaxAttempts(),
                properties.getRetryBackoff()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentOrchestrator agentOrchestrator(
            SessionStore sessionStore,
            ContentFetcher contentFetcher,
            ContentPreprocessor contentPreprocessor,
            ToolConnectionManager toolConnectionManager,
            ToolProviderCatalog toolProviderCatalog,
            ModelInvoker modelInvoker,
            ContentProperties contentProperties,
            ToolProviderProperties toolProperties,
            ModelProperties modelProperties
    ) {
        return new AgentOrchestrator(
                sessionStore,
                contentFetcher,
                contentPreprocessor,
                toolConnectionManager,
                toolProviderCatalog,
                modelInvoker,
                contentProperties,
                toolProperties,
                modelProperties
        );
    }
}
