package com.linlay.threadagent.content;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Condenser and synthesizer backed by the chat model. The chunk prompt asks for a rewrite at
 * 60-80% of the source length; the synthesis prompt carries the character bound.
 */
public class ChatClientContentRewriter implements ContentCondenser, ArticleSynthesizer {

    static final String CONDENSE_PROMPT = """
            You are a content rewriting expert. Rewrite the following web page fragment into precise,
            concise article paragraphs while keeping every important piece of information.

            Requirements:
            - Keep the facts, figures and details of the original; do not drop key content
            - Improve sentence structure so the text reads clearly
            - Remove redundant phrasing
            - Keep a neutral, objective tone
            - Aim for 60-80% of the original length
            - Write in the language of the fragment

            Web page fragment:
            ```
            {{text}}
            ```
            """;

    static final String SYNTHESIZE_PROMPT = """
            You are a content integration expert. Merge the rewritten web page sections below into one
            coherent, precise article.

            Requirements:
            - Integrate all sections seamlessly with a logical flow
            - Avoid repetition
            - Keep a professional, objective style
            - Produce a complete article rather than a bullet summary
            - Stay within {{max_chars}} characters
            - Write in the language of the sections

            Rewritten sections:
            {{sections}}
            """;

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([a-z_]+)}}");

    private final ChatClient chatClient;
    private final Scheduler scheduler;

    public ChatClientContentRewriter(ChatClient chatClient) {
        this(chatClient, Schedulers.boundedElastic());
    }

    public ChatClientContentRewriter(ChatClient chatClient, Scheduler scheduler) {
        this.chatClient = chatClient;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<String> condense(String text) {
        return call(render(CONDENSE_PROMPT, Map.of("text", text == null ? "" : text)));
    }

    @Override
    public Mono<String> synthesize(List<CondensedChunk> chunks, int maxChars) {
        return call(render(SYNTHESIZE_PROMPT, Map.of(
                "max_chars", String.valueOf(maxChars),
                "sections", sections(chunks)
        )));
    }

    static String sections(List<CondensedChunk> chunks) {
        StringBuilder builder = new StringBuilder();
        for (CondensedChunk chunk : chunks) {
            if (builder.length() > 0) {
                builder.append("\n\n");
            }
            builder.append("Section ").append(chunk.ordinal() + 1).append(":\n").append(chunk.condensedText());
        }
        return builder.toString();
    }

    static String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = values.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement == null ? matcher.group(0) : replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private Mono<String> call(String prompt) {
        return Mono.fromCallable(() -> chatClient.prompt().user(prompt).call().content())
                .subscribeOn(scheduler)
                .filter(StringUtils::hasText)
                .map(String::trim);
    }
}
