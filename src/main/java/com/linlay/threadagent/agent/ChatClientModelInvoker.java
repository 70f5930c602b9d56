package com.linlay.threadagent.agent;

import com.linlay.threadagent.memory.ConversationItem;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls the chat model through Spring AI. Tool calls requested by the model are executed by
 * Spring AI against the supplied callbacks before the final text is returned.
 */
public class ChatClientModelInvoker implements ModelInvoker {

    private final ChatClient chatClient;
    private final Scheduler scheduler;

    public ChatClientModelInvoker(ChatClient chatClient) {
        this(chatClient, Schedulers.boundedElastic());
    }

    public ChatClientModelInvoker(ChatClient chatClient, Scheduler scheduler) {
        this.chatClient = chatClient;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<String> invoke(ModelInvocation invocation) {
        return Mono.fromCallable(() -> call(invocation))
                .subscribeOn(scheduler);
    }

    private String call(ModelInvocation invocation) {
        ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
        if (StringUtils.hasText(invocation.systemPrompt())) {
            spec = spec.system(invocation.systemPrompt());
        }
        List<Message> messages = toMessages(invocation.history());
        if (!messages.isEmpty()) {
            spec = spec.messages(messages);
        }
        if (!invocation.toolCallbacks().isEmpty()) {
            spec = spec.toolCallbacks(invocation.toolCallbacks());
        }
        return spec.user(invocation.userText()).call().content();
    }

    static List<Message> toMessages(List<ConversationItem> history) {
        List<Message> messages = new ArrayList<>(history.size());
        for (ConversationItem item : history) {
            if (!item.modelInput() || !StringUtils.hasText(item.content())) {
                continue;
            }
            switch (item.role()) {
                case ConversationItem.ROLE_ASSISTANT -> messages.add(new AssistantMessage(item.content()));
                case "system" -> messages.add(new SystemMessage(item.content()));
                default -> messages.add(new UserMessage(item.content()));
            }
        }
        return messages;
    }
}
