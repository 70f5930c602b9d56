package com.linlay.threadagent.controller;

import com.linlay.threadagent.agent.AgentOrchestrator;
import com.linlay.threadagent.agent.AgentReply;
import com.linlay.threadagent.agent.ModelProperties;
import com.linlay.threadagent.agent.TurnRequest;
import com.linlay.threadagent.error.ModelInvocationException;
import com.linlay.threadagent.memory.ThreadKey;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final AgentOrchestrator orchestrator;
    private final ModelProperties modelProperties;

    public TurnController(AgentOrchestrator orchestrator, ModelProperties modelProperties) {
        this.orchestrator = orchestrator;
        this.modelProperties = modelProperties;
    }

    @PostMapping("/turns")
    public Mono<ResponseEntity<AgentReply>> turn(@Valid @RequestBody TurnBody body) {
        TurnRequest request = new TurnRequest(ThreadKey.of(body.anchorMessageId(), body.chatId()), body.text());
        return orchestrator.process(request)
                .map(ResponseEntity::ok)
                .onErrorResume(ModelInvocationException.class, ex -> {
                    log.warn("[turn:{}] [{}] attempts={} transient={}: {}", request.threadKey(), ex.kind(),
                            ex.attempts(), ex.transientFailure(), ex.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                            .body(AgentReply.of(modelProperties.getFailureMessage())));
                });
    }

    public record TurnBody(
            @NotNull Long anchorMessageId,
            @NotNull Long chatId,
            @NotBlank String text
    ) {
    }
}
