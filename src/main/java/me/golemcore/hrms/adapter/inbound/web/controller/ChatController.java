package me.golemcore.hrms.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.adapter.inbound.web.CallerHeaders;
import me.golemcore.hrms.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.hrms.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.service.AgentOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Chat endpoint. Caller identity comes from gateway headers.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final AgentOrchestrator orchestrator;

    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestHeader(CallerHeaders.CALLER_ROLE) String role,
            @RequestHeader(value = CallerHeaders.CALLER_NAME, required = false) String name,
            @RequestHeader(value = CallerHeaders.CALLER_EMP_CODE, required = false) String empCode,
            @RequestBody ChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        CallerIdentity caller = CallerHeaders.toIdentity(callerId, role, name, empCode, request.getSessionId());
        log.debug("[API] Chat turn: caller={}, session={}", caller.getId(), caller.getSessionId());

        return Mono.fromFuture(() -> orchestrator.submit(caller, request.getMessage()))
                .map(reply -> ResponseEntity.ok(ChatResponse.builder()
                        .reply(reply.reply())
                        .source(reply.source().getValue())
                        .build()));
    }
}
