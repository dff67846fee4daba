package me.golemcore.hrms.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.CachedReply;
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.ChatReply;
import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.domain.model.ReplySource;
import me.golemcore.hrms.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.hrms.domain.system.toolloop.ToolLoopTurnResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for a chat turn.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li>FAQ match, answered without queuing or touching the session or the
 * cache</li>
 * <li>query cache lookup, run in the session queue so it sees the cache as
 * left by earlier turns of the same session</li>
 * <li>model turn: user message appended, tool loop run, reply appended</li>
 * <li>cache maintenance: wipe on any requested write, store otherwise</li>
 * </ol>
 *
 * <p>
 * Everything after the FAQ match is serialized per session through
 * {@link SessionTurnCoordinator}; different sessions run in parallel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentOrchestrator {

    private final FaqMatcher faqMatcher;
    private final QueryCache queryCache;
    private final ConversationSessionService sessionService;
    private final SessionTurnCoordinator turnCoordinator;
    private final SystemPromptService systemPromptService;
    private final ToolLoopSystem toolLoopSystem;
    private final Clock clock;

    /**
     * Processes a turn asynchronously. FAQ answers complete immediately; every
     * other turn is queued behind earlier turns of the same session.
     */
    public CompletableFuture<ChatReply> submit(CallerIdentity caller, String message) {
        Optional<String> faq = faqMatcher.match(message);
        if (faq.isPresent()) {
            log.info("[Agent] FAQ hit for session={}", caller.getSessionId());
            return CompletableFuture.completedFuture(ChatReply.shortCircuit(faq.get(), ReplySource.FAQ));
        }
        return turnCoordinator.submit(caller.getSessionId(), () -> cachedOrModelTurn(caller, message));
    }

    private ChatReply cachedOrModelTurn(CallerIdentity caller, String message) {
        Optional<CachedReply> cached = queryCache.get(message);
        if (cached.isPresent()) {
            log.info("[Agent] Cache hit for session={}", caller.getSessionId());
            return ChatReply.shortCircuit(cached.get().getReply(), ReplySource.CACHE);
        }
        return runModelTurn(caller, message);
    }

    private ChatReply runModelTurn(CallerIdentity caller, String message) {
        String sessionId = caller.getSessionId();
        sessionService.append(sessionId, Message.user(message, clock.instant()));

        List<Message> transcript = new ArrayList<>();
        transcript.add(Message.system(systemPromptService.buildPrompt(caller)));
        transcript.addAll(sessionService.history(sessionId));

        ToolLoopTurnResult result = toolLoopSystem.processTurn(transcript, caller);
        String reply = result.finalText();

        sessionService.append(sessionId, Message.assistant(reply, clock.instant()));

        if (result.wroteData()) {
            int removed = queryCache.invalidateAll();
            log.info("[Agent] Write requested in session={}, dropped {} cached replies", sessionId, removed);
        } else {
            queryCache.set(message, reply, toolLabel(result.toolsUsed()), null);
        }

        log.debug("[Agent] Turn finished: session={}, llmCalls={}, tools={}, exhausted={}",
                sessionId, result.llmCalls(), result.toolExecutions(), result.exhausted());
        ReplySource source = result.exhausted() ? ReplySource.FALLBACK : ReplySource.MODEL;
        return new ChatReply(reply, source, result.llmCalls(), result.wroteData());
    }

    private static String toolLabel(List<String> toolsUsed) {
        if (toolsUsed == null || toolsUsed.isEmpty()) {
            return null;
        }
        return String.join(",", new LinkedHashSet<>(toolsUsed));
    }
}
