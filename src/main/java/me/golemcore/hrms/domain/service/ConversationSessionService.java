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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.ConversationSession;
import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide store of conversation histories keyed by session id.
 *
 * <p>
 * After every append the history is trimmed to the most recent
 * {@code hrms.agent.max-history} messages. Sessions live for the lifetime of
 * the process. Turns for one session are serialized by
 * {@link SessionTurnCoordinator}.
 */
@Service
@Slf4j
public class ConversationSessionService {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final int maxHistory;
    private final Clock clock;

    public ConversationSessionService(HrmsProperties properties, Clock clock) {
        this.maxHistory = properties.getAgent().getMaxHistory();
        this.clock = clock;
    }

    public ConversationSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            Instant now = clock.instant();
            log.debug("[Session] Created session {}", id);
            return ConversationSession.builder()
                    .id(id)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        });
    }

    public void append(String sessionId, Message message) {
        ConversationSession session = getOrCreate(sessionId);
        synchronized (session) {
            session.append(message, maxHistory, clock.instant());
        }
    }

    /**
     * Copy of the current history, oldest first.
     */
    public List<Message> history(String sessionId) {
        ConversationSession session = getOrCreate(sessionId);
        synchronized (session) {
            return List.copyOf(session.getMessages());
        }
    }

    public Optional<ConversationSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }
}
