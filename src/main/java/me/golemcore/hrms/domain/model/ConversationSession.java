package me.golemcore.hrms.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation history of one session. The system message is never stored
 * here; it is synthesized for every outbound request.
 */
@Data
@Builder
public class ConversationSession {

    private String id;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Appends a message and drops the oldest entries until at most
     * {@code maxMessages} remain.
     */
    public void append(Message message, int maxMessages, Instant now) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
        if (maxMessages > 0 && messages.size() > maxMessages) {
            messages.subList(0, messages.size() - maxMessages).clear();
        }
        this.updatedAt = now;
    }
}
