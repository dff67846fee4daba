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

/**
 * Final outcome of one chat turn.
 *
 * @param reply
 *            text returned to the caller
 * @param source
 *            stage that produced it
 * @param llmCalls
 *            completion-service requests issued during the turn
 * @param wroteData
 *            whether a mutating tool was requested during the turn
 */
public record ChatReply(String reply, ReplySource source, int llmCalls, boolean wroteData) {

    public static ChatReply shortCircuit(String reply, ReplySource source) {
        return new ChatReply(reply, source, 0, false);
    }
}
