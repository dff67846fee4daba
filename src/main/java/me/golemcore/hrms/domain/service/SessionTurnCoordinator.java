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
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Serializes turns per session id while letting different sessions run in
 * parallel.
 *
 * <p>
 * Each session keeps the tail of a future chain; a new turn starts only after
 * the previous one for the same session has finished, successfully or not. No
 * lock is held while a turn waits on the completion service or a tool.
 *
 * <p>
 * Callers receive a copy of the queued future. Cancelling or completing that
 * copy does not advance the queue; the next turn still waits for the running
 * one to return.
 */
@Service
@Slf4j
public class SessionTurnCoordinator {

    private final Executor sessionTurnExecutor;
    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public SessionTurnCoordinator(@Qualifier("sessionTurnExecutor") Executor sessionTurnExecutor) {
        this.sessionTurnExecutor = sessionTurnExecutor;
    }

    public <T> CompletableFuture<T> submit(String sessionId, Supplier<T> turn) {
        @SuppressWarnings("unchecked")
        CompletableFuture<T>[] scheduled = new CompletableFuture[1];
        tails.compute(sessionId, (key, previous) -> {
            CompletableFuture<?> start = previous != null
                    ? previous.handle((ignored, error) -> null)
                    : CompletableFuture.completedFuture(null);
            if (previous != null && !previous.isDone()) {
                log.debug("[Turn] Session {} busy, queuing turn", key);
            }
            scheduled[0] = start.thenApplyAsync(ignored -> turn.get(), sessionTurnExecutor);
            return scheduled[0];
        });
        CompletableFuture<T> run = scheduled[0];
        run.whenComplete((result, error) -> tails.remove(sessionId, run));
        return run.copy();
    }

    /**
     * Number of sessions with a queued or running turn.
     */
    public int activeSessions() {
        return tails.size();
    }
}
