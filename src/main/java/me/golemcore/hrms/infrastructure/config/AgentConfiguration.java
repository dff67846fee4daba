package me.golemcore.hrms.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the assistant: clock, JSON mapper and the worker pools for
 * chat turns and tool calls.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AgentConfiguration {

    private final HrmsProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Runs model turns. Turns of one session are chained, so this pool only
     * bounds cross-session parallelism.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService sessionTurnExecutor() {
        return Executors.newCachedThreadPool(namedThreads("chat-turn"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor() {
        return Executors.newFixedThreadPool(properties.getAgent().getToolThreads(), namedThreads("hr-tool"));
    }

    @PostConstruct
    public void init() {
        log.info("HRMS assistant starting...");
        log.info("LLM Provider: {} ({} / {})", properties.getLlm().getProvider(), properties.getLlm().getVendor(),
                properties.getLlm().getModel());
        log.info("HR backend: {}", properties.getBackend().getBaseUrl());
        log.info("Max tool rounds: {}, history cap: {}, cache: {}", properties.getAgent().getMaxToolRounds(),
                properties.getAgent().getMaxHistory(),
                properties.getCache().isEnabled() ? properties.getCache().getTtl() : "disabled");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
