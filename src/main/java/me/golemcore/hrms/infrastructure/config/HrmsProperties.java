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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the HR agent, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code hrms.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - completion service provider and model</li>
 * <li>{@link AgentProperties} - tool loop budget, history cap, timeouts</li>
 * <li>{@link CacheProperties} - query cache TTL and purge interval</li>
 * <li>{@link BackendProperties} - HR domain services endpoint</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link SecurityProperties} - role to permission grants</li>
 * </ul>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "hrms")
@Data
public class HrmsProperties {

    private LlmProperties llm = new LlmProperties();
    private AgentProperties agent = new AgentProperties();
    private CacheProperties cache = new CacheProperties();
    private BackendProperties backend = new BackendProperties();
    private HttpProperties http = new HttpProperties();
    private SecurityProperties security = new SecurityProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String vendor = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.3;
        private long timeoutMs = 60_000;
        private int maxRetries = 3;
    }

    @Data
    public static class AgentProperties {
        private int maxToolRounds = 8;
        private int maxHistory = 20;
        private long toolTimeoutMs = 30_000;
        private long llmTimeoutMs = 120_000;
        private int toolThreads = 8;
        private String fallbackMessage = "I'm sorry, I wasn't able to complete your request. "
                + "Please try rephrasing or simplifying your question.";
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private Duration purgeInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class BackendProperties {
        private String baseUrl = "http://localhost:8000";
        /**
         * Service token sent as a bearer credential. Blank means no
         * Authorization header.
         */
        private String apiToken;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private long slowCallThreshold = 5000;
    }

    @Data
    public static class SecurityProperties {
        /**
         * Overrides for role grants, keyed by role value (e.g. {@code hr_admin}).
         * Roles absent here keep their default grants.
         */
        private Map<String, List<String>> rolePermissions = new LinkedHashMap<>();
    }
}
