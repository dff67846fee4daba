package me.golemcore.hrms;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * HR assistant service.
 *
 * <p>
 * Answers employee and HR staff questions in natural language. A chat turn is
 * answered from static FAQ entries, from the query cache, or by a
 * completion service that may call HR tools on the caller's behalf, subject
 * to the caller's role.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ChatController
 * Domain Layer       → AgentOrchestrator, tool loop, HrToolDispatcher
 * Infrastructure     → LLM adapters, HR backend client
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code hrms.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HrmsAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(HrmsAgentApplication.class, args);
    }

}
