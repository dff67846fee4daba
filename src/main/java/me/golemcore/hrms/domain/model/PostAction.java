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

import java.util.Map;

/**
 * Best-effort follow-up attached to a successful tool result and executed after
 * the primary operation has committed. A failure is recorded on the result
 * under {@code warningKey}; it never fails the primary operation and is never
 * retried.
 *
 * @param name
 *            short description used in logs and the warning text
 * @param warningKey
 *            result key that receives the warning on failure
 * @param step
 *            the follow-up; may enrich the result payload on success
 */
public record PostAction(String name, String warningKey, Step step) {

    @FunctionalInterface
    public interface Step {

        void apply(Map<String, Object> result);
    }
}
