package me.golemcore.hrms.port.outbound;

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

import java.util.List;
import java.util.Map;

/**
 * Performance appraisal domain service.
 */
public interface AppraisalPort {

    Map<String, Object> initiate(String empCode, String appraisalCycle, String initiatedBy, String managerFeedback);

    /**
     * Completes an appraisal. {@code fields} holds rating, hike and revision
     * details as supplied by the caller.
     */
    Map<String, Object> complete(Map<String, Object> fields, String completedBy);

    List<Map<String, Object>> history(String empCode, int limit);
}
