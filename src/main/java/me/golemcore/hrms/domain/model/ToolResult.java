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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of tool execution. A successful result carries the structured payload
 * echoed back to the LLM; a failed one carries an error message and its
 * {@link ToolFailureKind}. Failures are values, never exceptions.
 */
@Data
@Builder
public class ToolResult {

    public static final String KEY_ERROR = "error";
    public static final String KEY_MESSAGE = "message";
    public static final String KEY_SUCCESS = "success";

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private Map<String, Object> data;
    private String error;
    private ToolFailureKind failureKind;

    @Builder.Default
    private List<PostAction> postActions = new ArrayList<>();

    /**
     * Creates a successful tool result with structured data.
     */
    public static ToolResult success(Map<String, Object> data) {
        return ToolResult.builder()
                .success(true)
                .data(new LinkedHashMap<>(data))
                .build();
    }

    /**
     * Creates a successful result holding only a {@code message} field, used when
     * a read finds nothing so the model does not mistake "no data" for an error.
     */
    public static ToolResult message(String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_MESSAGE, message);
        return success(data);
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    /**
     * Attaches a best-effort follow-up to run after this result is committed.
     */
    public ToolResult then(PostAction action) {
        if (postActions == null) {
            postActions = new ArrayList<>();
        }
        postActions.add(action);
        return this;
    }

    /**
     * Whether the domain service reported a problem inside an otherwise normal
     * response ({@code error} key or {@code success: false}).
     */
    public boolean hasInternalErrorFlag() {
        if (!success) {
            return true;
        }
        return data != null && (data.containsKey(KEY_ERROR) || Boolean.FALSE.equals(data.get(KEY_SUCCESS)));
    }

    /**
     * Shape sent back to the model as the tool message body.
     */
    public Map<String, Object> toPayload() {
        if (!success) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(KEY_ERROR, error);
            return payload;
        }
        return data != null ? data : Map.of();
    }
}
