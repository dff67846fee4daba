package me.golemcore.hrms.domain.tool;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over the JSON argument object the model supplied with a tool call.
 * Missing or malformed required arguments raise
 * {@link IllegalArgumentException}, which the dispatcher turns into an
 * {@code INVALID_ARGUMENTS} result.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values != null ? values : Collections.emptyMap();
    }

    public static ToolArguments of(Map<String, Object> values) {
        return new ToolArguments(values);
    }

    public String requireString(String name) {
        String value = optString(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return value;
    }

    public String optString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    public String optString(String name, String defaultValue) {
        String value = optString(name);
        return value != null ? value : defaultValue;
    }

    public double requireNumber(String name) {
        Double value = optNumber(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return value;
    }

    public Double optNumber(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a number", e);
        }
    }

    public int optInt(String name, int defaultValue) {
        Double value = optNumber(name);
        return value != null ? value.intValue() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> requireObject(String name) {
        Object value = values.get(name);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Missing required argument: " + name);
    }

    /**
     * Copy of all non-null arguments except the excluded names.
     */
    public Map<String, Object> without(String... excluded) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        for (String name : excluded) {
            copy.remove(name);
        }
        return copy;
    }

    /**
     * Snapshot of the raw arguments, used for audit details.
     */
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(values);
    }
}
