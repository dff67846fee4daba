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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.ToolDefinition;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tool schema advertised to the completion service, loaded from
 * {@code classpath:hr-tools.json}.
 *
 * <p>
 * The schema and {@link HrTool} must name exactly the same tools; startup
 * fails otherwise.
 */
@Component
@Slf4j
public class HrToolCatalog {

    static final String CATALOG_FILE = "hr-tools.json";

    private final ObjectMapper objectMapper;
    private final String resourcePath;
    private List<ToolDefinition> definitions = List.of();

    public HrToolCatalog(ObjectMapper objectMapper) {
        this(objectMapper, CATALOG_FILE);
    }

    HrToolCatalog(ObjectMapper objectMapper, String resourcePath) {
        this.objectMapper = objectMapper;
        this.resourcePath = resourcePath;
    }

    @PostConstruct
    public void init() {
        List<ToolDefinition> loaded = load();
        validate(loaded);
        Map<String, ToolDefinition> byName = loaded.stream()
                .collect(Collectors.toMap(ToolDefinition::getName, Function.identity()));
        List<ToolDefinition> ordered = new ArrayList<>();
        for (HrTool tool : HrTool.values()) {
            ordered.add(byName.get(tool.getToolName()));
        }
        this.definitions = Collections.unmodifiableList(ordered);
        log.info("[Tools] Loaded {} tool definitions", definitions.size());
    }

    public List<ToolDefinition> getDefinitions() {
        return definitions;
    }

    private List<ToolDefinition> load() {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new IllegalStateException("Tool catalog not found on classpath: " + resourcePath);
        }
        try (InputStream is = resource.getInputStream()) {
            return objectMapper.readValue(is, new TypeReference<List<ToolDefinition>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read tool catalog " + resourcePath, e);
        }
    }

    private static void validate(List<ToolDefinition> loaded) {
        Set<String> schemaNames = new HashSet<>();
        for (ToolDefinition definition : loaded) {
            if (!schemaNames.add(definition.getName())) {
                throw new IllegalStateException("Duplicate tool in catalog: " + definition.getName());
            }
        }
        Set<String> enumNames = Arrays.stream(HrTool.values())
                .map(HrTool::getToolName)
                .collect(Collectors.toSet());

        Set<String> missingSchema = new HashSet<>(enumNames);
        missingSchema.removeAll(schemaNames);
        Set<String> missingHandler = new HashSet<>(schemaNames);
        missingHandler.removeAll(enumNames);
        if (!missingSchema.isEmpty() || !missingHandler.isEmpty()) {
            throw new IllegalStateException("Tool catalog out of sync: no schema for " + missingSchema
                    + ", no handler for " + missingHandler);
        }
    }
}
