package me.golemcore.hrms.adapter.outbound.llm;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.LlmRequest;
import me.golemcore.hrms.domain.model.LlmResponse;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the completion service adapter named by {@code hrms.llm.provider}.
 *
 * <p>
 * Resolution order: the configured provider, then {@code none}, then the first
 * registered adapter. A selected adapter that reports itself unavailable (no
 * API key) is still used; its failures reach the caller as upstream errors.
 *
 * @see LlmProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final HrmsProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        Map<String, LlmProviderAdapter> byProvider = new LinkedHashMap<>();
        for (LlmProviderAdapter adapter : adapters) {
            byProvider.putIfAbsent(adapter.getProviderId(), adapter);
        }
        String provider = properties.getLlm().getProvider();

        activeAdapter = Optional.ofNullable(byProvider.get(provider))
                .or(() -> Optional.ofNullable(byProvider.get(PROVIDER_NONE)))
                .or(() -> adapters.stream().findFirst())
                .orElse(null);

        if (activeAdapter == null) {
            log.warn("[LLM] No adapters registered, chat turns will fail");
        } else if (!Objects.equals(provider, activeAdapter.getProviderId())) {
            log.warn("[LLM] Provider '{}' not found, using: {}", provider, activeAdapter.getProviderId());
        } else if (!activeAdapter.isAvailable()) {
            log.warn("[LLM] Provider '{}' has no API key, completion calls will be rejected upstream", provider);
        } else {
            log.info("[LLM] Active provider: {} (model {})", provider, activeAdapter.getCurrentModel());
        }
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter registered"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
