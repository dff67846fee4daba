package me.golemcore.hrms.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.RequestInterceptor;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates Feign clients over the shared OkHttp transport with Jackson JSON
 * encoding. Calls are never retried by Feign: HR writes are not idempotent.
 *
 * <pre>{@code
 * HrBackendApi api = factory.create(HrBackendApi.class, "http://hr-backend:8000",
 *         FeignClientFactory.bearerToken(token));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T create(Class<T> apiType, String baseUrl, RequestInterceptor... interceptors) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .requestInterceptors(List.of(interceptors))
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }

    /**
     * Adds {@code Authorization: Bearer <token>} to every request.
     */
    public static RequestInterceptor bearerToken(String token) {
        return template -> template.header("Authorization", "Bearer " + token);
    }
}
