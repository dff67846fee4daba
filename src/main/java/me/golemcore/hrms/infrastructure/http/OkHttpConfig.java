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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for calls to the HR domain services, configured
 * from {@code hrms.http.*}.
 *
 * <p>
 * Every exchange is logged with its status and duration; calls slower than
 * {@code hrms.http.slow-call-threshold} are logged at warn level.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final HrmsProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        HrmsProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(new BackendCallLogger(http.getSlowCallThreshold()))
                .build();
    }

    static final class BackendCallLogger implements Interceptor {

        private final long slowCallThresholdMs;

        BackendCallLogger(long slowCallThresholdMs) {
            this.slowCallThresholdMs = slowCallThresholdMs;
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            long started = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                if (elapsedMs >= slowCallThresholdMs) {
                    log.warn("[HTTP] Slow call {} {} -> {} in {} ms", request.method(), request.url().encodedPath(),
                            response.code(), elapsedMs);
                } else {
                    log.debug("[HTTP] {} {} -> {} in {} ms", request.method(), request.url().encodedPath(),
                            response.code(), elapsedMs);
                }
                return response;
            } catch (IOException e) {
                log.warn("[HTTP] {} {} failed: {}", request.method(), request.url().encodedPath(), e.getMessage());
                throw e;
            }
        }
    }
}
