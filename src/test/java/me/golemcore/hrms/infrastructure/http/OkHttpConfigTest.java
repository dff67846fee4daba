package me.golemcore.hrms.infrastructure.http;

import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        HrmsProperties properties = new HrmsProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
    }

    @Test
    void shouldPassResponsesAndFailuresThroughCallLogger() throws IOException {
        OkHttpMockEngine engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpConfig(new HrmsProperties()).okHttpClient().newBuilder()
                .addInterceptor(engine)
                .build();
        Request request = new Request.Builder().url("http://hr-backend.test/employees/stats").build();

        engine.enqueueJson(200, "{\"total_employees\":42}");
        try (Response response = client.newCall(request).execute()) {
            assertEquals(200, response.code());
            assertEquals("{\"total_employees\":42}", response.body().string());
        }

        engine.enqueueFailure(new IOException("connection reset"));
        assertThrows(IOException.class, () -> client.newCall(request).execute());
    }
}
