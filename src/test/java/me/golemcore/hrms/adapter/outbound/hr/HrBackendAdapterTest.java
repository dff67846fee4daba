package me.golemcore.hrms.adapter.outbound.hr;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.RetryableException;
import me.golemcore.hrms.domain.model.AuditEntry;
import me.golemcore.hrms.domain.model.UserRole;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.infrastructure.http.FeignClientFactory;
import me.golemcore.hrms.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HrBackendAdapterTest {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private HrBackendAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        HrmsProperties properties = new HrmsProperties();
        properties.getBackend().setBaseUrl("http://hr-backend.test");
        adapter = new HrBackendAdapter(new FeignClientFactory(client, objectMapper), properties);
    }

    @Test
    void shouldSendBearerTokenWhenConfigured() {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        HrmsProperties properties = new HrmsProperties();
        properties.getBackend().setBaseUrl("http://hr-backend.test");
        properties.getBackend().setApiToken("svc-token");
        HrBackendAdapter authenticated = new HrBackendAdapter(new FeignClientFactory(client, objectMapper),
                properties);
        engine.enqueueJson(200, "{}");

        authenticated.getActivePolicy();

        assertEquals("Bearer svc-token", engine.takeRequest().header("Authorization"));
    }

    @Test
    void shouldOmitAuthorizationWithoutToken() {
        engine.enqueueJson(200, "{}");

        adapter.getActivePolicy();

        assertNull(engine.takeRequest().header("Authorization"));
    }

    private Map<String, Object> sentBody(OkHttpMockEngine.CapturedRequest request) throws IOException {
        return objectMapper.readValue(request.body(), MAP_TYPE);
    }

    // ==================== Employees ====================

    @Test
    void shouldLookUpEmployeeByQuery() {
        engine.enqueueJson(200, "{\"emp_code\":\"EMP001\",\"name\":\"Asha Rao\"}");

        Map<String, Object> employee = adapter.lookup("Asha Rao");

        assertEquals("EMP001", employee.get("emp_code"));
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/employees/lookup", request.path());
        assertEquals("Asha Rao", request.queryParameter("query"));
    }

    @Test
    void shouldPassPagingParameters() {
        engine.enqueueJson(200, "{\"employees\":[],\"total\":0,\"page\":2,\"total_pages\":0}");

        adapter.listAll(2, 25, "eng");

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/employees/page", request.path());
        assertEquals("2", request.queryParameter("page"));
        assertEquals("25", request.queryParameter("page_size"));
        assertEquals("eng", request.queryParameter("search"));
    }

    @Test
    void shouldReturnEmptyWhenEmployeeIsMissing() {
        engine.enqueueJson(404, "{\"detail\":\"not found\"}");

        Optional<Map<String, Object>> employee = adapter.findByEmpCode("EMP404");

        assertTrue(employee.isEmpty());
        assertEquals("/employees/EMP404", engine.takeRequest().path());
    }

    @Test
    void shouldPropagateServerErrors() {
        engine.enqueueJson(500, "{\"detail\":\"boom\"}");

        assertThrows(FeignException.class, () -> adapter.getCompanyStats());
    }

    @Test
    void shouldPropagateTransportFailures() {
        engine.enqueueFailure(new IOException("connection reset"));

        assertThrows(RetryableException.class, () -> adapter.getCompanyStats());
    }

    @Test
    void shouldPatchEmployeeWithUpdatesOnly() throws IOException {
        engine.enqueueJson(200, "{\"message\":\"updated\"}");

        adapter.updateEmployee("EMP001", Map.of("designation", "Lead"));

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("PATCH", request.method());
        assertEquals("/employees/EMP001", request.path());
        assertEquals(Map.of("designation", "Lead"), sentBody(request));
    }

    // ==================== Leave ====================

    @Test
    void shouldSendLeaveApplication() throws IOException {
        engine.enqueueJson(200, "{\"message\":\"Leave applied\"}");

        adapter.applyLeave("EMP001", "casual", "2025-03-20", "2025-03-21", "family");

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/leaves", request.path());
        assertEquals(Map.of("emp_code", "EMP001", "leave_type", "casual", "start_date", "2025-03-20",
                "end_date", "2025-03-21", "reason", "family"), sentBody(request));
    }

    @Test
    void shouldOmitAbsentStatusFilter() {
        engine.enqueueJson(200, "[{\"leave_type\":\"sick\"}]");

        List<Map<String, Object>> records = adapter.getLeaveRecords("EMP001", null);

        assertEquals(1, records.size());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("EMP001", request.queryParameter("emp_code"));
        assertNull(request.queryParameter("status"));
    }

    @Test
    void shouldReadLeaveCredits() {
        engine.enqueueJson(200, "{\"casual_leave\":12,\"sick_leave\":10,\"earned_leave\":15}");

        Map<String, Integer> credits = adapter.getLeaveCredits();

        assertEquals(12, credits.get("casual_leave"));
        assertEquals("/hr-policy/leave-credits", engine.takeRequest().path());
    }

    // ==================== Users and audit ====================

    @Test
    void shouldReportMissingUser() {
        engine.enqueueJson(404, "{}");

        assertFalse(adapter.exists("ghost@acme.test"));
    }

    @Test
    void shouldUpdateRoleWithWireValue() throws IOException {
        engine.enqueueJson(200, "");

        adapter.updateRole("a@acme.test", UserRole.HR_ADMIN);

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("PUT", request.method());
        assertEquals(Map.of("role", "hr_admin"), sentBody(request));
    }

    @Test
    void shouldWriteAuditRecord() throws IOException {
        engine.enqueueJson(200, "");

        adapter.record(AuditEntry.builder()
                .action("apply_leave")
                .performedBy("asha@acme.test")
                .target("EMP001")
                .details(Map.of("leave_type", "casual"))
                .timestamp(Instant.parse("2025-03-15T10:00:00Z"))
                .build());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("/audit-logs", request.path());
        Map<String, Object> body = sentBody(request);
        assertEquals("apply_leave", body.get("action"));
        assertEquals("asha@acme.test", body.get("performed_by"));
        assertEquals("EMP001", body.get("target"));
        assertEquals(Map.of("leave_type", "casual"), body.get("details"));
        assertEquals("2025-03-15T10:00:00Z", body.get("timestamp"));
    }

    @Test
    void shouldAttachAuthorToPolicyUpdate() throws IOException {
        engine.enqueueJson(200, "{\"version\":3}");

        adapter.setPolicy(Map.of("state", "karnataka"), "hr@acme.test");

        Map<String, Object> body = sentBody(engine.takeRequest());
        assertEquals("karnataka", body.get("state"));
        assertEquals("hr@acme.test", body.get("created_by"));
    }
}
