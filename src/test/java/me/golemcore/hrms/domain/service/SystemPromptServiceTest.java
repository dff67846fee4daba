package me.golemcore.hrms.domain.service;

import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.UserRole;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class SystemPromptServiceTest {

    private final SystemPromptService service = new SystemPromptService();

    @Test
    void shouldDescribeCallerAndOwnEmployeeCode() {
        String prompt = service.buildPrompt(CallerIdentity.builder()
                .id("asha@acme.test").name("Asha").role(UserRole.EMPLOYEE).empCode("EMP001").build());

        assertTrue(prompt.contains("Current user: Asha (id asha@acme.test)"));
        assertTrue(prompt.contains("Role: employee"));
        assertTrue(prompt.contains("use emp_code \"EMP001\""));
        assertTrue(prompt.contains("Never reveal other employees' salary"));
    }

    @Test
    void shouldMarkUnlinkedEmployeeCode() {
        String prompt = service.buildPrompt(CallerIdentity.builder()
                .id("root@acme.test").role(UserRole.SUPER_ADMIN).build());

        assertTrue(prompt.contains("Employee code: not linked"));
        assertTrue(prompt.contains("Current user: root@acme.test"));
        assertTrue(prompt.contains("role assignment"));
    }
}
