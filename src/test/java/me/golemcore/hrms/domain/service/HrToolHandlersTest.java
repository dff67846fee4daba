package me.golemcore.hrms.domain.service;

import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.ToolFailureKind;
import me.golemcore.hrms.domain.model.ToolResult;
import me.golemcore.hrms.domain.model.UserRole;
import me.golemcore.hrms.domain.tool.HrTool;
import me.golemcore.hrms.domain.tool.ToolArguments;
import me.golemcore.hrms.port.outbound.AppraisalPort;
import me.golemcore.hrms.port.outbound.AttendancePort;
import me.golemcore.hrms.port.outbound.EmployeePort;
import me.golemcore.hrms.port.outbound.HrPolicyPort;
import me.golemcore.hrms.port.outbound.LeavePort;
import me.golemcore.hrms.port.outbound.PayrollPort;
import me.golemcore.hrms.port.outbound.UpdateRequestPort;
import me.golemcore.hrms.port.outbound.UserAccountPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HrToolHandlersTest {

    @Mock
    private EmployeePort employeePort;
    @Mock
    private LeavePort leavePort;
    @Mock
    private AttendancePort attendancePort;
    @Mock
    private PayrollPort payrollPort;
    @Mock
    private HrPolicyPort hrPolicyPort;
    @Mock
    private UpdateRequestPort updateRequestPort;
    @Mock
    private AppraisalPort appraisalPort;
    @Mock
    private UserAccountPort userAccountPort;

    private HrToolHandlers handlers;
    private final CallerIdentity caller = CallerIdentity.builder()
            .id("hr@acme.test").role(UserRole.HR_ADMIN).sessionId("s-1").build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(Instant.parse("2025-03-15T10:00:00Z"), ZoneOffset.UTC);
        handlers = new HrToolHandlers(employeePort, leavePort, attendancePort, payrollPort, hrPolicyPort,
                updateRequestPort, appraisalPort, userAccountPort, clock);
    }

    private ToolResult handle(HrTool tool, Map<String, Object> args) {
        return handlers.handle(tool, ToolArguments.of(args), caller);
    }

    // ==================== Listing ====================

    @Test
    void shouldClampPageSizeForFullListing() {
        handle(HrTool.LIST_ALL_EMPLOYEES, Map.of("page", 0, "page_size", 100, "search", "eng"));

        verify(employeePort).listAll(1, 25, "eng");
    }

    @Test
    void shouldUseDefaultPaging() {
        handle(HrTool.LIST_ALL_EMPLOYEES, Map.of());

        verify(employeePort).listAll(1, 10, null);
    }

    @Test
    void shouldWrapRecordsUnderNamedKey() {
        when(leavePort.getLeaveRecords("EMP001", "pending"))
                .thenReturn(List.of(Map.of("leave_type", "casual")));

        ToolResult result = handle(HrTool.GET_LEAVE_RECORDS, Map.of("emp_code", "EMP001", "status", "pending"));

        assertEquals(List.of(Map.of("leave_type", "casual")), result.getData().get("leave_records"));
    }

    @Test
    void shouldCountAppraisalHistory() {
        when(appraisalPort.history("EMP001", 20)).thenReturn(List.of(Map.of("rating", 4), Map.of("rating", 3)));

        ToolResult result = handle(HrTool.GET_APPRAISAL_HISTORY, Map.of("emp_code", "EMP001"));

        assertEquals(2, result.getData().get("total"));
    }

    @Test
    void shouldReportMissingPolicyHistoryAsMessage() {
        when(hrPolicyPort.getPolicyHistory(10)).thenReturn(List.of());

        ToolResult result = handle(HrTool.GET_HR_POLICY_HISTORY, Map.of());

        assertTrue(result.isSuccess());
        assertEquals("No policy history found. Set an HR policy first.", result.getData().get("message"));
    }

    // ==================== Writes ====================

    @Test
    void shouldRejectUnknownRoleAssignment() {
        assertThrows(IllegalArgumentException.class,
                () -> handle(HrTool.ASSIGN_ROLE, Map.of("email", "a@acme.test", "role", "ceo")));
        verify(userAccountPort, never()).updateRole(anyString(), any());
    }

    @Test
    void shouldFailRoleAssignmentForUnknownUser() {
        when(userAccountPort.exists("ghost@acme.test")).thenReturn(false);

        ToolResult result = handle(HrTool.ASSIGN_ROLE, Map.of("email", "ghost@acme.test", "role", "manager"));

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("User with email 'ghost@acme.test' not found.", result.getError());
    }

    @Test
    void shouldAssignRoleToExistingUser() {
        when(userAccountPort.exists("a@acme.test")).thenReturn(true);

        ToolResult result = handle(HrTool.ASSIGN_ROLE, Map.of("email", "a@acme.test", "role", "manager"));

        verify(userAccountPort).updateRole("a@acme.test", UserRole.MANAGER);
        assertEquals("Role updated to 'manager' for a@acme.test.", result.getData().get("message"));
    }

    @Test
    void shouldNormalizeTaxRegimeChoice() {
        when(employeePort.findByEmpCode("EMP001")).thenReturn(Optional.of(Map.of("name", "Asha")));

        ToolResult result = handle(HrTool.SET_EMPLOYEE_TAX_REGIME, Map.of("emp_code", "emp001", "tax_regime", "OLD"));

        verify(employeePort).updateTaxRegime("EMP001", "old");
        assertEquals(true, result.getData().get("success"));
    }

    @Test
    void shouldRejectUnsupportedTaxRegime() {
        assertThrows(IllegalArgumentException.class,
                () -> handle(HrTool.SET_EMPLOYEE_TAX_REGIME, Map.of("emp_code", "EMP001", "tax_regime", "flat")));
    }

    @Test
    void shouldRequireStateForPolicyUpdate() {
        assertThrows(IllegalArgumentException.class,
                () -> handle(HrTool.SET_HR_POLICY, Map.of("basic_pct", 40)));
        verify(hrPolicyPort, never()).setPolicy(any(), anyString());
    }

    @Test
    void shouldDefaultNationalityAndSchedulePostActions() {
        when(employeePort.addEmployee(any())).thenReturn(Map.of("message", "Employee EMP009 added."));

        ToolResult result = handle(HrTool.ADD_EMPLOYEE, Map.of("emp_code", "EMP009", "name", "Ravi",
                "email", "ravi@acme.test", "department", "Engineering", "designation", "Engineer",
                "date_of_joining", "2025-03-01", "salary", 1_200_000));

        verify(employeePort).addEmployee(argThat(
                fields -> "Indian".equals(fields.get("nationality"))));
        assertEquals(2, result.getPostActions().size());
        assertEquals("payroll_warning", result.getPostActions().get(0).warningKey());
        assertEquals("leave_warning", result.getPostActions().get(1).warningKey());
    }

    // ==================== Audit target ====================

    @Test
    void shouldResolveAuditTargetPerTool() {
        assertEquals("a@acme.test", handlers.auditTarget(HrTool.ASSIGN_ROLE,
                ToolArguments.of(Map.of("email", "a@acme.test"))));
        assertEquals("hr_policy", handlers.auditTarget(HrTool.SET_HR_POLICY, ToolArguments.of(Map.of())));
        assertEquals("req-7", handlers.auditTarget(HrTool.REVIEW_UPDATE_REQUEST,
                ToolArguments.of(Map.of("request_id", "req-7"))));
        assertEquals("EMP001", handlers.auditTarget(HrTool.APPLY_LEAVE,
                ToolArguments.of(Map.of("emp_code", "EMP001"))));
    }
}
