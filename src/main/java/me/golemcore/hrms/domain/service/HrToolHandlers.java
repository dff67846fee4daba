package me.golemcore.hrms.domain.service;

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
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.PostAction;
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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes an authorized tool call to the owning domain service and shapes the
 * result for the model. Every {@link HrTool} has exactly one handler.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HrToolHandlers {

    private static final String EMP_CODE = "emp_code";
    private static final String MESSAGE = ToolResult.KEY_MESSAGE;
    private static final String TOTAL = "total";
    private static final int MAX_PAGE_SIZE = 25;
    private static final int DEFAULT_PAGE_SIZE = 10;

    private final EmployeePort employeePort;
    private final LeavePort leavePort;
    private final AttendancePort attendancePort;
    private final PayrollPort payrollPort;
    private final HrPolicyPort hrPolicyPort;
    private final UpdateRequestPort updateRequestPort;
    private final AppraisalPort appraisalPort;
    private final UserAccountPort userAccountPort;
    private final Clock clock;

    public ToolResult handle(HrTool tool, ToolArguments args, CallerIdentity caller) {
        return switch (tool) {
        case LOOKUP_EMPLOYEE -> ToolResult.success(employeePort.lookup(args.requireString("query")));
        case LIST_EMPLOYEES_BY_DEPARTMENT -> listByDepartment(args);
        case LIST_ALL_EMPLOYEES -> listAllEmployees(args);
        case GET_LEAVE_RECORDS -> {
            String empCode = args.requireString(EMP_CODE);
            yield collection(leavePort.getLeaveRecords(empCode, args.optString("status")),
                    "leave_records", "No leave records for " + empCode + ".");
        }
        case APPLY_LEAVE -> ToolResult.success(leavePort.applyLeave(
                args.requireString(EMP_CODE),
                args.requireString("leave_type"),
                args.requireString("start_date"),
                args.requireString("end_date"),
                args.requireString("reason")));
        case APPROVE_OR_REJECT_LEAVE -> ToolResult.success(leavePort.approveOrReject(
                args.requireString(EMP_CODE),
                args.requireString("start_date"),
                args.requireString("action"),
                caller.getId()));
        case GET_ATTENDANCE -> {
            String empCode = args.requireString(EMP_CODE);
            yield collection(attendancePort.getAttendance(empCode, args.optString("date")),
                    "attendance", "No attendance records for " + empCode + ".");
        }
        case GET_PAYROLL -> {
            String empCode = args.requireString(EMP_CODE);
            yield collection(payrollPort.getSlips(empCode, args.optString("month")),
                    "payroll", "No payroll records for " + empCode + ".");
        }
        case GET_COMPANY_STATS -> ToolResult.success(employeePort.getCompanyStats());
        case ADD_EMPLOYEE -> addEmployee(args);
        case UPDATE_EMPLOYEE -> ToolResult.success(employeePort.updateEmployee(
                args.requireString(EMP_CODE), args.without(EMP_CODE)));
        case INITIATE_RESIGNATION -> ToolResult.success(employeePort.initiateResignation(
                args.requireString(EMP_CODE),
                args.requireString("resignation_date"),
                args.requireString("reason")));
        case ASSIGN_ROLE -> assignRole(args);
        case SET_HR_POLICY -> {
            args.requireString("state");
            yield ToolResult.success(hrPolicyPort.setPolicy(args.without(), caller.getId()));
        }
        case GET_HR_POLICY -> ToolResult.success(hrPolicyPort.getActivePolicy());
        case GET_HR_POLICY_HISTORY -> policyHistory(args);
        case COMPUTE_SALARY_BREAKUP -> ToolResult.success(hrPolicyPort.computeSalaryBreakup(
                args.requireNumber("annual_ctc"), args.optString("tax_regime")));
        case SET_EMPLOYEE_TAX_REGIME -> setTaxRegime(args);
        case SUBMIT_UPDATE_REQUEST -> ToolResult.success(updateRequestPort.submit(
                args.requireString(EMP_CODE),
                args.requireObject("fields"),
                args.requireString("reason")));
        case LIST_UPDATE_REQUESTS -> {
            List<Map<String, Object>> requests = updateRequestPort.list(args.optString("status"),
                    args.optString(EMP_CODE));
            yield counted(requests, "update_requests", TOTAL, "No update requests found.");
        }
        case REVIEW_UPDATE_REQUEST -> ToolResult.success(updateRequestPort.review(
                args.requireString("request_id"),
                args.requireString("action"),
                caller.getId(),
                args.optString("comment")));
        case INITIATE_APPRAISAL -> ToolResult.success(appraisalPort.initiate(
                args.requireString(EMP_CODE),
                args.requireString("appraisal_cycle"),
                caller.getId(),
                args.optString("manager_feedback")));
        case COMPLETE_APPRAISAL -> {
            args.requireString(EMP_CODE);
            args.requireString("appraisal_cycle");
            args.requireNumber("rating");
            yield ToolResult.success(appraisalPort.complete(args.without(), caller.getId()));
        }
        case GET_APPRAISAL_HISTORY -> {
            List<Map<String, Object>> appraisals = appraisalPort.history(args.optString(EMP_CODE),
                    args.optInt("limit", 20));
            yield counted(appraisals, "appraisals", TOTAL, "No appraisal records found.");
        }
        };
    }

    /**
     * Identifier of the entity a mutating tool acted on, recorded in the audit
     * log.
     */
    public String auditTarget(HrTool tool, ToolArguments args) {
        return switch (tool) {
        case ASSIGN_ROLE -> args.optString("email");
        case SET_HR_POLICY -> "hr_policy";
        case REVIEW_UPDATE_REQUEST -> args.optString("request_id", "");
        default -> args.optString(EMP_CODE);
        };
    }

    private ToolResult listByDepartment(ToolArguments args) {
        String department = args.requireString("department");
        return collection(employeePort.listByDepartment(department), "employees",
                "No employees in '" + department + "'.");
    }

    private ToolResult listAllEmployees(ToolArguments args) {
        int page = Math.max(1, args.optInt("page", 1));
        int pageSize = Math.max(1, Math.min(args.optInt("page_size", DEFAULT_PAGE_SIZE), MAX_PAGE_SIZE));
        return ToolResult.success(employeePort.listAll(page, pageSize, args.optString("search")));
    }

    private ToolResult addEmployee(ToolArguments args) {
        String empCode = args.requireString(EMP_CODE);
        args.requireString("name");
        args.requireString("email");
        args.requireString("department");
        args.requireString("designation");
        args.requireString("date_of_joining");
        double annualCtc = args.requireNumber("salary");

        Map<String, Object> fields = args.without();
        fields.putIfAbsent("nationality", "Indian");
        ToolResult result = ToolResult.success(employeePort.addEmployee(fields));

        String month = YearMonth.now(clock).toString();
        return result
                .then(new PostAction("Auto-payroll generation", "payroll_warning", payload -> {
                    Map<String, Object> payroll = hrPolicyPort.createPayrollFromCtc(empCode, annualCtc, month);
                    Object slip = payroll.getOrDefault("payroll", Map.of());
                    payload.put("payroll", slip);
                    appendMessage(payload, " Payroll created for " + month + netPaySuffix(slip));
                }))
                .then(new PostAction("Auto-leave-credit", "leave_warning", payload -> {
                    Map<String, Integer> credits = hrPolicyPort.getLeaveCredits();
                    int casual = requireCredit(credits, "casual_leave");
                    int sick = requireCredit(credits, "sick_leave");
                    int earned = requireCredit(credits, "earned_leave");
                    creditLeave(empCode, "casual", casual);
                    creditLeave(empCode, "sick", sick);
                    creditLeave(empCode, "earned", earned);
                    payload.put("leave_credits", credits);
                    appendMessage(payload, " Leave credits: CL=" + casual + ", SL=" + sick + ", EL=" + earned + ".");
                }));
    }

    private void creditLeave(String empCode, String leaveType, int days) {
        leavePort.creditLeave(empCode.toUpperCase(Locale.ROOT), leaveType, days,
                "Annual " + leaveType + " leave credit (" + days + " days) as per HR policy");
    }

    private static int requireCredit(Map<String, Integer> credits, String key) {
        Integer days = credits.get(key);
        if (days == null) {
            throw new IllegalStateException("Leave policy has no value for " + key);
        }
        return days;
    }

    private static String netPaySuffix(Object slip) {
        if (slip instanceof Map<?, ?> slipMap
                && slipMap.get("net_take_home") instanceof Map<?, ?> netTakeHome
                && netTakeHome.get("monthly") != null) {
            return " with net pay " + netTakeHome.get("monthly") + ".";
        }
        return ".";
    }

    private static void appendMessage(Map<String, Object> payload, String suffix) {
        Object current = payload.get(MESSAGE);
        payload.put(MESSAGE, (current != null ? current.toString() : "").concat(suffix).trim());
    }

    private ToolResult assignRole(ToolArguments args) {
        String email = args.requireString("email");
        String roleValue = args.requireString("role");
        Optional<UserRole> role = UserRole.fromValue(roleValue);
        if (role.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid role '" + roleValue + "'. Use super_admin, hr_admin, manager, or employee.");
        }
        if (!userAccountPort.exists(email)) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "User with email '" + email + "' not found.");
        }
        userAccountPort.updateRole(email, role.get());
        return ToolResult.message("Role updated to '" + role.get().getValue() + "' for " + email + ".");
    }

    private ToolResult policyHistory(ToolArguments args) {
        List<Map<String, Object>> history = hrPolicyPort.getPolicyHistory(args.optInt("limit", 10));
        return counted(history, "policy_history", "total_versions",
                "No policy history found. Set an HR policy first.");
    }

    private ToolResult setTaxRegime(ToolArguments args) {
        String empCode = args.requireString(EMP_CODE).toUpperCase(Locale.ROOT);
        String regime = args.requireString("tax_regime").toLowerCase(Locale.ROOT);
        if (!"new".equals(regime) && !"old".equals(regime)) {
            throw new IllegalArgumentException("tax_regime must be 'new' or 'old'.");
        }
        Optional<Map<String, Object>> employee = employeePort.findByEmpCode(empCode);
        if (employee.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Employee " + empCode + " not found.");
        }
        employeePort.updateTaxRegime(empCode, regime);
        Object name = employee.get().getOrDefault("name", empCode);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ToolResult.KEY_SUCCESS, true);
        data.put(MESSAGE, "Tax regime for " + name + " (" + empCode + ") set to '" + regime
                + "'. TDS will be calculated using " + regime + " regime slabs.");
        return ToolResult.success(data);
    }

    private static ToolResult collection(List<Map<String, Object>> items, String key, String emptyMessage) {
        if (items == null || items.isEmpty()) {
            return ToolResult.message(emptyMessage);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, items);
        return ToolResult.success(data);
    }

    private static ToolResult counted(List<Map<String, Object>> items, String key, String countKey,
            String emptyMessage) {
        if (items == null || items.isEmpty()) {
            return ToolResult.message(emptyMessage);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, items);
        data.put(countKey, items.size());
        return ToolResult.success(data);
    }
}
