package me.golemcore.hrms.adapter.outbound.hr;

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

import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.AuditEntry;
import me.golemcore.hrms.domain.model.UserRole;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.infrastructure.http.FeignClientFactory;
import me.golemcore.hrms.port.outbound.AppraisalPort;
import me.golemcore.hrms.port.outbound.AttendancePort;
import me.golemcore.hrms.port.outbound.AuditPort;
import me.golemcore.hrms.port.outbound.EmployeePort;
import me.golemcore.hrms.port.outbound.HrPolicyPort;
import me.golemcore.hrms.port.outbound.LeavePort;
import me.golemcore.hrms.port.outbound.PayrollPort;
import me.golemcore.hrms.port.outbound.UpdateRequestPort;
import me.golemcore.hrms.port.outbound.UserAccountPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HR domain services reached over HTTP at {@code hrms.backend.base-url}.
 *
 * <p>
 * Transport errors propagate as {@link FeignException}; the tool dispatcher
 * turns them into error results. A 404 on single-record reads means "absent".
 */
@Component
@Slf4j
public class HrBackendAdapter implements EmployeePort, LeavePort, AttendancePort, PayrollPort, HrPolicyPort,
        UpdateRequestPort, AppraisalPort, UserAccountPort, AuditPort {

    private final HrBackendApi api;

    public HrBackendAdapter(FeignClientFactory feignClientFactory, HrmsProperties properties) {
        this(createApi(feignClientFactory, properties.getBackend()));
        log.info("[Tools] HR backend at {}", properties.getBackend().getBaseUrl());
    }

    HrBackendAdapter(HrBackendApi api) {
        this.api = api;
    }

    private static HrBackendApi createApi(FeignClientFactory factory, HrmsProperties.BackendProperties backend) {
        String token = backend.getApiToken();
        if (token == null || token.isBlank()) {
            return factory.create(HrBackendApi.class, backend.getBaseUrl());
        }
        return factory.create(HrBackendApi.class, backend.getBaseUrl(), FeignClientFactory.bearerToken(token));
    }

    // ==================== EmployeePort ====================

    @Override
    public Map<String, Object> lookup(String query) {
        return api.lookupEmployee(query);
    }

    @Override
    public List<Map<String, Object>> listByDepartment(String department) {
        return api.listByDepartment(department);
    }

    @Override
    public Map<String, Object> listAll(int page, int pageSize, String search) {
        return api.listEmployees(page, pageSize, search);
    }

    @Override
    public Map<String, Object> getCompanyStats() {
        return api.companyStats();
    }

    @Override
    public Optional<Map<String, Object>> findByEmpCode(String empCode) {
        try {
            return Optional.ofNullable(api.getEmployee(empCode));
        } catch (FeignException.NotFound e) {
            return Optional.empty();
        }
    }

    @Override
    public Map<String, Object> addEmployee(Map<String, Object> fields) {
        return api.addEmployee(fields);
    }

    @Override
    public Map<String, Object> updateEmployee(String empCode, Map<String, Object> updates) {
        return api.updateEmployee(empCode, updates);
    }

    @Override
    public Map<String, Object> initiateResignation(String empCode, String resignationDate, String reason) {
        return api.initiateResignation(empCode, body(
                "resignation_date", resignationDate,
                "reason", reason));
    }

    @Override
    public void updateTaxRegime(String empCode, String taxRegime) {
        api.updateTaxRegime(empCode, body("tax_regime", taxRegime));
    }

    // ==================== LeavePort ====================

    @Override
    public List<Map<String, Object>> getLeaveRecords(String empCode, String status) {
        return api.leaveRecords(empCode, status);
    }

    @Override
    public Map<String, Object> applyLeave(String empCode, String leaveType, String startDate, String endDate,
            String reason) {
        return api.applyLeave(body(
                "emp_code", empCode,
                "leave_type", leaveType,
                "start_date", startDate,
                "end_date", endDate,
                "reason", reason));
    }

    @Override
    public Map<String, Object> approveOrReject(String empCode, String startDate, String action, String approvedBy) {
        return api.decideLeave(body(
                "emp_code", empCode,
                "start_date", startDate,
                "action", action,
                "approved_by", approvedBy));
    }

    @Override
    public void creditLeave(String empCode, String leaveType, int days, String reason) {
        api.creditLeave(body(
                "emp_code", empCode,
                "leave_type", leaveType,
                "days", days,
                "reason", reason));
    }

    // ==================== AttendancePort / PayrollPort ====================

    @Override
    public List<Map<String, Object>> getAttendance(String empCode, String date) {
        return api.attendance(empCode, date);
    }

    @Override
    public List<Map<String, Object>> getSlips(String empCode, String month) {
        return api.payroll(empCode, month);
    }

    // ==================== HrPolicyPort ====================

    @Override
    public Map<String, Object> setPolicy(Map<String, Object> fields, String createdBy) {
        Map<String, Object> request = new LinkedHashMap<>(fields);
        request.put("created_by", createdBy);
        return api.setPolicy(request);
    }

    @Override
    public Map<String, Object> getActivePolicy() {
        return api.activePolicy();
    }

    @Override
    public List<Map<String, Object>> getPolicyHistory(int limit) {
        return api.policyHistory(limit);
    }

    @Override
    public Map<String, Object> computeSalaryBreakup(double annualCtc, String taxRegime) {
        return api.salaryBreakup(annualCtc, taxRegime);
    }

    @Override
    public Map<String, Object> createPayrollFromCtc(String empCode, double annualCtc, String month) {
        return api.createPayrollFromCtc(body(
                "emp_code", empCode,
                "annual_ctc", annualCtc,
                "month", month));
    }

    @Override
    public Map<String, Integer> getLeaveCredits() {
        return api.leaveCredits();
    }

    // ==================== UpdateRequestPort ====================

    @Override
    public Map<String, Object> submit(String empCode, Map<String, Object> fields, String reason) {
        return api.submitUpdateRequest(body(
                "emp_code", empCode,
                "fields", fields,
                "reason", reason));
    }

    @Override
    public List<Map<String, Object>> list(String status, String empCode) {
        return api.listUpdateRequests(status, empCode);
    }

    @Override
    public Map<String, Object> review(String requestId, String action, String reviewerId, String comment) {
        return api.reviewUpdateRequest(requestId, body(
                "action", action,
                "reviewer_id", reviewerId,
                "comment", comment));
    }

    // ==================== AppraisalPort ====================

    @Override
    public Map<String, Object> initiate(String empCode, String appraisalCycle, String initiatedBy,
            String managerFeedback) {
        return api.initiateAppraisal(body(
                "emp_code", empCode,
                "appraisal_cycle", appraisalCycle,
                "initiated_by", initiatedBy,
                "manager_feedback", managerFeedback));
    }

    @Override
    public Map<String, Object> complete(Map<String, Object> fields, String completedBy) {
        Map<String, Object> request = new LinkedHashMap<>(fields);
        request.put("completed_by", completedBy);
        return api.completeAppraisal(request);
    }

    @Override
    public List<Map<String, Object>> history(String empCode, int limit) {
        return api.appraisals(empCode, limit);
    }

    // ==================== UserAccountPort ====================

    @Override
    public boolean exists(String email) {
        try {
            return api.getUser(email) != null;
        } catch (FeignException.NotFound e) {
            return false;
        }
    }

    @Override
    public void updateRole(String email, UserRole role) {
        api.updateRole(email, body("role", role.getValue()));
    }

    // ==================== AuditPort ====================

    @Override
    public void record(AuditEntry entry) {
        api.recordAudit(body(
                "action", entry.getAction(),
                "performed_by", entry.getPerformedBy(),
                "target", entry.getTarget(),
                "details", entry.getDetails(),
                "timestamp", entry.getTimestamp() != null ? entry.getTimestamp().toString() : null));
    }

    private static Map<String, Object> body(Object... keyValues) {
        Map<String, Object> body = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                body.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return body;
    }
}
