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

import feign.Headers;
import feign.Param;
import feign.RequestLine;

import java.util.List;
import java.util.Map;

/**
 * Declarative REST client for the HR domain services. Query parameters bound
 * to {@code null} are omitted from the request.
 */
@Headers("Content-Type: application/json")
public interface HrBackendApi {

    // ==================== Employees ====================

    @RequestLine("GET /employees/lookup?query={query}")
    Map<String, Object> lookupEmployee(@Param("query") String query);

    @RequestLine("GET /employees?department={department}")
    List<Map<String, Object>> listByDepartment(@Param("department") String department);

    @RequestLine("GET /employees/page?page={page}&page_size={pageSize}&search={search}")
    Map<String, Object> listEmployees(@Param("page") int page, @Param("pageSize") int pageSize,
            @Param("search") String search);

    @RequestLine("GET /employees/stats")
    Map<String, Object> companyStats();

    @RequestLine("GET /employees/{empCode}")
    Map<String, Object> getEmployee(@Param("empCode") String empCode);

    @RequestLine("POST /employees")
    Map<String, Object> addEmployee(Map<String, Object> fields);

    @RequestLine("PATCH /employees/{empCode}")
    Map<String, Object> updateEmployee(@Param("empCode") String empCode, Map<String, Object> updates);

    @RequestLine("POST /employees/{empCode}/resignation")
    Map<String, Object> initiateResignation(@Param("empCode") String empCode, Map<String, Object> body);

    @RequestLine("PUT /employees/{empCode}/tax-regime")
    void updateTaxRegime(@Param("empCode") String empCode, Map<String, Object> body);

    // ==================== Leave / attendance / payroll ====================

    @RequestLine("GET /leaves?emp_code={empCode}&status={status}")
    List<Map<String, Object>> leaveRecords(@Param("empCode") String empCode, @Param("status") String status);

    @RequestLine("POST /leaves")
    Map<String, Object> applyLeave(Map<String, Object> body);

    @RequestLine("POST /leaves/decision")
    Map<String, Object> decideLeave(Map<String, Object> body);

    @RequestLine("POST /leaves/credits")
    void creditLeave(Map<String, Object> body);

    @RequestLine("GET /attendance?emp_code={empCode}&date={date}")
    List<Map<String, Object>> attendance(@Param("empCode") String empCode, @Param("date") String date);

    @RequestLine("GET /payroll?emp_code={empCode}&month={month}")
    List<Map<String, Object>> payroll(@Param("empCode") String empCode, @Param("month") String month);

    // ==================== HR policy ====================

    @RequestLine("PUT /hr-policy")
    Map<String, Object> setPolicy(Map<String, Object> body);

    @RequestLine("GET /hr-policy")
    Map<String, Object> activePolicy();

    @RequestLine("GET /hr-policy/history?limit={limit}")
    List<Map<String, Object>> policyHistory(@Param("limit") int limit);

    @RequestLine("GET /hr-policy/salary-breakup?annual_ctc={annualCtc}&tax_regime={taxRegime}")
    Map<String, Object> salaryBreakup(@Param("annualCtc") double annualCtc, @Param("taxRegime") String taxRegime);

    @RequestLine("POST /payroll/from-ctc")
    Map<String, Object> createPayrollFromCtc(Map<String, Object> body);

    @RequestLine("GET /hr-policy/leave-credits")
    Map<String, Integer> leaveCredits();

    // ==================== Update requests / appraisals ====================

    @RequestLine("POST /update-requests")
    Map<String, Object> submitUpdateRequest(Map<String, Object> body);

    @RequestLine("GET /update-requests?status={status}&emp_code={empCode}")
    List<Map<String, Object>> listUpdateRequests(@Param("status") String status, @Param("empCode") String empCode);

    @RequestLine("POST /update-requests/{requestId}/review")
    Map<String, Object> reviewUpdateRequest(@Param("requestId") String requestId, Map<String, Object> body);

    @RequestLine("POST /appraisals")
    Map<String, Object> initiateAppraisal(Map<String, Object> body);

    @RequestLine("POST /appraisals/complete")
    Map<String, Object> completeAppraisal(Map<String, Object> body);

    @RequestLine("GET /appraisals?emp_code={empCode}&limit={limit}")
    List<Map<String, Object>> appraisals(@Param("empCode") String empCode, @Param("limit") int limit);

    // ==================== Users / audit ====================

    @RequestLine("GET /users/{email}")
    Map<String, Object> getUser(@Param("email") String email);

    @RequestLine("PUT /users/{email}/role")
    void updateRole(@Param("email") String email, Map<String, Object> body);

    @RequestLine("POST /audit-logs")
    void recordAudit(Map<String, Object> body);
}
