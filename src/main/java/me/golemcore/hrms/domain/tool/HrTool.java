package me.golemcore.hrms.domain.tool;

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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed catalog of tools the model may request. Each constant carries its wire
 * name, the permission a caller needs (or {@code null} for any authenticated
 * caller) and whether it mutates state.
 *
 * <p>
 * Handlers switch over this enum exhaustively, so adding a constant without a
 * handler fails compilation.
 */
public enum HrTool {

    LOOKUP_EMPLOYEE("lookup_employee", Permissions.VIEW_EMPLOYEE, false),
    LIST_EMPLOYEES_BY_DEPARTMENT("list_employees_by_department", Permissions.VIEW_EMPLOYEE, false),
    LIST_ALL_EMPLOYEES("list_all_employees", Permissions.VIEW_ALL_DATA, false),
    GET_LEAVE_RECORDS("get_leave_records", Permissions.VIEW_LEAVE, false),
    APPLY_LEAVE("apply_leave", Permissions.APPLY_LEAVE, true),
    APPROVE_OR_REJECT_LEAVE("approve_or_reject_leave", Permissions.APPROVE_LEAVE, true),
    GET_ATTENDANCE("get_attendance", Permissions.VIEW_ATTENDANCE, false),
    GET_PAYROLL("get_payroll", Permissions.VIEW_PAYROLL, false),
    GET_COMPANY_STATS("get_company_stats", Permissions.VIEW_EMPLOYEE, false),
    ADD_EMPLOYEE("add_employee", Permissions.MANAGE_EMPLOYEE, true),
    UPDATE_EMPLOYEE("update_employee", Permissions.MANAGE_EMPLOYEE, true),
    INITIATE_RESIGNATION("initiate_resignation", Permissions.MANAGE_EMPLOYEE, true),
    ASSIGN_ROLE("assign_role", Permissions.MANAGE_ROLES, true),
    SET_HR_POLICY("set_hr_policy", Permissions.MANAGE_EMPLOYEE, true),
    GET_HR_POLICY("get_hr_policy", Permissions.VIEW_EMPLOYEE, false),
    GET_HR_POLICY_HISTORY("get_hr_policy_history", Permissions.VIEW_EMPLOYEE, false),
    COMPUTE_SALARY_BREAKUP("compute_salary_breakup", Permissions.VIEW_PAYROLL, false),
    // any authenticated user may pick their own regime
    SET_EMPLOYEE_TAX_REGIME("set_employee_tax_regime", Permissions.APPLY_LEAVE, true),
    SUBMIT_UPDATE_REQUEST("submit_update_request", Permissions.APPLY_LEAVE, true),
    LIST_UPDATE_REQUESTS("list_update_requests", Permissions.VIEW_EMPLOYEE, false),
    REVIEW_UPDATE_REQUEST("review_update_request", Permissions.MANAGE_EMPLOYEE, true),
    INITIATE_APPRAISAL("initiate_appraisal", Permissions.MANAGE_EMPLOYEE, true),
    COMPLETE_APPRAISAL("complete_appraisal", Permissions.MANAGE_EMPLOYEE, true),
    GET_APPRAISAL_HISTORY("get_appraisal_history", Permissions.VIEW_EMPLOYEE, false);

    private static final Map<String, HrTool> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(HrTool::getToolName, Function.identity()));

    private final String toolName;
    private final String requiredPermission;
    private final boolean mutating;

    HrTool(String toolName, String requiredPermission, boolean mutating) {
        this.toolName = toolName;
        this.requiredPermission = requiredPermission;
        this.mutating = mutating;
    }

    public String getToolName() {
        return toolName;
    }

    public Optional<String> getRequiredPermission() {
        return Optional.ofNullable(requiredPermission);
    }

    public boolean isMutating() {
        return mutating;
    }

    public static Optional<HrTool> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * Name-based write classification. Unknown names are never writes.
     */
    public static boolean isWriteTool(String name) {
        return fromName(name).map(HrTool::isMutating).orElse(false);
    }

    /**
     * Permission strings referenced by the tool catalog.
     */
    public static final class Permissions {

        public static final String VIEW_EMPLOYEE = "view_employee";
        public static final String VIEW_LEAVE = "view_leave";
        public static final String APPLY_LEAVE = "apply_leave";
        public static final String APPROVE_LEAVE = "approve_leave";
        public static final String VIEW_PAYROLL = "view_payroll";
        public static final String VIEW_ATTENDANCE = "view_attendance";
        public static final String MANAGE_EMPLOYEE = "manage_employee";
        public static final String MANAGE_ROLES = "manage_roles";
        public static final String VIEW_OWN_DATA = "view_own_data";
        public static final String VIEW_ALL_DATA = "view_all_data";

        private Permissions() {
        }
    }
}
