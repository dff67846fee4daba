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

import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.UserRole;
import org.springframework.stereotype.Service;

/**
 * Builds the role-aware system message prepended to every model request. The
 * prompt is synthesized per turn and never stored in session history.
 */
@Service
public class SystemPromptService {

    private static final String NOT_LINKED = "not linked";

    public String buildPrompt(CallerIdentity caller) {
        String role = caller.getRole() != null ? caller.getRole().getValue() : "unknown";
        String empCode = caller.getEmpCode() != null && !caller.getEmpCode().isBlank()
                ? caller.getEmpCode()
                : NOT_LINKED;
        String name = caller.getName() != null ? caller.getName() : caller.getId();

        StringBuilder sb = new StringBuilder();
        sb.append("You are the HR assistant of the company's HR management system.\n\n");
        sb.append("Current user: ").append(name).append(" (id ").append(caller.getId()).append(")\n");
        sb.append("Role: ").append(role).append('\n');
        sb.append("Employee code: ").append(empCode).append("\n\n");

        sb.append("""
                You can look up employees, leave, attendance, payroll and company statistics, \
                manage employees and resignations, maintain the HR policy, compute salary breakups, \
                handle profile update requests and run performance appraisals. \
                Always call a tool to fetch real data. Never guess employee details.

                """);

        sb.append("Access rules for role \"").append(role).append("\":\n");
        sb.append(accessRules(caller.getRole())).append('\n');

        sb.append("When the user says \"my\" (my payroll, my leaves, my attendance, my details), use emp_code \"")
                .append(empCode).append("\".\n");
        sb.append("""
                For payroll, only pass a month when the user names one explicitly.
                Employee listings are paginated (10 per page, at most 25); always report the page and total.
                If a tool returns an error, explain it plainly. If an action needs a higher role, \
                say which role is needed.

                Formatting: present policies, salary breakups, tax slabs and listings as markdown tables; \
                format money with the rupee symbol. Be concise and professional.
                """);
        return sb.toString();
    }

    private static String accessRules(UserRole role) {
        if (role == null) {
            return "- No permissions. Answer general questions only.";
        }
        return switch (role) {
        case EMPLOYEE -> "- May only view and act on their own records. Never reveal other employees' "
                + "salary or payroll.";
        case MANAGER -> "- May view team data and approve or reject leave.";
        case HR_ADMIN -> "- May manage employees, approve leave, view all employee data, manage resignations "
                + "and set the HR policy.";
        case SUPER_ADMIN -> "- Full access, including role assignment.";
        };
    }
}
