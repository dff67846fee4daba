package me.golemcore.hrms.adapter.outbound.security;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.UserRole;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.port.outbound.AuthorizationPort;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static me.golemcore.hrms.domain.tool.HrTool.Permissions.APPLY_LEAVE;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.APPROVE_LEAVE;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.MANAGE_EMPLOYEE;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.MANAGE_ROLES;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.VIEW_ALL_DATA;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.VIEW_ATTENDANCE;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.VIEW_EMPLOYEE;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.VIEW_LEAVE;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.VIEW_OWN_DATA;
import static me.golemcore.hrms.domain.tool.HrTool.Permissions.VIEW_PAYROLL;

/**
 * Role grants from {@code hrms.security.role-permissions}, falling back to the
 * built-in matrix for roles that are not overridden.
 */
@Component
@Slf4j
public class ConfiguredRolePermissionsAdapter implements AuthorizationPort {

    private static final Map<UserRole, Set<String>> DEFAULT_GRANTS = defaultGrants();

    private final Map<UserRole, Set<String>> grants = new EnumMap<>(UserRole.class);

    public ConfiguredRolePermissionsAdapter(HrmsProperties properties) {
        grants.putAll(DEFAULT_GRANTS);
        Map<String, List<String>> overrides = properties.getSecurity().getRolePermissions();
        if (overrides == null) {
            return;
        }
        for (Map.Entry<String, List<String>> entry : overrides.entrySet()) {
            Optional<UserRole> role = UserRole.fromValue(entry.getKey());
            if (role.isEmpty()) {
                throw new IllegalStateException("Unknown role in hrms.security.role-permissions: " + entry.getKey());
            }
            Set<String> permissions = entry.getValue() != null ? Set.copyOf(entry.getValue()) : Set.of();
            grants.put(role.get(), permissions);
            log.info("[Tools] Role '{}' permissions overridden: {}", entry.getKey(), permissions);
        }
    }

    @Override
    public Set<String> getPermissions(UserRole role) {
        if (role == null) {
            return Set.of();
        }
        return grants.getOrDefault(role, Set.of());
    }

    private static Map<UserRole, Set<String>> defaultGrants() {
        Set<String> superAdmin = Set.of(VIEW_EMPLOYEE, VIEW_LEAVE, APPLY_LEAVE, APPROVE_LEAVE, VIEW_PAYROLL,
                VIEW_ATTENDANCE, MANAGE_EMPLOYEE, MANAGE_ROLES, VIEW_OWN_DATA, VIEW_ALL_DATA);
        Set<String> hrAdmin = new HashSet<>(superAdmin);
        hrAdmin.remove(MANAGE_ROLES);

        Map<UserRole, Set<String>> defaults = new EnumMap<>(UserRole.class);
        defaults.put(UserRole.SUPER_ADMIN, superAdmin);
        defaults.put(UserRole.HR_ADMIN, Set.copyOf(hrAdmin));
        defaults.put(UserRole.MANAGER, Set.of(VIEW_EMPLOYEE, VIEW_LEAVE, APPLY_LEAVE, APPROVE_LEAVE,
                VIEW_PAYROLL, VIEW_ATTENDANCE, VIEW_OWN_DATA));
        defaults.put(UserRole.EMPLOYEE, Set.of(VIEW_EMPLOYEE, VIEW_LEAVE, APPLY_LEAVE, VIEW_ATTENDANCE,
                VIEW_PAYROLL, VIEW_OWN_DATA));
        return defaults;
    }
}
