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
import me.golemcore.hrms.domain.model.ToolFailureKind;
import me.golemcore.hrms.domain.model.ToolResult;
import me.golemcore.hrms.domain.tool.HrTool;
import me.golemcore.hrms.port.outbound.AuthorizationPort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Checks the permission a tool requires against the caller's granted set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PermissionGate {

    private final AuthorizationPort authorizationPort;

    /**
     * @return a {@code PERMISSION_DENIED} result when the caller lacks the
     *         required permission, empty when the call may proceed
     */
    public Optional<ToolResult> check(HrTool tool, CallerIdentity caller) {
        Optional<String> required = tool.getRequiredPermission();
        if (required.isEmpty()) {
            return Optional.empty();
        }
        String permission = required.get();
        Set<String> granted = caller.getRole() != null ? authorizationPort.getPermissions(caller.getRole()) : Set.of();
        if (granted.contains(permission)) {
            return Optional.empty();
        }
        String role = caller.getRole() != null ? caller.getRole().getValue() : "unknown";
        log.warn("[Tools] Denied '{}' for caller={} role={} (missing {})",
                tool.getToolName(), caller.getId(), role, permission);
        return Optional.of(ToolResult.failure(ToolFailureKind.PERMISSION_DENIED,
                "Access denied. Your role '" + role + "' does not have '" + permission + "' permission."));
    }
}
