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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.AuditEntry;
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.PostAction;
import me.golemcore.hrms.domain.model.ToolFailureKind;
import me.golemcore.hrms.domain.model.ToolResult;
import me.golemcore.hrms.domain.tool.HrTool;
import me.golemcore.hrms.domain.tool.ToolArguments;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.port.outbound.AuditPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a single tool call on behalf of a caller: permission check, routing
 * to the owning domain service, post-actions and auditing.
 *
 * <p>
 * Never throws for tool-level problems. Every outcome, including denial and
 * unknown names, is returned as a {@link ToolResult}.
 *
 * <p>
 * The primary call runs on the tool executor under the tool timeout and its
 * worker is interrupted when the timeout fires. Post-actions and the audit
 * write run on the calling thread and are bounded only by the HTTP client's
 * connect and read timeouts ({@code hrms.http.*}).
 */
@Service
@Slf4j
public class HrToolDispatcher {

    private final PermissionGate permissionGate;
    private final HrToolHandlers handlers;
    private final AuditPort auditPort;
    private final Executor toolExecutor;
    private final HrmsProperties properties;
    private final Clock clock;

    public HrToolDispatcher(PermissionGate permissionGate, HrToolHandlers handlers, AuditPort auditPort,
            @Qualifier("toolExecutor") Executor toolExecutor, HrmsProperties properties, Clock clock) {
        this.permissionGate = permissionGate;
        this.handlers = handlers;
        this.auditPort = auditPort;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public ToolResult execute(String toolName, Map<String, Object> arguments, CallerIdentity caller) {
        Optional<HrTool> resolved = HrTool.fromName(toolName);
        if (resolved.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", toolName);
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        }
        HrTool tool = resolved.get();

        Optional<ToolResult> denied = permissionGate.check(tool, caller);
        if (denied.isPresent()) {
            return denied.get();
        }

        ToolArguments args = ToolArguments.of(arguments);
        log.info("[Tools] Executing '{}' for session={}", toolName, caller.getSessionId());
        ToolResult result = invoke(tool, args, caller);

        if (!result.hasInternalErrorFlag()) {
            runPostActions(tool, result);
        }
        if (tool.isMutating() && !result.hasInternalErrorFlag()) {
            audit(tool, args, caller);
        }
        return result;
    }

    private ToolResult invoke(HrTool tool, ToolArguments args, CallerIdentity caller) {
        FutureTask<ToolResult> future = new FutureTask<>(() -> handlers.handle(tool, args, caller));
        toolExecutor.execute(future);
        try {
            return future.get(properties.getAgent().getToolTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IllegalArgumentException) {
                log.warn("[Tools] Invalid arguments for '{}': {}", tool.getToolName(), cause.getMessage());
                return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, cause.getMessage());
            }
            log.error("[Tools] Tool execution failed: {}", tool.getToolName(), cause);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, safeCauseMessage(cause));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[Tools] Tool '{}' timed out after {} ms", tool.getToolName(),
                    properties.getAgent().getToolTimeoutMs());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool '" + tool.getToolName() + "' timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted");
        }
    }

    private void runPostActions(HrTool tool, ToolResult result) {
        for (PostAction action : result.getPostActions()) {
            try {
                action.step().apply(result.getData());
            } catch (RuntimeException e) {
                log.warn("[Tools] {} failed after '{}': {}", action.name(), tool.getToolName(),
                        safeCauseMessage(e));
                result.getData().put(action.warningKey(), action.name() + " failed: " + safeCauseMessage(e));
            }
        }
    }

    private void audit(HrTool tool, ToolArguments args, CallerIdentity caller) {
        AuditEntry entry = AuditEntry.builder()
                .action(tool.getToolName())
                .performedBy(caller.getId())
                .target(handlers.auditTarget(tool, args))
                .details(args.snapshot())
                .timestamp(clock.instant())
                .build();
        try {
            auditPort.record(entry);
        } catch (RuntimeException e) {
            log.warn("[Tools] Audit write failed for '{}': {}", tool.getToolName(), safeCauseMessage(e));
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
