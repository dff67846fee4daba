package me.golemcore.hrms.domain.system.toolloop;

import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.domain.model.ToolFailureKind;
import me.golemcore.hrms.domain.model.ToolResult;

/**
 * Result of executing a single tool call, keyed by the originating call id.
 *
 * @param messageContent
 *            JSON body of the tool message sent back to the model
 * @param synthetic
 *            true when produced by the loop itself rather than the executor
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        String escaped = reason == null ? "" : reason.replace("\\", "\\\\").replace("\"", "\\\"");
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                "{\"error\":\"" + escaped + "\"}", true);
    }
}
