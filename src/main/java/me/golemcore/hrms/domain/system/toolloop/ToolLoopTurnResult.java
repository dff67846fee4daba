package me.golemcore.hrms.domain.system.toolloop;

import java.util.List;

/**
 * Result of a single tool loop turn.
 *
 * @param finalText
 *            model answer, or the fallback message when the round budget ran out
 * @param exhausted
 *            whether the round budget ran out before a final answer
 * @param llmCalls
 *            completion-service requests issued
 * @param toolExecutions
 *            tool calls executed, including denied and failed ones
 * @param wroteData
 *            whether any requested tool is a write tool
 * @param toolsUsed
 *            requested tool names in request order
 */
public record ToolLoopTurnResult(String finalText, boolean exhausted, int llmCalls, int toolExecutions,
        boolean wroteData, List<String> toolsUsed) {
}
