package me.golemcore.hrms.domain.system.toolloop;

import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.Message;

/**
 * Port for executing a single tool call inside the tool loop.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(CallerIdentity caller, Message.ToolCall toolCall);
}
