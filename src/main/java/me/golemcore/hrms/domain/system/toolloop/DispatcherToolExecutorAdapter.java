package me.golemcore.hrms.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.domain.model.ToolResult;
import me.golemcore.hrms.domain.service.HrToolDispatcher;

/**
 * Bridges the tool loop to {@link HrToolDispatcher} and serializes the result
 * into the tool message body.
 */
public class DispatcherToolExecutorAdapter implements ToolExecutorPort {

    private final HrToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public DispatcherToolExecutorAdapter(HrToolDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolExecutionOutcome execute(CallerIdentity caller, Message.ToolCall toolCall) {
        ToolResult result = dispatcher.execute(toolCall.getName(), toolCall.getArguments(), caller);
        String content;
        try {
            content = objectMapper.writeValueAsString(result.toPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result of " + toolCall.getName(), e);
        }
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content, false);
    }
}
