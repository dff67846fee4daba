package me.golemcore.hrms.domain.system.toolloop;

import me.golemcore.hrms.domain.exception.UpstreamServiceException;
import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.LlmRequest;
import me.golemcore.hrms.domain.model.LlmResponse;
import me.golemcore.hrms.domain.model.Message;
import me.golemcore.hrms.domain.model.ToolFailureKind;
import me.golemcore.hrms.domain.tool.HrTool;
import me.golemcore.hrms.domain.tool.HrToolCatalog;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import me.golemcore.hrms.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * Each round sends the whole transcript with the full tool schema. Tool calls
 * are answered with exactly one tool message per call id, in request order.
 * The loop stops on the first answer without tool calls or once the round
 * budget is spent, in which case the configured fallback text is returned.
 *
 * <p>
 * Completion-service failures are not recovered here; they surface as
 * {@link UpstreamServiceException}.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HrToolCatalog toolCatalog;
    private final HrmsProperties properties;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HrToolCatalog toolCatalog,
            HrmsProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.toolCatalog = toolCatalog;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ToolLoopTurnResult processTurn(List<Message> transcript, CallerIdentity caller) {
        HrmsProperties.AgentProperties settings = properties.getAgent();
        int maxRounds = settings.getMaxToolRounds();

        int llmCalls = 0;
        int toolExecutions = 0;
        boolean wroteData = false;
        List<String> toolsUsed = new ArrayList<>();

        while (llmCalls < maxRounds) {
            // 1) LLM call
            LlmResponse response = call(buildRequest(transcript, caller));
            llmCalls++;

            // 2) Final answer (no tool calls)
            if (response == null || !response.hasToolCalls()) {
                String text = response != null && response.getContent() != null ? response.getContent() : "";
                return new ToolLoopTurnResult(text, false, llmCalls, toolExecutions, wroteData, toolsUsed);
            }

            // 3) Append assistant message with tool calls
            transcript.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .toolCalls(response.getToolCalls())
                    .timestamp(clock.instant())
                    .build());

            // 4) Execute tools and append results
            for (Message.ToolCall tc : response.getToolCalls()) {
                toolsUsed.add(tc.getName());
                // requested intent counts, not the outcome
                wroteData |= HrTool.isWriteTool(tc.getName());

                ToolExecutionOutcome outcome;
                try {
                    outcome = toolExecutor.execute(caller, tc);
                } catch (RuntimeException e) {
                    log.error("[Tools] Executor failed for '{}'", tc.getName(), e);
                    outcome = ToolExecutionOutcome.synthetic(tc, ToolFailureKind.EXECUTION_FAILED,
                            "Tool execution failed: " + e.getMessage());
                }
                toolExecutions++;

                transcript.add(Message.builder()
                        .role(Message.ROLE_TOOL)
                        .toolCallId(tc.getId())
                        .toolName(tc.getName())
                        .content(outcome.messageContent())
                        .timestamp(clock.instant())
                        .build());
            }
        }

        log.warn("[Agent] Round budget exhausted after {} LLM calls (session={})", llmCalls, caller.getSessionId());
        return new ToolLoopTurnResult(settings.getFallbackMessage(), true, llmCalls, toolExecutions, wroteData,
                toolsUsed);
    }

    private LlmRequest buildRequest(List<Message> transcript, CallerIdentity caller) {
        return LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .messages(new ArrayList<>(transcript))
                .tools(toolCatalog.getDefinitions())
                .toolChoice(LlmRequest.TOOL_CHOICE_AUTO)
                .temperature(properties.getLlm().getTemperature())
                .sessionId(caller.getSessionId())
                .build();
    }

    private LlmResponse call(LlmRequest request) {
        long timeoutMs = properties.getAgent().getLlmTimeoutMs();
        try {
            return llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new UpstreamServiceException("Completion service failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new UpstreamServiceException("Completion service timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamServiceException("Interrupted while waiting for completion service", e);
        } catch (RuntimeException e) {
            throw new UpstreamServiceException("Completion service failed: " + e.getMessage(), e);
        }
    }
}
