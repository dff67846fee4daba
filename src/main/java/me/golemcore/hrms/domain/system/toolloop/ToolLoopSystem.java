package me.golemcore.hrms.domain.system.toolloop;

import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.Message;

import java.util.List;

/**
 * Runs the bounded model/tool cycle for one turn.
 */
public interface ToolLoopSystem {

    /**
     * @param transcript
     *            outbound messages, system message first; extended in place with
     *            assistant tool-call and tool-result messages
     * @param caller
     *            identity used for permission checks
     */
    ToolLoopTurnResult processTurn(List<Message> transcript, CallerIdentity caller);
}
