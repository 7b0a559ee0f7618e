package com.daquv.agentstream.workflow.node;

import com.daquv.agentstream.config.WorkflowProperties;
import com.daquv.agentstream.workflow.AgentState;
import com.daquv.agentstream.workflow.StateKey;
import com.daquv.agentstream.workflow.StateUpdate;
import com.daquv.agentstream.workflow.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * 복잡한 작업 실행을 시뮬레이션하고 임시 답변을 남긴다.
 */
@Slf4j
@Component
public class ExecuteNode implements WorkflowNode {

    public static final String ID = "execute";

    static final String PROVISIONAL_ANSWER_TEMPLATE =
            "the simulation of the requested task ('%s') finished successfully after 3 seconds of computation";

    private final Duration delay;

    public ExecuteNode(WorkflowProperties workflowProperties) {
        this.delay = workflowProperties.getExecuteDelay();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<StateKey> writes() {
        return EnumSet.of(StateKey.EXECUTION_COMPLETE, StateKey.FINAL_ANSWER);
    }

    @Override
    public StateUpdate execute(AgentState state) throws InterruptedException {
        log.info("작업 시뮬레이션 시작 ({}ms)", delay.toMillis());
        Thread.sleep(delay.toMillis());

        return StateUpdate.builder()
                .executionComplete(true)
                .finalAnswer(String.format(PROVISIONAL_ANSWER_TEMPLATE, state.getUserMessage()))
                .build();
    }
}
