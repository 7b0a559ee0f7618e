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
 * 실행 결과를 확인하고 클라이언트에 보여줄 최종 답변을 만든다.
 */
@Slf4j
@Component
public class CheckResultNode implements WorkflowNode {

    public static final String ID = "check_result";

    static final String TASK_COMPLETE_TEMPLATE = "Task complete: %s. The agent has finished its work cycle.";

    static final String QUICK_RESPONSE_TEMPLATE =
            "Quick response: no complex execution was required for: '%s'. Process finished.";

    private final Duration delay;

    public CheckResultNode(WorkflowProperties workflowProperties) {
        this.delay = workflowProperties.getCheckDelay();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<StateKey> writes() {
        return EnumSet.of(StateKey.FINAL_ANSWER);
    }

    @Override
    public StateUpdate execute(AgentState state) throws InterruptedException {
        Thread.sleep(delay.toMillis());

        String finalAnswer;
        if (state.isExecutionComplete()) {
            finalAnswer = String.format(TASK_COMPLETE_TEMPLATE,
                    state.hasFinalAnswer() ? state.getFinalAnswer() : "");
        } else {
            finalAnswer = String.format(QUICK_RESPONSE_TEMPLATE, state.getUserMessage());
        }

        log.info("최종 답변 생성: {}...", finalAnswer.length() > 100 ? finalAnswer.substring(0, 100) : finalAnswer);
        return StateUpdate.builder()
                .finalAnswer(finalAnswer)
                .build();
    }
}
