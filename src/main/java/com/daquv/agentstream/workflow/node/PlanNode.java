package com.daquv.agentstream.workflow.node;

import com.daquv.agentstream.config.WorkflowProperties;
import com.daquv.agentstream.workflow.AgentState;
import com.daquv.agentstream.workflow.PlanNeeded;
import com.daquv.agentstream.workflow.StateKey;
import com.daquv.agentstream.workflow.StateUpdate;
import com.daquv.agentstream.workflow.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 사용자 메시지에 실행 키워드가 있는지 보고 실행 계획 필요 여부를 결정한다.
 */
@Slf4j
@Component
public class PlanNode implements WorkflowNode {

    public static final String ID = "plan";

    private final List<String> keywords;
    private final Duration delay;

    public PlanNode(WorkflowProperties workflowProperties) {
        this.keywords = workflowProperties.getPlanKeywords().stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.delay = workflowProperties.getPlanDelay();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<StateKey> writes() {
        return EnumSet.of(StateKey.PLAN_NEEDED);
    }

    @Override
    public StateUpdate execute(AgentState state) throws InterruptedException {
        // LLM 판단 시간 시뮬레이션
        Thread.sleep(delay.toMillis());

        String message = state.getUserMessage().toLowerCase(Locale.ROOT);
        PlanNeeded planNeeded = keywords.stream().anyMatch(message::contains) ? PlanNeeded.YES : PlanNeeded.NO;

        log.info("계획 필요 여부: {} - userMessage: {}", planNeeded, state.getUserMessage());
        return StateUpdate.builder()
                .planNeeded(planNeeded)
                .build();
    }
}
