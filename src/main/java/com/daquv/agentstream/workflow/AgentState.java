package com.daquv.agentstream.workflow;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 워크플로우 실행 1회가 소유하는 State
 * 불변 객체이며, 노드 업데이트는 {@link #merge(StateUpdate)}로 새 State를 만든다.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
public final class AgentState {

    private final String userMessage;

    @Builder.Default
    private final PlanNeeded planNeeded = PlanNeeded.UNSET;

    private final boolean executionComplete;

    private final String finalAnswer;

    public static AgentState initial(String userMessage) {
        if (userMessage == null) {
            throw new IllegalArgumentException("userMessage는 null일 수 없습니다.");
        }
        return AgentState.builder()
                .userMessage(userMessage)
                .build();
    }

    public boolean hasFinalAnswer() {
        return finalAnswer != null;
    }

    /**
     * 업데이트에 포함된 키만 덮어쓴 새 State 반환
     */
    public AgentState merge(StateUpdate update) {
        if (update == null || update.isEmpty()) {
            return this;
        }

        AgentStateBuilder builder = toBuilder();
        for (StateKey key : update.keys()) {
            switch (key) {
                case PLAN_NEEDED:
                    builder.planNeeded(update.getPlanNeeded());
                    break;
                case EXECUTION_COMPLETE:
                    builder.executionComplete(update.getExecutionComplete());
                    break;
                case FINAL_ANSWER:
                    builder.finalAnswer(update.getFinalAnswer());
                    break;
                default:
                    throw new IllegalArgumentException("알 수 없는 State 키: " + key);
            }
        }
        return builder.build();
    }
}
