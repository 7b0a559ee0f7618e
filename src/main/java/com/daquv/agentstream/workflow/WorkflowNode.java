package com.daquv.agentstream.workflow;

import java.util.Set;

/**
 * State를 받아 부분 업데이트를 반환하는 워크플로우 노드 인터페이스
 */
public interface WorkflowNode {

    /**
     * 현재 State를 읽고 부분 업데이트 반환 (지연/외부 작업 동안 블로킹될 수 있음)
     *
     * @throws InterruptedException 실행이 취소되어 인터럽트된 경우
     */
    StateUpdate execute(AgentState state) throws InterruptedException;

    /**
     * 노드 ID 반환
     */
    String getId();

    /**
     * 이 노드가 쓸 수 있는 State 키
     */
    Set<StateKey> writes();
}
