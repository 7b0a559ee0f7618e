package com.daquv.agentstream.workflow;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 노드 한 개가 완료된 결과 (nodeId, 부분 업데이트, 병합 후 State)
 */
@Getter
@ToString
@RequiredArgsConstructor
public class NodeStep {
    private final String nodeId;
    private final StateUpdate update;
    private final AgentState stateAfter;
}
