package com.daquv.agentstream.workflow;

/**
 * 조건부 엣지의 분기 함수. State를 수정하지 않고 판단만 한다.
 */
@FunctionalInterface
public interface RoutingFunction<K extends Enum<K>> {

    K route(AgentState state);
}
