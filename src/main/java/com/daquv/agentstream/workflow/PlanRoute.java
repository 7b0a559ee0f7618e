package com.daquv.agentstream.workflow;

/**
 * plan 노드 이후 조건부 엣지의 분기 결과
 */
public enum PlanRoute {
    /** 복잡한 실행이 필요함 -> execute */
    PLAN_NEEDED,
    /** 바로 응답 -> check_result */
    DIRECT_ANSWER
}
