package com.daquv.agentstream.workflow.exception;

import java.util.List;

/**
 * 그래프 정의가 잘못된 경우. 기동 시점에 한 번 검출되며 애플리케이션 기동을 중단시킨다.
 */
public class GraphValidationException extends WorkflowException {

    private final List<String> violations;

    public GraphValidationException(List<String> violations) {
        super(ErrorCode.GRAPH_VALIDATION, "그래프 검증 실패: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
