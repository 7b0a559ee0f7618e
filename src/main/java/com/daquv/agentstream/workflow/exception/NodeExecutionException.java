package com.daquv.agentstream.workflow.exception;

/**
 * 노드 실행 실패 (예외, 타임아웃, 선언하지 않은 State 키 쓰기). 해당 실행만 중단된다.
 */
public class NodeExecutionException extends WorkflowException {

    private final String nodeId;

    public NodeExecutionException(String nodeId, String message) {
        super(ErrorCode.NODE_EXECUTION, message);
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(ErrorCode.NODE_EXECUTION, message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
