package com.daquv.agentstream.workflow.exception;

public class RoutingException extends WorkflowException {

    private final String nodeId;

    public RoutingException(String nodeId, String message) {
        super(ErrorCode.ROUTING, message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
