package com.daquv.agentstream.workflow.exception;

public class RunCancelledException extends WorkflowException {

    public RunCancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }
}
