package com.daquv.agentstream.workflow.exception;

/**
 * 워크플로우 정의/실행 중 발생하는 예외의 공통 부모
 */
public class WorkflowException extends RuntimeException {

    private final ErrorCode errorCode;

    public WorkflowException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WorkflowException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
