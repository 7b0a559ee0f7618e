package com.daquv.agentstream.workflow.exception;

/**
 * 에러 코드 열거형
 */
public enum ErrorCode {
    // Graph definition errors
    GRAPH_VALIDATION("GRAPH_001"),
    ROUTING("GRAPH_002"),

    // Run errors
    NODE_EXECUTION("RUN_001"),
    STEP_LIMIT("RUN_002"),
    CANCELLED("RUN_003"),

    // Input errors
    EMPTY_PROMPT("INPUT_001"),

    // System errors
    UNKNOWN_ERROR("SYS_999");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
