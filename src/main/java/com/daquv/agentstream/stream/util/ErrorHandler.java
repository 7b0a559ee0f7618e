package com.daquv.agentstream.stream.util;

import com.daquv.agentstream.workflow.exception.ErrorCode;
import com.daquv.agentstream.workflow.exception.NodeExecutionException;
import com.daquv.agentstream.workflow.exception.RoutingException;
import com.daquv.agentstream.workflow.exception.WorkflowException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * 실행 중 발생한 예외를 스트림 에러 이벤트 문구로 변환하는 유틸리티 클래스
 */
@Slf4j
public class ErrorHandler {

    // 클라이언트에 표시할 메시지
    private static final Map<ErrorCode, String> USER_MESSAGES = new EnumMap<>(ErrorCode.class);

    static {
        USER_MESSAGES.put(ErrorCode.GRAPH_VALIDATION, "The workflow definition is invalid.");
        USER_MESSAGES.put(ErrorCode.ROUTING, "The workflow could not decide which step to run next.");

        USER_MESSAGES.put(ErrorCode.NODE_EXECUTION, "A workflow step failed.");
        USER_MESSAGES.put(ErrorCode.STEP_LIMIT, "The workflow exceeded the maximum number of steps.");
        USER_MESSAGES.put(ErrorCode.CANCELLED, "The workflow run was cancelled.");

        USER_MESSAGES.put(ErrorCode.EMPTY_PROMPT, "No prompt was provided.");

        USER_MESSAGES.put(ErrorCode.UNKNOWN_ERROR, "An unexpected error occurred while running the workflow.");
    }

    private ErrorHandler() {
    }

    /**
     * 예외를 에러 코드로 분류
     */
    public static ErrorCode classifyError(Throwable error) {
        if (error instanceof WorkflowException) {
            return ((WorkflowException) error).getErrorCode();
        }
        return ErrorCode.UNKNOWN_ERROR;
    }

    public static String getUserMessage(ErrorCode errorCode) {
        return USER_MESSAGES.getOrDefault(errorCode, USER_MESSAGES.get(ErrorCode.UNKNOWN_ERROR));
    }

    /**
     * 에러 이벤트 본문: "[코드] 사용자 메시지 (node: id)"
     */
    public static String describe(Throwable error) {
        ErrorCode errorCode = classifyError(error);

        StringBuilder description = new StringBuilder()
                .append('[').append(errorCode.getCode()).append("] ")
                .append(getUserMessage(errorCode));

        String nodeId = nodeIdOf(error);
        if (nodeId != null) {
            description.append(" (node: ").append(nodeId).append(')');
        }

        log.debug("에러 분류 - {}: {}", errorCode, error.getMessage());
        return description.toString();
    }

    private static String nodeIdOf(Throwable error) {
        if (error instanceof NodeExecutionException) {
            return ((NodeExecutionException) error).getNodeId();
        }
        if (error instanceof RoutingException) {
            return ((RoutingException) error).getNodeId();
        }
        return null;
    }
}
