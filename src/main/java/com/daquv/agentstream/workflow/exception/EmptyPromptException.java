package com.daquv.agentstream.workflow.exception;

public class EmptyPromptException extends WorkflowException {

    public EmptyPromptException() {
        super(ErrorCode.EMPTY_PROMPT, "프롬프트가 제공되지 않았습니다.");
    }
}
