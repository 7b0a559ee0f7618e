package com.daquv.agentstream.workflow;

/**
 * 노드가 쓸 수 있는 State 필드 키
 * userMessage는 실행 시작 시에만 설정되므로 키가 없다.
 */
public enum StateKey {
    PLAN_NEEDED("plan_needed"),
    EXECUTION_COMPLETE("execution_complete"),
    FINAL_ANSWER("final_answer");

    private final String fieldName;

    StateKey(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
