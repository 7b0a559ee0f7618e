package com.daquv.agentstream.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 노드가 반환하는 부분 State 업데이트
 * 설정한 키만 포함하며, 병합 시 해당 키만 덮어쓴다.
 */
public final class StateUpdate {

    private static final StateUpdate EMPTY = new StateUpdate(new EnumMap<>(StateKey.class));

    private final EnumMap<StateKey, Object> values;

    private StateUpdate(EnumMap<StateKey, Object> values) {
        this.values = values;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StateUpdate empty() {
        return EMPTY;
    }

    public Set<StateKey> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean contains(StateKey key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public PlanNeeded getPlanNeeded() {
        return (PlanNeeded) values.get(StateKey.PLAN_NEEDED);
    }

    public Boolean getExecutionComplete() {
        return (Boolean) values.get(StateKey.EXECUTION_COMPLETE);
    }

    public String getFinalAnswer() {
        return (String) values.get(StateKey.FINAL_ANSWER);
    }

    /**
     * 로그/WebSocket 전송용 맵 (snake_case 필드명)
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((key, value) -> map.put(key.getFieldName(),
                value instanceof Enum ? ((Enum<?>) value).name().toLowerCase() : value));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateUpdate)) {
            return false;
        }
        return values.equals(((StateUpdate) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StateUpdate" + toMap();
    }

    public static final class Builder {

        private final EnumMap<StateKey, Object> values = new EnumMap<>(StateKey.class);

        private Builder() {
        }

        public Builder planNeeded(PlanNeeded planNeeded) {
            if (planNeeded == null || planNeeded == PlanNeeded.UNSET) {
                throw new IllegalArgumentException("planNeeded는 YES 또는 NO만 설정할 수 있습니다: " + planNeeded);
            }
            values.put(StateKey.PLAN_NEEDED, planNeeded);
            return this;
        }

        public Builder executionComplete(boolean executionComplete) {
            values.put(StateKey.EXECUTION_COMPLETE, executionComplete);
            return this;
        }

        public Builder finalAnswer(String finalAnswer) {
            if (finalAnswer == null) {
                throw new IllegalArgumentException("finalAnswer는 null일 수 없습니다.");
            }
            values.put(StateKey.FINAL_ANSWER, finalAnswer);
            return this;
        }

        public StateUpdate build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new StateUpdate(new EnumMap<>(values));
        }
    }
}
