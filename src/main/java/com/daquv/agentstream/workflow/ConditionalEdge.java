package com.daquv.agentstream.workflow;

import com.daquv.agentstream.workflow.exception.RoutingException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 조건부 엣지 - 분기 함수 결과(enum)를 다음 노드 ID로 매핑한다.
 */
public final class ConditionalEdge<K extends Enum<K>> {

    private final Class<K> outcomeType;
    private final RoutingFunction<K> routingFunction;
    private final Map<K, String> table;

    ConditionalEdge(Class<K> outcomeType, RoutingFunction<K> routingFunction, Map<K, String> table) {
        this.outcomeType = outcomeType;
        this.routingFunction = routingFunction;
        EnumMap<K, String> copy = new EnumMap<>(outcomeType);
        copy.putAll(table);
        this.table = Collections.unmodifiableMap(copy);
    }

    public Map<K, String> getTable() {
        return table;
    }

    /**
     * 테이블에 매핑되지 않은 분기 결과
     */
    Set<K> missingOutcomes() {
        Set<K> missing = EnumSet.allOf(outcomeType);
        missing.removeAll(table.keySet());
        return missing;
    }

    /**
     * 병합이 끝난 State로 다음 노드 결정
     */
    String resolve(String fromNodeId, AgentState state) {
        K outcome = routingFunction.route(state);
        if (outcome == null) {
            throw new RoutingException(fromNodeId, "분기 함수가 결과를 반환하지 않았습니다 - node: " + fromNodeId);
        }
        String target = table.get(outcome);
        if (target == null) {
            throw new RoutingException(fromNodeId,
                    String.format("분기 결과 %s에 대한 매핑이 없습니다 - node: %s", outcome, fromNodeId));
        }
        return target;
    }
}
