package com.daquv.agentstream.workflow;

import com.daquv.agentstream.workflow.exception.GraphValidationException;
import com.daquv.agentstream.workflow.exception.RoutingException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 불변 워크플로우 그래프 정의 (노드, 무조건 엣지, 조건부 엣지, 시작/종료 지점)
 * {@link Builder#build()} 이후에는 변경되지 않으므로 동시 실행 간 공유해도 안전하다.
 */
public final class WorkflowGraph {

    public static final String START = "__start__";
    public static final String END = "__end__";

    private final Map<String, WorkflowNode> nodes;
    private final Map<String, String> edges;
    private final Map<String, ConditionalEdge<?>> conditionalEdges;
    private final String entry;

    private WorkflowGraph(Builder builder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.edges));
        this.conditionalEdges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.conditionalEdges));
        this.entry = builder.entry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEntry() {
        return entry;
    }

    public Set<String> getNodeIds() {
        return nodes.keySet();
    }

    public WorkflowNode getNode(String nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("등록되지 않은 노드: " + nodeId);
        }
        return node;
    }

    /**
     * 현재 노드 완료 후 이동할 노드 ID. 나가는 엣지가 없으면 {@link #END}.
     */
    public String next(String nodeId, AgentState state) {
        if (!nodes.containsKey(nodeId)) {
            throw new RoutingException(nodeId, "등록되지 않은 노드에서 분기할 수 없습니다: " + nodeId);
        }
        ConditionalEdge<?> conditional = conditionalEdges.get(nodeId);
        if (conditional != null) {
            return conditional.resolve(nodeId, state);
        }
        return edges.getOrDefault(nodeId, END);
    }

    public static final class Builder {

        private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        private final Map<String, String> edges = new LinkedHashMap<>();
        private final Map<String, ConditionalEdge<?>> conditionalEdges = new LinkedHashMap<>();
        private final Set<String> terminals = new LinkedHashSet<>();
        private final List<String> violations = new ArrayList<>();
        private String entry;

        private Builder() {
        }

        public Builder addNode(WorkflowNode node) {
            return addNode(node.getId(), node);
        }

        public Builder addNode(String nodeId, WorkflowNode node) {
            if (nodeId == null || nodeId.trim().isEmpty()) {
                violations.add("노드 ID가 비어 있습니다.");
                return this;
            }
            if (START.equals(nodeId) || END.equals(nodeId)) {
                violations.add("예약된 노드 ID는 사용할 수 없습니다: " + nodeId);
                return this;
            }
            if (node == null) {
                violations.add("노드 구현이 없습니다: " + nodeId);
                return this;
            }
            if (nodes.putIfAbsent(nodeId, node) != null) {
                violations.add("중복된 노드 ID: " + nodeId);
            }
            return this;
        }

        public Builder addEdge(String from, String to) {
            if (START.equals(from)) {
                return setEntry(to);
            }
            if (END.equals(from)) {
                violations.add("END에서 나가는 엣지는 정의할 수 없습니다: " + to);
                return this;
            }
            if (START.equals(to)) {
                violations.add("START로 들어오는 엣지는 정의할 수 없습니다: " + from);
                return this;
            }
            if (edges.containsKey(from) || conditionalEdges.containsKey(from)) {
                violations.add("노드에 나가는 엣지가 이미 정의되어 있습니다: " + from);
                return this;
            }
            edges.put(from, to);
            return this;
        }

        public <K extends Enum<K>> Builder addConditionalEdge(String from, Class<K> outcomeType,
                                                              RoutingFunction<K> routingFunction,
                                                              Map<K, String> table) {
            if (outcomeType == null || routingFunction == null || table == null) {
                violations.add("조건부 엣지 정의가 불완전합니다: " + from);
                return this;
            }
            if (edges.containsKey(from) || conditionalEdges.containsKey(from)) {
                violations.add("노드에 나가는 엣지가 이미 정의되어 있습니다: " + from);
                return this;
            }
            conditionalEdges.put(from, new ConditionalEdge<>(outcomeType, routingFunction, table));
            return this;
        }

        public Builder setEntry(String nodeId) {
            if (entry != null && !entry.equals(nodeId)) {
                violations.add(String.format("시작 노드가 이미 지정되어 있습니다: %s (요청: %s)", entry, nodeId));
                return this;
            }
            entry = nodeId;
            return this;
        }

        public Builder setTerminal(String nodeId) {
            terminals.add(nodeId);
            return this;
        }

        /**
         * 그래프 검증 후 불변 그래프 생성
         *
         * @throws GraphValidationException 정의가 잘못된 경우 (모든 위반 사항을 모아서 보고)
         */
        public WorkflowGraph build() {
            List<String> errors = new ArrayList<>(violations);

            if (entry == null) {
                errors.add("시작 노드가 지정되지 않았습니다.");
            } else if (!nodes.containsKey(entry)) {
                errors.add("시작 노드가 등록되지 않았습니다: " + entry);
            }

            edges.forEach((from, to) -> {
                if (!nodes.containsKey(from)) {
                    errors.add("엣지의 출발 노드가 등록되지 않았습니다: " + from);
                }
                if (!END.equals(to) && !nodes.containsKey(to)) {
                    errors.add(String.format("엣지의 도착 노드가 등록되지 않았습니다: %s -> %s", from, to));
                }
            });

            conditionalEdges.forEach((from, conditional) -> {
                if (!nodes.containsKey(from)) {
                    errors.add("조건부 엣지의 출발 노드가 등록되지 않았습니다: " + from);
                }
                Set<?> missing = conditional.missingOutcomes();
                if (!missing.isEmpty()) {
                    errors.add(String.format("조건부 엣지 %s의 분기 테이블에 누락된 결과가 있습니다: %s", from, missing));
                }
                conditional.getTable().forEach((outcome, to) -> {
                    if (!END.equals(to) && !nodes.containsKey(to)) {
                        errors.add(String.format("조건부 엣지의 도착 노드가 등록되지 않았습니다: %s[%s] -> %s", from, outcome, to));
                    }
                });
            });

            for (String terminal : terminals) {
                if (!nodes.containsKey(terminal)) {
                    errors.add("종료 노드가 등록되지 않았습니다: " + terminal);
                } else if (conditionalEdges.containsKey(terminal)
                        || (edges.containsKey(terminal) && !END.equals(edges.get(terminal)))) {
                    errors.add("종료 노드에 다른 노드로 나가는 엣지가 있습니다: " + terminal);
                }
            }

            nodes.forEach((nodeId, node) -> {
                if (node.writes() == null) {
                    errors.add("노드의 쓰기 키 선언이 없습니다: " + nodeId);
                }
            });

            if (errors.isEmpty() && !isEndReachable()) {
                errors.add("시작 노드에서 END에 도달할 수 있는 경로가 없습니다.");
            }

            if (!errors.isEmpty()) {
                throw new GraphValidationException(errors);
            }

            for (String terminal : terminals) {
                edges.putIfAbsent(terminal, END);
            }
            return new WorkflowGraph(this);
        }

        private boolean isEndReachable() {
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(entry);

            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (END.equals(current)) {
                    return true;
                }
                if (!visited.add(current)) {
                    continue;
                }
                if (terminals.contains(current)) {
                    return true;
                }
                ConditionalEdge<?> conditional = conditionalEdges.get(current);
                if (conditional != null) {
                    queue.addAll(conditional.getTable().values());
                } else if (edges.containsKey(current)) {
                    queue.add(edges.get(current));
                } else {
                    // 나가는 엣지가 없는 노드는 종료로 간주
                    return true;
                }
            }
            return false;
        }
    }
}
