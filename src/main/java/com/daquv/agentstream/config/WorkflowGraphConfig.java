package com.daquv.agentstream.config;

import com.daquv.agentstream.workflow.AgentState;
import com.daquv.agentstream.workflow.PlanRoute;
import com.daquv.agentstream.workflow.WorkflowGraph;
import com.daquv.agentstream.workflow.node.CheckResultNode;
import com.daquv.agentstream.workflow.node.ExecuteNode;
import com.daquv.agentstream.workflow.node.PlanNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * 에이전트 워크플로우 그래프 구성
 * START -> plan -(YES)-> execute -> check_result -> END
 *                \-(NO)--------------^
 */
@Slf4j
@Configuration
public class WorkflowGraphConfig {

    @Bean
    public WorkflowGraph agentWorkflowGraph(PlanNode planNode, ExecuteNode executeNode,
                                            CheckResultNode checkResultNode) {
        Map<PlanRoute, String> planRoutes = new EnumMap<>(PlanRoute.class);
        planRoutes.put(PlanRoute.PLAN_NEEDED, ExecuteNode.ID);
        planRoutes.put(PlanRoute.DIRECT_ANSWER, CheckResultNode.ID);

        WorkflowGraph graph = WorkflowGraph.builder()
                .addNode(planNode)
                .addNode(executeNode)
                .addNode(checkResultNode)
                .addEdge(WorkflowGraph.START, PlanNode.ID)
                .addConditionalEdge(PlanNode.ID, PlanRoute.class, WorkflowGraphConfig::routePlan, planRoutes)
                .addEdge(ExecuteNode.ID, CheckResultNode.ID)
                .setTerminal(CheckResultNode.ID)
                .build();

        log.info("워크플로우 그래프 구성 완료 - nodes: {}", graph.getNodeIds());
        return graph;
    }

    /**
     * plan 조건부 엣지: planNeeded가 설정되지 않았으면 분기 결과 없음
     */
    static PlanRoute routePlan(AgentState state) {
        switch (state.getPlanNeeded()) {
            case YES:
                return PlanRoute.PLAN_NEEDED;
            case NO:
                return PlanRoute.DIRECT_ANSWER;
            default:
                return null;
        }
    }
}
