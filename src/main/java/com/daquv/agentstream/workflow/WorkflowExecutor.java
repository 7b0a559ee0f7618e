package com.daquv.agentstream.workflow;

import com.daquv.agentstream.config.WorkflowProperties;
import com.daquv.agentstream.workflow.exception.ErrorCode;
import com.daquv.agentstream.workflow.exception.NodeExecutionException;
import com.daquv.agentstream.workflow.exception.RunCancelledException;
import com.daquv.agentstream.workflow.exception.WorkflowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 그래프를 시작 노드부터 END까지 순차 실행한다.
 * 한 실행 안에서 노드는 동시에 두 개 이상 실행되지 않으며, 분기는 항상 직전 노드의 병합 결과로 판단한다.
 */
@Slf4j
@Component
public class WorkflowExecutor {

    private final AsyncTaskExecutor nodeTaskExecutor;
    private final Duration nodeTimeout;
    private final int maxSteps;

    public WorkflowExecutor(@Qualifier("nodeTaskExecutor") AsyncTaskExecutor nodeTaskExecutor,
                            WorkflowProperties workflowProperties) {
        this.nodeTaskExecutor = nodeTaskExecutor;
        this.nodeTimeout = workflowProperties.getNodeTimeout();
        this.maxSteps = workflowProperties.getMaxSteps();
    }

    /**
     * 워크플로우 실행
     *
     * @return 누적 병합된 최종 State와 방문한 노드 목록
     * @throws NodeExecutionException 노드 실패/타임아웃 시 (이후 노드는 실행되지 않음)
     * @throws RunCancelledException  취소 신호를 받은 경우
     */
    public RunResult execute(String runId, WorkflowGraph graph, AgentState initialState,
                             RunCancellation cancellation, NodeStepListener listener) {
        log.info("=== 워크플로우 실행 시작 - runId: {} ===", runId);

        AgentState state = initialState;
        List<String> visited = new ArrayList<>();
        String current = graph.getEntry();

        while (!WorkflowGraph.END.equals(current)) {
            if (visited.size() >= maxSteps) {
                throw new WorkflowException(ErrorCode.STEP_LIMIT,
                        String.format("최대 노드 실행 횟수(%d)를 초과했습니다 - runId: %s", maxSteps, runId));
            }
            cancellation.throwIfCancelled();

            WorkflowNode node = graph.getNode(current);
            StateUpdate update = executeNode(runId, current, node, state, cancellation);
            checkWrites(current, node, update);

            state = state.merge(update);
            visited.add(current);

            try {
                listener.onStep(new NodeStep(current, update, state));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException("진행 이벤트 전송 중 인터럽트되었습니다 - node: " + current);
            }

            current = graph.next(current, state);
            log.debug("다음 노드: {} - runId: {}", current, runId);
        }

        log.info("=== 워크플로우 실행 완료 - runId: {}, visited: {} ===", runId, visited);
        return new RunResult(runId, state, List.copyOf(visited));
    }

    /**
     * 개별 노드 실행 (타임아웃 + 취소 처리)
     */
    private StateUpdate executeNode(String runId, String nodeId, WorkflowNode node,
                                    AgentState state, RunCancellation cancellation) {
        long startTime = System.currentTimeMillis();
        log.info("▶ 노드 실행 시작: {} - runId: {}", nodeId, runId);

        Future<StateUpdate> future = nodeTaskExecutor.submit(() -> node.execute(state));
        cancellation.bind(future);
        try {
            StateUpdate update = future.get(nodeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("✅ 노드 실행 완료: {} ({}ms) - runId: {}, update: {}",
                    nodeId, System.currentTimeMillis() - startTime, runId, update);
            return update != null ? update : StateUpdate.empty();

        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("⏱ 노드 실행 시간 초과: {} ({}ms) - runId: {}", nodeId, nodeTimeout.toMillis(), runId);
            throw new NodeExecutionException(nodeId,
                    String.format("노드 실행 시간이 %dms를 초과했습니다: %s", nodeTimeout.toMillis(), nodeId), e);

        } catch (CancellationException e) {
            throw new RunCancelledException(
                    String.format("노드 실행 중 취소되었습니다: %s (%s)", nodeId, cancellation.getReason()));

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RunCancelledException("노드 실행 대기 중 인터럽트되었습니다: " + nodeId);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof InterruptedException && cancellation.isCancelled()) {
                throw new RunCancelledException(
                        String.format("노드 실행 중 취소되었습니다: %s (%s)", nodeId, cancellation.getReason()));
            }
            log.error("❌ 노드 실행 실패: {} - runId: {}", nodeId, runId, cause);
            throw new NodeExecutionException(nodeId,
                    String.format("노드 실행 실패: %s - %s", nodeId, cause.getMessage()), cause);

        } finally {
            cancellation.unbind();
        }
    }

    private void checkWrites(String nodeId, WorkflowNode node, StateUpdate update) {
        Set<StateKey> undeclared = update.isEmpty() ? EnumSet.noneOf(StateKey.class) : EnumSet.copyOf(update.keys());
        undeclared.removeAll(node.writes());
        if (!undeclared.isEmpty()) {
            throw new NodeExecutionException(nodeId,
                    String.format("노드 %s가 선언하지 않은 State 키를 썼습니다: %s", nodeId, undeclared));
        }
    }
}
