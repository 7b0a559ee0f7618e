package com.daquv.agentstream.stream;

import com.daquv.agentstream.config.StreamProperties;
import com.daquv.agentstream.stream.util.ErrorHandler;
import com.daquv.agentstream.workflow.AgentState;
import com.daquv.agentstream.workflow.NodeStep;
import com.daquv.agentstream.workflow.RunCancellation;
import com.daquv.agentstream.workflow.RunResult;
import com.daquv.agentstream.workflow.WorkflowExecutor;
import com.daquv.agentstream.workflow.WorkflowGraph;
import com.daquv.agentstream.workflow.exception.EmptyPromptException;
import com.daquv.agentstream.workflow.exception.RunCancelledException;
import com.daquv.agentstream.workflow.exception.WorkflowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 워크플로우 실행 1회를 클라이언트용 이벤트 스트림으로 변환한다.
 * 진행 메시지 -> 결과 또는 에러 이벤트 1건 -> 종료 이벤트 1건 순서를 보장한다.
 */
@Slf4j
@Component
public class StreamingBridge {

    private final WorkflowGraph graph;
    private final WorkflowExecutor workflowExecutor;
    private final AsyncTaskExecutor workflowTaskExecutor;
    private final RunRegistry runRegistry;
    private final StreamProperties streamProperties;
    private final Map<String, String> progressMessages;

    public StreamingBridge(WorkflowGraph graph,
                           WorkflowExecutor workflowExecutor,
                           @Qualifier("workflowTaskExecutor") AsyncTaskExecutor workflowTaskExecutor,
                           RunRegistry runRegistry,
                           StreamProperties streamProperties) {
        this.graph = graph;
        this.workflowExecutor = workflowExecutor;
        this.workflowTaskExecutor = workflowTaskExecutor;
        this.runRegistry = runRegistry;
        this.streamProperties = streamProperties;
        this.progressMessages = Map.copyOf(streamProperties.getProgressMessages());

        List<String> missing = new ArrayList<>();
        for (String nodeId : graph.getNodeIds()) {
            if (!progressMessages.containsKey(nodeId)) {
                missing.add(nodeId);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("진행 메시지가 설정되지 않은 노드가 있습니다: " + missing);
        }
    }

    /**
     * 프롬프트로 실행을 시작하고 이벤트를 읽을 세션을 반환한다.
     * 프롬프트가 비어 있으면 실행 없이 에러 이벤트 1건만 담긴 세션을 반환한다.
     */
    public StreamSession open(String prompt) {
        String runId = UUID.randomUUID().toString();
        EventChannel channel = new EventChannel(streamProperties.getChannelCapacity());
        StreamSession session = new StreamSession(runId, channel, new RunCancellation());

        if (prompt == null || prompt.isEmpty()) {
            log.warn("프롬프트 없음 - 워크플로우를 실행하지 않습니다. runId: {}", runId);
            publishEmptyPrompt(channel, new EmptyPromptException());
            return session;
        }

        log.info("😊 스트림 요청 수신 - runId: {}, prompt: {}", runId, prompt);
        runRegistry.register(session);
        try {
            workflowTaskExecutor.execute(() -> stream(session, prompt));
        } catch (TaskRejectedException e) {
            log.error("❌ 실행 스레드 풀이 가득 차 실행을 시작할 수 없습니다 - runId: {}", runId, e);
            finish(session, StreamEvent.error(errorText(e)));
        }
        return session;
    }

    /**
     * 실행 1회를 채널로 흘려보낸다. 어떤 경로로 끝나든 최종 이벤트 1건과 종료 이벤트 1건을 보낸다.
     */
    void stream(StreamSession session, String prompt) {
        String runId = session.getRunId();
        RunCancellation cancellation = session.getCancellation();
        long startTime = System.currentTimeMillis();
        StreamEvent outcome = null;

        try {
            RunResult result = workflowExecutor.execute(runId, graph, AgentState.initial(prompt), cancellation,
                    step -> publishProgress(session, step));

            AgentState finalState = result.getFinalState();
            outcome = StreamEvent.result(resultText(finalState.hasFinalAnswer()
                    ? finalState.getFinalAnswer()
                    : streamProperties.getMissingAnswerMessage()));
            log.info("✅ 실행 완료 - runId: {}, {}ms", runId, System.currentTimeMillis() - startTime);

        } catch (RunCancelledException e) {
            log.warn("🛑 실행 취소됨 - runId: {}: {}", runId, e.getMessage());
            outcome = StreamEvent.error(errorText(e));

        } catch (WorkflowException e) {
            log.error("❌ 실행 실패 - runId: {}: {}", runId, e.getMessage(), e);
            outcome = StreamEvent.error(errorText(e));

        } catch (RuntimeException e) {
            log.error("❌ 실행 중 예상하지 못한 오류 - runId: {}", runId, e);
            outcome = StreamEvent.error(errorText(e));

        } finally {
            if (outcome == null) {
                outcome = StreamEvent.error(errorText(new IllegalStateException("run aborted")));
            }
            finish(session, outcome);
        }
    }

    private void publishProgress(StreamSession session, NodeStep step) throws InterruptedException {
        session.getChannel().publish(StreamEvent.progress(step.getNodeId(), progressMessages.get(step.getNodeId())));

        // 클라이언트가 진행 메시지를 볼 수 있도록 잠시 대기
        Duration pause = streamProperties.getProgressPause();
        session.getCancellation().sleep(pause);
    }

    /**
     * 최종 이벤트 -> 종료 이벤트 -> 등록 해제 -> 채널 닫기. 인터럽트 상태여도 반드시 전송을 시도한다.
     */
    private void finish(StreamSession session, StreamEvent outcome) {
        EventChannel channel = session.getChannel();
        boolean interrupted = Thread.interrupted();
        try {
            publishQuietly(session, outcome);
            publishQuietly(session, StreamEvent.sentinel(streamProperties.getSentinelMessage()));
        } finally {
            runRegistry.remove(session.getRunId());
            channel.close();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void publishQuietly(StreamSession session, StreamEvent event) {
        try {
            session.getChannel().publish(event);
        } catch (InterruptedException e) {
            log.warn("이벤트 전송 중 인터럽트 - runId: {}, event: {}", session.getRunId(), event.getType());
            Thread.currentThread().interrupt();
        }
    }

    private void publishEmptyPrompt(EventChannel channel, EmptyPromptException e) {
        try {
            channel.publish(StreamEvent.error(streamProperties.getEmptyPromptMessage()));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            channel.close();
        }
        log.debug("빈 프롬프트 처리 - {}", ErrorHandler.describe(e));
    }

    private String resultText(String answer) {
        String prefix = streamProperties.getResultPrefix();
        return prefix == null || prefix.isEmpty() ? answer : prefix + " " + answer;
    }

    private String errorText(Throwable e) {
        return streamProperties.getErrorPrefix() + " " + ErrorHandler.describe(e);
    }
}
