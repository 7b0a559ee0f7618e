package com.daquv.agentstream.stream;

import com.daquv.agentstream.WorkflowFixtures;
import com.daquv.agentstream.config.StreamProperties;
import com.daquv.agentstream.config.WorkflowProperties;
import com.daquv.agentstream.workflow.StateUpdate;
import com.daquv.agentstream.workflow.WorkflowExecutor;
import com.daquv.agentstream.workflow.WorkflowGraph;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.daquv.agentstream.WorkflowFixtures.stub;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class StreamingBridgeTest {

    private static final String PLAN_MESSAGE = "**Step 1: [PLANNING].** Analyzing the user's request...";
    private static final String EXECUTE_MESSAGE =
            "**Step 2: [EXECUTION].** Complex task detected. Starting 3-second simulation...";
    private static final String CHECK_MESSAGE =
            "**Step 3: [VERIFICATION].** Collecting and formatting the final answer.";
    private static final String SENTINEL = "--- END OF STREAM ---";

    private ThreadPoolTaskExecutor nodeTaskExecutor;
    private ThreadPoolTaskExecutor workflowTaskExecutor;
    private WorkflowProperties workflowProperties;
    private StreamProperties streamProperties;
    private RunRegistry runRegistry;

    @BeforeEach
    void setUp() {
        nodeTaskExecutor = WorkflowFixtures.threadPool("test-node-");
        workflowTaskExecutor = WorkflowFixtures.threadPool("test-run-");
        workflowProperties = WorkflowFixtures.zeroDelayWorkflowProperties();
        streamProperties = WorkflowFixtures.zeroPauseStreamProperties();
        runRegistry = new RunRegistry(streamProperties);
    }

    @AfterEach
    void tearDown() {
        workflowTaskExecutor.shutdown();
        nodeTaskExecutor.shutdown();
    }

    private StreamingBridge bridge(WorkflowGraph graph) {
        return new StreamingBridge(graph, new WorkflowExecutor(nodeTaskExecutor, workflowProperties),
                workflowTaskExecutor, runRegistry, streamProperties);
    }

    private StreamingBridge agentBridge() {
        return bridge(WorkflowFixtures.agentGraph(workflowProperties));
    }

    private static List<StreamEvent> drain(StreamSession session) throws InterruptedException {
        List<StreamEvent> events = new ArrayList<>();
        StreamEvent event;
        while ((event = session.next()) != null) {
            events.add(event);
        }
        return events;
    }

    private static List<String> messages(List<StreamEvent> events) {
        List<String> messages = new ArrayList<>();
        events.forEach(event -> messages.add(event.getMessage()));
        return messages;
    }

    // ------------------------------------------------------------------
    // 정상 시나리오
    // ------------------------------------------------------------------

    @Test
    void directAnswer_streamsPlanCheckResultThenSentinel() throws Exception {
        List<StreamEvent> events = drain(agentBridge().open("hola"));

        assertThat(messages(events)).containsExactly(
                PLAN_MESSAGE,
                CHECK_MESSAGE,
                "Quick response: no complex execution was required for: 'hola'. Process finished.",
                SENTINEL);
        assertThat(events).extracting(StreamEvent::getType).containsExactly(
                StreamEventType.PROGRESS, StreamEventType.PROGRESS, StreamEventType.RESULT, StreamEventType.SENTINEL);
        assertThat(events.get(0).getNodeId()).isEqualTo("plan");
        assertThat(events.get(1).getNodeId()).isEqualTo("check_result");
    }

    @Test
    void plannedTask_streamsAllThreeStepsThenSentinel() throws Exception {
        List<StreamEvent> events = drain(agentBridge().open("simular carga"));

        assertThat(messages(events)).containsExactly(
                PLAN_MESSAGE,
                EXECUTE_MESSAGE,
                CHECK_MESSAGE,
                "Task complete: the simulation of the requested task ('simular carga') finished successfully "
                        + "after 3 seconds of computation. The agent has finished its work cycle.",
                SENTINEL);
    }

    @Test
    void configuredResultPrefix_isPrependedToResultOnly() throws Exception {
        streamProperties.setResultPrefix("**[RESULTADO FINAL DEL AGENTE]**");

        List<StreamEvent> events = drain(agentBridge().open("hola"));

        assertThat(messages(events)).containsExactly(
                PLAN_MESSAGE,
                CHECK_MESSAGE,
                "**[RESULTADO FINAL DEL AGENTE]** Quick response: no complex execution was required for: 'hola'. "
                        + "Process finished.",
                SENTINEL);
    }

    @Test
    void finishedRun_isRemovedFromRegistry() throws Exception {
        StreamSession session = agentBridge().open("hola");
        drain(session);

        assertThat(session.isFinished()).isTrue();
        assertThat(runRegistry.get(session.getRunId())).isNull();
        assertThat(runRegistry.activeCount()).isZero();
    }

    // ------------------------------------------------------------------
    // 빈 프롬프트
    // ------------------------------------------------------------------

    @Test
    void emptyPrompt_emitsSingleErrorWithoutRunning() throws Exception {
        WorkflowExecutor executor = mock(WorkflowExecutor.class);
        StreamingBridge bridge = new StreamingBridge(WorkflowFixtures.agentGraph(workflowProperties), executor,
                workflowTaskExecutor, runRegistry, streamProperties);

        List<StreamEvent> events = drain(bridge.open(""));

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(StreamEventType.ERROR);
        assertThat(events.get(0).getMessage()).isEqualTo("ERROR: No prompt was provided.");
        verifyNoInteractions(executor);
        assertThat(runRegistry.activeCount()).isZero();
    }

    @Test
    void missingPrompt_isTreatedAsEmpty() throws Exception {
        assertThat(messages(drain(agentBridge().open(null)))).containsExactly("ERROR: No prompt was provided.");
    }

    // ------------------------------------------------------------------
    // 실패 경로: 에러 이벤트 뒤에 항상 종료 이벤트
    // ------------------------------------------------------------------

    @Test
    void nodeFailure_emitsErrorThenSentinel() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .addNode(stub("plan").doing(state -> {
                    throw new IllegalStateException("boom");
                }))
                .addEdge(WorkflowGraph.START, "plan")
                .build();

        List<StreamEvent> events = drain(bridge(graph).open("hola"));

        assertThat(messages(events)).containsExactly(
                "**[FATAL ERROR]** [RUN_001] A workflow step failed. (node: plan)",
                SENTINEL);
        assertThat(events.get(0).getType()).isEqualTo(StreamEventType.ERROR);
    }

    @Test
    void runWithoutFinalAnswer_emitsFallbackResult() throws Exception {
        WorkflowGraph graph = WorkflowGraph.builder()
                .addNode(stub("plan").returning(StateUpdate.empty()))
                .addEdge(WorkflowGraph.START, "plan")
                .build();

        List<StreamEvent> events = drain(bridge(graph).open("hola"));

        assertThat(messages(events)).containsExactly(
                PLAN_MESSAGE,
                "Error: no final answer was generated.",
                SENTINEL);
    }

    @Test
    void rejectedRun_emitsErrorThenSentinel() throws Exception {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        doThrow(new TaskRejectedException("full")).when(saturated).execute(any(Runnable.class));
        StreamingBridge bridge = new StreamingBridge(WorkflowFixtures.agentGraph(workflowProperties),
                new WorkflowExecutor(nodeTaskExecutor, workflowProperties), saturated, runRegistry, streamProperties);

        StreamSession session = bridge.open("hola");
        List<StreamEvent> events = drain(session);

        assertThat(events).extracting(StreamEvent::getType)
                .containsExactly(StreamEventType.ERROR, StreamEventType.SENTINEL);
        assertThat(events.get(0).getMessage()).startsWith("**[FATAL ERROR]** [SYS_999]");
        assertThat(runRegistry.activeCount()).isZero();
    }

    @Test
    void cancelledRun_emitsCancelledErrorThenSentinel() throws Exception {
        workflowProperties.setExecuteDelay(Duration.ofSeconds(10));
        StreamSession session = agentBridge().open("simular");

        List<StreamEvent> events = new ArrayList<>();
        events.add(session.next());
        session.cancel("client went away", false);
        events.addAll(drain(session));

        assertThat(events.get(0).getMessage()).isEqualTo(PLAN_MESSAGE);
        StreamEvent error = events.get(events.size() - 2);
        assertThat(error.getType()).isEqualTo(StreamEventType.ERROR);
        assertThat(error.getMessage()).isEqualTo("**[FATAL ERROR]** [RUN_003] The workflow run was cancelled.");
        assertThat(events.get(events.size() - 1).isSentinel()).isTrue();
        assertThat(events).filteredOn(StreamEvent::isSentinel).hasSize(1);
    }

    @Test
    void consumerGone_runStillFinishesAndLeavesRegistry() throws Exception {
        workflowProperties.setExecuteDelay(Duration.ofSeconds(10));
        StreamSession session = agentBridge().open("simular");
        session.next();

        session.cancel("client disconnected", true);

        long deadline = System.currentTimeMillis() + 5_000;
        while (!session.isFinished() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(session.isFinished()).isTrue();
        assertThat(session.next()).isNull();
        assertThat(runRegistry.activeCount()).isZero();
    }

    // ------------------------------------------------------------------
    // 구성 검증
    // ------------------------------------------------------------------

    @Test
    void nodeWithoutProgressMessage_isRejectedAtStartup() {
        WorkflowGraph graph = WorkflowGraph.builder()
                .addNode(stub("unknown_step"))
                .addEdge(WorkflowGraph.START, "unknown_step")
                .build();

        assertThatThrownBy(() -> bridge(graph))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unknown_step");
    }
}
