package com.daquv.agentstream.stream;

import com.daquv.agentstream.config.StreamProperties;
import com.daquv.agentstream.stream.util.WebSocketUtils;
import com.daquv.agentstream.workflow.RunCancellation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamWebSocketHandlerTest {

    @Mock
    private StreamingBridge streamingBridge;

    @Mock
    private WebSocketSession webSocketSession;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        lenient().when(webSocketSession.getId()).thenReturn("ws-1");
        lenient().when(webSocketSession.isOpen()).thenReturn(true);
    }

    // 전송 작업을 호출 스레드에서 바로 실행
    private StreamWebSocketHandler inlineHandler() {
        return new StreamWebSocketHandler(streamingBridge, new WebSocketUtils(objectMapper), objectMapper,
                new TaskExecutorAdapter(Runnable::run), new StreamProperties());
    }

    // 전송 작업을 실행하지 않음 (실행 중 상태 유지)
    private StreamWebSocketHandler idleHandler() {
        return new StreamWebSocketHandler(streamingBridge, new WebSocketUtils(objectMapper), objectMapper,
                new TaskExecutorAdapter(task -> { }), new StreamProperties());
    }

    private static StreamSession closedSession(StreamEvent... events) throws InterruptedException {
        EventChannel channel = new EventChannel(events.length + 1);
        for (StreamEvent event : events) {
            channel.publish(event);
        }
        channel.close();
        return new StreamSession("run-1", channel, new RunCancellation());
    }

    private List<Map<String, Object>> sentMessages(int expected) throws Exception {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(webSocketSession, times(expected)).sendMessage(captor.capture());

        List<Map<String, Object>> messages = new ArrayList<>();
        for (WebSocketMessage<?> message : captor.getAllValues()) {
            messages.add(objectMapper.readValue(((TextMessage) message).getPayload(),
                    new TypeReference<Map<String, Object>>() { }));
        }
        return messages;
    }

    // ------------------------------------------------------------------
    // 정상 흐름
    // ------------------------------------------------------------------

    @Test
    void prompt_forwardsEveryEventAsJson() throws Exception {
        when(streamingBridge.open("hola")).thenReturn(closedSession(
                StreamEvent.progress("plan", "step one"),
                StreamEvent.result("answer"),
                StreamEvent.sentinel("--- END OF STREAM ---")));
        StreamWebSocketHandler handler = inlineHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"hola\"}"));

        List<Map<String, Object>> messages = sentMessages(3);
        assertThat(messages.get(0))
                .containsEntry("status", "success")
                .containsEntry("type", "progress")
                .containsEntry("node_id", "plan")
                .containsEntry("message", "step one");
        assertThat(messages.get(1)).containsEntry("type", "result").containsEntry("message", "answer");
        assertThat(messages.get(2)).containsEntry("type", "end").containsEntry("message", "--- END OF STREAM ---");
        assertThat(handler.activeStreamCount()).isZero();
    }

    @Test
    void emptyPrompt_forwardsErrorStatus() throws Exception {
        when(streamingBridge.open("")).thenReturn(closedSession(StreamEvent.error("ERROR: No prompt was provided.")));
        StreamWebSocketHandler handler = inlineHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"\"}"));

        List<Map<String, Object>> messages = sentMessages(1);
        assertThat(messages.get(0))
                .containsEntry("status", "error")
                .containsEntry("type", "error")
                .containsEntry("message", "ERROR: No prompt was provided.");
    }

    // ------------------------------------------------------------------
    // 요청 오류
    // ------------------------------------------------------------------

    @Test
    void malformedPayload_sendsErrorWithoutOpeningRun() throws Exception {
        StreamWebSocketHandler handler = inlineHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("not json"));

        assertThat(sentMessages(1).get(0))
                .containsEntry("status", "error")
                .containsEntry("message", "**[FATAL ERROR]** Invalid request payload.");
        verifyNoInteractions(streamingBridge);
    }

    @Test
    void secondPromptWhileRunning_isRejected() throws Exception {
        when(streamingBridge.open("simular")).thenReturn(new StreamSession("run-1", new EventChannel(4), new RunCancellation()));
        StreamWebSocketHandler handler = idleHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"simular\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"hola\"}"));

        verify(streamingBridge, times(1)).open(any());
        assertThat(sentMessages(1).get(0))
                .containsEntry("status", "error")
                .containsEntry("message", "**[FATAL ERROR]** A run is already in progress on this connection.");
    }

    @Test
    void secondPromptWhilePreviousEventsAreStillBeingSent_isRejected() throws Exception {
        StreamSession producerDone = closedSession(
                StreamEvent.result("answer"),
                StreamEvent.sentinel("--- END OF STREAM ---"));
        when(streamingBridge.open("hola")).thenReturn(producerDone);
        StreamWebSocketHandler handler = idleHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"hola\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"simular\"}"));

        verify(streamingBridge, times(1)).open(any());
        assertThat(handler.activeStreamCount()).isEqualTo(1);
        assertThat(producerDone.next().getMessage()).isEqualTo("answer");
        assertThat(sentMessages(1).get(0))
                .containsEntry("status", "error")
                .containsEntry("message", "**[FATAL ERROR]** A run is already in progress on this connection.");
    }

    @Test
    void nullPayload_isTreatedAsMissingPrompt() throws Exception {
        when(streamingBridge.open(isNull())).thenReturn(closedSession(StreamEvent.error("ERROR: No prompt was provided.")));
        StreamWebSocketHandler handler = inlineHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("null"));

        assertThat(sentMessages(1).get(0))
                .containsEntry("status", "error")
                .containsEntry("message", "ERROR: No prompt was provided.");
    }

    @Test
    void promptAfterPreviousRunDelivered_isAccepted() throws Exception {
        when(streamingBridge.open("hola")).thenReturn(
                closedSession(StreamEvent.sentinel("--- END OF STREAM ---")),
                closedSession(StreamEvent.sentinel("--- END OF STREAM ---")));
        StreamWebSocketHandler handler = inlineHandler();
        handler.afterConnectionEstablished(webSocketSession);

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"hola\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"hola\"}"));

        verify(streamingBridge, times(2)).open("hola");
        assertThat(sentMessages(2)).allSatisfy(message -> assertThat(message).containsEntry("type", "end"));
    }

    // ------------------------------------------------------------------
    // 연결 종료
    // ------------------------------------------------------------------

    @Test
    void connectionClosed_cancelsActiveRun() throws Exception {
        EventChannel channel = new EventChannel(4);
        StreamSession running = new StreamSession("run-1", channel, new RunCancellation());
        when(streamingBridge.open("simular")).thenReturn(running);
        StreamWebSocketHandler handler = idleHandler();
        handler.afterConnectionEstablished(webSocketSession);
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"simular\"}"));

        handler.afterConnectionClosed(webSocketSession, CloseStatus.GOING_AWAY);

        assertThat(running.getCancellation().isCancelled()).isTrue();
        assertThat(channel.isAbandoned()).isTrue();
        assertThat(handler.activeStreamCount()).isZero();
    }

    @Test
    void sendFailure_cancelsRun() throws Exception {
        EventChannel channel = new EventChannel(4);
        channel.publish(StreamEvent.progress("plan", "step one"));
        StreamSession running = new StreamSession("run-1", channel, new RunCancellation());
        when(streamingBridge.open("simular")).thenReturn(running);
        when(webSocketSession.isOpen()).thenReturn(false);
        StreamWebSocketHandler handler = inlineHandler();

        handler.handleTextMessage(webSocketSession, new TextMessage("{\"prompt\": \"simular\"}"));

        assertThat(running.getCancellation().isCancelled()).isTrue();
        assertThat(channel.isAbandoned()).isTrue();
        verify(webSocketSession, atLeastOnce()).isOpen();
    }
}
