package com.daquv.agentstream.stream;

import com.daquv.agentstream.config.StreamProperties;
import com.daquv.agentstream.stream.dto.StreamRequestDto;
import com.daquv.agentstream.stream.util.WebSocketUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * /ws/stream 핸들러. 연결당 실행은 1개만 허용한다.
 */
@Component
@Slf4j
public class StreamWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final StreamingBridge streamingBridge;
    private final WebSocketUtils webSocketUtils;
    private final ObjectMapper objectMapper;
    private final AsyncTaskExecutor streamWriterTaskExecutor;
    private final StreamProperties streamProperties;

    // WebSocket 세션 ID -> 진행 중인 실행
    private final Map<String, StreamSession> activeStreams = new ConcurrentHashMap<>();

    // WebSocket 세션 ID -> 동시 전송용 데코레이터
    private final Map<String, WebSocketSession> decoratedSessions = new ConcurrentHashMap<>();

    public StreamWebSocketHandler(StreamingBridge streamingBridge, WebSocketUtils webSocketUtils,
                                  ObjectMapper objectMapper,
                                  @Qualifier("streamWriterTaskExecutor") AsyncTaskExecutor streamWriterTaskExecutor,
                                  StreamProperties streamProperties) {
        this.streamingBridge = streamingBridge;
        this.webSocketUtils = webSocketUtils;
        this.objectMapper = objectMapper;
        this.streamWriterTaskExecutor = streamWriterTaskExecutor;
        this.streamProperties = streamProperties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        decoratedSessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.info("WebSocket 연결 - sessionId: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession target = decoratedSessions.getOrDefault(session.getId(), session);
        String payload = message.getPayload();
        log.info("😊 WebSocket Stream 요청 수신: {}", payload);

        StreamRequestDto request;
        try {
            request = objectMapper.readValue(payload, StreamRequestDto.class);
        } catch (JsonProcessingException e) {
            log.warn("잘못된 요청 형식 - sessionId: {}: {}", session.getId(), e.getOriginalMessage());
            webSocketUtils.sendError(target, streamProperties.getErrorPrefix() + " Invalid request payload.");
            return;
        }

        // 전송 작업이 끝나야(drain의 finally) 항목이 제거되므로, 항목이 있으면 이전 실행의 이벤트가 아직 전송 중이다
        StreamSession running = activeStreams.get(session.getId());
        if (running != null) {
            rejectConcurrentRun(session, target, running);
            return;
        }

        // JSON "null" 페이로드는 프롬프트 없음으로 처리
        StreamSession streamSession = streamingBridge.open(request != null ? request.getPrompt() : null);
        running = activeStreams.putIfAbsent(session.getId(), streamSession);
        if (running != null) {
            streamSession.cancel("concurrent run on the same connection", true);
            rejectConcurrentRun(session, target, running);
            return;
        }

        try {
            streamWriterTaskExecutor.execute(() -> drain(session.getId(), target, streamSession));
        } catch (TaskRejectedException e) {
            log.error("❌ 전송 스레드 풀이 가득 찼습니다 - runId: {}", streamSession.getRunId(), e);
            streamSession.cancel("stream writer rejected", true);
            activeStreams.remove(session.getId(), streamSession);
            webSocketUtils.sendError(target, streamProperties.getErrorPrefix() + " The server is busy.");
        }
    }

    private void rejectConcurrentRun(WebSocketSession session, WebSocketSession target, StreamSession running) {
        log.warn("이미 실행 중인 요청이 있습니다 - sessionId: {}, runId: {}", session.getId(), running.getRunId());
        webSocketUtils.sendError(target, streamProperties.getErrorPrefix() + " A run is already in progress on this connection.");
    }

    /**
     * 채널이 닫힐 때까지 이벤트를 클라이언트로 전달
     */
    void drain(String sessionId, WebSocketSession target, StreamSession streamSession) {
        try {
            StreamEvent event;
            while ((event = streamSession.next()) != null) {
                webSocketUtils.sendEvent(target, event);
            }
            log.info("WebSocket 스트림 전송 완료 - runId: {}", streamSession.getRunId());

        } catch (IOException e) {
            log.warn("WebSocket 전송 실패 - runId: {}: {}", streamSession.getRunId(), e.getMessage());
            streamSession.cancel("websocket send failed", true);

        } catch (InterruptedException e) {
            log.warn("WebSocket 전송 중 인터럽트 - runId: {}", streamSession.getRunId());
            streamSession.cancel("stream writer interrupted", true);
            Thread.currentThread().interrupt();

        } finally {
            activeStreams.remove(sessionId, streamSession);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        decoratedSessions.remove(session.getId());
        StreamSession streamSession = activeStreams.remove(session.getId());
        if (streamSession != null) {
            streamSession.cancel("websocket closed: " + status, true);
        }
        log.info("WebSocket 연결 종료 - sessionId: {}, status: {}", session.getId(), status);
    }

    int activeStreamCount() {
        return activeStreams.size();
    }
}
