package com.daquv.agentstream.stream.util;

import com.daquv.agentstream.stream.StreamEvent;
import com.daquv.agentstream.stream.StreamEventType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class WebSocketUtils {

    private final ObjectMapper objectMapper;

    public WebSocketUtils(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 스트림 이벤트 1건을 JSON 텍스트 메시지로 전송
     *
     * @param session WebSocket 세션
     * @param event   전송할 이벤트
     * @throws IOException 전송 실패 (연결 끊김 등)
     */
    public void sendEvent(WebSocketSession session, StreamEvent event) throws IOException {
        if (session == null || !session.isOpen()) {
            throw new IOException("WebSocket 세션이 닫혀 있습니다");
        }

        Map<String, Object> messageData = new LinkedHashMap<>();
        messageData.put("status", event.getType() == StreamEventType.ERROR ? "error" : "success");
        messageData.put("type", event.getType().getWireName());
        messageData.put("node_id", event.getNodeId());
        messageData.put("message", event.getMessage());

        String jsonMessage = objectMapper.writeValueAsString(messageData);
        session.sendMessage(new TextMessage(jsonMessage));

        log.debug("WebSocket 메시지 전송 완료: {} - {}", event.getType(), event.getMessage());
    }

    /**
     * 실행과 무관한 요청 오류 전송. 전송 실패는 로그만 남긴다.
     */
    public void sendError(WebSocketSession session, String errorMessage) {
        try {
            sendEvent(session, StreamEvent.error(errorMessage));
        } catch (IOException e) {
            log.error("WebSocket 에러 메시지 전송 실패: {} - {}", errorMessage, e.getMessage());
        }
    }
}
