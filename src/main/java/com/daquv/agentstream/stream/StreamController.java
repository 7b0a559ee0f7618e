package com.daquv.agentstream.stream;

import com.daquv.agentstream.stream.util.SseFrames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@RestController
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private static final MediaType EVENT_STREAM_UTF8 = new MediaType("text", "event-stream", StandardCharsets.UTF_8);

    private final StreamingBridge streamingBridge;

    public StreamController(StreamingBridge streamingBridge) {
        this.streamingBridge = streamingBridge;
    }

    /**
     * 프롬프트 1건을 실행하고 진행 상황을 SSE로 전송
     */
    @GetMapping("/stream")
    public ResponseEntity<StreamingResponseBody> stream(@RequestParam(value = "prompt", required = false) String prompt) {
        log.info("😊 HTTP Stream 요청 수신: {}", prompt);

        StreamingResponseBody body = out -> {
            StreamSession session = streamingBridge.open(prompt);
            try {
                StreamEvent event;
                while ((event = session.next()) != null) {
                    SseFrames.write(out, event.getMessage());
                }
                log.info("스트림 전송 완료 - runId: {}", session.getRunId());

            } catch (IOException e) {
                log.warn("클라이언트 연결 끊김 - runId: {}: {}", session.getRunId(), e.getMessage());
                session.cancel("client disconnected", true);

            } catch (InterruptedException e) {
                log.warn("스트림 전송 중 인터럽트 - runId: {}", session.getRunId());
                session.cancel("stream writer interrupted", true);
                Thread.currentThread().interrupt();
            }
        };

        return ResponseEntity.ok()
                .contentType(EVENT_STREAM_UTF8)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "*")
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "*")
                .body(body);
    }
}
