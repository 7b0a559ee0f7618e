package com.daquv.agentstream.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스트리밍 설정 (agent.stream.*)
 * 노드별 진행 메시지와 종료/에러 문구는 클라이언트에 노출되는 계약이다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "agent.stream")
public class StreamProperties {

    /** 노드 ID -> 진행 메시지 */
    @NotNull
    private Map<String, String> progressMessages = defaultProgressMessages();

    @NotBlank
    private String sentinelMessage = "--- END OF STREAM ---";

    @NotBlank
    private String errorPrefix = "**[FATAL ERROR]**";

    /** 결과 이벤트 앞에 붙는 문구. 비어 있으면 답변만 전송한다 */
    private String resultPrefix = "";

    @NotBlank
    private String emptyPromptMessage = "ERROR: No prompt was provided.";

    @NotBlank
    private String missingAnswerMessage = "Error: no final answer was generated.";

    /** 진행 메시지 전송 후 대기 시간 */
    @NotNull
    private Duration progressPause = Duration.ofMillis(500);

    /** 실행별 이벤트 채널 크기. 결과+종료 이벤트를 담을 수 있도록 최소 2 */
    @Min(2)
    private int channelCapacity = 16;

    /** 이 시간을 넘긴 실행은 취소된다 */
    @NotNull
    private Duration maxRunDuration = Duration.ofMinutes(5);

    private int runPoolSize = 16;

    private int runQueueCapacity = 100;

    /** SSE 비동기 요청 타임아웃 */
    @NotNull
    private Duration asyncTimeout = Duration.ofMinutes(10);

    private static Map<String, String> defaultProgressMessages() {
        Map<String, String> messages = new LinkedHashMap<>();
        messages.put("plan", "**Step 1: [PLANNING].** Analyzing the user's request...");
        messages.put("execute", "**Step 2: [EXECUTION].** Complex task detected. Starting 3-second simulation...");
        messages.put("check_result", "**Step 3: [VERIFICATION].** Collecting and formatting the final answer.");
        return messages;
    }
}
