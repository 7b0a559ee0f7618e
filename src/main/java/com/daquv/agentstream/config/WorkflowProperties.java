package com.daquv.agentstream.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 워크플로우 실행 설정 (agent.workflow.*)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "agent.workflow")
public class WorkflowProperties {

    /** plan 노드가 실행 필요로 판단하는 키워드 (대소문자 무시, 부분 문자열 매칭) */
    @NotEmpty
    private List<String> planKeywords = new ArrayList<>(Arrays.asList("simular", "ejecutar"));

    @NotNull
    private Duration planDelay = Duration.ofMillis(500);

    @NotNull
    private Duration executeDelay = Duration.ofSeconds(3);

    @NotNull
    private Duration checkDelay = Duration.ofMillis(500);

    /** 노드 1개 실행 제한 시간. 초과 시 노드 실행 실패로 처리 */
    @NotNull
    private Duration nodeTimeout = Duration.ofSeconds(30);

    /** 실행 1회당 최대 노드 실행 횟수 */
    @Min(1)
    private int maxSteps = 25;

    private int nodePoolSize = 8;

    private int nodeQueueCapacity = 100;
}
