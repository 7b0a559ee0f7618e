package com.daquv.agentstream.stream;

import com.daquv.agentstream.config.StreamProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 진행 중인 실행 관리
 * 실행 상태는 각 실행이 소유하며, 여기서는 취소를 위해 세션 핸들만 보관한다.
 */
@Component
@Slf4j
public class RunRegistry {

    // runId별 진행 중인 세션
    private final ConcurrentHashMap<String, StreamSession> activeRuns = new ConcurrentHashMap<>();

    private final Duration maxRunDuration;

    public RunRegistry(StreamProperties streamProperties) {
        this.maxRunDuration = streamProperties.getMaxRunDuration();
    }

    public void register(StreamSession session) {
        activeRuns.put(session.getRunId(), session);
        log.debug("실행 등록 - runId: {}, active: {}", session.getRunId(), activeRuns.size());
    }

    public void remove(String runId) {
        if (runId != null && activeRuns.remove(runId) != null) {
            log.debug("실행 제거 - runId: {}, active: {}", runId, activeRuns.size());
        }
    }

    public StreamSession get(String runId) {
        return runId != null ? activeRuns.get(runId) : null;
    }

    public int activeCount() {
        return activeRuns.size();
    }

    /**
     * 최대 실행 시간을 넘긴 실행 취소
     */
    @Scheduled(fixedDelayString = "${agent.stream.sweep-interval-ms:30000}")
    public void cancelOverdueRuns() {
        Instant deadline = Instant.now().minus(maxRunDuration);
        List<StreamSession> overdue = new ArrayList<>();

        activeRuns.values().forEach(session -> {
            if (session.getStartedAt().isBefore(deadline)) {
                overdue.add(session);
            }
        });

        overdue.forEach(session -> session.cancel("최대 실행 시간 초과 (" + maxRunDuration + ")", false));

        if (!overdue.isEmpty()) {
            log.warn("최대 실행 시간을 넘긴 실행 {} 개 취소", overdue.size());
        }
    }

    /**
     * 종료 시 진행 중인 실행 모두 취소
     */
    @PreDestroy
    public void cancelAll() {
        if (activeRuns.isEmpty()) {
            return;
        }
        log.info("애플리케이션 종료 - 진행 중인 실행 {} 개 취소", activeRuns.size());
        activeRuns.values().forEach(session -> session.cancel("application shutdown", false));
    }
}
