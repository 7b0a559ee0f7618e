package com.daquv.agentstream.stream;

import com.daquv.agentstream.workflow.RunCancellation;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * 전송 계층이 소비하는 실행 1회 핸들 (이벤트 채널 + 취소)
 */
@Slf4j
public class StreamSession {

    private final String runId;
    private final EventChannel channel;
    private final RunCancellation cancellation;
    private final Instant startedAt;

    public StreamSession(String runId, EventChannel channel, RunCancellation cancellation) {
        this.runId = runId;
        this.channel = channel;
        this.cancellation = cancellation;
        this.startedAt = Instant.now();
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public RunCancellation getCancellation() {
        return cancellation;
    }

    EventChannel getChannel() {
        return channel;
    }

    /**
     * 다음 이벤트. 스트림이 끝났으면 null.
     */
    public StreamEvent next() throws InterruptedException {
        return channel.next();
    }

    public boolean isFinished() {
        return channel.isClosed();
    }

    /**
     * 실행 취소. 소비자가 떠난 경우 이후 이벤트는 버려진다.
     */
    public void cancel(String reason, boolean consumerGone) {
        if (consumerGone) {
            channel.abandon();
        }
        if (channel.isClosed()) {
            return;
        }
        if (cancellation.cancel(reason)) {
            log.info("🛑 실행 취소 요청 - runId: {}, reason: {}", runId, reason);
        }
    }
}
