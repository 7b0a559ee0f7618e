package com.daquv.agentstream.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 실행 1회의 이벤트를 전송 계층으로 넘기는 크기 제한 채널
 * 생산자는 채널이 가득 차면 대기하고, 소비자는 close() 이후 남은 이벤트를 모두 읽으면 종료한다.
 * 소비자가 abandon()하면 이후 이벤트는 버려진다.
 */
@Slf4j
public class EventChannel {

    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<StreamEvent> queue;
    private volatile boolean closed;
    private volatile boolean abandoned;

    public EventChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 이벤트 발행. 채널이 가득 차 있으면 소비자가 읽을 때까지 대기한다.
     */
    public void publish(StreamEvent event) throws InterruptedException {
        if (closed) {
            throw new IllegalStateException("닫힌 채널에는 이벤트를 발행할 수 없습니다: " + event);
        }
        while (!abandoned) {
            if (queue.offer(event, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
        log.debug("소비자가 없어 이벤트를 버립니다: {}", event);
    }

    /**
     * 다음 이벤트. 채널이 닫히고 비었거나 소비자가 떠났으면 null.
     */
    public StreamEvent next() throws InterruptedException {
        while (!abandoned) {
            StreamEvent event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (event != null) {
                return abandoned ? null : event;
            }
            if (closed && queue.isEmpty()) {
                return null;
            }
        }
        return null;
    }

    public void close() {
        closed = true;
    }

    public void abandon() {
        abandoned = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isAbandoned() {
        return abandoned;
    }
}
