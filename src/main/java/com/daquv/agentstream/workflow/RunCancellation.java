package com.daquv.agentstream.workflow;

import com.daquv.agentstream.workflow.exception.RunCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 실행 1회에 대한 외부 취소 신호
 * 취소 시 실행 중인 노드를 인터럽트하고, 다음 노드 시작 전에 실행을 중단시킨다.
 */
public class RunCancellation {

    private final AtomicReference<String> reason = new AtomicReference<>();

    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /**
     * @return 이번 호출로 처음 취소된 경우 true
     */
    public boolean cancel(String cancelReason) {
        if (!reason.compareAndSet(null, cancelReason != null ? cancelReason : "cancelled")) {
            return false;
        }
        cancelled.countDown();
        Future<?> future = inFlight.get();
        if (future != null) {
            future.cancel(true);
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException("실행이 취소되었습니다: " + reason.get());
        }
    }

    /**
     * 주어진 시간만큼 대기하되, 취소되면 즉시 중단
     */
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            throwIfCancelled();
            return;
        }
        if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
            throwIfCancelled();
        }
    }

    void bind(Future<?> future) {
        inFlight.set(future);
        // bind 직전에 취소된 경우
        if (isCancelled()) {
            future.cancel(true);
        }
    }

    void unbind() {
        inFlight.set(null);
    }
}
