package com.daquv.agentstream.stream;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 클라이언트에 전달되는 이벤트 1건
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StreamEvent {

    private final StreamEventType type;
    /** PROGRESS 이벤트만 노드 ID를 가진다 */
    private final String nodeId;
    private final String message;

    private StreamEvent(StreamEventType type, String nodeId, String message) {
        this.type = type;
        this.nodeId = nodeId;
        this.message = message;
    }

    public static StreamEvent progress(String nodeId, String message) {
        return new StreamEvent(StreamEventType.PROGRESS, nodeId, message);
    }

    public static StreamEvent result(String message) {
        return new StreamEvent(StreamEventType.RESULT, null, message);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(StreamEventType.ERROR, null, message);
    }

    public static StreamEvent sentinel(String message) {
        return new StreamEvent(StreamEventType.SENTINEL, null, message);
    }

    public boolean isSentinel() {
        return type == StreamEventType.SENTINEL;
    }
}
