package com.daquv.agentstream.stream.util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * text/event-stream 프레임 작성 유틸리티
 * 메시지의 각 줄을 "data: " 줄로 쓰고 빈 줄로 이벤트를 끝낸다.
 */
public final class SseFrames {

    private static final String DATA_PREFIX = "data: ";

    private SseFrames() {
    }

    public static String frame(String message) {
        String normalized = message == null ? "" : message.replace("\r\n", "\n").replace('\r', '\n');

        StringBuilder frame = new StringBuilder();
        for (String line : normalized.split("\n", -1)) {
            frame.append(DATA_PREFIX).append(line).append('\n');
        }
        return frame.append('\n').toString();
    }

    /**
     * 프레임 1개를 쓰고 바로 flush 한다.
     */
    public static void write(OutputStream out, String message) throws IOException {
        out.write(frame(message).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
