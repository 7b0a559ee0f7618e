package com.daquv.agentstream.stream;

public enum StreamEventType {
    PROGRESS("progress"),
    RESULT("result"),
    ERROR("error"),
    SENTINEL("end");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
