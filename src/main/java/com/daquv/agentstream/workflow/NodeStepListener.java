package com.daquv.agentstream.workflow;

@FunctionalInterface
public interface NodeStepListener {

    NodeStepListener NONE = step -> { };

    /**
     * 노드 완료마다 실행 스레드에서 순서대로 호출된다.
     */
    void onStep(NodeStep step) throws InterruptedException;
}
