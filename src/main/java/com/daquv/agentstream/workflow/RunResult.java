package com.daquv.agentstream.workflow;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@RequiredArgsConstructor
public class RunResult {
    private final String runId;
    private final AgentState finalState;
    private final List<String> visitedNodes;
}
