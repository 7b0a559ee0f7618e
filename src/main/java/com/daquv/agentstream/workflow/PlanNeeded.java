package com.daquv.agentstream.workflow;

public enum PlanNeeded {
    UNSET,
    YES,
    NO
}
