package com.xbleey.marketreport.enums;

public enum TriggerState {
    IDLE,
    DUE,
    RUNNING,
    DONE_SUCCESS,
    DONE_FAILURE;

    public boolean isDone() {
        return this == DONE_SUCCESS || this == DONE_FAILURE;
    }
}
