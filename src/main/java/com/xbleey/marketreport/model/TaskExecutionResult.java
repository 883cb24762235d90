package com.xbleey.marketreport.model;

import java.util.Optional;

public record TaskExecutionResult(String message, boolean success) {

    private static final TaskExecutionResult FAILED = new TaskExecutionResult(null, false);

    public TaskExecutionResult {
        if (message != null && message.isBlank()) {
            message = null;
        }
        if (message == null) {
            success = false;
        }
    }

    public static TaskExecutionResult failed() {
        return FAILED;
    }

    public static TaskExecutionResult of(String message) {
        return new TaskExecutionResult(message, true);
    }

    public Optional<String> messageText() {
        return Optional.ofNullable(message);
    }
}
