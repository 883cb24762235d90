package com.xbleey.marketreport.model;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

public record TriggerSpec(
        String taskId,
        LocalTime triggerTime,
        String markerId
) {

    public TriggerSpec {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        if (triggerTime == null) {
            throw new IllegalArgumentException("triggerTime must not be null");
        }
        triggerTime = triggerTime.truncatedTo(ChronoUnit.MINUTES);
        markerId = markerId == null || markerId.isBlank() ? taskId : markerId;
    }

    public boolean matchesMinute(LocalTime time) {
        return triggerTime.equals(time.truncatedTo(ChronoUnit.MINUTES));
    }

    public boolean reachedBy(LocalTime time) {
        return !time.truncatedTo(ChronoUnit.MINUTES).isBefore(triggerTime);
    }
}
