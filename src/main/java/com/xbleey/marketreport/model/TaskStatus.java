package com.xbleey.marketreport.model;

import com.xbleey.marketreport.enums.TriggerState;

import java.time.LocalDate;

public record TaskStatus(
        String taskId,
        String triggerTime,
        String markerId,
        LocalDate lastRunDate,
        TriggerState state
) {
}
