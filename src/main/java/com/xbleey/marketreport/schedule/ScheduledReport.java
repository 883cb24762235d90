package com.xbleey.marketreport.schedule;

import com.xbleey.marketreport.model.TriggerSpec;
import com.xbleey.marketreport.task.ReportTask;

public record ScheduledReport(TriggerSpec trigger, ReportTask task) {

    public String taskId() {
        return trigger.taskId();
    }
}
