package com.xbleey.marketreport.task;

import com.xbleey.marketreport.enums.AnalysisType;

import java.util.List;

/**
 * One scheduled report: produce it and hand it to the notification channels.
 */
public interface ReportTask {

    String taskId();

    /**
     * @return true when a report was produced, whether or not delivery succeeded
     */
    boolean execute();

    /**
     * Variant of this task restricted to the given analyses; tasks without analysis selection return themselves.
     */
    default ReportTask withAnalysisTypes(List<AnalysisType> analysisTypes) {
        return this;
    }
}
