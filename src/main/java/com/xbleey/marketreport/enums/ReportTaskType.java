package com.xbleey.marketreport.enums;

public enum ReportTaskType {
    COMMAND,
    FALLBACK_CHAIN
}
