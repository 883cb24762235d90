package com.xbleey.marketreport.schedule;

import java.time.LocalDateTime;

public record TickSummary(LocalDateTime tickTime, int executed, int succeeded) {
}
