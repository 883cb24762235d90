package com.xbleey.marketreport.controller;

import com.xbleey.marketreport.enums.AnalysisType;
import com.xbleey.marketreport.enums.TriggerState;
import com.xbleey.marketreport.model.TaskStatus;
import com.xbleey.marketreport.schedule.DailyReportScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportTaskControllerTest {

    @Test
    void listTasksReturnsSchedulerStatuses() {
        DailyReportScheduler scheduler = mock(DailyReportScheduler.class);
        TaskStatus status = new TaskStatus("market-analysis", "09:45", "last_run",
                LocalDate.of(2026, 3, 2), TriggerState.DONE_SUCCESS);
        when(scheduler.statuses()).thenReturn(List.of(status));

        assertThat(new ReportTaskController(scheduler).listTasks()).containsExactly(status);
    }

    @Test
    void runTaskPassesParsedAnalyses() {
        DailyReportScheduler scheduler = mock(DailyReportScheduler.class);
        when(scheduler.runNow("market-analysis", List.of(AnalysisType.INDUSTRY_FLOW))).thenReturn(true);
        when(scheduler.stateOf("market-analysis")).thenReturn(TriggerState.DONE_SUCCESS);

        Map<String, Object> response = new ReportTaskController(scheduler)
                .runTask("market-analysis", List.of("industry_flow"));

        assertThat(response).containsEntry("produced", true);
        assertThat(response).containsEntry("state", TriggerState.DONE_SUCCESS);
    }

    @Test
    void unknownTaskIsNotFound() {
        DailyReportScheduler scheduler = mock(DailyReportScheduler.class);
        when(scheduler.runNow("nope", List.of())).thenThrow(new NoSuchElementException("Unknown report task: nope"));

        assertThatThrownBy(() -> new ReportTaskController(scheduler).runTask("nope", null))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void unknownAnalysisIsBadRequest() {
        DailyReportScheduler scheduler = mock(DailyReportScheduler.class);

        assertThatThrownBy(() -> new ReportTaskController(scheduler).runTask("market-analysis", List.of("crypto")))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
        verify(scheduler, never()).runNow(anyString(), anyList());
    }
}
