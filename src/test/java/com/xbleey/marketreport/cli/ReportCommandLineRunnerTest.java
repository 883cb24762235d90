package com.xbleey.marketreport.cli;

import com.xbleey.marketreport.schedule.DailyReportScheduler;
import com.xbleey.marketreport.schedule.ReportSchedulerLoop;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ReportCommandLineRunnerTest {

    private final DailyReportScheduler scheduler = mock(DailyReportScheduler.class);
    private final ReportSchedulerLoop loop = mock(ReportSchedulerLoop.class);
    private final ApplicationExitHandler exitHandler = mock(ApplicationExitHandler.class);
    private final ReportCommandLineRunner runner = new ReportCommandLineRunner(scheduler, loop, exitHandler);

    @Test
    void scheduleStartsLoopAndKeepsRunning() {
        runner.run(new DefaultApplicationArguments("--schedule"));

        verify(loop).start();
        verifyNoInteractions(exitHandler);
    }

    @Test
    void onceExitsZeroWhenEveryTaskProducedAReport() {
        when(scheduler.runOnce(List.of("market-analysis"), List.of()))
                .thenReturn(Map.of("market-analysis", true));

        runner.run(new DefaultApplicationArguments("--once", "--task=market-analysis"));

        verify(exitHandler).exit(0);
        verifyNoInteractions(loop);
    }

    @Test
    void onceExitsOneWhenAnyTaskFailed() {
        when(scheduler.runOnce(List.of(), List.of()))
                .thenReturn(Map.of("market-analysis", true, "macro-data", false));

        runner.run(new DefaultApplicationArguments());

        verify(exitHandler).exit(1);
    }

    @Test
    void unknownTaskExitsTwo() {
        when(scheduler.runOnce(List.of("nope"), List.of()))
                .thenThrow(new IllegalArgumentException("Unknown report task: nope"));

        runner.run(new DefaultApplicationArguments("--task=nope"));

        verify(exitHandler).exit(2);
    }

    @Test
    void conflictingModesExitTwo() {
        runner.run(new DefaultApplicationArguments("--schedule", "--once"));

        verify(exitHandler).exit(2);
        verifyNoInteractions(loop, scheduler);
    }
}
