package com.xbleey.marketreport.cli;

import com.xbleey.marketreport.schedule.DailyReportScheduler;
import com.xbleey.marketreport.schedule.ReportSchedulerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ReportCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReportCommandLineRunner.class);

    private final DailyReportScheduler scheduler;
    private final ReportSchedulerLoop schedulerLoop;
    private final ApplicationExitHandler exitHandler;

    public ReportCommandLineRunner(
            DailyReportScheduler scheduler,
            ReportSchedulerLoop schedulerLoop,
            ApplicationExitHandler exitHandler
    ) {
        this.scheduler = scheduler;
        this.schedulerLoop = schedulerLoop;
        this.exitHandler = exitHandler;
    }

    @Override
    public void run(ApplicationArguments args) {
        LaunchOptions options;
        try {
            options = LaunchOptions.from(args);
        } catch (IllegalArgumentException ex) {
            log.error("Invalid arguments: {}", ex.getMessage());
            exitHandler.exit(2);
            return;
        }
        if (options.schedule()) {
            schedulerLoop.start();
            return;
        }
        exitHandler.exit(runOnce(options));
    }

    int runOnce(LaunchOptions options) {
        log.info("Running report tasks once: tasks={} analyses={}",
                options.taskIds().isEmpty() ? "all" : options.taskIds(), options.analysisTypes());
        Map<String, Boolean> results;
        try {
            results = scheduler.runOnce(options.taskIds(), options.analysisTypes());
        } catch (IllegalArgumentException ex) {
            log.error("Cannot run tasks: {}", ex.getMessage());
            return 2;
        } catch (RuntimeException ex) {
            log.error("Report run failed", ex);
            return 1;
        }
        boolean allProduced = !results.isEmpty() && results.values().stream().allMatch(Boolean::booleanValue);
        log.info("Run finished: {}", results);
        return allProduced ? 0 : 1;
    }
}
