package com.xbleey.marketreport.schedule;

import com.xbleey.marketreport.config.ReportScheduleProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link DailyReportScheduler#tick()} forever. A failed tick is logged and the
 * next one waits for the error cooldown instead of the normal interval.
 */
@Service
public class ReportSchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(ReportSchedulerLoop.class);

    private final TaskScheduler taskScheduler;
    private final DailyReportScheduler scheduler;
    private final ReportScheduleProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile ScheduledFuture<?> next;
    private volatile Instant lastTickAt;
    private volatile String lastTickError;

    public ReportSchedulerLoop(
            @Qualifier("reportTaskScheduler") TaskScheduler taskScheduler,
            DailyReportScheduler scheduler,
            ReportScheduleProperties properties,
            Clock clock
    ) {
        this.taskScheduler = taskScheduler;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scheduler loop already running");
            return;
        }
        log.info("Scheduler loop started, tick every {}, zone {}", properties.getTickInterval(), properties.getZone());
        scheduleNext(Duration.ZERO);
    }

    void runTick() {
        if (!running.get()) {
            return;
        }
        Duration delay = properties.getTickInterval();
        try {
            TickSummary summary = scheduler.tick();
            lastTickError = null;
            if (summary.executed() > 0) {
                log.info("Tick at {} ran {} task(s), {} produced a report",
                        summary.tickTime(), summary.executed(), summary.succeeded());
            }
        } catch (Throwable ex) {
            // the loop only ends through stop(), so errors are survived as well
            lastTickError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
            delay = properties.getErrorCooldown();
            log.error("Scheduler tick failed, retrying in {}", delay, ex);
        } finally {
            lastTickAt = Instant.now(clock);
        }
        scheduleNext(delay);
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> future = next;
        if (future != null) {
            future.cancel(false);
        }
        log.info("Scheduler loop stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    public String getLastTickError() {
        return lastTickError;
    }

    private void scheduleNext(Duration delay) {
        if (!running.get()) {
            return;
        }
        next = taskScheduler.schedule(this::runTick, Instant.now(clock).plus(delay));
    }
}
