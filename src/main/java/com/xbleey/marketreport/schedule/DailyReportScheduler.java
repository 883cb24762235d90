package com.xbleey.marketreport.schedule;

import com.xbleey.marketreport.config.ReportScheduleProperties;
import com.xbleey.marketreport.enums.AnalysisType;
import com.xbleey.marketreport.enums.TriggerState;
import com.xbleey.marketreport.model.TaskStatus;
import com.xbleey.marketreport.model.TriggerSpec;
import com.xbleey.marketreport.repository.DailyRunMarkerStore;
import com.xbleey.marketreport.task.ReportTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fires every registered report at most once per calendar day.
 * <p>
 * Each tick walks the triggers in registration order. A trigger is due when its
 * minute has come and its marker does not hold today's date. A task that
 * produced a report gets today's date written to its marker even if delivery
 * failed; a task that produced nothing leaves the marker alone and waits for
 * the next day.
 */
@Service
public class DailyReportScheduler {

    public static final String TASK_ID_KEY = "task.id";

    private static final Logger log = LoggerFactory.getLogger(DailyReportScheduler.class);

    private final ReportTaskRegistry registry;
    private final DailyRunMarkerStore markerStore;
    private final ReportScheduleProperties properties;
    private final Clock clock;
    private final Object executionLock = new Object();
    private final Map<String, TriggerState> states = new ConcurrentHashMap<>();
    private final Map<String, LocalDate> attemptedOn = new ConcurrentHashMap<>();

    public DailyReportScheduler(
            ReportTaskRegistry registry,
            DailyRunMarkerStore markerStore,
            ReportScheduleProperties properties,
            Clock clock
    ) {
        this.registry = registry;
        this.markerStore = markerStore;
        this.properties = properties;
        this.clock = clock;
    }

    public TickSummary tick() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        int executed = 0;
        int succeeded = 0;
        for (ScheduledReport report : registry.all()) {
            if (!isDue(report.trigger(), now.toLocalTime(), today)) {
                continue;
            }
            executed++;
            if (runScheduled(report, today)) {
                succeeded++;
            }
        }
        return new TickSummary(now, executed, succeeded);
    }

    public boolean runNow(String taskId, List<AnalysisType> analysisTypes) {
        ScheduledReport report = registry.find(taskId)
                .orElseThrow(() -> new NoSuchElementException("Unknown report task: " + taskId));
        ReportTask task = report.task().withAnalysisTypes(analysisTypes);
        log.info("Running task {} on demand", taskId);
        return execute(taskId, task);
    }

    public Map<String, Boolean> runOnce(Collection<String> taskIds, List<AnalysisType> analysisTypes) {
        List<String> selected = new ArrayList<>();
        if (taskIds == null || taskIds.isEmpty()) {
            registry.all().forEach(report -> selected.add(report.taskId()));
        } else {
            for (String taskId : taskIds) {
                if (registry.find(taskId).isEmpty()) {
                    throw new IllegalArgumentException("Unknown report task: " + taskId);
                }
                selected.add(taskId);
            }
        }
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String taskId : selected) {
            results.put(taskId, runNow(taskId, analysisTypes));
        }
        return results;
    }

    public List<TaskStatus> statuses() {
        List<TaskStatus> statuses = new ArrayList<>();
        for (ScheduledReport report : registry.all()) {
            TriggerSpec trigger = report.trigger();
            statuses.add(new TaskStatus(
                    trigger.taskId(),
                    trigger.triggerTime().toString(),
                    trigger.markerId(),
                    readMarker(trigger).orElse(null),
                    stateOf(trigger.taskId())
            ));
        }
        return statuses;
    }

    public TriggerState stateOf(String taskId) {
        return states.getOrDefault(taskId, TriggerState.IDLE);
    }

    private boolean isDue(TriggerSpec trigger, LocalTime time, LocalDate today) {
        String taskId = trigger.taskId();
        boolean attemptedToday = today.equals(attemptedOn.get(taskId));
        if (!attemptedToday) {
            states.computeIfPresent(taskId, (id, state) -> state.isDone() ? TriggerState.IDLE : state);
        }
        boolean timeReached = properties.isCatchUp() ? trigger.reachedBy(time) : trigger.matchesMinute(time);
        if (!timeReached || attemptedToday) {
            return false;
        }
        Optional<LocalDate> lastRun = readMarker(trigger);
        if (lastRun.isPresent() && lastRun.get().equals(today)) {
            attemptedOn.put(taskId, today);
            log.info("Task {} already ran today ({}), skipping", taskId, today);
            return false;
        }
        states.put(taskId, TriggerState.DUE);
        return true;
    }

    private boolean runScheduled(ScheduledReport report, LocalDate today) {
        TriggerSpec trigger = report.trigger();
        String taskId = trigger.taskId();
        attemptedOn.put(taskId, today);
        log.info("Trigger time {} reached, running task {}", trigger.triggerTime(), taskId);
        boolean produced = execute(taskId, report.task());
        if (!produced) {
            log.error("Task {} produced no report, next attempt tomorrow at {}", taskId, trigger.triggerTime());
            return false;
        }
        if (!writeMarker(trigger, today)) {
            log.error("Task {} ran but its marker {} was not saved, it may run again", taskId, trigger.markerId());
        }
        log.info("Task {} done for {}, next run tomorrow at {}", taskId, today, trigger.triggerTime());
        return true;
    }

    private boolean execute(String taskId, ReportTask task) {
        synchronized (executionLock) {
            states.put(taskId, TriggerState.RUNNING);
            MDC.put(TASK_ID_KEY, taskId);
            try {
                boolean produced = task.execute();
                states.put(taskId, produced ? TriggerState.DONE_SUCCESS : TriggerState.DONE_FAILURE);
                return produced;
            } catch (RuntimeException ex) {
                states.put(taskId, TriggerState.DONE_FAILURE);
                throw ex;
            } finally {
                MDC.remove(TASK_ID_KEY);
            }
        }
    }

    private Optional<LocalDate> readMarker(TriggerSpec trigger) {
        try {
            return markerStore.readLastRunDate(trigger.markerId());
        } catch (RuntimeException ex) {
            log.warn("Marker {} unreadable, treating task {} as not run", trigger.markerId(), trigger.taskId(), ex);
            return Optional.empty();
        }
    }

    private boolean writeMarker(TriggerSpec trigger, LocalDate today) {
        try {
            return markerStore.writeLastRunDate(trigger.markerId(), today);
        } catch (RuntimeException ex) {
            log.warn("Marker {} write threw", trigger.markerId(), ex);
            return false;
        }
    }
}
