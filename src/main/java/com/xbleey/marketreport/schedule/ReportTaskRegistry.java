package com.xbleey.marketreport.schedule;

import com.xbleey.marketreport.config.ReportTaskProperties;
import com.xbleey.marketreport.model.TriggerSpec;
import com.xbleey.marketreport.task.ReportTaskFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registered report tasks in configuration order, which is also their execution order within a tick.
 */
@Component
public class ReportTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReportTaskRegistry.class);

    private final List<ScheduledReport> reports;

    @Autowired
    public ReportTaskRegistry(ReportTaskProperties properties, ReportTaskFactory factory) {
        List<ScheduledReport> built = new ArrayList<>();
        List<ReportTaskProperties.TaskDefinition> tasks = properties.getTasks();
        for (int i = 0; i < tasks.size(); i++) {
            ReportTaskProperties.TaskDefinition definition = tasks.get(i);
            TriggerSpec trigger = new TriggerSpec(
                    definition.getId(),
                    definition.triggerTime("report.tasks[" + i + "]"),
                    definition.resolvedMarkerId()
            );
            built.add(new ScheduledReport(trigger, factory.create(definition)));
            log.info("Registered report task {} ({}) daily at {}", trigger.taskId(), definition.getType(),
                    trigger.triggerTime());
        }
        this.reports = List.copyOf(built);
    }

    public ReportTaskRegistry(List<ScheduledReport> reports) {
        this.reports = List.copyOf(reports);
    }

    public List<ScheduledReport> all() {
        return reports;
    }

    public Optional<ScheduledReport> find(String taskId) {
        return reports.stream()
                .filter(report -> report.taskId().equals(taskId))
                .findFirst();
    }
}
