package com.xbleey.marketreport.task;

import com.xbleey.marketreport.enums.AnalysisType;
import com.xbleey.marketreport.model.TaskExecutionResult;
import com.xbleey.marketreport.notify.ReportDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Report produced by an external analysis command, selected analyses passed as flags.
 */
public class CommandReportTask implements ReportTask {

    private static final Logger log = LoggerFactory.getLogger(CommandReportTask.class);

    private final String taskId;
    private final TaskCommand command;
    private final List<AnalysisType> analysisTypes;
    private final TaskRunner taskRunner;
    private final ReportDelivery delivery;

    public CommandReportTask(
            String taskId,
            TaskCommand command,
            List<AnalysisType> analysisTypes,
            TaskRunner taskRunner,
            ReportDelivery delivery
    ) {
        this.taskId = taskId;
        this.command = command;
        this.analysisTypes = analysisTypes == null ? List.of() : List.copyOf(analysisTypes);
        this.taskRunner = taskRunner;
        this.delivery = delivery;
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public boolean execute() {
        TaskExecutionResult result = taskRunner.execute(taskId, command.withExtraArguments(analysisFlags()));
        if (result.messageText().isEmpty()) {
            log.error("Task {} produced no report, nothing to send", taskId);
            return false;
        }
        log.info("Task {} produced a report, sending notification", taskId);
        delivery.deliver(result.message());
        return true;
    }

    @Override
    public ReportTask withAnalysisTypes(List<AnalysisType> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        return new CommandReportTask(taskId, command, overrides, taskRunner, delivery);
    }

    public List<String> analysisFlags() {
        if (analysisTypes.isEmpty() || analysisTypes.containsAll(List.of(AnalysisType.values()))) {
            return List.of(AnalysisType.ALL_FLAG);
        }
        List<String> flags = new ArrayList<>();
        for (AnalysisType type : analysisTypes) {
            flags.add(type.getFlag());
        }
        return flags;
    }
}
