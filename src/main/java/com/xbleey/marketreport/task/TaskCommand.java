package com.xbleey.marketreport.task;

import com.xbleey.marketreport.config.ReportTaskProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record TaskCommand(
        List<String> arguments,
        Path workingDirectory,
        Duration timeout,
        ReportExtractor extractor
) {

    public TaskCommand {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("command arguments must not be empty");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        arguments = List.copyOf(arguments);
    }

    public static TaskCommand from(ReportTaskProperties.CommandDefinition definition) {
        String directory = definition.getWorkingDirectory();
        return new TaskCommand(
                definition.getCommand(),
                directory == null || directory.isBlank() ? null : Path.of(directory),
                definition.getTimeout(),
                ReportExtractor.from(definition)
        );
    }

    public TaskCommand withExtraArguments(List<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(arguments);
        merged.addAll(extra);
        return new TaskCommand(merged, workingDirectory, timeout, extractor);
    }
}
