package com.xbleey.marketreport.task;

import com.xbleey.marketreport.model.TaskExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external analysis command with a wall-clock limit and extracts its report.
 */
@Component
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);
    private static final int FULL_OUTPUT_LOG_LIMIT = 1000;
    private static final int OUTPUT_PREVIEW_LENGTH = 100;
    private static final long TERMINATION_WAIT_SECONDS = 5;

    public TaskExecutionResult execute(String taskId, TaskCommand command) {
        log.info("Running task {}: {}", taskId, String.join(" ", command.arguments()));
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("report-task-", ".out");
            ProcessBuilder builder = new ProcessBuilder(command.arguments())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            if (command.workingDirectory() != null) {
                builder.directory(command.workingDirectory().toFile());
            }
            process = builder.start();
            boolean finished = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                terminate(process);
                log.error("Task {} timed out after {}s", taskId, command.timeout().toSeconds());
                return TaskExecutionResult.failed();
            }
            String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            logOutput(taskId, exitCode, output);
            if (exitCode != 0) {
                log.error("Task {} failed with exit code {}", taskId, exitCode);
                return TaskExecutionResult.failed();
            }
            Optional<String> report = command.extractor().extract(output);
            if (report.isEmpty()) {
                log.error("Task {} finished but produced no report", taskId);
                return TaskExecutionResult.failed();
            }
            return TaskExecutionResult.of(report.get());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            terminate(process);
            log.error("Task {} interrupted", taskId);
            return TaskExecutionResult.failed();
        } catch (IOException ex) {
            log.error("Task {} could not be run", taskId, ex);
            return TaskExecutionResult.failed();
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static void logOutput(String taskId, int exitCode, String output) {
        log.info("Task {} exit code {}, output length {} chars", taskId, exitCode, output.length());
        if (output.isEmpty()) {
            return;
        }
        if (output.length() < FULL_OUTPUT_LOG_LIMIT) {
            log.info("Task {} output:\n{}", taskId, output);
        } else {
            log.info("Task {} output head:\n{}...", taskId, output.substring(0, OUTPUT_PREVIEW_LENGTH));
        }
    }

    private static void terminate(Process process) {
        if (process == null) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Process {} did not exit after forced termination", process.pid());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.debug("Failed to delete task output file {}", file, ex);
        }
    }
}
