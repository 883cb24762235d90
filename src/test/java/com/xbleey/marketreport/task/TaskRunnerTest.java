package com.xbleey.marketreport.task;

import com.xbleey.marketreport.config.ReportTaskProperties;
import com.xbleey.marketreport.model.TaskExecutionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisabledOnOs(OS.WINDOWS)
class TaskRunnerTest {

    private final TaskRunner runner = new TaskRunner();

    @TempDir
    Path tempDir;

    @Test
    void extractsReportFromSuccessfulRun() throws Exception {
        Path script = script("printf 'loading\\n分析报告:\\n\\n报告内容\\n\\n===== DONE =====\\n'\n");

        TaskExecutionResult result = runner.execute("analysis", shell(script, Duration.ofSeconds(10)));

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("报告内容");
    }

    @Test
    void mergesStandardErrorIntoCapturedOutput() throws Exception {
        Path script = script("echo '涨幅最大: 中芯国际' 1>&2\n");

        TaskExecutionResult result = runner.execute("analysis", shell(script, Duration.ofSeconds(10)));

        assertThat(result.messageText()).contains("涨幅最大: 中芯国际");
    }

    @Test
    void nonZeroExitIsFailure() throws Exception {
        Path script = script("echo 'partial output'\nexit 3\n");

        TaskExecutionResult result = runner.execute("analysis", shell(script, Duration.ofSeconds(10)));

        assertThat(result.success()).isFalse();
        assertThat(result.messageText()).isEmpty();
    }

    @Test
    void timeoutKillsTheProcessTree() throws Exception {
        Path witness = tempDir.resolve("survived");
        long started = System.nanoTime();

        Path script = script("(sleep 3; touch '" + witness + "') &\nsleep 30\n");

        TaskExecutionResult result = runner.execute("analysis", shell(script, Duration.ofMillis(500)));

        assertThat(result.success()).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
        Thread.sleep(4000);
        assertThat(Files.exists(witness)).isFalse();
    }

    @Test
    void runsInConfiguredWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("report.txt"), "\n分析报告:\n\n目录内容\n", StandardCharsets.UTF_8);
        TaskCommand command = new TaskCommand(List.of("sh", "-c", "cat report.txt"), tempDir,
                Duration.ofSeconds(10), ReportExtractor.from(new ReportTaskProperties.CommandDefinition()));

        assertThat(runner.execute("analysis", command).message()).isEqualTo("目录内容");
    }

    @Test
    void missingExecutableIsFailure() {
        TaskCommand command = new TaskCommand(List.of("/definitely/not/here"), null,
                Duration.ofSeconds(5), ReportExtractor.from(new ReportTaskProperties.CommandDefinition()));

        assertThat(runner.execute("analysis", command).success()).isFalse();
    }

    private Path script(String body) throws Exception {
        Path script = Files.createTempFile(tempDir, "task-", ".sh");
        Files.writeString(script, body, StandardCharsets.UTF_8);
        return script;
    }

    private static TaskCommand shell(Path script, Duration timeout) {
        return new TaskCommand(List.of("sh", script.toString()), null, timeout,
                ReportExtractor.from(new ReportTaskProperties.CommandDefinition()));
    }
}
