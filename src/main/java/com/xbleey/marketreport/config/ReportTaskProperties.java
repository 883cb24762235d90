package com.xbleey.marketreport.config;

import com.xbleey.marketreport.enums.AnalysisType;
import com.xbleey.marketreport.enums.ProviderType;
import com.xbleey.marketreport.enums.ReportTaskType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Data
@Component
@ConfigurationProperties(prefix = "report")
public class ReportTaskProperties {

    public static final DateTimeFormatter TRIGGER_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final Pattern MARKER_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private List<TaskDefinition> tasks = new ArrayList<>();

    public void setTasks(List<TaskDefinition> tasks) {
        this.tasks = tasks == null ? new ArrayList<>() : new ArrayList<>(tasks);
    }

    @PostConstruct
    public void validate() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < tasks.size(); i++) {
            TaskDefinition task = tasks.get(i);
            String prefix = "report.tasks[" + i + "]";
            if (task == null || isBlank(task.getId())) {
                throw new IllegalStateException(prefix + ".id must be configured");
            }
            if (!ids.add(task.getId())) {
                throw new IllegalStateException(prefix + ".id duplicates task " + task.getId());
            }
            task.triggerTime(prefix);
            if (!MARKER_ID_PATTERN.matcher(task.resolvedMarkerId()).matches()) {
                throw new IllegalStateException(prefix + ".marker-id may only contain letters, digits, '.', '_' and '-'");
            }
            if (task.getType() == null) {
                throw new IllegalStateException(prefix + ".type must be configured");
            }
            if (task.getType() == ReportTaskType.COMMAND) {
                validateCommand(task.getCommand(), prefix + ".command");
            } else {
                validateProviders(task.getProviders(), prefix + ".providers");
            }
        }
    }

    private static void validateCommand(CommandDefinition command, String prefix) {
        if (command == null || command.getCommand() == null || command.getCommand().isEmpty()) {
            throw new IllegalStateException(prefix + ".command must be configured");
        }
        if (command.getTimeout() == null || command.getTimeout().isZero() || command.getTimeout().isNegative()) {
            throw new IllegalStateException(prefix + ".timeout must be > 0");
        }
        for (String code : command.getAnalysisTypes()) {
            try {
                AnalysisType.fromCode(code);
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException(prefix + ".analysis-types: " + ex.getMessage());
            }
        }
    }

    private static void validateProviders(List<ProviderDefinition> providers, String prefix) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalStateException(prefix + " must contain at least one provider");
        }
        for (int i = 0; i < providers.size(); i++) {
            ProviderDefinition provider = providers.get(i);
            String path = prefix + "[" + i + "]";
            if (provider == null || provider.getType() == null) {
                throw new IllegalStateException(path + ".type must be configured");
            }
            switch (provider.getType()) {
                case CHAT_MODEL -> {
                    require(provider.getBaseUrl(), path + ".base-url");
                    require(provider.getModel(), path + ".model");
                }
                case JSON_FEED -> {
                    require(provider.getUrl(), path + ".url");
                    require(provider.getTitleField(), path + ".title-field");
                    String pointer = provider.getItemsPointer();
                    if (pointer != null && !pointer.isEmpty() && !pointer.startsWith("/")) {
                        throw new IllegalStateException(path + ".items-pointer must be empty or start with '/'");
                    }
                }
                case HTML_SCRAPE -> {
                    require(provider.getUrl(), path + ".url");
                    require(provider.getSelector(), path + ".selector");
                }
                case COMMAND -> validateCommand(provider.getCommand(), path + ".command");
                default -> throw new IllegalStateException(path + ".type is not supported");
            }
        }
    }

    private static void require(String value, String path) {
        if (isBlank(value)) {
            throw new IllegalStateException(path + " must be configured");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Data
    public static class TaskDefinition {

        private String id;
        private String triggerTime;
        private String markerId;
        private ReportTaskType type = ReportTaskType.COMMAND;
        private String title;
        private List<String> channels = new ArrayList<>();
        private CommandDefinition command;
        private List<ProviderDefinition> providers = new ArrayList<>();

        public String resolvedMarkerId() {
            return isBlank(markerId) ? id : markerId.trim();
        }

        public String resolvedTitle() {
            return isBlank(title) ? id : title.trim();
        }

        public LocalTime triggerTime(String path) {
            if (isBlank(triggerTime)) {
                throw new IllegalStateException(path + ".trigger-time must be configured");
            }
            try {
                return LocalTime.parse(triggerTime.trim(), TRIGGER_TIME_FORMAT);
            } catch (DateTimeParseException ex) {
                throw new IllegalStateException(path + ".trigger-time must be HH:mm, was " + triggerTime);
            }
        }
    }

    @Data
    public static class CommandDefinition {

        private List<String> command = new ArrayList<>();
        private String workingDirectory;
        private List<String> analysisTypes = new ArrayList<>();
        private Duration timeout = Duration.ofMinutes(5);
        private String startMarker = "\n分析报告:\n\n";
        private String endMarker = "\n\n=====";
        private List<String> keywords = new ArrayList<>(List.of(
                "资金流入最多",
                "资金流出最多",
                "成交量最大",
                "涨幅最大",
                "跌幅最大"
        ));
        private int fallbackLength = 1000;

        public List<AnalysisType> resolvedAnalysisTypes() {
            List<AnalysisType> types = new ArrayList<>();
            for (String code : analysisTypes) {
                types.add(AnalysisType.fromCode(code));
            }
            return types;
        }
    }

    @Data
    public static class ProviderDefinition {

        private String name;
        private ProviderType type;
        private int priority;
        private String url;
        private String baseUrl;
        private String model;
        private String prompt;
        private String itemsPointer = "";
        private String titleField;
        private String summaryField;
        private String selector;
        private int limit = 10;
        private Duration timeout = Duration.ofSeconds(60);
        private CommandDefinition command;

        public String resolvedName() {
            if (!isBlank(name)) {
                return name.trim();
            }
            return type == null ? "provider-" + priority : type.name().toLowerCase(Locale.ROOT) + "-" + priority;
        }
    }
}
