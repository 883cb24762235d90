package com.xbleey.marketreport.cli;

import com.xbleey.marketreport.enums.AnalysisType;
import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Command line switches: {@code --schedule}, {@code --once}, {@code --task=a,b} and the analysis
 * selectors {@code --industry}, {@code --volume}, {@code --us}, {@code --all}.
 * Without a mode switch the tasks run once. {@code --all} selects every analysis, which
 * overrides the analyses configured for a command task.
 */
public record LaunchOptions(boolean schedule, List<String> taskIds, List<AnalysisType> analysisTypes) {

    public static LaunchOptions from(ApplicationArguments args) {
        boolean schedule = args.containsOption("schedule");
        if (schedule && args.containsOption("once")) {
            throw new IllegalArgumentException("--schedule and --once cannot be combined");
        }
        Set<String> taskIds = new LinkedHashSet<>();
        List<String> taskValues = args.getOptionValues("task");
        if (taskValues != null) {
            for (String value : taskValues) {
                for (String id : value.split(",")) {
                    if (!id.isBlank()) {
                        taskIds.add(id.trim());
                    }
                }
            }
        }
        List<AnalysisType> analysisTypes = new ArrayList<>();
        if (args.containsOption("all")) {
            analysisTypes.addAll(List.of(AnalysisType.values()));
        } else {
            if (args.containsOption("industry")) {
                analysisTypes.add(AnalysisType.INDUSTRY_FLOW);
            }
            if (args.containsOption("volume")) {
                analysisTypes.add(AnalysisType.ABNORMAL_VOLUME);
            }
            if (args.containsOption("us")) {
                analysisTypes.add(AnalysisType.US_STOCK);
            }
        }
        return new LaunchOptions(schedule, List.copyOf(taskIds), List.copyOf(analysisTypes));
    }
}
