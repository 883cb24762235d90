package com.xbleey.marketreport.task;

import com.xbleey.marketreport.config.ReportTaskProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls the report block out of captured command output.
 * <p>
 * Order of attempts: text between the start and end markers, then every line that
 * mentions a keyword, then the head of the raw output.
 */
public class ReportExtractor {

    private final String startMarker;
    private final String endMarker;
    private final List<String> keywords;
    private final int fallbackLength;

    public ReportExtractor(String startMarker, String endMarker, List<String> keywords, int fallbackLength) {
        this.startMarker = startMarker;
        this.endMarker = endMarker;
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
        this.fallbackLength = Math.max(0, fallbackLength);
    }

    public static ReportExtractor from(ReportTaskProperties.CommandDefinition definition) {
        return new ReportExtractor(
                definition.getStartMarker(),
                definition.getEndMarker(),
                definition.getKeywords(),
                definition.getFallbackLength()
        );
    }

    public Optional<String> extract(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        if (hasStartMarker(output)) {
            // an empty marked block means the run produced no report
            return extractMarkedBlock(output);
        }
        Optional<String> keywordLines = extractKeywordLines(output);
        if (keywordLines.isPresent()) {
            return keywordLines;
        }
        String head = head(output);
        return head.isBlank() ? Optional.empty() : Optional.of(head);
    }

    boolean hasStartMarker(String output) {
        return startMarker != null && !startMarker.isEmpty() && output.contains(startMarker);
    }

    Optional<String> extractMarkedBlock(String output) {
        if (!hasStartMarker(output)) {
            return Optional.empty();
        }
        int start = output.indexOf(startMarker);
        String report = output.substring(start + startMarker.length());
        if (endMarker != null && !endMarker.isEmpty()) {
            int end = report.indexOf(endMarker);
            if (end >= 0) {
                report = report.substring(0, end);
            }
        }
        report = report.trim();
        return report.isEmpty() ? Optional.empty() : Optional.of(report);
    }

    String head(String output) {
        if (output.length() <= fallbackLength) {
            return output;
        }
        int end = fallbackLength;
        if (end > 0 && Character.isHighSurrogate(output.charAt(end - 1))) {
            end--;
        }
        return output.substring(0, end);
    }

    Optional<String> extractKeywordLines(String output) {
        if (keywords.isEmpty()) {
            return Optional.empty();
        }
        List<String> matched = new ArrayList<>();
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            for (String keyword : keywords) {
                if (line.contains(keyword)) {
                    matched.add(trimmed);
                    break;
                }
            }
        }
        return matched.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", matched));
    }
}
