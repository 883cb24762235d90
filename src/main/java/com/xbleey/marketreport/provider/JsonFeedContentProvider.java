package com.xbleey.marketreport.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.marketreport.notify.ReportDelivery;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aggregator tier: renders the first items of a JSON feed as a numbered list.
 */
public class JsonFeedContentProvider extends HttpContentProvider {

    private final ObjectMapper objectMapper;
    private final String url;
    private final String itemsPointer;
    private final String titleField;
    private final String summaryField;
    private final int limit;

    public JsonFeedContentProvider(
            String name,
            ReportDelivery delivery,
            OkHttpClient okHttpClient,
            ObjectMapper objectMapper,
            String url,
            String itemsPointer,
            String titleField,
            String summaryField,
            int limit
    ) {
        super(name, delivery, okHttpClient);
        this.objectMapper = objectMapper;
        this.url = url;
        this.itemsPointer = itemsPointer == null ? "" : itemsPointer;
        this.titleField = titleField;
        this.summaryField = summaryField;
        this.limit = Math.max(1, limit);
    }

    @Override
    protected Optional<String> produce() throws Exception {
        Request request = new Request.Builder().url(url).get().build();
        JsonNode root = objectMapper.readTree(executeForBody(request));
        JsonNode items = root.at(itemsPointer);
        if (!items.isArray()) {
            throw new IllegalStateException("no array at '" + itemsPointer + "' in feed " + url);
        }
        List<String> lines = new ArrayList<>();
        for (JsonNode item : items) {
            if (lines.size() >= limit) {
                break;
            }
            String title = item.path(titleField).asText("").trim();
            if (title.isEmpty()) {
                continue;
            }
            StringBuilder line = new StringBuilder().append(lines.size() + 1).append(". ").append(title);
            if (summaryField != null && !summaryField.isBlank()) {
                String summary = item.path(summaryField).asText("").trim();
                if (!summary.isEmpty()) {
                    line.append("\n   ").append(summary);
                }
            }
            lines.add(line.toString());
        }
        return lines.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", lines));
    }
}
