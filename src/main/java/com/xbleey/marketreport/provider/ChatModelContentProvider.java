package com.xbleey.marketreport.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.marketreport.notify.ReportDelivery;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Generative tier: asks an Ollama compatible model to write the report.
 */
public class ChatModelContentProvider extends HttpContentProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Pattern THINK_BLOCK = Pattern.compile("(?s)<think>.*?</think>");
    private static final String DATE_PLACEHOLDER = "{date}";

    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final String prompt;
    private final Clock clock;

    public ChatModelContentProvider(
            String name,
            ReportDelivery delivery,
            OkHttpClient okHttpClient,
            ObjectMapper objectMapper,
            String baseUrl,
            String model,
            String prompt,
            Clock clock
    ) {
        super(name, delivery, okHttpClient);
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.prompt = prompt;
        this.clock = clock;
    }

    @Override
    protected Optional<String> produce() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", resolvePrompt());
        body.put("stream", false);
        Request request = new Request.Builder()
                .url(baseUrl + "/api/generate")
                .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON))
                .build();
        JsonNode response = objectMapper.readTree(executeForBody(request));
        String text = THINK_BLOCK.matcher(response.path("response").asText("")).replaceAll("").trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    String resolvePrompt() {
        String template = prompt == null || prompt.isBlank()
                ? "请用中文总结{date}的财经要闻，按重要性列出不超过10条。"
                : prompt;
        return template.replace(DATE_PLACEHOLDER, LocalDate.now(clock).toString());
    }
}
