package com.xbleey.marketreport.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token authenticated push endpoint (PushPlus).
 */
public class TokenWebhookChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(TokenWebhookChannel.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int SUCCESS_CODE = 200;

    private final String name;
    private final String endpoint;
    private final String token;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public TokenWebhookChannel(
            String name,
            String endpoint,
            String token,
            OkHttpClient okHttpClient,
            ObjectMapper objectMapper
    ) {
        this.name = name;
        this.endpoint = endpoint;
        this.token = token;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return token != null && !token.isBlank() && endpoint != null && !endpoint.isBlank();
    }

    @Override
    public boolean send(String title, String content) {
        if (!isConfigured()) {
            log.warn("Skip {} notification: token not configured", name);
            return false;
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("token", token);
            body.put("title", title);
            body.put("content", content);
            body.put("template", "txt");
            Request request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON))
                    .build();
            try (Response response = okHttpClient.newCall(request).execute()) {
                if (response.body() == null) {
                    log.warn("{} notification failed: empty response, http status {}", name, response.code());
                    return false;
                }
                JsonNode result = objectMapper.readTree(response.body().string());
                int code = result.path("code").asInt(-1);
                if (code == SUCCESS_CODE) {
                    log.info("{} notification sent", name);
                    return true;
                }
                log.warn("{} notification failed: code={} msg={}", name, code, result.path("msg").asText("-"));
                return false;
            }
        } catch (Exception ex) {
            log.warn("{} notification failed", name, ex);
            return false;
        }
    }
}
