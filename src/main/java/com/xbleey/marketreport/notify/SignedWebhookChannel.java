package com.xbleey.marketreport.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Group robot webhook (WeCom / DingTalk style) with optional HmacSHA256 request signing.
 */
public class SignedWebhookChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SignedWebhookChannel.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String name;
    private final String webhookUrl;
    private final String secret;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SignedWebhookChannel(
            String name,
            String webhookUrl,
            String secret,
            OkHttpClient okHttpClient,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.name = name;
        this.webhookUrl = webhookUrl;
        this.secret = secret;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public boolean send(String title, String content) {
        if (!isConfigured()) {
            log.warn("Skip {} notification: webhook not configured", name);
            return false;
        }
        try {
            HttpUrl url = resolveUrl(clock.millis());
            if (url == null) {
                log.warn("Skip {} notification: invalid webhook url", name);
                return false;
            }
            Map<String, Object> text = new LinkedHashMap<>();
            text.put("content", title + "\n" + content);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("msgtype", "text");
            body.put("text", text);
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsBytes(body), JSON))
                    .build();
            try (Response response = okHttpClient.newCall(request).execute()) {
                if (response.body() == null) {
                    log.warn("{} notification failed: empty response, http status {}", name, response.code());
                    return false;
                }
                JsonNode result = objectMapper.readTree(response.body().string());
                int errcode = result.path("errcode").asInt(-1);
                if (errcode == 0) {
                    log.info("{} notification sent", name);
                    return true;
                }
                log.warn("{} notification failed: errcode={} errmsg={}",
                        name, errcode, result.path("errmsg").asText("-"));
                return false;
            }
        } catch (Exception ex) {
            log.warn("{} notification failed", name, ex);
            return false;
        }
    }

    HttpUrl resolveUrl(long timestampMillis) throws GeneralSecurityException {
        HttpUrl base = HttpUrl.parse(webhookUrl.trim());
        if (base == null || secret == null || secret.isBlank()) {
            return base;
        }
        String timestamp = Long.toString(timestampMillis);
        String sign = URLEncoder.encode(sign(timestamp, secret), StandardCharsets.UTF_8);
        return base.newBuilder()
                .addEncodedQueryParameter("timestamp", timestamp)
                .addEncodedQueryParameter("sign", sign)
                .build();
    }

    static String sign(String timestamp, String secret) throws GeneralSecurityException {
        String stringToSign = timestamp + "\n" + secret;
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
        byte[] digest = mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(digest);
    }
}
