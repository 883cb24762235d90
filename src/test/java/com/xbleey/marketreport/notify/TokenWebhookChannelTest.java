package com.xbleey.marketreport.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class TokenWebhookChannelTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsTokenTitleAndContent() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"code\":200,\"msg\":\"请求成功\"}"));
        TokenWebhookChannel channel = channel("tok-1");

        assertThat(channel.send("title", "content")).isTrue();

        RecordedRequest request = server.takeRequest();
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("token").asText()).isEqualTo("tok-1");
        assertThat(body.path("title").asText()).isEqualTo("title");
        assertThat(body.path("content").asText()).isEqualTo("content");
        assertThat(body.path("template").asText()).isEqualTo("txt");
    }

    @Test
    void nonSuccessCodeIsFailure() {
        server.enqueue(new MockResponse().setBody("{\"code\":903,\"msg\":\"无效的用户token\"}"));

        assertThat(channel("tok-1").send("title", "content")).isFalse();
    }

    @Test
    void missingTokenIsNotConfigured() {
        TokenWebhookChannel channel = channel(null);

        assertThat(channel.isConfigured()).isFalse();
        assertThat(channel.send("title", "content")).isFalse();
        assertThat(server.getRequestCount()).isZero();
    }

    private TokenWebhookChannel channel(String token) {
        return new TokenWebhookChannel("pushplus", server.url("/send").toString(), token,
                new OkHttpClient(), objectMapper);
    }
}
