package com.xbleey.marketreport.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.marketreport.config.NotificationChannelConfig;
import com.xbleey.marketreport.config.NotificationProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

/**
 * Sends a real message through every channel configured in the environment
 * (WECHAT_WORK_WEBHOOK, DINGTALK_ACCESS_TOKEN, PUSHPLUS_TOKEN, SMTP_*).
 */
@Tag("manual")
class NotificationChannelsManualTest {

    @Test
    void sendOnce() {
        NotificationProperties properties = new NotificationProperties();
        properties.getWecom().setWebhook(System.getenv("WECHAT_WORK_WEBHOOK"));
        properties.getWecom().setSecret(System.getenv("WECHAT_WORK_SECRET"));
        properties.getDingtalk().setAccessToken(System.getenv("DINGTALK_ACCESS_TOKEN"));
        properties.getDingtalk().setSecret(System.getenv("DINGTALK_SECRET"));
        properties.getPushplus().setToken(System.getenv("PUSHPLUS_TOKEN"));
        properties.getEmail().setSmtpServer(System.getenv("SMTP_SERVER"));
        properties.getEmail().setUsername(System.getenv("SMTP_USERNAME"));
        properties.getEmail().setPassword(System.getenv("SMTP_PASSWORD"));
        properties.getEmail().setToEmail(System.getenv("SMTP_TO"));

        NotificationDispatcher dispatcher = new NotificationChannelConfig().notificationDispatcher(
                properties, new OkHttpClient(), new ObjectMapper(), Clock.systemDefaultZone());
        Map<String, Boolean> results = dispatcher.dispatch("测试通知", "这是一条测试消息");
        System.out.println(results);
    }
}
