package com.xbleey.marketreport.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "report.notify")
public class NotificationProperties {

    public static final String DINGTALK_SEND_URL = "https://oapi.dingtalk.com/robot/send";

    private Duration timeout = Duration.ofSeconds(10);
    private Webhook wecom = new Webhook();
    private Webhook dingtalk = new Webhook();
    private PushPlus pushplus = new PushPlus();
    private Email email = new Email();

    @PostConstruct
    public void validate() {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalStateException("report.notify.timeout must be > 0");
        }
        if (email != null && (email.getSmtpPort() <= 0 || email.getSmtpPort() > 65535)) {
            throw new IllegalStateException("report.notify.email.smtp-port must be a valid port");
        }
    }

    @Data
    public static class Webhook {

        private String webhook;
        private String accessToken;
        private String secret;

        /**
         * DingTalk robots are usually configured by access token alone, the URL is derived from it.
         */
        public String resolveUrl(String baseUrl) {
            if (webhook != null && !webhook.isBlank()) {
                return webhook.trim();
            }
            if (baseUrl != null && accessToken != null && !accessToken.isBlank()) {
                return baseUrl + "?access_token=" + accessToken.trim();
            }
            return null;
        }
    }

    @Data
    public static class PushPlus {

        private String token;
        private String endpoint = "http://www.pushplus.plus/send";
    }

    @Data
    public static class Email {

        private String smtpServer;
        private int smtpPort = 465;
        private String username;
        private String password;
        private String fromEmail;
        private String toEmail;

        public String resolvedFromEmail() {
            return fromEmail == null || fromEmail.isBlank() ? username : fromEmail;
        }
    }
}
