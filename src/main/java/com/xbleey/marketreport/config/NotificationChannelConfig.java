package com.xbleey.marketreport.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.marketreport.notify.NotificationChannel;
import com.xbleey.marketreport.notify.NotificationDispatcher;
import com.xbleey.marketreport.notify.SignedWebhookChannel;
import com.xbleey.marketreport.notify.SmtpEmailChannel;
import com.xbleey.marketreport.notify.TokenWebhookChannel;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class NotificationChannelConfig {

    @Bean
    public NotificationDispatcher notificationDispatcher(
            NotificationProperties properties,
            OkHttpClient okHttpClient,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        NotificationProperties.Webhook wecom = properties.getWecom();
        NotificationProperties.Webhook dingtalk = properties.getDingtalk();
        NotificationProperties.PushPlus pushplus = properties.getPushplus();
        NotificationProperties.Email email = properties.getEmail();
        List<NotificationChannel> channels = List.of(
                new SignedWebhookChannel("wecom", wecom.resolveUrl(null), wecom.getSecret(),
                        okHttpClient, objectMapper, clock),
                new SignedWebhookChannel("dingtalk", dingtalk.resolveUrl(NotificationProperties.DINGTALK_SEND_URL),
                        dingtalk.getSecret(), okHttpClient, objectMapper, clock),
                new TokenWebhookChannel("pushplus", pushplus.getEndpoint(), pushplus.getToken(),
                        okHttpClient, objectMapper),
                new SmtpEmailChannel(email, SmtpEmailChannel.mailSenderFor(email, properties.getTimeout()))
        );
        return new NotificationDispatcher(channels);
    }
}
