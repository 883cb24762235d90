package com.xbleey.marketreport.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class ReportAppConfig {

    @Bean
    public OkHttpClient okHttpClient(NotificationProperties notificationProperties) {
        return new OkHttpClient.Builder()
                .connectTimeout(notificationProperties.getTimeout())
                .readTimeout(notificationProperties.getTimeout())
                .writeTimeout(notificationProperties.getTimeout())
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock clock(ReportScheduleProperties scheduleProperties) {
        return Clock.system(scheduleProperties.getZone());
    }

    /**
     * One thread only: ticks and the tasks they run never overlap.
     */
    @Bean
    public ThreadPoolTaskScheduler reportTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("report-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
