package com.xbleey.marketreport.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Component
@ConfigurationProperties(prefix = "report.schedule")
public class ReportScheduleProperties {

    private ZoneId zone = ZoneId.systemDefault();
    private Duration tickInterval = Duration.ofSeconds(60);
    private Duration errorCooldown = Duration.ofMinutes(5);

    /**
     * When enabled a trigger is due at or after its minute, not only at it,
     * so a tick delayed past the exact minute still fires that day.
     */
    private boolean catchUp = true;

    @PostConstruct
    public void validate() {
        if (zone == null) {
            throw new IllegalStateException("report.schedule.zone must be configured");
        }
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalStateException("report.schedule.tick-interval must be > 0");
        }
        if (errorCooldown == null || errorCooldown.isNegative()) {
            throw new IllegalStateException("report.schedule.error-cooldown must be >= 0");
        }
    }
}
