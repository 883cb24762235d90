package com.xbleey.marketreport.config;

import com.xbleey.marketreport.enums.MarkerStoreType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Data
@Component
@ConfigurationProperties(prefix = "report.marker")
public class MarkerStoreProperties {

    private MarkerStoreType store = MarkerStoreType.FILE;
    private Path directory = Path.of("logs", "markers");
    private String redisKeyPrefix = "report:marker:";

    @PostConstruct
    public void validate() {
        if (store == null) {
            throw new IllegalStateException("report.marker.store must be configured");
        }
        if (store == MarkerStoreType.FILE && directory == null) {
            throw new IllegalStateException("report.marker.directory must be configured for file store");
        }
    }
}
