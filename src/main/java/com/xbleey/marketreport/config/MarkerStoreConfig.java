package com.xbleey.marketreport.config;

import com.xbleey.marketreport.mapper.DailyRunMarkerMapper;
import com.xbleey.marketreport.repository.DailyRunMarkerStore;
import com.xbleey.marketreport.repository.FileDailyRunMarkerStore;
import com.xbleey.marketreport.repository.MyBatisPlusDailyRunMarkerStore;
import com.xbleey.marketreport.repository.RedisDailyRunMarkerStore;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class MarkerStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "report.marker", name = "store", havingValue = "file", matchIfMissing = true)
    public DailyRunMarkerStore fileDailyRunMarkerStore(MarkerStoreProperties properties) {
        return new FileDailyRunMarkerStore(properties.getDirectory());
    }

    @Bean
    @ConditionalOnProperty(prefix = "report.marker", name = "store", havingValue = "redis")
    public DailyRunMarkerStore redisDailyRunMarkerStore(StringRedisTemplate redisTemplate,
                                                        MarkerStoreProperties properties) {
        return new RedisDailyRunMarkerStore(redisTemplate, properties.getRedisKeyPrefix());
    }

    /**
     * Mapper scanning lives here so the mapper beans only exist when a datasource is expected.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "report.marker", name = "store", havingValue = "database")
    @MapperScan("com.xbleey.marketreport.mapper")
    static class DatabaseMarkerStoreConfig {

        @Bean
        public DailyRunMarkerStore databaseDailyRunMarkerStore(DailyRunMarkerMapper mapper, Clock clock) {
            return new MyBatisPlusDailyRunMarkerStore(mapper, clock);
        }
    }
}
