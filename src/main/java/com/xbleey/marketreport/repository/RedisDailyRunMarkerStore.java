package com.xbleey.marketreport.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.LocalDate;
import java.util.Optional;

public class RedisDailyRunMarkerStore implements DailyRunMarkerStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDailyRunMarkerStore.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisDailyRunMarkerStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Optional<LocalDate> readLastRunDate(String markerId) {
        try {
            String cached = redisTemplate.opsForValue().get(key(markerId));
            if (cached == null || cached.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(LocalDate.parse(cached.trim()));
        } catch (Exception ex) {
            log.warn("Failed to read run marker {} from redis, treating as not run", markerId, ex);
            return Optional.empty();
        }
    }

    @Override
    public boolean writeLastRunDate(String markerId, LocalDate date) {
        try {
            redisTemplate.opsForValue().set(key(markerId), date.toString());
            return true;
        } catch (Exception ex) {
            log.warn("Failed to write run marker {} to redis", markerId, ex);
            return false;
        }
    }

    public String key(String markerId) {
        return keyPrefix + markerId;
    }
}
