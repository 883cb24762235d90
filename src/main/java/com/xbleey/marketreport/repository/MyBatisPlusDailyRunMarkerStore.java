package com.xbleey.marketreport.repository;

import com.xbleey.marketreport.mapper.DailyRunMarkerMapper;
import com.xbleey.marketreport.model.DailyRunMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

public class MyBatisPlusDailyRunMarkerStore implements DailyRunMarkerStore {

    private static final Logger log = LoggerFactory.getLogger(MyBatisPlusDailyRunMarkerStore.class);

    private final DailyRunMarkerMapper mapper;
    private final Clock clock;

    public MyBatisPlusDailyRunMarkerStore(DailyRunMarkerMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Optional<LocalDate> readLastRunDate(String markerId) {
        try {
            return Optional.ofNullable(mapper.selectById(markerId))
                    .map(DailyRunMarker::getLastRunDate);
        } catch (Exception ex) {
            log.warn("Failed to read run marker {} from database, treating as not run", markerId, ex);
            return Optional.empty();
        }
    }

    @Override
    public boolean writeLastRunDate(String markerId, LocalDate date) {
        try {
            DailyRunMarker marker = new DailyRunMarker();
            marker.setMarkerId(markerId);
            marker.setLastRunDate(date);
            marker.setUpdatedAt(clock.instant());
            if (mapper.updateById(marker) > 0) {
                return true;
            }
            return mapper.insert(marker) > 0;
        } catch (Exception ex) {
            log.warn("Failed to write run marker {} to database", markerId, ex);
            return false;
        }
    }
}
