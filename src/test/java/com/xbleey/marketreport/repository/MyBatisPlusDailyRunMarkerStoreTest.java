package com.xbleey.marketreport.repository;

import com.xbleey.marketreport.mapper.DailyRunMarkerMapper;
import com.xbleey.marketreport.model.DailyRunMarker;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MyBatisPlusDailyRunMarkerStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T01:45:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void readReturnsStoredDate() {
        DailyRunMarkerMapper mapper = mock(DailyRunMarkerMapper.class);
        DailyRunMarker marker = new DailyRunMarker();
        marker.setMarkerId("last_run");
        marker.setLastRunDate(LocalDate.of(2026, 3, 1));
        when(mapper.selectById("last_run")).thenReturn(marker);

        MyBatisPlusDailyRunMarkerStore store = new MyBatisPlusDailyRunMarkerStore(mapper, CLOCK);

        assertThat(store.readLastRunDate("last_run")).contains(LocalDate.of(2026, 3, 1));
    }

    @Test
    void writeInsertsWhenNoRowUpdated() {
        DailyRunMarkerMapper mapper = mock(DailyRunMarkerMapper.class);
        when(mapper.updateById(any(DailyRunMarker.class))).thenReturn(0);
        when(mapper.insert(any(DailyRunMarker.class))).thenReturn(1);

        MyBatisPlusDailyRunMarkerStore store = new MyBatisPlusDailyRunMarkerStore(mapper, CLOCK);

        assertThat(store.writeLastRunDate("last_run", LocalDate.of(2026, 3, 2))).isTrue();
        ArgumentCaptor<DailyRunMarker> captor = ArgumentCaptor.forClass(DailyRunMarker.class);
        verify(mapper).insert(captor.capture());
        assertThat(captor.getValue().getLastRunDate()).isEqualTo(LocalDate.of(2026, 3, 2));
        assertThat(captor.getValue().getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void writeUpdatesExistingRow() {
        DailyRunMarkerMapper mapper = mock(DailyRunMarkerMapper.class);
        when(mapper.updateById(any(DailyRunMarker.class))).thenReturn(1);

        MyBatisPlusDailyRunMarkerStore store = new MyBatisPlusDailyRunMarkerStore(mapper, CLOCK);

        assertThat(store.writeLastRunDate("last_run", LocalDate.of(2026, 3, 2))).isTrue();
        verify(mapper, never()).insert(any(DailyRunMarker.class));
    }

    @Test
    void databaseErrorFailsOpen() {
        DailyRunMarkerMapper mapper = mock(DailyRunMarkerMapper.class);
        when(mapper.selectById("last_run")).thenThrow(new IllegalStateException("connection refused"));

        MyBatisPlusDailyRunMarkerStore store = new MyBatisPlusDailyRunMarkerStore(mapper, CLOCK);

        assertThat(store.readLastRunDate("last_run")).isEmpty();
    }
}
