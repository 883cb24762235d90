package com.xbleey.marketreport.repository;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Durable "last completed on" slot per marker id.
 * <p>
 * Reads fail open: a missing or unreadable slot is reported as empty so the task is
 * treated as not yet run today. Writes never throw; a failed write is logged and
 * reported through the return value.
 */
public interface DailyRunMarkerStore {

    Optional<LocalDate> readLastRunDate(String markerId);

    boolean writeLastRunDate(String markerId, LocalDate date);
}
