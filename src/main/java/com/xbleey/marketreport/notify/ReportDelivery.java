package com.xbleey.marketreport.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Dated title plus channel selection of one report task, bound to the dispatcher.
 */
public class ReportDelivery {

    private static final Logger log = LoggerFactory.getLogger(ReportDelivery.class);

    private final String title;
    private final List<String> channels;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public ReportDelivery(String title, List<String> channels, NotificationDispatcher dispatcher, Clock clock) {
        this.title = title;
        this.channels = channels == null ? List.of() : List.copyOf(channels);
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * @return true when at least one channel (or the console fallback) accepted the report
     */
    public boolean deliver(String content) {
        Map<String, Boolean> results = dispatcher.dispatch(datedTitle(), content, channels);
        boolean delivered = results.containsValue(true);
        if (!delivered) {
            log.error("Report '{}' was not delivered by any channel: {}", title, results);
        }
        return delivered;
    }

    public String datedTitle() {
        return title + " (" + LocalDate.now(clock) + ")";
    }

    public String getTitle() {
        return title;
    }
}
