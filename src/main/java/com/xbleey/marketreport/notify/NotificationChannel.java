package com.xbleey.marketreport.notify;

/**
 * One delivery mechanism for a finished report.
 * <p>
 * Implementations never throw: every transport or parsing problem is logged and
 * reported as {@code false}.
 */
public interface NotificationChannel {

    String name();

    boolean isConfigured();

    boolean send(String title, String content);
}
