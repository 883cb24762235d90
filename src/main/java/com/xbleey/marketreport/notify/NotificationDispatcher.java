package com.xbleey.marketreport.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fans one report out to every configured channel, once each.
 * <p>
 * With no channel to attempt the report is written to the log and recorded under
 * {@value #CONSOLE_CHANNEL} as delivered, so a result without any {@code true}
 * value always means every attempted channel failed.
 */
public class NotificationDispatcher {

    public static final String CONSOLE_CHANNEL = "console";

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationChannel> channels;

    public NotificationDispatcher(List<NotificationChannel> channels) {
        this.channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public Map<String, Boolean> dispatch(String title, String content) {
        return dispatch(title, content, Set.of());
    }

    public Map<String, Boolean> dispatch(String title, String content, Collection<String> enabledChannels) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (content == null || content.isBlank()) {
            log.warn("Skip dispatch of '{}': empty content", title);
            return results;
        }
        for (NotificationChannel channel : channels) {
            if (!isEnabled(channel, enabledChannels)) {
                continue;
            }
            boolean sent = sendQuietly(channel, title, content);
            results.put(channel.name(), sent);
            if (!sent) {
                log.warn("Notification channel {} failed for '{}'", channel.name(), title);
            }
        }
        if (results.isEmpty()) {
            log.info("No notification channel configured, report follows:\ntitle: {}\ncontent:\n{}", title, content);
            results.put(CONSOLE_CHANNEL, true);
            return results;
        }
        List<String> delivered = results.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .toList();
        if (delivered.isEmpty()) {
            log.error("All notification channels failed for '{}': {}", title, results.keySet());
        } else {
            log.info("Notification '{}' delivered via {}", title, delivered);
        }
        return results;
    }

    public List<NotificationChannel> getChannels() {
        return channels;
    }

    private static boolean isEnabled(NotificationChannel channel, Collection<String> enabledChannels) {
        if (!channel.isConfigured()) {
            return false;
        }
        return enabledChannels == null || enabledChannels.isEmpty() || enabledChannels.contains(channel.name());
    }

    private static boolean sendQuietly(NotificationChannel channel, String title, String content) {
        try {
            return channel.send(title, content);
        } catch (Exception ex) {
            log.warn("Notification channel {} threw while sending", channel.name(), ex);
            return false;
        }
    }
}
