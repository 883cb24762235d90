package com.xbleey.marketreport.controller;

import com.xbleey.marketreport.notify.NotificationDispatcher;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public NotificationController(NotificationDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @PostMapping("/test")
    public Map<String, Object> sendTest(
            @RequestParam(value = "title", defaultValue = "测试通知") String title,
            @RequestParam(value = "content", required = false) String content
    ) {
        String body = content == null || content.isBlank()
                ? "这是一条测试消息，发送时间: " + LocalDateTime.now(clock).format(TIME_FORMAT)
                : content;
        Map<String, Boolean> results = dispatcher.dispatch(title, body);
        boolean delivered = results.containsValue(Boolean.TRUE);
        return Map.of(
                "status", delivered ? "ok" : "failed",
                "channels", results
        );
    }
}
