package com.vybescope.api.controller;

import com.vybescope.domain.NotificationIntent;
import com.vybescope.notification.ReactorNotificationSink;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * SSE stream of notification intents for the chat front end. Without userId every intent is sent.
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final ReactorNotificationSink notificationSink;

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<NotificationIntent>> stream(@RequestParam(required = false) Long userId) {
        Flux<NotificationIntent> intents = userId == null
                ? notificationSink.stream()
                : notificationSink.streamFor(userId);
        return intents.map(intent -> ServerSentEvent.<NotificationIntent>builder()
                .id(intent.payload().eventId() + ":" + intent.userId())
                .event(intent.kind().name())
                .data(intent)
                .build());
    }
}
