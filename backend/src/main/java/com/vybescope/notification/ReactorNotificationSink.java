package com.vybescope.notification;

import com.vybescope.domain.NotificationIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Multicasts intents to the stream subscribers connected at publish time (the chat front end over SSE).
 * Nothing is retained for later subscribers: with no subscriber the intent is dropped. Each
 * subscriber has its own buffer of {@link #BUFFER_SIZE} intents; a subscriber that falls further
 * behind loses its oldest pending intents without holding back the others.
 */
@Component
@Slf4j
public class ReactorNotificationSink implements NotificationSink {

    static final int BUFFER_SIZE = 1024;

    private final Sinks.Many<NotificationIntent> sink =
            Sinks.many().multicast().directBestEffort();

    /**
     * Synchronized because cycles may publish from different threads and Sinks.Many requires
     * serialized emission.
     */
    @Override
    public synchronized void publish(NotificationIntent intent) {
        Sinks.EmitResult result = sink.tryEmitNext(intent);
        if (result.isSuccess()) {
            log.debug("Published {} for user {} event {}", intent.kind(), intent.userId(), intent.payload().eventId());
        } else if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("No stream subscriber, dropped {} for user {}", intent.kind(), intent.userId());
        } else {
            log.warn("Could not publish {} for user {}: {}", intent.kind(), intent.userId(), result);
        }
    }

    public Flux<NotificationIntent> stream() {
        return buffered(sink.asFlux());
    }

    public Flux<NotificationIntent> streamFor(long userId) {
        return buffered(sink.asFlux().filter(intent -> intent.userId() == userId));
    }

    private static Flux<NotificationIntent> buffered(Flux<NotificationIntent> source) {
        return source.onBackpressureBuffer(BUFFER_SIZE,
                dropped -> log.warn("Stream subscriber lagging, dropped {} for user {}", dropped.kind(), dropped.userId()),
                BufferOverflowStrategy.DROP_OLDEST);
    }
}
