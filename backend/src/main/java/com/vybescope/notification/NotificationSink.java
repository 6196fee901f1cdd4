package com.vybescope.notification;

import com.vybescope.domain.NotificationIntent;

/**
 * Receives notification intents in the order a tick produced them. Delivery is the sink's concern.
 */
public interface NotificationSink {

    void publish(NotificationIntent intent);
}
