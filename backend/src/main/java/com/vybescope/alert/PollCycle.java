package com.vybescope.alert;

import com.vybescope.domain.NotificationIntent;
import com.vybescope.notification.NotificationSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base for the periodic cycles. A tick that starts while the previous one is still running is
 * skipped and counted, never queued. Exceptions never escape {@link #tick()}, so a failing tick
 * cannot cancel the fixed-rate trigger.
 */
@Slf4j
public abstract class PollCycle {

    private final CycleType type;
    private final NotificationSink notificationSink;
    protected final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedTicks = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private volatile boolean suspended;
    private volatile boolean stopping;
    private volatile TickReport lastReport;

    protected PollCycle(CycleType type, NotificationSink notificationSink, Clock clock) {
        this.type = type;
        this.notificationSink = notificationSink;
        this.clock = clock;
    }

    public final void tick() {
        if (suspended || stopping) {
            log.debug("{} tick ignored: suspended={} stopping={}", type, suspended, stopping);
            return;
        }
        if (!running.compareAndSet(false, true)) {
            recordSkippedTick();
            return;
        }
        try {
            TickReport report = runTick();
            lastReport = report;
            completedTicks.incrementAndGet();
            if (report.entities() > 0) {
                log.info("{} tick: entities={} failed={} candidates={} new={} intents={} took={}ms{}",
                        type, report.entities(), report.failedEntities(), report.candidates(),
                        report.newEvents(), report.intents(), report.duration().toMillis(),
                        report.interrupted() ? " (interrupted)" : "");
            }
        } catch (RuntimeException e) {
            log.error("{} tick failed", type, e);
        } finally {
            running.set(false);
        }
    }

    /**
     * One pass over the registry snapshot. Implementations check {@link #isStopping()} before
     * marking each event.
     */
    protected abstract TickReport runTick();

    /**
     * Hands an intent to the sink. Dedup already happened, so a sink failure loses this delivery
     * only and does not stop the tick.
     */
    protected boolean dispatch(NotificationIntent intent) {
        try {
            notificationSink.publish(intent);
            return true;
        } catch (RuntimeException e) {
            log.warn("{}: sink rejected intent for user {} event {}: {}",
                    type, intent.userId(), intent.payload().eventId(), e.getMessage());
            return false;
        }
    }

    public void recordSkippedTick() {
        long skipped = skippedTicks.incrementAndGet();
        log.info("{} tick skipped, previous tick still running (skipped so far: {})", type, skipped);
    }

    public void suspend() {
        suspended = true;
    }

    public void resume() {
        suspended = false;
    }

    public void requestStop() {
        stopping = true;
    }

    public boolean isStopping() {
        return stopping;
    }

    public CycleState state() {
        if (suspended) {
            return CycleState.SUSPENDED;
        }
        return running.get() ? CycleState.RUNNING : CycleState.IDLE;
    }

    public CycleType type() {
        return type;
    }

    public long completedTicks() {
        return completedTicks.get();
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    public TickReport lastReport() {
        return lastReport;
    }
}
