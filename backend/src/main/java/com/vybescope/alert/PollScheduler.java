package com.vybescope.alert;

import com.vybescope.alert.config.PollSchedule;
import com.vybescope.config.AsyncConfig;
import com.vybescope.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives the two poll cycles at fixed rates. The trigger thread only hands the tick to the cycle
 * executor, so a slow tick never delays the other cycle's trigger.
 */
@Component
@Slf4j
public class PollScheduler implements SmartLifecycle {

    private final Map<CycleType, PollCycle> cycles = new EnumMap<>(CycleType.class);
    private final Map<CycleType, ScheduledFuture<?>> triggers = new EnumMap<>(CycleType.class);
    private final PollSchedule pollSchedule;
    private final TaskScheduler taskScheduler;
    private final Executor cycleExecutor;
    private final Clock clock;
    private volatile boolean running;

    public PollScheduler(
            List<PollCycle> pollCycles,
            PollSchedule pollSchedule,
            @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler taskScheduler,
            @Qualifier(AsyncConfig.CYCLE_EXECUTOR) Executor cycleExecutor,
            Clock clock) {
        for (PollCycle cycle : pollCycles) {
            cycles.put(cycle.type(), cycle);
        }
        this.pollSchedule = pollSchedule;
        this.taskScheduler = taskScheduler;
        this.cycleExecutor = cycleExecutor;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (PollCycle cycle : cycles.values()) {
            PollSchedule.CycleSettings settings = pollSchedule.settingsFor(cycle.type());
            if (!settings.enabled()) {
                cycle.suspend();
                log.info("{} cycle disabled by configuration", cycle.type());
                continue;
            }
            schedule(cycle);
        }
    }

    @Override
    public synchronized void stop() {
        running = false;
        for (PollCycle cycle : cycles.values()) {
            cycle.requestStop();
        }
        triggers.values().forEach(f -> f.cancel(false));
        triggers.clear();
        log.info("Poll scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Suspends a cycle at runtime. The trigger keeps firing but ticks return immediately.
     */
    public PollCycle suspend(CycleType type) {
        PollCycle cycle = cycle(type);
        cycle.suspend();
        log.info("{} cycle suspended", type);
        return cycle;
    }

    /**
     * Resumes a cycle; a cycle disabled by configuration gets its trigger on first resume.
     */
    public synchronized PollCycle resume(CycleType type) {
        PollCycle cycle = cycle(type);
        cycle.resume();
        if (running && !triggers.containsKey(type)) {
            schedule(cycle);
        }
        log.info("{} cycle resumed", type);
        return cycle;
    }

    public PollCycle cycle(CycleType type) {
        PollCycle cycle = cycles.get(type);
        if (cycle == null) {
            throw new NoSuchElementException("No poll cycle registered for " + type);
        }
        return cycle;
    }

    public List<PollCycle> cycles() {
        return List.copyOf(cycles.values());
    }

    void fire(PollCycle cycle) {
        try {
            cycleExecutor.execute(cycle::tick);
        } catch (TaskRejectedException e) {
            cycle.recordSkippedTick();
        }
    }

    private void schedule(PollCycle cycle) {
        PollSchedule.CycleSettings settings = pollSchedule.settingsFor(cycle.type());
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                () -> fire(cycle),
                clock.instant().plus(settings.initialDelay()),
                settings.interval());
        triggers.put(cycle.type(), future);
        log.info("{} cycle scheduled every {}s, first tick in {}s",
                cycle.type(), settings.interval().toSeconds(), settings.initialDelay().toSeconds());
    }
}
