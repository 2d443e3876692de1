package org.bump.sync;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class ExecutorTickScheduler implements TickScheduler {

    private final ScheduledExecutorService scheduler;

    public ExecutorTickScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable tick, long periodMs) {
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }
}
