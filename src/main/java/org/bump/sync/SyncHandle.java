package org.bump.sync;

import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Attache possédée par son appelant : porte le minuteur, l'état actif et le dernier résultat.
 * L'application d'un résultat et le détachement se synchronisent sur le handle,
 * donc aucun callback ne démarre une fois {@link #deactivate()} revenu.
 * Une attache « louée » doit être lue via {@link #snapshot()} pour rester en vie.
 */
public class SyncHandle<T> {

    @Getter
    private final String id;
    @Getter
    private final Long ownerId;
    @Getter
    private final long intervalMs;
    @Getter
    private final boolean leased;

    private final Callable<T> query;
    private final SyncListener<T> listener;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    // ticks écoulés depuis la dernière lecture
    private final AtomicInteger unreadTicks = new AtomicInteger();
    private volatile boolean active = true;
    private volatile TickScheduler.Cancellable timer;

    private T data;
    private String error;
    private boolean loading = true;
    private Instant lastSuccessAt;

    SyncHandle(String id, Long ownerId, long intervalMs, boolean leased,
               Callable<T> query, SyncListener<T> listener, Clock clock) {
        this.id = id;
        this.ownerId = ownerId;
        this.intervalMs = intervalMs;
        this.leased = leased;
        this.query = query;
        this.listener = listener;
        this.clock = clock;
    }

    public boolean isActive() {
        return active;
    }

    Callable<T> query() {
        return query;
    }

    void timer(TickScheduler.Cancellable timer) {
        this.timer = timer;
        // détaché avant l'armement du minuteur
        if (!active) timer.cancel();
    }

    // false si un fetch est déjà en cours : le tick est sauté
    boolean tryStartFetch() {
        return active && inFlight.compareAndSet(false, true);
    }

    void endFetch() {
        inFlight.set(false);
    }

    boolean isFetching() {
        return inFlight.get();
    }

    int countUnreadTick() {
        return unreadTicks.incrementAndGet();
    }

    synchronized void applyData(T result) {
        if (!active) return;
        data = result;
        error = null;
        loading = false;
        lastSuccessAt = clock.instant();
        listener.onData(result);
    }

    // Erreur collante : conservée jusqu'au prochain succès, la donnée précédente reste lisible
    synchronized void applyError(String message) {
        if (!active) return;
        error = message;
        loading = false;
        listener.onError(message);
    }

    void deactivate() {
        synchronized (this) {
            active = false;
        }
        TickScheduler.Cancellable t = timer;
        if (t != null) t.cancel();
    }

    public synchronized SyncSnapshot snapshot() {
        unreadTicks.set(0);
        return new SyncSnapshot(id, data, error, loading, active, intervalMs, lastSuccessAt);
    }
}
