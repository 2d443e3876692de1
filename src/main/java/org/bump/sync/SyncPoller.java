package org.bump.sync;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.bump.error.NotFoundException;
import org.bump.error.ValidationException;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Rafraîchissement périodique générique : exécute une requête tout de suite puis à chaque tick,
 * jusqu'au détachement. Pas de backoff, un échec est simplement retenté au tick suivant.
 * Les attaches louées (clients distants) sont détachées après {@code leaseTicks} ticks sans lecture.
 */
@Slf4j
public class SyncPoller {

    static final String FETCH_ERROR = "Failed to fetch data. Please try again.";

    private final TickScheduler scheduler;
    private final Executor fetchExecutor;
    private final Clock clock;
    private final long defaultIntervalMs;
    private final long minIntervalMs;
    private final int leaseTicks;
    private final int maxPerOwner;

    // handleId -> attache
    private final Map<String, SyncHandle<?>> handles = new ConcurrentHashMap<>();

    public SyncPoller(TickScheduler scheduler, Executor fetchExecutor, Clock clock,
                      long defaultIntervalMs, long minIntervalMs, int leaseTicks, int maxPerOwner) {
        this.scheduler = scheduler;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        this.defaultIntervalMs = defaultIntervalMs;
        this.minIntervalMs = minIntervalMs;
        this.leaseTicks = leaseTicks;
        this.maxPerOwner = maxPerOwner;
    }

    /** Attache locale : vit jusqu'à {@link #detach(SyncHandle)}, les résultats passent par le listener. */
    public <T> SyncHandle<T> attach(Long ownerId, Callable<T> query, Long intervalMs, SyncListener<T> listener) {
        return start(ownerId, query, intervalMs, false, listener);
    }

    /** Attache lue par snapshot : détachée si personne ne la lit pendant {@code leaseTicks} ticks. */
    public <T> SyncHandle<T> lease(Long ownerId, Callable<T> query, Long intervalMs) {
        return start(ownerId, query, intervalMs, true, SyncListener.none());
    }

    private <T> SyncHandle<T> start(Long ownerId, Callable<T> query, Long intervalMs, boolean leased, SyncListener<T> listener) {
        long interval = intervalMs == null || intervalMs == 0 ? defaultIntervalMs : intervalMs;
        if (interval < minIntervalMs) {
            throw new ValidationException("Intervalle trop court (minimum " + minIntervalMs + " ms)");
        }
        SyncHandle<T> handle = new SyncHandle<>(UUID.randomUUID().toString(), ownerId, interval, leased, query,
                listener != null ? listener : SyncListener.none(), clock);
        synchronized (handles) {
            if (maxPerOwner > 0 && countOwnedBy(ownerId) >= maxPerOwner) {
                throw new ValidationException("Trop d'abonnements actifs (maximum " + maxPerOwner + ")");
            }
            handles.put(handle.getId(), handle);
        }

        tick(handle);
        handle.timer(scheduler.scheduleAtFixedRate(() -> onTimer(handle), interval));
        log.debug("Attache {} créée pour {} ({} ms{})", handle.getId(), ownerId, interval, leased ? ", louée" : "");
        return handle;
    }

    private long countOwnedBy(Long ownerId) {
        return handles.values().stream().filter(h -> h.getOwnerId().equals(ownerId)).count();
    }

    public void detach(SyncHandle<?> handle) {
        if (handle == null) return;
        handles.remove(handle.getId());
        handle.deactivate();
        log.debug("Attache {} détachée", handle.getId());
    }

    /** Détache par id, seulement pour le propriétaire de l'attache. */
    public void detach(String handleId, Long ownerId) {
        detach(find(handleId, ownerId));
    }

    public SyncHandle<?> find(String handleId, Long ownerId) {
        SyncHandle<?> h = handleId == null ? null : handles.get(handleId);
        if (h == null || !h.getOwnerId().equals(ownerId)) {
            throw new NotFoundException("Abonnement introuvable");
        }
        return h;
    }

    public int activeCount() {
        return handles.size();
    }

    @PreDestroy
    public void detachAll() {
        handles.values().forEach(this::detach);
    }

    private <T> void onTimer(SyncHandle<T> handle) {
        if (handle.isLeased() && handle.countUnreadTick() > leaseTicks) {
            log.info("Attache {} abandonnée ({} ticks sans lecture), détachement", handle.getId(), leaseTicks);
            detach(handle);
            return;
        }
        tick(handle);
    }

    <T> void tick(SyncHandle<T> handle) {
        if (!handle.tryStartFetch()) {
            if (handle.isActive()) {
                log.debug("Attache {} : fetch précédent encore en cours, tick ignoré", handle.getId());
            }
            return;
        }
        try {
            fetchExecutor.execute(() -> fetch(handle));
        } catch (RejectedExecutionException e) {
            handle.endFetch();
            log.warn("Attache {} : fetch refusé par l'exécuteur", handle.getId());
        }
    }

    private <T> void fetch(SyncHandle<T> handle) {
        try {
            T result = handle.query().call();
            handle.applyData(result);
        } catch (Exception e) {
            log.warn("Attache {} : échec du rafraîchissement ({})", handle.getId(), e.getMessage());
            handle.applyError(FETCH_ERROR);
        } finally {
            handle.endFetch();
        }
    }
}
