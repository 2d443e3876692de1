package org.bump.sync;

/**
 * Source de ticks périodiques d'une attache. Isolée pour pouvoir piloter le temps à la main dans les tests.
 */
public interface TickScheduler {

    Cancellable scheduleAtFixedRate(Runnable tick, long periodMs);

    interface Cancellable {
        void cancel();
    }
}
