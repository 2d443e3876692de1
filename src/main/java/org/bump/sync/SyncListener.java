package org.bump.sync;

// Callbacks d'une attache ; jamais appelés après detach()
public interface SyncListener<T> {

    void onData(T data);

    default void onError(String message) {
    }

    static <T> SyncListener<T> none() {
        return data -> { };
    }
}
