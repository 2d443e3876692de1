package org.bump.sync;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class SyncSnapshot {
    private final String handle;
    private final Object data;
    private final String error;
    private final boolean loading;
    private final boolean active;
    private final long intervalMs;
    private final Instant lastSuccessAt;
}
