package com.starwatch.infra;

import com.starwatch.exception.SyncCancelledException;

public final class Cancellation {

    private Cancellation() {
    }

    /**
     * Fails fast when the current thread was interrupted, keeping the interrupt flag set.
     */
    public static void throwIfCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SyncCancelledException("Sync cancelled during " + stage);
        }
    }
}
