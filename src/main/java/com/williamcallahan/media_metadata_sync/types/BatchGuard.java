/**
 * Cancellation flag shared by the items of one library batch
 *
 * @author William Callahan
 *
 * Features:
 * - Set once when the batch times out or its waiting thread is interrupted
 * - Workers check it before every store mutation, so abandoned work never writes
 */
package com.williamcallahan.media_metadata_sync.types;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class BatchGuard {

    private final AtomicBoolean abandoned = new AtomicBoolean(false);

    public void abandon() {
        abandoned.set(true);
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }

    /**
     * @param mutation what the caller is about to write, for the exception message
     * @throws CancellationException once the batch has been abandoned
     */
    public void ensureActive(String mutation) {
        if (abandoned.get()) {
            throw new CancellationException("Batch abandoned, skipping " + mutation);
        }
    }
}
