package com.vidnyan.statute.domain.verification;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for long verifications.
 * The verifier polls it between statutes and between statute pairs, never during a solver call.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("the shared token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
