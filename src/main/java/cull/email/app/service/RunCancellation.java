package cull.email.app.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a run. Checked before each label and each
 * chunk; chunks already sent to Gmail are not rolled back.
 */
public class RunCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
