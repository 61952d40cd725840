package sh.harold.tidybox.core.concurrent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and the work it started.
 *
 * <p>Work checks the token between discrete units (a search root, a folder, a pattern) and
 * never in the middle of one.
 */
public final class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared none() token cannot be cancelled.");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
