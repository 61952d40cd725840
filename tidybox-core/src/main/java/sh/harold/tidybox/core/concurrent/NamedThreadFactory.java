package sh.harold.tidybox.core.concurrent;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates daemon worker threads named {@code <prefix>-<n>}.
 */
public final class NamedThreadFactory implements ThreadFactory {
    private final String namePrefix;
    private final AtomicInteger counter = new AtomicInteger();
    private final System.Logger logger;

    public NamedThreadFactory(String namePrefix, System.Logger logger) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        this.logger = Objects.requireNonNull(logger, "logger");
        if (namePrefix.isBlank()) {
            throw new IllegalArgumentException("namePrefix must be non-blank.");
        }
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setDaemon(true);
        thread.setName(namePrefix + "-" + counter.incrementAndGet());
        thread.setUncaughtExceptionHandler((failed, error) ->
            logger.log(System.Logger.Level.ERROR, "Uncaught failure on " + failed.getName(), error));
        return thread;
    }
}
