package com.graphsync.engine;

import com.graphsync.exception.RateLimitedException;
import com.graphsync.exception.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Retries remote hub calls for as long as the hub rate-limits them. Any other failure propagates at once.
 */
public class RetryLoop {
    private static final Logger log = LoggerFactory.getLogger(RetryLoop.class);

    static final long BASE_DELAY_MS = 60_000;
    static final int JITTER_MS = 10_000;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;
    private final Random random;

    public RetryLoop() {
        this(duration -> Thread.sleep(duration.toMillis()), new Random());
    }

    public RetryLoop(Sleeper sleeper, Random random) {
        this.sleeper = sleeper;
        this.random = random;
    }

    public void run(Runnable action) {
        call(() -> {
            action.run();
            return null;
        });
    }

    public <T> T call(Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (RateLimitedException e) {
                Duration delay = Duration.ofMillis(BASE_DELAY_MS + random.nextInt(JITTER_MS));
                log.warn("Rate limited by the hub (attempt {}), retrying in {} s", attempt, delay.toSeconds());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SyncException("Interrupted while waiting for the hub", ie);
                }
                attempt++;
            }
        }
    }
}
