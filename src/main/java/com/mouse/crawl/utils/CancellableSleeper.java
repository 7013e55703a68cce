package com.mouse.crawl.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * Sleeps in short slices so a cooperative stop request takes effect within one slice.
 */
@Slf4j
@Component
public class CancellableSleeper {

    static final long POLL_SLICE_MS = 200;

    /**
     * @return false if the sleep was cut short by {@code shouldStop} or an interrupt
     */
    public boolean sleep(long millis, BooleanSupplier shouldStop) {
        long deadline = System.currentTimeMillis() + Math.max(0, millis);
        while (true) {
            if (shouldStop != null && shouldStop.getAsBoolean()) {
                return false;
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return true;
            }
            try {
                Thread.sleep(Math.min(POLL_SLICE_MS, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Sleep interrupted with {}ms remaining", remaining);
                return false;
            }
        }
    }

    public boolean sleepWithJitter(long baseMillis, long jitterMillis, BooleanSupplier shouldStop) {
        long jitter = jitterMillis > 0 ? ThreadLocalRandom.current().nextLong(jitterMillis + 1) : 0;
        return sleep(baseMillis + jitter, shouldStop);
    }
}
