/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.keys;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Delays grow by a constant multiplier from an initial delay up to a maximum. A random jitter of
 * up to the growth of the last step is added so that concurrent retries spread out.
 */
public class ExponentialJitterBackoffStrategy implements BackoffStrategy {

    private final Duration initialDelay;
    private final Duration maximumDelay;
    private final double multiplier;
    private final Random random;

    public ExponentialJitterBackoffStrategy(@NonNull Duration initialDelay,
                                            @NonNull Duration maximumDelay,
                                            double multiplier,
                                            @NonNull Random random) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier should not reduce the initial delay");
        }
        if (initialDelay.isNegative() || maximumDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= initialDelay <= maximumDelay");
        }
        this.initialDelay = initialDelay;
        this.maximumDelay = maximumDelay;
        this.multiplier = multiplier;
        this.random = Objects.requireNonNull(random);
    }

    @Override
    public Duration getDelay(int failures) {
        if (failures < 0) {
            throw new IllegalArgumentException("failures must not be negative");
        }
        if (failures == 0) {
            return Duration.ZERO;
        }
        long backoff = exponentialBackoffMillis(failures);
        long maxJitter = backoff - exponentialBackoffMillis(failures - 1);
        long jitter = maxJitter > 0 ? Math.floorMod(random.nextLong(), maxJitter) : 0;
        return Duration.ofMillis(Math.min(backoff + jitter, maximumDelay.toMillis()));
    }

    private long exponentialBackoffMillis(int failures) {
        if (failures == 0) {
            return 0;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failures - 1.0);
        return (long) Math.min(millis, maximumDelay.toMillis());
    }
}
