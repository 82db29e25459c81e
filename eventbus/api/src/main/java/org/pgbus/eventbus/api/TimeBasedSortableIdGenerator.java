/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pgbus.eventbus.api;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Fixed-width base-36 ids made of 13 characters of epoch milliseconds, 4 characters of a per-millisecond sequence and
 * 8 random characters (25 characters in total). Ids from one generator are strictly increasing, ids from different
 * generators are ordered by millisecond.
 */
public class TimeBasedSortableIdGenerator implements SortableIdGenerator {
    private static final int RADIX = 36;
    private static final int TIME_WIDTH = 13;
    private static final int SEQUENCE_WIDTH = 4;
    private static final int RANDOM_WIDTH = 8;
    private static final int MAX_SEQUENCE = 36 * 36 * 36 * 36 - 1;
    private static final long RANDOM_BOUND = 2821109907456L; // 36^8

    private final Clock clock;
    private final Random random;

    private long lastMillis = -1;
    private int sequence;

    public TimeBasedSortableIdGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    public TimeBasedSortableIdGenerator(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.random = Objects.requireNonNull(random, Random.class.getSimpleName() + " cannot be null");
    }

    @Override
    public synchronized String next() {
        long millis = clock.millis();
        if (millis > lastMillis) {
            lastMillis = millis;
            sequence = 0;
        } else if (sequence < MAX_SEQUENCE) {
            // Clock didn't move (or moved backwards)
            sequence++;
        } else {
            lastMillis++;
            sequence = 0;
        }
        long randomPart = (long) (random.nextDouble() * RANDOM_BOUND);
        return encode(lastMillis, TIME_WIDTH) + encode(sequence, SEQUENCE_WIDTH) + encode(randomPart, RANDOM_WIDTH);
    }

    static String encode(long value, int width) {
        if (value < 0) throw new IllegalArgumentException("value must be >= 0");
        String s = Long.toString(value, RADIX);
        if (s.length() > width) throw new IllegalArgumentException("value too large");
        return "0".repeat(width - s.length()) + s;
    }
}
