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

package org.pgbus.subscription;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Maps a subscription id to the 64-bit number used as advisory lock key.
 */
public final class LockNumbers {

    private LockNumbers() {
    }

    /**
     * The first 8 bytes of the SHA-1 digest of the UTF-8 encoded subscription id, read as a little-endian signed long.
     * Every process sharing a store must compute the same number for the same id.
     */
    public static long lockNumber(String subscriptionId) {
        Objects.requireNonNull(subscriptionId, "Subscription id cannot be null");
        final MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
        byte[] digest = sha1.digest(subscriptionId.getBytes(UTF_8));
        return ByteBuffer.wrap(digest, 0, Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }
}
