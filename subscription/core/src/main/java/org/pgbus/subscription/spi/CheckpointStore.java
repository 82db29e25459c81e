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

package org.pgbus.subscription.spi;

import org.pgbus.eventbus.api.CheckpointWriteException;

import java.util.Optional;

/**
 * Durable per-subscription record of the id of the last delivered event.
 */
public interface CheckpointStore {

    /**
     * Insert or overwrite the checkpoint of the subscription. Last writer wins.
     *
     * @throws CheckpointWriteException If the checkpoint couldn't be written
     */
    void save(String subscriptionId, String eventId);

    /**
     * @return The checkpoint, or empty if the subscription was never checkpointed
     */
    Optional<String> load(String subscriptionId);

    void delete(String subscriptionId);
}
