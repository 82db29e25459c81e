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

import org.pgbus.eventbus.api.Event;
import org.pgbus.eventbus.api.EventSubscription;

import java.util.Iterator;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * An {@link EventSubscription} iterating a {@link SubscriptionDeliveryLoop}.
 */
public class DeliveryLoopEventSubscription implements EventSubscription {
    private final SubscriptionDeliveryLoop loop;
    private final Consumer<DeliveryLoopEventSubscription> onClose;
    private final AtomicBoolean iterated = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param onClose Invoked once the subscription is closed, e.g. to deregister it from the bus
     */
    public DeliveryLoopEventSubscription(SubscriptionDeliveryLoop loop, Consumer<DeliveryLoopEventSubscription> onClose) {
        this.loop = loop;
        this.onClose = onClose;
    }

    @Override
    public String id() {
        return loop.subscriptionId();
    }

    @Override
    public Iterator<Event> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("Subscription " + id() + " can only be iterated once");
        }
        return loop;
    }

    @Override
    public void close() {
        // The loop may already have closed itself, the handle must still be deregistered
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            loop.close();
        } finally {
            onClose.accept(this);
        }
    }

    public DeliveryState state() {
        return loop.state();
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", DeliveryLoopEventSubscription.class.getSimpleName() + "[", "]")
                .add("id='" + id() + "'")
                .add("state=" + loop.state())
                .toString();
    }
}
