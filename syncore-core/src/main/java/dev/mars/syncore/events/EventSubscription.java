package dev.mars.syncore.events;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import io.vertx.core.Future;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * A typed event-bus subscriber with a bounded hand-off buffer.
 *
 * <p>Decoded events are queued and handed to the handler one at a time, in arrival order. When
 * the handler falls behind, or the subscription is paused, at most {@code maxBuffered} events are
 * kept and the oldest is dropped to make room. The event bus is never blocked.</p>
 *
 * @param <T> the decoded event type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class EventSubscription<T> {
    private static final Logger logger = LoggerFactory.getLogger(EventSubscription.class);

    private final String address;
    private final int maxBuffered;
    private final Consumer<T> handler;
    private final Deque<T> buffer = new ArrayDeque<>();
    private MessageConsumer<JsonObject> consumer;

    private boolean paused;
    private boolean delivering;
    private long received;
    private long dropped;

    EventSubscription(String address, int maxBuffered, Consumer<T> handler) {
        if (maxBuffered < 1) {
            throw new IllegalArgumentException("maxBuffered must be at least 1, was " + maxBuffered);
        }
        this.address = address;
        this.maxBuffered = maxBuffered;
        this.handler = handler;
    }

    void bind(MessageConsumer<JsonObject> consumer) {
        this.consumer = consumer;
    }

    void offer(T event) {
        synchronized (this) {
            received++;
            if (buffer.size() >= maxBuffered) {
                buffer.pollFirst();
                dropped++;
                logger.warn("Subscriber on {} is behind, dropped oldest event ({} dropped so far)", address, dropped);
            }
            buffer.addLast(event);
        }
        deliver();
    }

    /**
     * Stops handing events to the handler. Arriving events are still buffered.
     */
    public synchronized void pause() {
        paused = true;
    }

    /**
     * Hands buffered events to the handler, then continues with live delivery.
     */
    public void resume() {
        synchronized (this) {
            paused = false;
        }
        deliver();
    }

    private void deliver() {
        while (true) {
            T next;
            synchronized (this) {
                if (paused || delivering || buffer.isEmpty()) {
                    return;
                }
                next = buffer.pollFirst();
                delivering = true;
            }
            try {
                handler.accept(next);
            } catch (RuntimeException e) {
                logger.error("Event handler on {} failed", address, e);
            } finally {
                synchronized (this) {
                    delivering = false;
                }
            }
        }
    }

    public Future<Void> unregister() {
        return consumer.unregister();
    }

    public String address() {
        return address;
    }

    public synchronized int buffered() {
        return buffer.size();
    }

    public synchronized long received() {
        return received;
    }

    public synchronized long dropped() {
        return dropped;
    }
}
