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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.syncore.api.error.CoordinationException;
import dev.mars.syncore.api.error.SyncoreError;
import dev.mars.syncore.api.error.SyncoreErrorCodes;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Publishes coordination events on the Vert.x event bus as JSON objects.
 *
 * <p>Payload records are converted with Jackson so that {@code java.time} values travel as
 * ISO-8601 strings. Subscribers decode the JSON back into the payload type and receive it through
 * an {@link EventSubscription}, whose buffer holds at most {@code maxBuffered} events and drops the
 * oldest when a subscriber falls behind.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class CoordinationEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(CoordinationEventPublisher.class);

    private final Vertx vertx;
    private final ObjectMapper objectMapper;
    private final int maxBuffered;

    public CoordinationEventPublisher(Vertx vertx, int maxBuffered) {
        this(vertx, createObjectMapper(), maxBuffered);
    }

    public CoordinationEventPublisher(Vertx vertx, ObjectMapper objectMapper, int maxBuffered) {
        this.vertx = vertx;
        this.objectMapper = objectMapper;
        this.maxBuffered = maxBuffered;
    }

    /**
     * Object mapper used for every event payload.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Publishes to every subscriber of {@code address}.
     *
     * @throws CoordinationException if the payload cannot be encoded
     */
    public void publish(String address, Object payload) {
        JsonObject json = toJson(payload);
        vertx.eventBus().publish(address, json);
        logger.debug("Published event to {}", address);
    }

    public JsonObject toJson(Object payload) {
        try {
            return new JsonObject(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new CoordinationException(SyncoreError.of(SyncoreErrorCodes.EVENT_ENCODING_FAILED,
                "Failed to encode event payload", payload.getClass().getName()), e);
        }
    }

    public <T> T decode(JsonObject json, Class<T> type) {
        try {
            return objectMapper.readValue(json.encode(), type);
        } catch (JsonProcessingException e) {
            throw new CoordinationException(SyncoreError.of(SyncoreErrorCodes.EVENT_DECODING_FAILED,
                "Failed to decode event payload", type.getName()), e);
        }
    }

    /**
     * Registers a typed subscriber. Decoding failures are logged and the event is skipped.
     */
    public <T> EventSubscription<T> subscribe(String address, Class<T> type, Consumer<T> handler) {
        EventSubscription<T> subscription = new EventSubscription<>(address, maxBuffered, handler);
        MessageConsumer<JsonObject> consumer = vertx.eventBus().consumer(address, message -> {
            T event;
            try {
                event = decode(message.body(), type);
            } catch (CoordinationException e) {
                logger.warn("Dropping undecodable event on {}: {}", address, e.getMessage());
                return;
            }
            subscription.offer(event);
        });
        subscription.bind(consumer);
        return subscription;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
