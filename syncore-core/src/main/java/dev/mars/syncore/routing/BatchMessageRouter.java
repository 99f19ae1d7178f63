package dev.mars.syncore.routing;

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

import dev.mars.syncore.api.messaging.RouteMessageRequest;
import dev.mars.syncore.api.messaging.RouteMessageResponse;
import dev.mars.syncore.api.state.SystemState;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes a batch of messages with settle-all semantics: a failure for one request becomes a
 * failed response in its slot and never aborts the rest.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-19
 * @version 1.0
 */
public class BatchMessageRouter {
    private static final Logger logger = LoggerFactory.getLogger(BatchMessageRouter.class);

    private final MessageRouter router;

    public BatchMessageRouter(MessageRouter router) {
        this.router = router;
    }

    public Future<List<RouteMessageResponse>> routeAll(SystemState state, List<RouteMessageRequest> requests) {
        logger.info("Executing batch message routing for {} messages", requests.size());

        List<Future<RouteMessageResponse>> futures = new ArrayList<>(requests.size());
        for (RouteMessageRequest request : requests) {
            futures.add(routeOne(state, request)
                .recover(error -> {
                    logger.warn("Batch routing failed for message: {}", error.getMessage());
                    return Future.succeededFuture(
                        RouteMessageResponse.failure("Batch routing error", 0.0, String.valueOf(error.getMessage())));
                }));
        }

        return Future.all(futures)
            .map(composite -> futures.stream().map(Future::result).toList());
    }

    private Future<RouteMessageResponse> routeOne(SystemState state, RouteMessageRequest request) {
        try {
            return Future.succeededFuture(router.route(state, request));
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
