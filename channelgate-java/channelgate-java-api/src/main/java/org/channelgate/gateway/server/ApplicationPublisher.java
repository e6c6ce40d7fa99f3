/*
 * Copyright (c) 2008-2022 the original author or authors.
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
package org.channelgate.gateway.server;

import java.util.Map;

/**
 * <p>The cross-process pub/sub transport that carries messages
 * to the backend application, for example a Redis connection.</p>
 */
@FunctionalInterface
public interface ApplicationPublisher {
    /**
     * @param channel the application channel
     * @param payload the message payload
     */
    void publish(String channel, Map<String, Object> payload);
}
