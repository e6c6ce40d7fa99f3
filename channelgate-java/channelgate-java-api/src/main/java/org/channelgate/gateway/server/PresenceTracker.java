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

import org.channelgate.gateway.GatewaySocket;

/**
 * <p>Tracks the members of presence channels and notifies the other
 * members when a member joins or leaves.</p>
 */
public interface PresenceTracker {
    /**
     * @param socket the socket that joined
     * @param channel the presence channel
     * @param member the member descriptor, either parsed structured data or the raw value
     */
    void join(GatewaySocket socket, String channel, Object member);

    /**
     * @param socket the socket that is leaving
     * @param channel the presence channel
     */
    void leave(GatewaySocket socket, String channel);
}
