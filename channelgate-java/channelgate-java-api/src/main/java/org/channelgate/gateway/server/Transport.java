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

import java.util.Set;

import org.channelgate.gateway.GatewaySocket;

/**
 * <p>The connection transport that owns sockets and channel membership,
 * and that performs the actual delivery of events to sockets.</p>
 * <p>Implementations must make {@link #join(GatewaySocket, String)} and
 * {@link #leave(GatewaySocket, String)} idempotent and safe to invoke
 * concurrently for the same channel.</p>
 */
public interface Transport {
    /**
     * <p>Adds the given socket to the members of the given channel.</p>
     *
     * @param socket  the socket joining
     * @param channel the channel name
     */
    void join(GatewaySocket socket, String channel);

    /**
     * <p>Removes the given socket from the members of the given channel.</p>
     * <p>Leaving a channel the socket is not a member of is a no-operation.</p>
     *
     * @param socket  the socket leaving
     * @param channel the channel name
     */
    void leave(GatewaySocket socket, String channel);

    /**
     * @param channel the channel name
     * @return a snapshot of the sockets that are members of the given channel
     */
    Set<GatewaySocket> membersOf(String channel);

    /**
     * @param socket the socket
     * @return a snapshot of the channels the given socket is a member of
     */
    Set<String> channelsOf(GatewaySocket socket);

    /**
     * @param socket  the socket
     * @param channel the channel name
     * @return whether the socket is currently a member of the channel
     */
    default boolean isMember(GatewaySocket socket, String channel) {
        return membersOf(channel).contains(socket);
    }

    /**
     * <p>Emits the given event to all members of the given channel.</p>
     *
     * @param channel  the channel name
     * @param event    the event name
     * @param excluded the socket that must not receive the event, or null
     * @param args     the event arguments
     */
    void broadcast(String channel, String event, GatewaySocket excluded, Object... args);

    /**
     * <p>Emits the given event to the given socket only.</p>
     *
     * @param socket the target socket
     * @param event  the event name
     * @param args   the event arguments
     */
    void emitTo(GatewaySocket socket, String event, Object... args);
}
