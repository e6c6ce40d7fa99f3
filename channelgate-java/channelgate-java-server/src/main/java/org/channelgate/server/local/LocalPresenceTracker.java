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
package org.channelgate.server.local;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.server.PresenceTracker;
import org.channelgate.gateway.server.Transport;
import org.eclipse.jetty.util.thread.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link PresenceTracker} that keeps presence members in memory and
 * notifies members of presence changes through the {@link Transport}.</p>
 * <p>A member that joins from several sockets is announced to the others
 * only once, when its first socket joins, and its departure only when its
 * last socket leaves.</p>
 * <p>Events emitted:</p>
 * <ul>
 * <li>{@value #SUBSCRIBED_EVENT}{@code (channel, members)} to the joining socket</li>
 * <li>{@value #JOINING_EVENT}{@code (channel, member)} to the other members</li>
 * <li>{@value #LEAVING_EVENT}{@code (channel, member)} to the other members</li>
 * </ul>
 */
public class LocalPresenceTracker implements PresenceTracker {
    public static final String SUBSCRIBED_EVENT = "presence:subscribed";
    public static final String JOINING_EVENT = "presence:joining";
    public static final String LEAVING_EVENT = "presence:leaving";

    private static final Logger _logger = LoggerFactory.getLogger(LocalPresenceTracker.class);

    private final AutoLock lock = new AutoLock();
    private final Map<String, Map<GatewaySocket, Object>> _channels = new HashMap<>();
    private final Transport _transport;

    public LocalPresenceTracker(Transport transport) {
        _transport = transport;
    }

    @Override
    public void join(GatewaySocket socket, String channel, Object member) {
        boolean announce;
        List<Object> members;
        try (AutoLock ignored = lock.lock()) {
            Map<GatewaySocket, Object> sockets = _channels.computeIfAbsent(channel, k -> new LinkedHashMap<>());
            announce = !sockets.containsValue(member);
            sockets.put(socket, member);
            members = distinct(sockets);
        }

        if (_logger.isDebugEnabled()) {
            _logger.debug("{} joined presence channel {} as {}", socket.getId(), channel, member);
        }

        _transport.emitTo(socket, SUBSCRIBED_EVENT, channel, members);
        if (announce) {
            _transport.broadcast(channel, JOINING_EVENT, socket, channel, member);
        }
    }

    @Override
    public void leave(GatewaySocket socket, String channel) {
        Object member;
        boolean announce;
        try (AutoLock ignored = lock.lock()) {
            Map<GatewaySocket, Object> sockets = _channels.get(channel);
            if (sockets == null || !sockets.containsKey(socket)) {
                return;
            }
            member = sockets.remove(socket);
            announce = !sockets.containsValue(member);
            if (sockets.isEmpty()) {
                _channels.remove(channel);
            }
        }

        if (_logger.isDebugEnabled()) {
            _logger.debug("{} left presence channel {} as {}", socket.getId(), channel, member);
        }

        if (announce) {
            _transport.broadcast(channel, LEAVING_EVENT, socket, channel, member);
        }
    }

    /**
     * @param channel the presence channel
     * @return the distinct members of the channel
     */
    public List<Object> getMembers(String channel) {
        try (AutoLock ignored = lock.lock()) {
            Map<GatewaySocket, Object> sockets = _channels.get(channel);
            return sockets == null ? List.of() : distinct(sockets);
        }
    }

    private static List<Object> distinct(Map<GatewaySocket, Object> sockets) {
        List<Object> result = new ArrayList<>();
        for (Object member : sockets.values()) {
            if (!result.contains(member)) {
                result.add(member);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("%s@%x", getClass().getSimpleName(), hashCode());
    }
}
