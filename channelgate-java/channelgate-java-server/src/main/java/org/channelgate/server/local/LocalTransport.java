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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.server.Transport;
import org.eclipse.jetty.util.thread.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A {@link Transport} that keeps channel membership in memory and
 * delivers events synchronously to {@link LocalSocket}s.</p>
 * <p>Membership is indexed both by channel and by socket; the two indexes
 * are updated together under a single lock, and queries return snapshots.</p>
 */
public class LocalTransport implements Transport {
    private static final Logger _logger = LoggerFactory.getLogger(LocalTransport.class);

    private final AutoLock lock = new AutoLock();
    private final Map<String, Set<GatewaySocket>> _rooms = new HashMap<>();
    private final Map<GatewaySocket, Set<String>> _socketRooms = new HashMap<>();

    @Override
    public void join(GatewaySocket socket, String channel) {
        try (AutoLock ignored = lock.lock()) {
            _rooms.computeIfAbsent(channel, name -> new HashSet<>()).add(socket);
            _socketRooms.computeIfAbsent(socket, s -> new HashSet<>()).add(channel);
        }
        if (_logger.isDebugEnabled()) {
            _logger.debug("{} joined room {}", socket, channel);
        }
    }

    @Override
    public void leave(GatewaySocket socket, String channel) {
        try (AutoLock ignored = lock.lock()) {
            Set<GatewaySocket> members = _rooms.get(channel);
            if (members != null && members.remove(socket) && members.isEmpty()) {
                _rooms.remove(channel);
            }
            Set<String> channels = _socketRooms.get(socket);
            if (channels != null && channels.remove(channel) && channels.isEmpty()) {
                _socketRooms.remove(socket);
            }
        }
        if (_logger.isDebugEnabled()) {
            _logger.debug("{} left room {}", socket, channel);
        }
    }

    @Override
    public Set<GatewaySocket> membersOf(String channel) {
        try (AutoLock ignored = lock.lock()) {
            Set<GatewaySocket> members = _rooms.get(channel);
            return members == null ? Collections.emptySet() : Set.copyOf(members);
        }
    }

    @Override
    public Set<String> channelsOf(GatewaySocket socket) {
        try (AutoLock ignored = lock.lock()) {
            Set<String> channels = _socketRooms.get(socket);
            return channels == null ? Collections.emptySet() : Set.copyOf(channels);
        }
    }

    @Override
    public boolean isMember(GatewaySocket socket, String channel) {
        try (AutoLock ignored = lock.lock()) {
            Set<GatewaySocket> members = _rooms.get(channel);
            return members != null && members.contains(socket);
        }
    }

    /**
     * @return the names of the channels that have at least one member
     */
    public Set<String> getChannels() {
        try (AutoLock ignored = lock.lock()) {
            return Set.copyOf(_rooms.keySet());
        }
    }

    @Override
    public void broadcast(String channel, String event, GatewaySocket excluded, Object... args) {
        Set<GatewaySocket> members = membersOf(channel);
        if (_logger.isDebugEnabled()) {
            _logger.debug("Broadcasting {} to {} members of {}", event, members.size(), channel);
        }
        for (GatewaySocket member : members) {
            if (member != excluded) {
                emitTo(member, event, args);
            }
        }
    }

    @Override
    public void emitTo(GatewaySocket socket, String event, Object... args) {
        if (!(socket instanceof LocalSocket)) {
            throw new IllegalArgumentException("Not a local socket: " + socket);
        }
        ((LocalSocket)socket).deliver(event, args);
    }

    @Override
    public String toString() {
        int rooms;
        try (AutoLock ignored = lock.lock()) {
            rooms = _rooms.size();
        }
        return String.format("%s@%x[rooms=%d]", getClass().getSimpleName(), hashCode(), rooms);
    }
}
