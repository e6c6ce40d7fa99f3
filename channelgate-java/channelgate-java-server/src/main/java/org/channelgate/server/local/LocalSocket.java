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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.channelgate.gateway.GatewaySocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An in-process socket, whose events are delivered to its listeners.</p>
 */
public class LocalSocket implements GatewaySocket {
    private static final Logger _logger = LoggerFactory.getLogger(LocalSocket.class);

    private final List<EventListener> _listeners = new CopyOnWriteArrayList<>();
    private final String _id;
    private volatile boolean _connected = true;

    public LocalSocket(String id) {
        _id = id;
    }

    @Override
    public String getId() {
        return _id;
    }

    @Override
    public boolean isConnected() {
        return _connected;
    }

    /**
     * <p>Marks this socket as disconnected.</p>
     * <p>Membership cleanup is performed by the gateway router,
     * not by this method.</p>
     */
    public void disconnect() {
        _connected = false;
    }

    public void addListener(EventListener listener) {
        _listeners.add(listener);
    }

    public void removeListener(EventListener listener) {
        _listeners.remove(listener);
    }

    void deliver(String event, Object[] args) {
        if (!isConnected()) {
            if (_logger.isDebugEnabled()) {
                _logger.debug("Not delivering {} to disconnected {}", event, this);
            }
            return;
        }
        for (EventListener listener : _listeners) {
            try {
                listener.onEvent(event, args);
            } catch (Throwable x) {
                _logger.info("Exception while invoking listener " + listener, x);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), _id);
    }

    /**
     * <p>Listener for events emitted to a socket.</p>
     */
    @FunctionalInterface
    public interface EventListener {
        /**
         * @param event the event name
         * @param args  the event arguments
         */
        void onEvent(String event, Object[] args);
    }
}
