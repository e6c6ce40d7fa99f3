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
package org.channelgate.server;

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.server.ClientEventRequest;
import org.channelgate.gateway.server.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Decides whether an event originated by a client may be relayed.</p>
 * <p>An event is acceptable only if its name is a client event name, its
 * channel is private, and the sender is a member of that channel.
 * Unacceptable events are dropped without notifying the sender.</p>
 */
public class EventGate {
    private static final Logger _logger = LoggerFactory.getLogger(EventGate.class);

    private final ChannelClassifier _classifier;
    private final Transport _transport;

    public EventGate(ChannelClassifier classifier, Transport transport) {
        _classifier = classifier;
        _transport = transport;
    }

    public boolean isEventAcceptable(GatewaySocket socket, ClientEventRequest request) {
        String channel = request.getChannel();
        String event = request.getEvent();
        if (channel == null || channel.isEmpty() || event == null || event.isEmpty()) {
            return false;
        }

        boolean acceptable = _classifier.isClientEvent(event) &&
                _classifier.isPrivate(channel) &&
                _transport.isMember(socket, channel);
        if (!acceptable && _logger.isDebugEnabled()) {
            _logger.debug("Dropping event {} from {} on channel {}", event, socket.getId(), channel);
        }
        return acceptable;
    }
}
