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

import java.util.LinkedHashMap;
import java.util.Map;

import org.channelgate.gateway.server.ApplicationPublisher;
import org.channelgate.gateway.server.ClientEventRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Forwards client events destined to the backend application
 * to the {@link ApplicationPublisher}, if one is configured.</p>
 * <p>The target channel is normalized to the application channel pattern,
 * and the payload is decorated with the subscriber-facing channel the
 * event was sent on, under the {@value #SOURCE_CHANNEL_FIELD} key.</p>
 */
public class ApplicationBridge {
    public static final String SOURCE_CHANNEL_FIELD = "sourceChannel";

    private static final Logger _logger = LoggerFactory.getLogger(ApplicationBridge.class);

    private final ChannelClassifier _classifier;
    private final ApplicationPublisher _publisher;

    /**
     * @param classifier the classifier for application channel names
     * @param publisher  the publisher, or null if the deployment has no application bridge
     */
    public ApplicationBridge(ChannelClassifier classifier, ApplicationPublisher publisher) {
        _classifier = classifier;
        _publisher = publisher;
    }

    public boolean isEnabled() {
        return _publisher != null;
    }

    /**
     * @param request the client event
     * @return whether the event is flagged for the application and names an application channel
     */
    public boolean isApplicationBound(ClientEventRequest request) {
        String appChannel = request.getAppChannel();
        return request.isToApplication() && appChannel != null && !appChannel.isEmpty();
    }

    /**
     * @param appChannel the application channel requested by the client
     * @return the application channel name, prefixed if it does not match the application pattern
     */
    public String normalize(String appChannel) {
        if (_classifier.isAppChannel(appChannel)) {
            return appChannel;
        }
        return _classifier.getAppChannelPrefix() + appChannel;
    }

    /**
     * <p>Publishes the given client event to the application.</p>
     *
     * @param request the application-bound client event
     * @return whether the event has been published
     */
    public boolean route(ClientEventRequest request) {
        if (!isApplicationBound(request)) {
            return false;
        }
        if (_publisher == null) {
            if (_logger.isDebugEnabled()) {
                _logger.debug("No application publisher, dropping event for {}", request.getAppChannel());
            }
            return false;
        }

        String channel = normalize(request.getAppChannel());
        Map<String, Object> payload = new LinkedHashMap<>();
        Object data = request.getData();
        Map<String, Object> dataMap = request.getDataAsMap();
        if (dataMap != null) {
            payload.putAll(dataMap);
        } else if (data != null) {
            payload.put(ClientEventRequest.DATA_FIELD, data);
        }
        payload.put(SOURCE_CHANNEL_FIELD, request.getChannel());

        _logger.info("Sending data to application channel: {}", channel);
        _publisher.publish(channel, payload);
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), _publisher);
    }
}
