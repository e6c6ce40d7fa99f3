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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BooleanSupplier;

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.Promise;
import org.channelgate.gateway.SubscriptionState;
import org.channelgate.gateway.server.ApplicationPublisher;
import org.channelgate.gateway.server.Authenticator;
import org.channelgate.gateway.server.ClientEventRequest;
import org.channelgate.gateway.server.PresenceTracker;
import org.channelgate.gateway.server.SubscriptionRequest;
import org.channelgate.gateway.server.Transport;
import org.channelgate.server.authorizer.SubscriptionAuthorizer;
import org.eclipse.jetty.util.component.AbstractLifeCycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Routes the join, leave and client event requests arriving from the
 * {@link Transport} to the transport room operations, after classifying
 * the target channel and authorizing the request.</p>
 * <p>The router is configured with options, read when the router is
 * {@link #start() started}; changing options afterwards has no effect
 * until the router is restarted.</p>
 */
public class GatewayRouter extends AbstractLifeCycle {
    public static final String DEV_MODE_OPTION = "devMode";
    public static final String DATABASE_OPTION = "database";
    public static final String PRIVATE_CHANNELS_OPTION = "privateChannels";
    public static final String CLIENT_EVENTS_OPTION = "clientEvents";
    public static final String APP_CHANNEL_OPTION = "appChannel";
    public static final String REDIS_DATABASE = "redis";

    private final Logger _logger = LoggerFactory.getLogger(getClass().getName() + "." + Integer.toHexString(System.identityHashCode(this)));
    private final Map<String, Object> _options = new TreeMap<>();
    private final ConcurrentMap<SubscriptionKey, Integer> _pending = new ConcurrentHashMap<>();
    // At most one rejected channel per socket, the most recent one.
    private final ConcurrentMap<GatewaySocket, String> _rejected = new ConcurrentHashMap<>();
    // Replaced when the socket disconnects, so that authentications started before are discarded.
    private final ConcurrentMap<GatewaySocket, Object> _generations = new ConcurrentHashMap<>();
    private final Transport _transport;
    private final Authenticator _authenticator;
    private final PresenceTracker _presence;
    private final ApplicationPublisher _publisher;
    private final JacksonMemberParser _memberParser = new JacksonMemberParser();
    private boolean _devMode;
    private ChannelClassifier _classifier;
    private SubscriptionAuthorizer _authorizer;
    private EventGate _eventGate;
    private ApplicationBridge _bridge;

    public GatewayRouter(Transport transport, Authenticator authenticator, PresenceTracker presence) {
        this(transport, authenticator, presence, null);
    }

    /**
     * @param transport     the connection transport
     * @param authenticator the authenticator for private channels
     * @param presence      the presence channels member tracker
     * @param publisher     the application publisher, or null; it is used only
     *                      if the {@value #DATABASE_OPTION} option is {@value #REDIS_DATABASE}
     */
    public GatewayRouter(Transport transport, Authenticator authenticator, PresenceTracker presence, ApplicationPublisher publisher) {
        _transport = transport;
        _authenticator = authenticator;
        _presence = presence;
        _publisher = publisher;
    }

    @Override
    protected void doStart() throws Exception {
        super.doStart();

        _devMode = getOption(DEV_MODE_OPTION, false);

        ChannelPatterns patterns = new ChannelPatterns(
                getOption(PRIVATE_CHANNELS_OPTION, ChannelPatterns.DEFAULT_PRIVATE_CHANNELS),
                getOption(CLIENT_EVENTS_OPTION, ChannelPatterns.DEFAULT_CLIENT_EVENTS),
                getOption(APP_CHANNEL_OPTION, ChannelPatterns.DEFAULT_APP_CHANNEL));
        _classifier = new ChannelClassifier(patterns);
        _authorizer = new SubscriptionAuthorizer(_classifier, _transport, _authenticator, _presence, _memberParser, _devMode);
        _eventGate = new EventGate(_classifier, _transport);

        ApplicationPublisher publisher = null;
        if (REDIS_DATABASE.equals(getOption(DATABASE_OPTION, ""))) {
            if (_publisher == null) {
                _logger.info("No application publisher configured for database {}", REDIS_DATABASE);
            }
            publisher = _publisher;
        }
        _bridge = new ApplicationBridge(_classifier, publisher);

        if (_logger.isDebugEnabled()) {
            _logger.debug("Channel patterns: {}, application bridge: {}", patterns, _bridge);
        }
        _logger.info("Channels are ready.");
    }

    @Override
    protected void doStop() throws Exception {
        super.doStop();
        _pending.clear();
        _rejected.clear();
        _generations.clear();
        _classifier = null;
        _authorizer = null;
        _eventGate = null;
        _bridge = null;
    }

    public Map<String, Object> getOptions() {
        return _options;
    }

    public Object getOption(String name) {
        return _options.get(name);
    }

    public void setOption(String name, Object value) {
        _options.put(name, value);
    }

    public void setOptions(Map<String, Object> options) {
        _options.putAll(options);
    }

    protected boolean getOption(String name, boolean dft) {
        Object value = getOption(name);
        if (value == null) {
            return dft;
        }
        if (value instanceof Boolean) {
            return (Boolean)value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    protected String getOption(String name, String dft) {
        Object value = getOption(name);
        return value == null ? dft : value.toString();
    }

    protected List<String> getOption(String name, List<String> dft) {
        Object value = getOption(name);
        if (value == null) {
            return dft;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable) {
            for (Object item : (Iterable<?>)value) {
                result.add(String.valueOf(item));
            }
        } else {
            for (String item : value.toString().split(",")) {
                item = item.trim();
                if (!item.isEmpty()) {
                    result.add(item);
                }
            }
        }
        return result;
    }

    public boolean isDevMode() {
        return _devMode;
    }

    public ChannelClassifier getChannelClassifier() {
        return _classifier;
    }

    public EventGate getEventGate() {
        return _eventGate;
    }

    public ApplicationBridge getApplicationBridge() {
        return _bridge;
    }

    public SubscriptionAuthorizer getSubscriptionAuthorizer() {
        return _authorizer;
    }

    /**
     * @param socket  the socket that requests to join
     * @param request the subscription request
     * @see #join(GatewaySocket, SubscriptionRequest, Promise)
     */
    public void join(GatewaySocket socket, SubscriptionRequest request) {
        join(socket, request, Promise.noop());
    }

    /**
     * <p>Joins the socket to the channel of the given request.</p>
     * <p>Requests without channel are ignored, and the promise is succeeded
     * with {@link SubscriptionState#UNSUBSCRIBED}.</p>
     * <p>Authentication results that arrive after the socket has been
     * {@link #disconnect(GatewaySocket, String) disconnected} are discarded,
     * even if the transport still reports the socket as connected.</p>
     *
     * @param socket  the socket that requests to join
     * @param request the subscription request
     * @param promise the promise notified of the subscription state after the join attempt
     */
    public void join(GatewaySocket socket, SubscriptionRequest request, Promise<SubscriptionState> promise) {
        checkStarted();
        String channel = request.getChannel();
        if (channel == null || channel.isEmpty()) {
            promise.succeed(SubscriptionState.UNSUBSCRIBED);
            return;
        }

        SubscriptionKey key = new SubscriptionKey(socket, channel);
        BooleanSupplier current;
        if (_classifier.isPrivate(channel)) {
            Object generation = _generations.computeIfAbsent(socket, s -> new Object());
            current = () -> _generations.get(socket) == generation;
            _pending.merge(key, 1, Integer::sum);
        } else {
            current = () -> true;
        }
        _authorizer.authorizeAndJoin(socket, request, current, Promise.from(state -> {
            // Attempts abandoned by disconnect() no longer own a pending count.
            if (current.getAsBoolean()) {
                _pending.computeIfPresent(key, this::decrement);
                if (state == SubscriptionState.REJECTED) {
                    _rejected.put(socket, channel);
                } else if (state == SubscriptionState.SUBSCRIBED) {
                    _rejected.remove(socket, channel);
                }
            }
            promise.succeed(state);
        }, failure -> {
            if (current.getAsBoolean()) {
                _pending.computeIfPresent(key, this::decrement);
            }
            promise.fail(failure);
        }));
    }

    private Integer decrement(SubscriptionKey key, Integer count) {
        return count > 1 ? count - 1 : null;
    }

    /**
     * <p>Removes the socket from the given channel.</p>
     * <p>For presence channels, the presence tracker is notified before the
     * socket is removed, so that the other members are notified of the leave
     * while the socket is still a member.</p>
     * <p>Leaving a channel that the socket has not joined is a no-operation.</p>
     *
     * @param socket  the socket that leaves
     * @param channel the channel to leave
     * @param reason  the reason for leaving, for logging
     */
    public void leave(GatewaySocket socket, String channel, String reason) {
        checkStarted();
        if (channel == null || channel.isEmpty()) {
            return;
        }

        if (_classifier.isPresence(channel)) {
            _presence.leave(socket, channel);
        }
        _transport.leave(socket, channel);
        _rejected.remove(socket, channel);

        if (_devMode) {
            _logger.info("{} left channel: {} ({})", socket.getId(), channel, reason);
        }
    }

    /**
     * <p>Removes the socket from all the channels it joined, typically
     * because the socket is disconnecting.</p>
     * <p>Authentications still pending for the socket are abandoned:
     * their results will not join the socket to any channel.</p>
     *
     * @param socket the socket that disconnects
     * @param reason the reason of the disconnection, for logging
     */
    public void disconnect(GatewaySocket socket, String reason) {
        checkStarted();
        _generations.remove(socket);
        _pending.keySet().removeIf(key -> key.socket() == socket);
        _rejected.remove(socket);
        Set<String> channels = _transport.channelsOf(socket);
        for (String channel : channels) {
            leave(socket, channel, reason);
        }
    }

    /**
     * <p>Relays a client event to the other members of its channel, or to the
     * backend application, if the event is acceptable.</p>
     *
     * @param socket  the socket that sent the event
     * @param request the client event
     */
    public void clientEvent(GatewaySocket socket, ClientEventRequest request) {
        checkStarted();
        if (!_eventGate.isEventAcceptable(socket, request)) {
            return;
        }

        if (_bridge.isApplicationBound(request)) {
            _bridge.route(request);
        } else {
            String channel = request.getChannel();
            _transport.broadcast(channel, request.getEvent(), socket, channel, request.getData());
        }
    }

    /**
     * @param socket  the socket
     * @param channel the channel
     * @return the state of the subscription of the socket to the channel
     */
    public SubscriptionState getSubscriptionState(GatewaySocket socket, String channel) {
        if (_transport.isMember(socket, channel)) {
            return SubscriptionState.SUBSCRIBED;
        }
        if (_pending.containsKey(new SubscriptionKey(socket, channel))) {
            return SubscriptionState.PENDING_AUTH;
        }
        if (channel.equals(_rejected.get(socket))) {
            return SubscriptionState.REJECTED;
        }
        return SubscriptionState.UNSUBSCRIBED;
    }

    private void checkStarted() {
        if (!isStarted()) {
            throw new IllegalStateException("Not started: " + this);
        }
    }

    @Override
    public String toString() {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), getState());
    }

    private record SubscriptionKey(GatewaySocket socket, String channel) {
    }
}
