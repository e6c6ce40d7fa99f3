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
package org.channelgate.server.authorizer;

import java.util.function.BooleanSupplier;

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.Promise;
import org.channelgate.gateway.SubscriptionState;
import org.channelgate.gateway.server.AuthResult;
import org.channelgate.gateway.server.Authenticator;
import org.channelgate.gateway.server.PresenceTracker;
import org.channelgate.gateway.server.SubscriptionRequest;
import org.channelgate.gateway.server.Transport;
import org.channelgate.server.ChannelClassifier;
import org.channelgate.server.JacksonMemberParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Decides whether a socket may join a channel and, if so, joins it.</p>
 * <p>Sockets join non-private channels unconditionally; joins to private
 * channels are authenticated by the {@link Authenticator}, whose result
 * arrives asynchronously. No lock is held while waiting for it, so
 * concurrent joins never wait on each other.</p>
 * <p>Results of back-to-back joins to the same channel may complete in
 * a different order than the joins were issued, unless the authenticator
 * itself serializes them.</p>
 */
public class SubscriptionAuthorizer {
    public static final String SUBSCRIPTION_ERROR_EVENT = "subscription_error";
    public static final int AUTHENTICATOR_FAILURE_STATUS = 500;

    private static final Logger _logger = LoggerFactory.getLogger(SubscriptionAuthorizer.class);

    private final ChannelClassifier _classifier;
    private final Transport _transport;
    private final Authenticator _authenticator;
    private final PresenceTracker _presence;
    private final JacksonMemberParser _memberParser;
    private final boolean _devMode;

    public SubscriptionAuthorizer(ChannelClassifier classifier, Transport transport, Authenticator authenticator, PresenceTracker presence, JacksonMemberParser memberParser, boolean devMode) {
        _classifier = classifier;
        _transport = transport;
        _authenticator = authenticator;
        _presence = presence;
        _memberParser = memberParser;
        _devMode = devMode;
    }

    /**
     * <p>Joins the socket to the channel of the request, authenticating
     * the join first if the channel is private.</p>
     * <p>The promise is succeeded with {@link SubscriptionState#SUBSCRIBED} when
     * the socket joined, with {@link SubscriptionState#REJECTED} when the
     * authenticator denied the join, and with {@link SubscriptionState#UNSUBSCRIBED}
     * when the socket disconnected before the authentication result arrived.</p>
     *
     * @param socket  the socket that requests to join
     * @param request the subscription request
     * @param promise the promise notified of the outcome
     */
    public void authorizeAndJoin(GatewaySocket socket, SubscriptionRequest request, Promise<SubscriptionState> promise) {
        authorizeAndJoin(socket, request, () -> true, promise);
    }

    /**
     * <p>Joins the socket to the channel of the request, like
     * {@link #authorizeAndJoin(GatewaySocket, SubscriptionRequest, Promise)},
     * discarding the authentication result also when {@code current} returns
     * false at the time the result arrives.</p>
     *
     * @param socket  the socket that requests to join
     * @param request the subscription request
     * @param current whether the join attempt is still wanted by its issuer
     * @param promise the promise notified of the outcome
     */
    public void authorizeAndJoin(GatewaySocket socket, SubscriptionRequest request, BooleanSupplier current, Promise<SubscriptionState> promise) {
        String channel = request.getChannel();
        if (!_classifier.isPrivate(channel)) {
            _transport.join(socket, channel);
            onJoin(socket, channel);
            promise.succeed(SubscriptionState.SUBSCRIBED);
            return;
        }

        if (_logger.isDebugEnabled()) {
            _logger.debug("Authenticating {} for private channel {}", socket.getId(), channel);
        }

        try {
            _authenticator.authenticate(socket, request, Promise.from(
                    result -> complete(socket, request, current, result, promise),
                    failure -> complete(socket, request, current, AuthResult.deny(AUTHENTICATOR_FAILURE_STATUS, String.valueOf(failure.getMessage())), promise)));
        } catch (Throwable x) {
            _logger.info("Exception while invoking authenticator " + _authenticator, x);
            complete(socket, request, current, AuthResult.deny(AUTHENTICATOR_FAILURE_STATUS, String.valueOf(x.getMessage())), promise);
        }
    }

    private void complete(GatewaySocket socket, SubscriptionRequest request, BooleanSupplier current, AuthResult result, Promise<SubscriptionState> promise) {
        String channel = request.getChannel();
        try {
            if (!socket.isConnected() || !current.getAsBoolean()) {
                if (_logger.isDebugEnabled()) {
                    _logger.debug("Discarding {} for departed {} on channel {}", result, socket.getId(), channel);
                }
                promise.succeed(SubscriptionState.UNSUBSCRIBED);
                return;
            }

            if (result instanceof AuthResult.Granted) {
                _transport.join(socket, channel);
                if (_classifier.isPresence(channel)) {
                    Object member = _memberParser.parse(((AuthResult.Granted)result).getChannelData());
                    _presence.join(socket, channel, member);
                }
                onJoin(socket, channel);
                promise.succeed(SubscriptionState.SUBSCRIBED);
            } else {
                AuthResult.Denied denied = (AuthResult.Denied)result;
                _logger.info("{} denied subscription to channel {}: {}", socket.getId(), channel, denied.getReason());
                _transport.emitTo(socket, SUBSCRIPTION_ERROR_EVENT, channel, denied.getStatus());
                promise.succeed(SubscriptionState.REJECTED);
            }
        } catch (Throwable x) {
            _logger.info("Exception while completing subscription of " + socket.getId() + " to " + channel, x);
            promise.fail(x);
        }
    }

    private void onJoin(GatewaySocket socket, String channel) {
        if (_devMode) {
            _logger.info("{} joined channel: {}", socket.getId(), channel);
        }
    }

    @Override
    public String toString() {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), _authenticator);
    }
}
