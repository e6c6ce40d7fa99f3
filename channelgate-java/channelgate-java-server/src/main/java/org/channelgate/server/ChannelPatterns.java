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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>The glob-like patterns used to classify channel names and event names.</p>
 * <p>A pattern is a string where the first {@code *} stands for any sequence
 * of characters; the rest of the pattern is interpreted as a regular expression.</p>
 * <p>Instances are immutable.</p>
 */
public final class ChannelPatterns {
    public static final List<String> DEFAULT_PRIVATE_CHANNELS = List.of("private-*", "presence-*");
    public static final List<String> DEFAULT_CLIENT_EVENTS = List.of("client-*");
    public static final String DEFAULT_APP_CHANNEL = "app-*";

    private static final ChannelPatterns DEFAULTS = new ChannelPatterns(DEFAULT_PRIVATE_CHANNELS, DEFAULT_CLIENT_EVENTS, DEFAULT_APP_CHANNEL);

    private final List<String> privateChannels;
    private final List<String> clientEvents;
    private final String appChannel;

    public ChannelPatterns(List<String> privateChannels, List<String> clientEvents, String appChannel) {
        this.privateChannels = Collections.unmodifiableList(Arrays.asList(privateChannels.toArray(new String[0])));
        this.clientEvents = Collections.unmodifiableList(Arrays.asList(clientEvents.toArray(new String[0])));
        this.appChannel = Objects.requireNonNull(appChannel);
    }

    public static ChannelPatterns defaults() {
        return DEFAULTS;
    }

    public List<String> getPrivateChannels() {
        return privateChannels;
    }

    public List<String> getClientEvents() {
        return clientEvents;
    }

    public String getAppChannel() {
        return appChannel;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ChannelPatterns)) {
            return false;
        }
        ChannelPatterns that = (ChannelPatterns)obj;
        return privateChannels.equals(that.privateChannels) &&
                clientEvents.equals(that.clientEvents) &&
                appChannel.equals(that.appChannel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(privateChannels, clientEvents, appChannel);
    }

    @Override
    public String toString() {
        return String.format("%s@%x[private=%s,client=%s,app=%s]",
                getClass().getSimpleName(),
                hashCode(),
                privateChannels,
                clientEvents,
                appChannel);
    }
}
