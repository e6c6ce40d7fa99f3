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

import java.util.HashMap;
import java.util.Map;

/**
 * <p>A request of a socket to join a channel, as sent by the client.</p>
 * <p>Fields other than the channel are opaque to the routing core and are
 * made available to the {@link Authenticator}.</p>
 */
public class SubscriptionRequest extends HashMap<String, Object> {
    private static final long serialVersionUID = -2268457340178232873L;

    public static final String CHANNEL_FIELD = "channel";
    public static final String CHANNEL_DATA_FIELD = "channel_data";
    public static final String AUTH_FIELD = "auth";

    public SubscriptionRequest() {
    }

    public SubscriptionRequest(String channel) {
        setChannel(channel);
    }

    public SubscriptionRequest(Map<String, Object> fields) {
        putAll(fields);
    }

    public String getChannel() {
        Object channel = get(CHANNEL_FIELD);
        return channel == null ? null : String.valueOf(channel);
    }

    public void setChannel(String channel) {
        put(CHANNEL_FIELD, channel);
    }

    public Object getChannelData() {
        return get(CHANNEL_DATA_FIELD);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getAuth() {
        Object auth = get(AUTH_FIELD);
        return auth instanceof Map ? (Map<String, Object>)auth : null;
    }

    public void setAuth(Map<String, Object> auth) {
        put(AUTH_FIELD, auth);
    }
}
