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
 * <p>An event originated by a subscriber, to be relayed to the other
 * members of a channel or to the backend application.</p>
 */
public class ClientEventRequest extends HashMap<String, Object> {
    private static final long serialVersionUID = 6021839542815497205L;

    public static final String CHANNEL_FIELD = "channel";
    public static final String EVENT_FIELD = "event";
    public static final String DATA_FIELD = "data";
    public static final String TO_APPLICATION_FIELD = "toApplication";
    public static final String APP_CHANNEL_FIELD = "appChannel";

    public ClientEventRequest() {
    }

    public ClientEventRequest(String channel, String event, Object data) {
        put(CHANNEL_FIELD, channel);
        put(EVENT_FIELD, event);
        put(DATA_FIELD, data);
    }

    public ClientEventRequest(Map<String, Object> fields) {
        putAll(fields);
    }

    public String getChannel() {
        Object channel = get(CHANNEL_FIELD);
        return channel == null ? null : String.valueOf(channel);
    }

    public String getEvent() {
        Object event = get(EVENT_FIELD);
        return event == null ? null : String.valueOf(event);
    }

    public Object getData() {
        return get(DATA_FIELD);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        Object data = getData();
        return data instanceof Map ? (Map<String, Object>)data : null;
    }

    /**
     * @return whether the client flagged this event as destined to the backend application
     */
    public boolean isToApplication() {
        Object value = get(TO_APPLICATION_FIELD);
        if (value instanceof Boolean) {
            return (Boolean)value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public String getAppChannel() {
        Object appChannel = get(APP_CHANNEL_FIELD);
        return appChannel == null ? null : String.valueOf(appChannel);
    }

    /**
     * <p>Flags this event as destined to the given application channel.</p>
     *
     * @param appChannel the application channel
     * @return this request
     */
    public ClientEventRequest toApplication(String appChannel) {
        put(TO_APPLICATION_FIELD, true);
        put(APP_CHANNEL_FIELD, appChannel);
        return this;
    }
}
