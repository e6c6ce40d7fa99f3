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
import java.util.regex.Pattern;

/**
 * <p>Classifies channel names and event names against {@link ChannelPatterns}.</p>
 * <p>{@link #isPrivate(String)} and {@link #isClientEvent(String)} look for a match
 * anywhere in the name, so that for example {@code not-private-x} is a private
 * channel; {@link #isPresence(String)} and {@link #isAppChannel(String)} only
 * match at the start of the name.</p>
 */
public class ChannelClassifier {
    public static final String PRESENCE_PREFIX = "presence-";

    private final ChannelPatterns patterns;
    private final List<Pattern> privateChannels;
    private final List<Pattern> clientEvents;
    private final Pattern appChannel;
    private final String appChannelPrefix;

    public ChannelClassifier(ChannelPatterns patterns) {
        this.patterns = patterns;
        this.privateChannels = compile(patterns.getPrivateChannels());
        this.clientEvents = compile(patterns.getClientEvents());
        this.appChannel = Pattern.compile("^" + expand(patterns.getAppChannel(), ".*"));
        this.appChannelPrefix = expand(patterns.getAppChannel(), "");
    }

    public ChannelPatterns getPatterns() {
        return patterns;
    }

    /**
     * @param channel the channel name
     * @return whether the channel requires authentication before joining
     */
    public boolean isPrivate(String channel) {
        return find(privateChannels, channel);
    }

    /**
     * @param channel the channel name
     * @return whether the channel is a presence channel
     */
    public boolean isPresence(String channel) {
        return channel != null && channel.startsWith(PRESENCE_PREFIX);
    }

    /**
     * @param event the event name
     * @return whether the event may be relayed between subscribers
     */
    public boolean isClientEvent(String event) {
        return find(clientEvents, event);
    }

    /**
     * @param channel the channel name
     * @return whether the channel is already a well-formed application channel name
     */
    public boolean isAppChannel(String channel) {
        return channel != null && appChannel.matcher(channel).find();
    }

    /**
     * @return the application channel pattern without its wildcard, for example {@code app-}
     */
    public String getAppChannelPrefix() {
        return appChannelPrefix;
    }

    private static boolean find(List<Pattern> patterns, String name) {
        if (name == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> globs) {
        List<Pattern> result = new ArrayList<>(globs.size());
        for (String glob : globs) {
            result.add(Pattern.compile(expand(glob, ".*")));
        }
        return result;
    }

    // Only the first wildcard is expanded.
    private static String expand(String glob, String replacement) {
        int star = glob.indexOf('*');
        if (star < 0) {
            return glob;
        }
        return glob.substring(0, star) + replacement + glob.substring(star + 1);
    }

    @Override
    public String toString() {
        return String.format("%s@%x[%s]", getClass().getSimpleName(), hashCode(), patterns);
    }
}
