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
package org.channelgate.gateway;

/**
 * <p>The states of a socket subscription to a channel.</p>
 */
public enum SubscriptionState {
    /**
     * The socket is not a member of the channel
     */
    UNSUBSCRIBED,
    /**
     * A join to a private channel is waiting for the authentication result
     */
    PENDING_AUTH,
    /**
     * The socket is a member of the channel
     */
    SUBSCRIBED,
    /**
     * The last join attempt was denied; a new join attempt may be issued
     */
    REJECTED
}
