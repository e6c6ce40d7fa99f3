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
 * <p>A client connection as seen by the routing core.</p>
 * <p>Sockets are owned by the transport; the core only needs their identity
 * and whether they are still connected, so that results of asynchronous
 * operations are not applied to a socket that went away in the meantime.</p>
 */
public interface GatewaySocket {
    /**
     * @return the transport-assigned id of this socket
     */
    String getId();

    /**
     * @return whether this socket is still connected
     */
    boolean isConnected();
}
