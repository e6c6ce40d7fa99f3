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

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.Promise;

/**
 * <p>The backend that validates the right of a socket to join a private channel.</p>
 * <p>Implementations typically perform a remote call and complete the promise
 * when the response arrives; they must not block the calling thread.</p>
 * <p>Denials are reported by succeeding the promise with a
 * {@link AuthResult#deny(int, String) denied result}; failing the promise is
 * reserved for unexpected failures of the authenticator itself.</p>
 */
public interface Authenticator {
    /**
     * @param socket  the socket that requests to join
     * @param request the subscription request
     * @param promise the promise to complete with the authentication result
     */
    void authenticate(GatewaySocket socket, SubscriptionRequest request, Promise<AuthResult> promise);
}
