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

import org.channelgate.gateway.GatewaySocket;
import org.channelgate.gateway.Promise;
import org.channelgate.gateway.server.AuthResult;
import org.channelgate.gateway.server.Authenticator;
import org.channelgate.gateway.server.SubscriptionRequest;

/**
 * <p>This {@link Authenticator} implementation grants or denies every
 * subscription request with a result defined at construction time,
 * without contacting any backend.</p>
 * <p>It is useful for deployments that do not use private channels,
 * and for testing.</p>
 */
public class GrantAuthenticator implements Authenticator {
    /**
     * Grants every subscription, without presence member data
     */
    public static final GrantAuthenticator GRANT_ALL = new GrantAuthenticator(AuthResult.grant());

    /**
     * Denies every subscription with status 403
     */
    public static final GrantAuthenticator DENY_ALL = new GrantAuthenticator(AuthResult.deny(403, "Private channels are not enabled"));

    private final AuthResult _result;

    public GrantAuthenticator(AuthResult result) {
        _result = result;
    }

    @Override
    public void authenticate(GatewaySocket socket, SubscriptionRequest request, Promise<AuthResult> promise) {
        promise.succeed(_result);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + _result + "]";
    }
}
