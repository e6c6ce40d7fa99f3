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

/**
 * <p>The result of the authentication of a subscription to a private channel.</p>
 * <p>A result is either {@link Granted}, possibly carrying the presence member
 * data, or {@link Denied}, carrying a status code and a reason.</p>
 */
public abstract class AuthResult {
    /**
     * @param channelData the presence member data, may be null
     * @return a result that grants the subscription
     */
    public static AuthResult grant(Object channelData) {
        return new Granted(channelData);
    }

    /**
     * @return a result that grants the subscription without member data
     */
    public static AuthResult grant() {
        return Granted.GRANTED;
    }

    /**
     * @param status the status code reported to the client
     * @param reason the reason for which the subscription is denied
     * @return a result that denies the subscription
     */
    public static AuthResult deny(int status, String reason) {
        return new Denied(status, reason);
    }

    public boolean isGranted() {
        return false;
    }

    public boolean isDenied() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName().toLowerCase();
    }

    public static final class Granted extends AuthResult {
        private static final Granted GRANTED = new Granted(null);

        private final Object channelData;

        private Granted(Object channelData) {
            this.channelData = channelData;
        }

        /**
         * @return the presence member data returned by the authenticator, or null
         */
        public Object getChannelData() {
            return channelData;
        }

        @Override
        public boolean isGranted() {
            return true;
        }
    }

    public static final class Denied extends AuthResult {
        private final int status;
        private final String reason;

        private Denied(int status, String reason) {
            if (reason == null) {
                reason = "";
            }
            this.status = status;
            this.reason = reason;
        }

        public int getStatus() {
            return status;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public boolean isDenied() {
            return true;
        }

        @Override
        public String toString() {
            return super.toString() + " (status=" + status + ", reason='" + reason + "')";
        }
    }
}
