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
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.channelgate.gateway.Promise;
import org.channelgate.gateway.SubscriptionState;
import org.channelgate.gateway.server.ApplicationPublisher;
import org.channelgate.gateway.server.ClientEventRequest;
import org.channelgate.gateway.server.SubscriptionRequest;
import org.channelgate.server.authorizer.SubscriptionAuthorizer;
import org.channelgate.server.local.LocalSocket;
import org.channelgate.server.local.LocalTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GatewayRouterTest {
    private final LocalTransport transport = new LocalTransport();
    private final DeferredAuthenticator authenticator = new DeferredAuthenticator();
    private final RecordingPresenceTracker presence = new RecordingPresenceTracker(transport);
    private final List<Object[]> published = new ArrayList<>();
    private final ApplicationPublisher publisher = (channel, payload) -> published.add(new Object[]{channel, payload});
    private final LocalSocket alice = new LocalSocket("alice");
    private final LocalSocket bob = new LocalSocket("bob");
    private final RecordingListener aliceEvents = RecordingListener.on(alice);
    private final RecordingListener bobEvents = RecordingListener.on(bob);
    private GatewayRouter router;

    @BeforeEach
    public void init() throws Exception {
        router = new GatewayRouter(transport, authenticator, presence, publisher);
        router.setOption(GatewayRouter.DEV_MODE_OPTION, true);
        router.setOption(GatewayRouter.DATABASE_OPTION, GatewayRouter.REDIS_DATABASE);
        router.start();
    }

    @AfterEach
    public void destroy() throws Exception {
        router.stop();
    }

    @Test
    public void testJoinPublicChannel() throws Exception {
        Promise.Completable<SubscriptionState> promise = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest("public-room"), promise);

        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, promise.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(0, authenticator.getPendingCount());
        Assertions.assertTrue(transport.membersOf("public-room").contains(alice));
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, router.getSubscriptionState(alice, "public-room"));
    }

    @Test
    public void testJoinWithoutChannelIsIgnored() throws Exception {
        Promise.Completable<SubscriptionState> promise = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest(), promise);

        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, promise.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(transport.channelsOf(alice).isEmpty());
        Assertions.assertEquals(0, authenticator.getPendingCount());
    }

    @Test
    public void testPrivateJoinStateMachine() throws Exception {
        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room1"));

        Promise.Completable<SubscriptionState> denied = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest("private-room1"), denied);
        Assertions.assertEquals(SubscriptionState.PENDING_AUTH, router.getSubscriptionState(alice, "private-room1"));

        authenticator.next().deny(403, "Forbidden");
        Assertions.assertEquals(SubscriptionState.REJECTED, denied.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(SubscriptionState.REJECTED, router.getSubscriptionState(alice, "private-room1"));
        Assertions.assertEquals(1, aliceEvents.named(SubscriptionAuthorizer.SUBSCRIPTION_ERROR_EVENT).size());

        // A new attempt re-enters authentication.
        Promise.Completable<SubscriptionState> granted = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest("private-room1"), granted);
        Assertions.assertEquals(SubscriptionState.PENDING_AUTH, router.getSubscriptionState(alice, "private-room1"));

        authenticator.next().grant(null);
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, granted.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, router.getSubscriptionState(alice, "private-room1"));

        router.leave(alice, "private-room1", "test");
        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room1"));
    }

    @Test
    public void testLeaveNotJoinedChannelIsNoop() {
        Assertions.assertDoesNotThrow(() -> router.leave(alice, "private-room1", "test"));
        Assertions.assertDoesNotThrow(() -> router.leave(alice, "presence-room1", "test"));
        Assertions.assertDoesNotThrow(() -> router.leave(alice, null, "test"));
        Assertions.assertTrue(transport.channelsOf(alice).isEmpty());
    }

    @Test
    public void testLeavePresenceChannelNotifiesTrackerBeforeRemoval() throws Exception {
        Promise.Completable<SubscriptionState> promise = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest("presence-room1"), promise);
        authenticator.next().grant("{\"id\":1,\"name\":\"A\"}");
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, promise.get(5, TimeUnit.SECONDS));

        router.leave(alice, "presence-room1", "unsubscribed");

        Assertions.assertEquals(2, presence.calls.size());
        RecordingPresenceTracker.Call join = presence.calls.get(0);
        Assertions.assertEquals(Map.of("id", 1, "name", "A"), join.member());
        RecordingPresenceTracker.Call leave = presence.calls.get(1);
        Assertions.assertEquals("leave", leave.type());
        Assertions.assertTrue(leave.wasMember());
        Assertions.assertFalse(transport.isMember(alice, "presence-room1"));
    }

    @Test
    public void testLeavePrivateChannelDoesNotNotifyTracker() {
        transport.join(alice, "private-room1");
        router.leave(alice, "private-room1", "unsubscribed");
        Assertions.assertTrue(presence.calls.isEmpty());
        Assertions.assertFalse(transport.isMember(alice, "private-room1"));
    }

    @Test
    public void testDisconnectLeavesAllChannels() throws Exception {
        router.join(alice, new SubscriptionRequest("public-room"));
        router.join(alice, new SubscriptionRequest("presence-room1"));
        authenticator.next().grant("{\"id\":1}");
        router.join(alice, new SubscriptionRequest("private-room2"));
        Assertions.assertEquals(2, transport.channelsOf(alice).size());

        alice.disconnect();
        router.disconnect(alice, "transport close");

        Assertions.assertTrue(transport.channelsOf(alice).isEmpty());
        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room2"));
        Assertions.assertEquals("leave", presence.calls.get(presence.calls.size() - 1).type());

        // The pending authentication completes after the disconnection.
        authenticator.next().grant(null);
        Assertions.assertFalse(transport.isMember(alice, "private-room2"));
        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room2"));
    }

    @Test
    public void testGrantAfterRouterDisconnectIsDiscarded() throws Exception {
        Promise.Completable<SubscriptionState> promise = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest("private-room2"), promise);

        // The transport still reports the socket as connected.
        router.disconnect(alice, "transport close");
        Assertions.assertTrue(alice.isConnected());

        authenticator.next().grant(null);

        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, promise.get(5, TimeUnit.SECONDS));
        Assertions.assertFalse(transport.isMember(alice, "private-room2"));
        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room2"));

        // Joins after the disconnection are honored again.
        Promise.Completable<SubscriptionState> rejoin = new Promise.Completable<>();
        router.join(alice, new SubscriptionRequest("private-room2"), rejoin);
        authenticator.next().grant(null);
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, rejoin.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(transport.isMember(alice, "private-room2"));
    }

    @Test
    public void testOnlyLatestRejectionIsRemembered() throws Exception {
        for (int i = 0; i < 10; ++i) {
            router.join(alice, new SubscriptionRequest("private-room" + i));
            authenticator.next().deny(403, "Forbidden");
        }

        Assertions.assertEquals(SubscriptionState.REJECTED, router.getSubscriptionState(alice, "private-room9"));
        for (int i = 0; i < 9; ++i) {
            Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room" + i));
        }

        router.join(alice, new SubscriptionRequest("private-room9"));
        authenticator.next().grant(null);
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, router.getSubscriptionState(alice, "private-room9"));
        router.leave(alice, "private-room9", "test");
        Assertions.assertEquals(SubscriptionState.UNSUBSCRIBED, router.getSubscriptionState(alice, "private-room9"));
    }

    @Test
    public void testConcurrentAttemptsStayPendingUntilLastCompletes() throws Exception {
        router.join(alice, new SubscriptionRequest("private-room1"));
        router.join(alice, new SubscriptionRequest("private-room1"));

        authenticator.next().deny(403, "Forbidden");
        Assertions.assertEquals(SubscriptionState.PENDING_AUTH, router.getSubscriptionState(alice, "private-room1"));

        authenticator.next().grant(null);
        Assertions.assertEquals(SubscriptionState.SUBSCRIBED, router.getSubscriptionState(alice, "private-room1"));
    }

    @Test
    public void testClientEventBroadcastToOtherMembers() throws Exception {
        transport.join(alice, "private-room1");
        transport.join(bob, "private-room1");

        router.clientEvent(alice, new ClientEventRequest("private-room1", "client-msg", Map.of("text", "hi")));

        Assertions.assertTrue(aliceEvents.events.isEmpty());
        List<RecordingListener.Event> received = bobEvents.named("client-msg");
        Assertions.assertEquals(1, received.size());
        Assertions.assertEquals(List.of("private-room1", Map.of("text", "hi")), received.get(0).args());
        Assertions.assertTrue(published.isEmpty());
    }

    @Test
    public void testClientEventFromNonMemberIsDropped() {
        transport.join(bob, "private-room1");

        router.clientEvent(alice, new ClientEventRequest("private-room1", "client-msg", "hi"));

        Assertions.assertTrue(bobEvents.events.isEmpty());
        Assertions.assertTrue(aliceEvents.events.isEmpty());
    }

    @Test
    public void testClientEventOnPublicChannelIsDropped() {
        transport.join(alice, "public-room1");
        transport.join(bob, "public-room1");

        router.clientEvent(alice, new ClientEventRequest("public-room1", "client-msg", "hi"));

        Assertions.assertTrue(bobEvents.events.isEmpty());
        Assertions.assertTrue(aliceEvents.events.isEmpty());
    }

    @Test
    public void testClientEventToApplication() {
        transport.join(alice, "private-room1");
        transport.join(bob, "private-room1");

        ClientEventRequest request = new ClientEventRequest("private-room1", "client-msg", Map.of("x", 1)).toApplication("orders");
        router.clientEvent(alice, request);

        Assertions.assertEquals(1, published.size());
        Assertions.assertEquals("app-orders", published.get(0)[0]);
        Assertions.assertEquals(Map.of("x", 1, "sourceChannel", "private-room1"), published.get(0)[1]);
        // Not broadcast to the other members.
        Assertions.assertTrue(bobEvents.events.isEmpty());
    }

    @Test
    public void testApplicationEventNotAcceptableIsNotPublished() {
        ClientEventRequest request = new ClientEventRequest("private-room1", "client-msg", Map.of("x", 1)).toApplication("orders");
        router.clientEvent(alice, request);
        Assertions.assertTrue(published.isEmpty());
    }

    @Test
    public void testWithoutDatabaseApplicationEventsAreDropped() throws Exception {
        router.stop();
        router.getOptions().remove(GatewayRouter.DATABASE_OPTION);
        router.start();
        Assertions.assertFalse(router.getApplicationBridge().isEnabled());

        transport.join(alice, "private-room1");
        transport.join(bob, "private-room1");
        router.clientEvent(alice, new ClientEventRequest("private-room1", "client-msg", Map.of("x", 1)).toApplication("orders"));

        Assertions.assertTrue(published.isEmpty());
        Assertions.assertTrue(bobEvents.events.isEmpty());
    }

    @Test
    public void testPatternOptions() throws Exception {
        router.stop();
        router.setOption(GatewayRouter.PRIVATE_CHANNELS_OPTION, "secure-*, presence-*");
        router.setOption(GatewayRouter.CLIENT_EVENTS_OPTION, List.of("peer-*"));
        router.setOption(GatewayRouter.APP_CHANNEL_OPTION, "backend-*");
        router.setOption(GatewayRouter.DEV_MODE_OPTION, "false");
        router.start();

        Assertions.assertFalse(router.isDevMode());
        ChannelClassifier classifier = router.getChannelClassifier();
        Assertions.assertEquals(List.of("secure-*", "presence-*"), classifier.getPatterns().getPrivateChannels());
        Assertions.assertTrue(classifier.isPrivate("secure-room"));
        Assertions.assertFalse(classifier.isPrivate("private-room"));
        Assertions.assertTrue(classifier.isClientEvent("peer-typing"));
        Assertions.assertEquals("backend-", classifier.getAppChannelPrefix());

        transport.join(alice, "secure-room");
        transport.join(bob, "secure-room");
        router.clientEvent(alice, new ClientEventRequest("secure-room", "peer-typing", null).toApplication("orders"));
        Assertions.assertEquals("backend-orders", published.get(0)[0]);
    }

    @Test
    public void testNotStarted() throws Exception {
        router.stop();
        Assertions.assertThrows(IllegalStateException.class, () -> router.join(alice, new SubscriptionRequest("public-room")));
        Assertions.assertThrows(IllegalStateException.class, () -> router.clientEvent(alice, new ClientEventRequest()));
    }
}
