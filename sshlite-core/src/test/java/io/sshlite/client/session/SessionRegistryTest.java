/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.sshlite.client.session;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.sshlite.client.auth.AuthResolver;
import io.sshlite.client.auth.Credential;
import io.sshlite.client.auth.CredentialKind;
import io.sshlite.client.auth.CredentialPrompter;
import io.sshlite.client.auth.CredentialService;
import io.sshlite.common.AuthenticationException;
import io.sshlite.common.ConnectionException;
import io.sshlite.common.ConnectionFailure;
import io.sshlite.common.ConnectionState;
import io.sshlite.common.HostConfig;
import io.sshlite.common.HostVerificationException;
import io.sshlite.common.SshLiteModuleProperties;
import io.sshlite.common.event.ReconnectEvent;
import io.sshlite.common.event.SessionEventListener;
import io.sshlite.common.store.InMemoryKeyValueStore;
import io.sshlite.common.store.InMemorySecretStore;
import io.sshlite.util.test.ManualReconnectScheduler;
import org.apache.sshd.common.PropertyResolverUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class SessionRegistryTest {
    private static final HostConfig HOST = new HostConfig("10.0.0.5", 2222, "deploy");
    private static final HostConfig OTHER_HOST = new HostConfig("10.0.0.6", 22, "deploy");

    private final Map<String, Object> properties = new HashMap<>();
    private final List<ReconnectEvent> reconnectEvents = Collections.synchronizedList(new ArrayList<>());
    private final List<ConnectionState> states = Collections.synchronizedList(new ArrayList<>());
    private CredentialService credentials;
    private CredentialPrompter prompter;
    private FakeHostSessionFactory factory;
    private ManualReconnectScheduler scheduler;
    private SessionRegistry registry;

    public SessionRegistryTest() {
        super();
    }

    @BeforeEach
    void setUp() {
        properties.put(SshLiteModuleProperties.RECONNECT_INTERVAL.getName(), 250L);
        credentials = new CredentialService(new InMemoryKeyValueStore(), new InMemorySecretStore());
        prompter = Mockito.mock(CredentialPrompter.class);
        factory = new FakeHostSessionFactory(
                new AuthResolver(credentials, prompter), PropertyResolverUtils.toPropertyResolver(properties));
        scheduler = new ManualReconnectScheduler();
        registry = new SessionRegistry(
                factory, scheduler, PropertyResolverUtils.toPropertyResolver(properties), credentials, prompter);
        registry.addSessionEventListener(new SessionEventListener() {
            @Override
            public void sessionStateChanged(HostSession session, ConnectionState state) {
                states.add(state);
            }

            @Override
            public void sessionReconnecting(ReconnectEvent event) {
                reconnectEvents.add(event);
            }
        });
    }

    @AfterEach
    void tearDown() throws IOException {
        registry.close();
    }

    @Test
    void connectReusesLiveSession() throws IOException {
        HostSession first = registry.connect(HOST, null);
        HostSession second = registry.connect(HOST, null);
        assertSame(first, second, "Live session not reused");
        assertEquals(1, factory.getCreated().size(), "Mismatched created sessions");
        assertEquals(Arrays.asList(ConnectionState.CONNECTING, ConnectionState.CONNECTED), states);
        assertTrue(registry.hasConnections(), "No connections reported");
        assertEquals(Collections.singletonList(first), registry.getConnectedSessions());
    }

    @Test
    void failedConnectIsNotRegisteredNorRetried() {
        factory.failNextConnect(new ConnectionException(HOST.getIdentityKey(), ConnectionFailure.REFUSED, "refused"));
        assertThrows(ConnectionException.class, () -> registry.connect(HOST, null));
        assertNull(registry.getSession(HOST.getIdentityKey()), "Failed session registered");
        assertEquals(0, scheduler.getPendingCount(), "Reconnection scheduled for a never established session");
        assertTrue(reconnectEvents.isEmpty(), "Unexpected reconnection events: " + reconnectEvents);
    }

    @Test
    void droppedSessionIsReconnected() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        dropped.dropTransport();

        assertEvents(event(0, true));
        assertTrue(registry.isReconnecting(HOST.getIdentityKey()), "Not reconnecting");
        assertEquals(Duration.ofMillis(250L), scheduler.getLastDelay(), "Mismatched retry interval");
        assertEquals(Collections.singletonMap(HOST.getIdentityKey(), 0), registry.getReconnectingIdentities());

        assertEquals(1, scheduler.runPending(), "Mismatched executed attempts");
        assertEvents(event(0, true), event(1, true), event(1, false));
        assertFalse(registry.isReconnecting(HOST.getIdentityKey()), "Still reconnecting");

        HostSession current = registry.getSession(HOST.getIdentityKey());
        assertNotSame(dropped, current, "Dropped session kept");
        assertTrue(current.isConnected(), "Reconnected session not connected");
        assertEquals(0, scheduler.getPendingCount(), "Leftover attempts");
    }

    @Test
    void retriesUntilConnectionSucceeds() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        factory.failNextConnect(new ConnectionException(HOST.getIdentityKey(), ConnectionFailure.TIMEOUT, "timeout"));
        factory.failNextConnect(new ConnectionException(HOST.getIdentityKey(), ConnectionFailure.REFUSED, "refused"));
        dropped.dropTransport();

        scheduler.runPending();
        assertEquals(1, registry.getReconnectingIdentities().get(HOST.getIdentityKey()), "Mismatched attempt");
        scheduler.runPending();
        scheduler.runPending();
        assertEvents(event(0, true), event(1, true), event(2, true), event(3, true), event(3, false));
        assertTrue(registry.getSession(HOST.getIdentityKey()).isConnected(), "Not reconnected");
    }

    @Test
    void abandonsAfterMaxAttempts() throws IOException {
        properties.put(SshLiteModuleProperties.RECONNECT_MAX_ATTEMPTS.getName(), 2);
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        for (int index = 0; index < 3; index++) {
            factory.failNextConnect(
                    new ConnectionException(HOST.getIdentityKey(), ConnectionFailure.UNREACHABLE, "unreachable"));
        }
        dropped.dropTransport();

        scheduler.runPending();
        scheduler.runPending();
        assertEvents(event(0, true), event(1, true), event(2, true), event(2, false));
        assertEquals(0, scheduler.getPendingCount(), "Attempts scheduled after giving up");
        assertFalse(registry.isReconnecting(HOST.getIdentityKey()), "Still reconnecting");
        assertNull(registry.getSession(HOST.getIdentityKey()), "Failed session registered");
    }

    @Test
    void authenticationFailureAbandonsSeries() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        factory.failNextConnect(new AuthenticationException(HOST.getIdentityKey(), "denied"));
        dropped.dropTransport();

        scheduler.runPending();
        assertEvents(event(0, true), event(1, true), event(1, false));
        assertEquals(0, scheduler.getPendingCount(), "Retry scheduled after an authentication failure");
    }

    @Test
    void hostVerificationFailureAbandonsSeries() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        factory.failNextConnect(new HostVerificationException(
                HOST.getIdentityKey(), HostVerificationException.Reason.REJECTED_CHANGED, "SHA256:new", "SHA256:old",
                "changed"));
        dropped.dropTransport();

        scheduler.runPending();
        assertEvents(event(0, true), event(1, true), event(1, false));
        assertEquals(0, scheduler.getPendingCount(), "Retry scheduled after a host verification failure");
    }

    @Test
    void manualDisconnectDoesNotReconnect() throws IOException {
        HostSession session = registry.connect(HOST, null);
        assertTrue(registry.disconnect(HOST.getIdentityKey()), "Nothing disconnected");
        assertFalse(session.isConnected(), "Session still connected");
        assertNull(registry.getSession(HOST.getIdentityKey()), "Session still registered");
        assertEquals(0, scheduler.getPendingCount(), "Reconnection scheduled after a manual disconnect");
        assertTrue(reconnectEvents.isEmpty(), "Unexpected reconnection events: " + reconnectEvents);
        assertFalse(registry.disconnect(HOST.getIdentityKey()), "Disconnected twice");
    }

    @Test
    void manualDisconnectStopsPendingSeries() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        dropped.dropTransport();

        assertTrue(registry.disconnect(HOST.getIdentityKey()), "Nothing stopped");
        assertEvents(event(0, true), event(0, false));
        assertEquals(0, scheduler.runPending(), "Cancelled attempt executed");
        assertFalse(registry.isReconnecting(HOST.getIdentityKey()), "Still reconnecting");
    }

    @Test
    void explicitConnectCancelsPendingSeries() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        dropped.dropTransport();

        HostSession session = registry.connect(HOST, null);
        assertTrue(session.isConnected(), "Not connected");
        assertEvents(event(0, true), event(0, false));
        assertEquals(0, scheduler.runPending(), "Cancelled attempt executed");
        assertFalse(registry.isReconnecting(HOST.getIdentityKey()), "Still reconnecting");
    }

    @Test
    void connectWithOtherCredentialReplacesSession() throws IOException {
        HostSession first = registry.connect(HOST, null);
        Credential credential = credentials.addCredential(
                HOST.getIdentityKey(), "ops", CredentialKind.PASSWORD, "secret", null);
        HostSession second = registry.connect(HOST, credential);

        assertNotSame(first, second, "Session of another credential reused");
        assertFalse(first.isConnected(), "Replaced session still connected");
        assertTrue(second.isConnected(), "Replacement not connected");
        assertEquals(credential, second.getCredential(), "Mismatched credential");
        assertSame(second, registry.getSession(HOST.getIdentityKey()), "Replacement not registered");
        assertEquals(Collections.singletonList(second), registry.getConnectedSessions());
        assertEquals(0, scheduler.getPendingCount(), "Reconnection scheduled for the replaced session");
        assertTrue(reconnectEvents.isEmpty(), "Unexpected reconnection events: " + reconnectEvents);
    }

    @Test
    void explicitConnectDuringAttemptKeepsSingleSession() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        dropped.dropTransport();
        factory.setConnectHook(() -> {
            factory.setConnectHook(null);
            try {
                registry.connect(HOST, null);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });

        assertEquals(1, scheduler.runPending(), "Mismatched executed attempts");
        assertEvents(event(0, true), event(1, true), event(1, false));

        List<FakeHostSession> created = factory.getCreated();
        assertEquals(3, created.size(), "Mismatched created sessions");
        FakeHostSession attempt = created.get(1);
        FakeHostSession explicit = created.get(2);
        assertSame(explicit, registry.getSession(HOST.getIdentityKey()), "Explicit session not registered");
        assertTrue(explicit.isConnected(), "Explicit session not connected");
        assertFalse(attempt.isConnected(), "Superseded attempt left connected");
        assertEquals(Collections.singletonList(explicit), registry.getConnectedSessions());
        assertEquals(0, scheduler.getPendingCount(), "Leftover attempts");
    }

    @Test
    void disconnectDuringAttemptLeavesNothingConnected() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        dropped.dropTransport();
        factory.setConnectHook(() -> {
            factory.setConnectHook(null);
            assertTrue(registry.disconnect(HOST.getIdentityKey()), "Running series not stopped");
        });

        scheduler.runPending();
        assertEvents(event(0, true), event(1, true), event(1, false));
        assertFalse(factory.getLastCreated().isConnected(), "Superseded attempt left connected");
        assertNull(registry.getSession(HOST.getIdentityKey()), "Session registered after disconnect");
        assertFalse(registry.hasConnections(), "Connections reported after disconnect");
        assertFalse(registry.isReconnecting(HOST.getIdentityKey()), "Still reconnecting");
        assertEquals(0, scheduler.getPendingCount(), "Leftover attempts");
    }

    @Test
    void noReconnectionWhenDisabled() throws IOException {
        properties.put(SshLiteModuleProperties.AUTO_RECONNECT.getName(), false);
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        dropped.dropTransport();

        assertEquals(0, scheduler.getPendingCount(), "Reconnection scheduled");
        assertNull(registry.getSession(HOST.getIdentityKey()), "Dropped session still registered");
    }

    @Test
    void reconnectUsesOriginalCredential() throws IOException {
        Credential credential = credentials.addCredential(
                HOST.getIdentityKey(), "ops", CredentialKind.PASSWORD, "secret", null);
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, credential);
        dropped.dropTransport();
        scheduler.runPending();

        assertEquals(credential, factory.getLastCreated().getCredential(), "Mismatched reconnection credential");
        Mockito.verify(prompter, Mockito.never()).chooseCredential(Mockito.any(), Mockito.any());
    }

    @Test
    void reconnectUsesSingleRegisteredCredential() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        Credential credential = credentials.addCredential(
                HOST.getIdentityKey(), "ops", CredentialKind.PASSWORD, "secret", null);
        dropped.dropTransport();
        scheduler.runPending();

        assertEquals(credential, factory.getLastCreated().getCredential(), "Mismatched reconnection credential");
        Mockito.verify(prompter, Mockito.never()).chooseCredential(Mockito.any(), Mockito.any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void reconnectAsksToChooseAmongSeveralCredentials() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        credentials.addCredential(HOST.getIdentityKey(), "first", CredentialKind.PASSWORD, "secret-1", null);
        credentials.addCredential(HOST.getIdentityKey(), "second", CredentialKind.PASSWORD, "secret-2", null);
        Mockito.when(prompter.chooseCredential(Mockito.eq(HOST), Mockito.anyList()))
                .thenAnswer(invocation -> ((List<Credential>) invocation.getArgument(1)).get(1));
        dropped.dropTransport();
        scheduler.runPending();

        List<Credential> candidates = credentials.listCredentials(HOST);
        assertEquals(2, candidates.size(), "Mismatched candidates");
        assertEquals(candidates.get(1), factory.getLastCreated().getCredential(), "Mismatched chosen credential");
    }

    @Test
    void snapshotsReflectRunningSeries() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        factory.failNextConnect(new ConnectionException(HOST.getIdentityKey(), ConnectionFailure.TIMEOUT, "timeout"));
        dropped.dropTransport();
        scheduler.runPending();

        List<ReconnectRecord> records = registry.getReconnectRecords();
        assertEquals(1, records.size(), "Mismatched records");
        ReconnectRecord snapshot = records.get(0);
        assertEquals(HOST.getIdentityKey(), snapshot.getIdentity());
        assertEquals(1, snapshot.getAttempt(), "Mismatched attempt");

        scheduler.runPending();
        assertEquals(1, snapshot.getAttempt(), "Snapshot changed");
    }

    @Test
    void closeStopsEverything() throws IOException {
        FakeHostSession dropped = (FakeHostSession) registry.connect(HOST, null);
        HostSession other = registry.connect(OTHER_HOST, null);
        Closeable resource = Mockito.mock(Closeable.class);
        registry.addOwnedResource(resource);
        dropped.dropTransport();

        registry.close();
        assertTrue(registry.isClosed(), "Not closed");
        assertFalse(other.isConnected(), "Other session still connected");
        assertEquals(0, scheduler.runPending(), "Attempt executed after close");
        assertEvents(event(0, true), event(0, false));
        Mockito.verify(resource).close();
        assertThrows(IllegalStateException.class, () -> registry.connect(HOST, null));
    }

    private static ReconnectEvent event(int attempt, boolean reconnecting) {
        return new ReconnectEvent(HOST, attempt, reconnecting);
    }

    private void assertEvents(ReconnectEvent... expected) {
        List<String> actual;
        synchronized (reconnectEvents) {
            actual = reconnectEvents.stream().map(ReconnectEvent::toString).collect(Collectors.toList());
        }
        assertEquals(Arrays.stream(expected).map(ReconnectEvent::toString).collect(Collectors.toList()), actual);
    }
}
