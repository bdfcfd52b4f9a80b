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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import io.sshlite.client.auth.Credential;
import io.sshlite.client.auth.CredentialPrompter;
import io.sshlite.client.auth.CredentialService;
import io.sshlite.common.AuthenticationException;
import io.sshlite.common.ConnectionState;
import io.sshlite.common.HostConfig;
import io.sshlite.common.HostVerificationException;
import io.sshlite.common.SshLiteModuleProperties;
import io.sshlite.common.event.ListenerNotifier;
import io.sshlite.common.event.ReconnectEvent;
import io.sshlite.common.event.SessionEventListener;
import org.apache.sshd.common.PropertyResolver;
import org.apache.sshd.common.util.ExceptionUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Maps host identities to their live {@link HostSession} and re-establishes sessions whose transport dropped
 * unexpectedly.
 * <P>
 * A caller-initiated {@link #disconnect(String)} first records the intent and cancels any pending retry, and only
 * then closes the transport, so the close notification can never start a reconnection series for it. An unexpected
 * close creates a {@link ReconnectRecord} and retries at a fixed interval until the session is re-established, the
 * attempt ceiling (if any) is reached, or an authentication/host verification failure makes retrying pointless.
 * </P>
 */
public class SessionRegistry extends AbstractLoggingBean implements Closeable {
    private final HostSessionFactory sessionFactory;
    private final ReconnectScheduler scheduler;
    private final PropertyResolver config;
    private final CredentialService credentials;
    private final CredentialPrompter prompter;
    private final ListenerNotifier notifier = new ListenerNotifier();
    private final Object lock = new Object();
    private final Map<String, HostSession> sessions = new HashMap<>();
    private final Map<String, ReconnectRecord> records = new HashMap<>();
    private final Set<String> manualDisconnects = new HashSet<>();
    private final List<Closeable> ownedResources = new ArrayList<>();
    private boolean closed;

    public SessionRegistry(HostSessionFactory sessionFactory, ReconnectScheduler scheduler, PropertyResolver config,
                           CredentialService credentials, CredentialPrompter prompter) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "No session factory");
        this.scheduler = Objects.requireNonNull(scheduler, "No scheduler");
        this.config = Objects.requireNonNull(config, "No configuration");
        this.credentials = Objects.requireNonNull(credentials, "No credential service");
        this.prompter = (prompter == null) ? CredentialPrompter.NONE : prompter;
    }

    public PropertyResolver getConfig() {
        return config;
    }

    public CredentialService getCredentialService() {
        return credentials;
    }

    public void addSessionEventListener(SessionEventListener listener) {
        notifier.addListener(listener);
    }

    public void removeSessionEventListener(SessionEventListener listener) {
        notifier.removeListener(listener);
    }

    /**
     * Registers a resource released by {@link #close()} after every session was disconnected
     *
     * @param resource The resource
     */
    public void addOwnedResource(Closeable resource) {
        synchronized (lock) {
            ownedResources.add(Objects.requireNonNull(resource, "No resource"));
        }
    }

    /**
     * Returns the session of the host identity - connecting it if necessary. A pending reconnection series of the
     * identity is abandoned in favor of this explicit request. A session opened with another credential is
     * disconnected and replaced.
     *
     * @param  host        The target host
     * @param  credential  Explicit credential - {@code null} to probe the defaults
     * @return             The connected session
     * @throws IOException If failed to connect - see {@link HostSession#connect()}
     */
    public HostSession connect(HostConfig host, Credential credential) throws IOException {
        String identity = host.getIdentityKey();
        HostSession session;
        HostSession replaced = null;
        ReconnectRecord abandoned;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Registry closed");
            }

            abandoned = records.remove(identity);
            if (abandoned != null) {
                abandoned.cancelPending();
            }

            session = sessions.get(identity);
            if ((session != null) && (!Objects.equals(session.getCredential(), credential))) {
                sessions.remove(identity);
                replaced = session;
                session = null;
            }

            if (session == null) {
                session = createSession(host, credential);
                sessions.put(identity, session);
            }
        }

        if (abandoned != null) {
            notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(host, abandoned.getAttempt(), false)));
        }

        if (replaced != null) {
            if (log.isDebugEnabled()) {
                log.debug("connect({}) replace session of credential={}", identity, replaced.getCredential());
            }
            // no longer registered - its close does not start a reconnection
            replaced.disconnect();
        }

        try {
            session.connect();
        } catch (IOException | RuntimeException e) {
            synchronized (lock) {
                sessions.remove(identity, session);
            }
            throw e;
        }
        return session;
    }

    protected HostSession createSession(HostConfig host, Credential credential) throws IOException {
        HostSession session = sessionFactory.createSession(host, credential);
        session.addSessionEventListener(notifier.asRelay());
        session.addSessionEventListener(new SessionMonitor());
        return session;
    }

    /**
     * Disconnects the session of the identity. The intent is recorded and any pending retry cancelled before the
     * transport is told to close.
     *
     * @param  identity The identity key
     * @return          {@code true} if there was a session or a reconnection series to stop
     */
    public boolean disconnect(String identity) {
        HostSession session;
        ReconnectRecord record;
        synchronized (lock) {
            session = sessions.get(identity);
            if (session != null) {
                manualDisconnects.add(identity);
            }
            record = records.remove(identity);
            if (record != null) {
                record.cancelPending();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("disconnect({}) session={}, reconnecting={}", identity, session, record);
        }

        if (session != null) {
            session.disconnect();
            synchronized (lock) {
                sessions.remove(identity, session);
                manualDisconnects.remove(identity);
            }
        }

        if (record != null) {
            notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(record.getHost(), record.getAttempt(), false)));
        }
        return (session != null) || (record != null);
    }

    /**
     * @return Number of identities that were disconnected or whose reconnection was stopped
     */
    public int disconnectAll() {
        Set<String> identities;
        synchronized (lock) {
            identities = new HashSet<>(sessions.keySet());
            identities.addAll(records.keySet());
        }

        int count = 0;
        for (String identity : identities) {
            if (disconnect(identity)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Invoked when a session's transport closed
     *
     * @param session The session
     */
    protected void handleSessionClosed(HostSession session) {
        String identity = session.getId();
        ReconnectRecord record;
        synchronized (lock) {
            if (sessions.get(identity) != session) {
                return; // replaced or already removed
            }

            if (manualDisconnects.remove(identity)) {
                sessions.remove(identity);
                ReconnectRecord stale = records.remove(identity);
                if (stale != null) {
                    stale.cancelPending();
                }
                if (log.isDebugEnabled()) {
                    log.debug("handleSessionClosed({}) manual disconnect", identity);
                }
                return;
            }

            if (closed || (!SshLiteModuleProperties.AUTO_RECONNECT.getRequired(config))) {
                sessions.remove(identity);
                return;
            }

            if (records.containsKey(identity)) {
                return;
            }

            record = new ReconnectRecord(session.getHost(), session.getCredential());
            records.put(identity, record);
            scheduleAttempt(record);
        }

        log.info("handleSessionClosed({}) connection lost - reconnecting", identity);
        notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(record.getHost(), 0, true)));
    }

    // must be called while holding the lock
    protected void scheduleAttempt(ReconnectRecord record) {
        Duration interval = SshLiteModuleProperties.RECONNECT_INTERVAL.getRequired(config);
        record.setPending(scheduler.schedule(() -> runAttempt(record), interval));
    }

    /**
     * Runs one attempt of a reconnection series
     *
     * @param record The series
     */
    protected void runAttempt(ReconnectRecord record) {
        String identity = record.getIdentity();
        HostConfig host = record.getHost();
        int attempt;
        synchronized (lock) {
            if (closed || (records.get(identity) != record)) {
                return; // cancelled
            }
            attempt = record.nextAttempt();
            sessions.remove(identity);
        }

        notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(host, attempt, true)));

        HostSession session;
        try {
            Credential credential = resolveReconnectCredential(record);
            session = createSession(host, credential);
        } catch (IOException | RuntimeException e) {
            log.warn("runAttempt({})[{}] failed to prepare session: {}", identity, attempt, e.getMessage());
            retryOrAbandon(record, attempt, null);
            return;
        }

        synchronized (lock) {
            if (closed || (records.get(identity) != record)) {
                return;
            }
        }

        // published only once connected - an explicit connect or disconnect meanwhile supersedes this attempt
        try {
            session.connect();
        } catch (AuthenticationException | HostVerificationException e) {
            log.warn("runAttempt({})[{}] giving up ({}): {}", identity, attempt, e.getClass().getSimpleName(), e.getMessage());
            abandon(record, attempt, session);
            return;
        } catch (IOException | RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("runAttempt({})[{}] failed ({}): {}", identity, attempt, e.getClass().getSimpleName(), e.getMessage());
            }
            retryOrAbandon(record, attempt, session);
            return;
        }

        boolean current;
        synchronized (lock) {
            current = (!closed) && records.remove(identity, record);
            if (current) {
                sessions.put(identity, session);
            }
        }

        if (!current) {
            // the series was stopped while the attempt was in flight
            session.disconnect();
            return;
        }

        log.info("runAttempt({}) reconnected after {} attempt(s)", identity, attempt);
        notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(host, attempt, false)));

        if (!session.isConnected()) {
            // dropped before it was registered
            handleSessionClosed(session);
        }
    }

    protected void retryOrAbandon(ReconnectRecord record, int attempt, HostSession failed) {
        String identity = record.getIdentity();
        int maxAttempts = SshLiteModuleProperties.RECONNECT_MAX_ATTEMPTS.getRequired(config);
        synchronized (lock) {
            if (failed != null) {
                sessions.remove(identity, failed);
            }
            if (closed || (records.get(identity) != record)) {
                return;
            }
            if ((maxAttempts <= 0) || (attempt < maxAttempts)) {
                scheduleAttempt(record);
                return;
            }
        }

        log.warn("retryOrAbandon({}) giving up after {} attempt(s)", identity, attempt);
        abandon(record, attempt, failed);
    }

    protected void abandon(ReconnectRecord record, int attempt, HostSession failed) {
        String identity = record.getIdentity();
        boolean current;
        synchronized (lock) {
            if (failed != null) {
                sessions.remove(identity, failed);
            }
            current = records.remove(identity, record);
        }

        if (current) {
            notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(record.getHost(), attempt, false)));
        }
    }

    /**
     * Picks the credential of a reconnection attempt: the one used originally, else the single registered one, else
     * the one chosen by the user among several.
     *
     * @param  record      The series
     * @return             The credential - {@code null} to probe the defaults
     * @throws IOException If failed to read the credential index
     */
    protected Credential resolveReconnectCredential(ReconnectRecord record) throws IOException {
        Credential credential = record.getCredential();
        if (credential != null) {
            return credential;
        }

        List<Credential> candidates = credentials.listCredentials(record.getHost());
        int numCandidates = candidates.size();
        if (numCandidates <= 0) {
            return null;
        }
        if (numCandidates == 1) {
            return candidates.get(0);
        }
        return prompter.chooseCredential(record.getHost(), Collections.unmodifiableList(candidates));
    }

    /* -------------------------------------------------------------------------------------------- */

    public HostSession getSession(String identity) {
        synchronized (lock) {
            return sessions.get(identity);
        }
    }

    public List<HostSession> getConnectedSessions() {
        List<HostSession> result = new ArrayList<>();
        synchronized (lock) {
            for (HostSession s : sessions.values()) {
                if (s.isConnected()) {
                    result.add(s);
                }
            }
        }
        return result;
    }

    public boolean hasConnections() {
        synchronized (lock) {
            return sessions.values().stream().anyMatch(HostSession::isConnected);
        }
    }

    public boolean isReconnecting(String identity) {
        synchronized (lock) {
            return records.containsKey(identity);
        }
    }

    /**
     * @return Identity key to the current attempt number of every running reconnection series
     */
    public Map<String, Integer> getReconnectingIdentities() {
        Map<String, Integer> result = new TreeMap<>();
        synchronized (lock) {
            records.forEach((id, r) -> result.put(id, r.getAttempt()));
        }
        return result;
    }

    /**
     * @return Immutable snapshots of the running reconnection series
     */
    public List<ReconnectRecord> getReconnectRecords() {
        Map<String, ReconnectRecord> sorted = new LinkedHashMap<>();
        synchronized (lock) {
            new TreeMap<>(records).forEach((id, r) -> sorted.put(id, r.snapshot()));
        }
        return new ArrayList<>(sorted.values());
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Cancels every pending retry, disconnects every session, then releases the owned resources
     */
    @Override
    public void close() throws IOException {
        List<ReconnectRecord> stopped;
        List<Closeable> resources;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;

            stopped = new ArrayList<>(records.values());
            records.clear();
            stopped.forEach(ReconnectRecord::cancelPending);
            resources = new ArrayList<>(ownedResources);
            ownedResources.clear();
        }

        int count = disconnectAll();
        for (ReconnectRecord r : stopped) {
            notifier.fire(l -> l.sessionReconnecting(new ReconnectEvent(r.getHost(), r.getAttempt(), false)));
        }

        IOException err = null;
        for (Closeable c : resources) {
            try {
                c.close();
            } catch (IOException e) {
                err = ExceptionUtils.accumulateException(err, e);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("close({}) disconnected={}, stopped reconnections={}", this, count, stopped.size());
        }

        if (err != null) {
            throw err;
        }
    }

    /**
     * Tracks the state transitions of one session - only the close of an established transport counts as a drop
     */
    protected class SessionMonitor implements SessionEventListener {
        private volatile boolean established;

        protected SessionMonitor() {
            super();
        }

        @Override
        public void sessionStateChanged(HostSession session, ConnectionState state) {
            if (state == ConnectionState.CONNECTED) {
                established = true;
            } else if ((state == ConnectionState.DISCONNECTED) && established) {
                established = false;
                handleSessionClosed(session);
            }
        }

        @Override
        public String toString() {
            return SessionRegistry.this.toString();
        }
    }
}
