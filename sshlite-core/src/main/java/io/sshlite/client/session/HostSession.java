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

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.sshlite.client.auth.AuthOffers;
import io.sshlite.client.auth.AuthResolver;
import io.sshlite.client.auth.Credential;
import io.sshlite.client.keyverifier.HostIdentityVerifier;
import io.sshlite.client.search.RemoteSearchEngine;
import io.sshlite.client.search.SearchMatch;
import io.sshlite.client.search.SearchRequest;
import io.sshlite.client.watch.CapabilityProbe;
import io.sshlite.client.watch.ChangeWatchBroker;
import io.sshlite.client.watch.ServerCapabilities;
import io.sshlite.common.AuthenticationException;
import io.sshlite.common.ConnectionException;
import io.sshlite.common.ConnectionFailure;
import io.sshlite.common.ConnectionState;
import io.sshlite.common.HostConfig;
import io.sshlite.common.HostVerificationException;
import io.sshlite.common.OperationCancelledException;
import io.sshlite.common.PortForwardingException;
import io.sshlite.common.SshLiteException;
import io.sshlite.common.SshLiteModuleProperties;
import io.sshlite.common.TransferException;
import io.sshlite.common.event.FileChangeEvent;
import io.sshlite.common.event.ListenerNotifier;
import io.sshlite.common.event.SessionEventListener;
import io.sshlite.common.util.CancelToken;
import io.sshlite.common.util.PermissionsFormatter;
import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ChannelShell;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.AttributeRepository;
import org.apache.sshd.common.PropertyResolver;
import org.apache.sshd.common.SshConstants;
import org.apache.sshd.common.SshException;
import org.apache.sshd.common.future.CloseFuture;
import org.apache.sshd.common.future.SshFutureListener;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.ValidateUtils;
import org.apache.sshd.common.util.io.output.LineLevelAppender;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;
import org.apache.sshd.common.util.net.SshdSocketAddress;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.client.SftpClient.Attributes;
import org.apache.sshd.sftp.client.SftpClient.CloseableHandle;
import org.apache.sshd.sftp.client.SftpClient.DirEntry;
import org.apache.sshd.sftp.client.SftpClient.OpenMode;
import org.apache.sshd.sftp.client.SftpClientFactory;

/**
 * The session of one host identity ({@code address:port:user}). Owns at most one live transport over which all
 * exec, file transfer, forwarding and watcher channels are multiplexed, together with the per-transport resources:
 * the lazily opened SFTP client, the watchers, the local port forwards and the capability probe result.
 * <P>
 * The close notification of the transport is the single trigger that releases those resources and moves the session
 * to {@link ConnectionState#DISCONNECTED} - it runs exactly once per transport whatever closed it.
 * </P>
 */
public class HostSession extends AbstractLoggingBean implements RemoteCommandExecutor, RemoteFileAccessor, Closeable {
    public static final String HOME_ALIAS = "~";

    private final HostConfig host;
    private final Credential credential;
    private final SshClient client;
    private final AuthResolver authResolver;
    private final PropertyResolver config;
    private final ExecutorService workers;
    private final CapabilityProbe capabilityProbe;
    private final ListenerNotifier notifier = new ListenerNotifier();
    private final ChangeWatchBroker watchBroker;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final Object connectLock = new Object();
    private final Object resourceLock = new Object();
    private final Map<Integer, PortForward> forwards = new TreeMap<>();

    private volatile TransportMonitor transport;
    private volatile CompletableFuture<ServerCapabilities> capabilities;
    private SftpClient sftp;
    private boolean connectAborted;

    public HostSession(SshClient client, AuthResolver authResolver, PropertyResolver config, ExecutorService workers,
                       HostConfig host, Credential credential) {
        this.client = Objects.requireNonNull(client, "No client");
        this.authResolver = Objects.requireNonNull(authResolver, "No authentication resolver");
        this.config = Objects.requireNonNull(config, "No configuration");
        this.workers = Objects.requireNonNull(workers, "No worker pool");
        this.host = Objects.requireNonNull(host, "No host");
        this.credential = credential;
        this.capabilityProbe = createCapabilityProbe();
        this.watchBroker = new ChangeWatchBroker(
                this, this::awaitCapabilities, SshLiteModuleProperties.CAPABILITY_WAIT_TIMEOUT.getRequired(config),
                this::fireFileChanged);
    }

    /**
     * @return The identity key - stable across reconnections
     */
    public String getId() {
        return host.getIdentityKey();
    }

    @Override
    public String getIdentity() {
        return getId();
    }

    public HostConfig getHost() {
        return host;
    }

    /**
     * @return The explicit credential used to connect - {@code null} if the defaults were probed
     */
    public Credential getCredential() {
        return credential;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isConnected() {
        TransportMonitor t = transport;
        return getState().isConnected() && (t != null) && t.getSession().isOpen();
    }

    public PropertyResolver getConfig() {
        return config;
    }

    public void addSessionEventListener(SessionEventListener listener) {
        notifier.addListener(listener);
    }

    public void removeSessionEventListener(SessionEventListener listener) {
        notifier.removeListener(listener);
    }

    /**
     * Establishes the transport - does nothing if already connected. On success the capability probe is started in
     * the background. A {@link #disconnect()} issued while connecting aborts the attempt.
     *
     * @throws AuthenticationException   If the credentials were rejected or none could be offered
     * @throws HostVerificationException If the host key was not trusted
     * @throws ConnectionException       If the transport could not be established or the attempt was aborted
     */
    public void connect() throws SshLiteException {
        synchronized (connectLock) {
            if (isConnected()) {
                return;
            }

            TransportMonitor stale = transport;
            if (stale != null) {
                // closed but its notification is still on its way
                detachTransport(stale);
                stale.getSession().close(true);
            }

            synchronized (resourceLock) {
                connectAborted = false;
            }
            setState(ConnectionState.CONNECTING);
            ClientSession session = null;
            AuthOffers offers = null;
            try {
                offers = authResolver.resolve(host, credential);
                session = openTransport();
                offers.applyTo(session, authResolver.createUserInteraction(offers));
                session.auth().verify(SshLiteModuleProperties.AUTH_TIMEOUT.getRequired(config));
            } catch (IOException | RuntimeException e) {
                SshLiteException err = translateConnectFailure(session, e);
                if (session != null) {
                    session.close(true);
                }
                if ((err instanceof AuthenticationException) && (offers != null)) {
                    invalidateSecrets(offers);
                }
                setState(ConnectionState.ERROR);
                throw err;
            }

            try {
                authResolver.onAuthenticated(offers);
            } catch (IOException e) {
                log.warn("connect({}) failed to record authenticated secret: {}", this, e.getMessage());
            }

            TransportMonitor monitor = new TransportMonitor(session);
            CompletableFuture<ServerCapabilities> pendingCapabilities = new CompletableFuture<>();
            boolean aborted;
            synchronized (resourceLock) {
                aborted = connectAborted;
                if (!aborted) {
                    transport = monitor;
                    capabilities = pendingCapabilities;
                }
            }

            if (aborted || (!transitionState(ConnectionState.CONNECTING, ConnectionState.CONNECTED))) {
                detachTransport(monitor);
                session.close(true);
                setState(ConnectionState.DISCONNECTED);
                throw new ConnectionException(getId(), ConnectionFailure.CLOSED,
                        "Connection to " + host + " aborted by disconnect");
            }

            if (log.isDebugEnabled()) {
                log.debug("connect({}) authenticated via {}", this, offers.getPreferredAuths());
            }

            // notified at once if the transport already closed
            session.addCloseFutureListener(monitor);
            if (!session.isOpen()) {
                handleTransportClosed(monitor);
                return;
            }
            startCapabilityProbe(pendingCapabilities);
        }
    }

    protected void startCapabilityProbe(CompletableFuture<ServerCapabilities> result) {
        try {
            CompletableFuture.supplyAsync(() -> capabilityProbe.probe(this), workers)
                    .whenComplete((caps, err) -> {
                        if (err == null) {
                            result.complete(caps);
                        } else {
                            result.completeExceptionally(err);
                        }
                    });
        } catch (RejectedExecutionException e) {
            log.warn("startCapabilityProbe({}) rejected: {}", this, e.getMessage());
            result.completeExceptionally(e);
        }
    }

    protected ClientSession openTransport() throws IOException {
        AttributeRepository context = AttributeRepository.ofKeyValuePair(HostIdentityVerifier.HOST_CONFIG, host);
        return client.connect(host.getUsername(), host.getAddress(), host.getPort(), context)
                .verify(SshLiteModuleProperties.CONNECT_TIMEOUT.getRequired(config))
                .getSession();
    }

    protected SshLiteException translateConnectFailure(ClientSession session, Throwable e) {
        if (e instanceof SshLiteException) {
            return (SshLiteException) e;
        }

        String identity = getId();
        HostVerificationException rejected
                = (session == null) ? null : session.getAttribute(HostIdentityVerifier.VERIFICATION_FAILURE);
        if (rejected != null) {
            return rejected;
        }

        if ((e instanceof SshException)
                && (((SshException) e).getDisconnectCode() == SshConstants.SSH2_DISCONNECT_NO_MORE_AUTH_METHODS_AVAILABLE)) {
            return new AuthenticationException(identity, "Authentication failed for " + host + ": " + e.getMessage(), e);
        }

        ConnectionFailure failure = ConnectionFailure.classify(e);
        return new ConnectionException(identity, failure, "Failed to connect to " + host + ": " + e.getMessage(), e);
    }

    protected void invalidateSecrets(AuthOffers offers) {
        try {
            authResolver.onAuthenticationFailed(offers);
        } catch (IOException e) {
            log.warn("connect({}) failed to invalidate stored secrets: {}", this, e.getMessage());
        }
    }

    /**
     * Closes the SFTP client, the watchers and the port forwards, then the transport. Never throws.
     */
    public void disconnect() {
        TransportMonitor monitor;
        synchronized (resourceLock) {
            monitor = transport;
            if (monitor == null) {
                connectAborted = true; // an in-flight connect must not publish its transport
            }
        }
        if (monitor == null) {
            setState(ConnectionState.DISCONNECTED);
            return;
        }

        releaseResources(true);
        ClientSession session = monitor.getSession();
        try {
            session.close(false).await(SshLiteModuleProperties.CHANNEL_OPEN_TIMEOUT.getRequired(config));
        } catch (IOException | RuntimeException e) {
            log.warn("disconnect({}) graceful close failed ({}): {}", this, e.getClass().getSimpleName(), e.getMessage());
            session.close(true);
        }
        handleTransportClosed(monitor);
    }

    @Override
    public void close() {
        disconnect();
    }

    /**
     * @param monitor The transport that closed
     */
    protected void handleTransportClosed(TransportMonitor monitor) {
        if (detachTransport(monitor)) {
            setState(ConnectionState.DISCONNECTED);
        }
    }

    /**
     * Releases the per-transport resources if the monitor is still the current transport
     *
     * @param  monitor The transport
     * @return         {@code false} if already handled or superseded by a newer transport
     */
    protected boolean detachTransport(TransportMonitor monitor) {
        if (!monitor.markHandled()) {
            return false;
        }

        synchronized (resourceLock) {
            if (transport != monitor) {
                if (log.isDebugEnabled()) {
                    log.debug("detachTransport({}) ignore stale transport={}", this, monitor.getSession());
                }
                return false;
            }
            transport = null;
        }
        releaseResources(false);
        capabilities = null;

        if (log.isDebugEnabled()) {
            log.debug("detachTransport({}) transport={}", this, monitor.getSession());
        }
        return true;
    }

    /**
     * @param remoteReachable {@code true} if the remote side can still be asked to stop the watchers
     */
    protected void releaseResources(boolean remoteReachable) {
        SftpClient sftpClient;
        List<PortForward> toStop;
        synchronized (resourceLock) {
            sftpClient = sftp;
            sftp = null;
            toStop = new ArrayList<>(forwards.values());
            forwards.clear();
        }

        if (sftpClient != null) {
            try {
                sftpClient.close();
            } catch (IOException e) {
                log.warn("releaseResources({}) failed to close SFTP client: {}", this, e.getMessage());
            }
        }

        if (remoteReachable) {
            watchBroker.unwatchAll();
        } else {
            watchBroker.clear();
        }

        TransportMonitor monitor = transport;
        for (PortForward f : toStop) {
            if ((!remoteReachable) || (monitor == null)) {
                continue; // the forwarder goes away with the transport
            }
            try {
                monitor.getSession().stopLocalPortForwarding(f.getLocalAddress());
            } catch (IOException e) {
                log.warn("releaseResources({}) failed to stop forward {}: {}", this, f, e.getMessage());
            }
        }
    }

    /**
     * @param  expected The state the session must be in
     * @param  newState The new state
     * @return          {@code true} if the session was in the expected state
     */
    protected boolean transitionState(ConnectionState expected, ConnectionState newState) {
        if (!state.compareAndSet(expected, newState)) {
            return false;
        }

        if (log.isDebugEnabled()) {
            log.debug("transitionState({}) {} => {}", this, expected, newState);
        }
        notifier.fire(l -> l.sessionStateChanged(this, newState));
        return true;
    }

    protected void setState(ConnectionState newState) {
        ConnectionState prev = state.getAndSet(newState);
        if (prev == newState) {
            return;
        }

        if (log.isDebugEnabled()) {
            log.debug("setState({}) {} => {}", this, prev, newState);
        }
        notifier.fire(l -> l.sessionStateChanged(this, newState));
    }

    protected void fireFileChanged(FileChangeEvent event) {
        notifier.fire(l -> l.remoteFileChanged(this, event));
    }

    protected ClientSession requireTransport() throws ConnectionException {
        TransportMonitor monitor = transport;
        if ((monitor == null) || (!getState().isConnected())) {
            throw ConnectionException.notConnected(getId());
        }

        ClientSession session = monitor.getSession();
        if (!session.isOpen()) {
            throw new ConnectionException(getId(), ConnectionFailure.CLOSED, "Connection closed: " + getId());
        }
        return session;
    }

    /* -------------------------------------------------------------------------------------------- */

    /**
     * @return The probe result - {@code null} if not known yet
     */
    public ServerCapabilities getCapabilities() {
        CompletableFuture<ServerCapabilities> f = capabilities;
        return (f == null) ? null : f.getNow(null);
    }

    /**
     * @param  timeout Maximum time to wait for the capability probe
     * @return         The probe result - {@code null} if still unknown after the timeout or not connected
     */
    public ServerCapabilities awaitCapabilities(Duration timeout) {
        CompletableFuture<ServerCapabilities> f = capabilities;
        if (f == null) {
            return null;
        }

        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            log.warn("awaitCapabilities({}) probe failed: {}", this, e.getCause().getMessage());
            return ServerCapabilities.UNKNOWN;
        }
    }

    protected CapabilityProbe createCapabilityProbe() {
        return new CapabilityProbe();
    }

    /* -------------------------------------------------------------------------------------------- */

    /**
     * Runs a command to completion over a new exec channel
     *
     * @param  command     The command line
     * @return             The stdout - if the command exited with status zero
     * @throws IOException If the command failed - the {@link TransferException} carries the exit status and stderr
     */
    public String exec(String command) throws IOException {
        ExecResult result = execute(command);
        if (!result.isSuccess()) {
            throw new TransferException(
                    getId(), null, command, result.getExitStatus(), result.getStderr(),
                    "Command failed with exit status " + result.getExitStatus() + ": " + result.getStderr().trim(), null);
        }
        return result.getStdout();
    }

    @Override
    public ExecResult execute(RemoteCommand command) throws IOException {
        return execute(command.getCommandLine());
    }

    public ExecResult execute(String command) throws IOException {
        ValidateUtils.checkNotNullAndNotEmpty(command, "No command");
        ClientSession session = requireTransport();
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        try (ChannelExec channel = session.createExecChannel(command)) {
            channel.setOut(stdout);
            channel.setErr(stderr);
            channel.open().verify(SshLiteModuleProperties.CHANNEL_OPEN_TIMEOUT.getRequired(config));

            Duration timeout = SshLiteModuleProperties.EXEC_TIMEOUT.getRequired(config);
            Set<ClientChannelEvent> events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), timeout.toMillis());
            String err = new String(stderr.toByteArray(), StandardCharsets.UTF_8);
            if (events.contains(ClientChannelEvent.TIMEOUT)) {
                throw new TransferException(getId(), null, command, null, err,
                        "Command timed out after " + timeout.toMillis() + " ms", null);
            }

            ExecResult result = new ExecResult(
                    command, channel.getExitStatus(), new String(stdout.toByteArray(), StandardCharsets.UTF_8), err);
            if (log.isTraceEnabled()) {
                log.trace("execute({}) {}", this, result);
            }
            return result;
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(null, command, e);
        }
    }

    @Override
    public RemoteProcess start(RemoteCommand command, LineLevelAppender output) throws IOException {
        ClientSession session = requireTransport();
        try {
            return ChannelRemoteProcess.start(session, this, command, output,
                    SshLiteModuleProperties.CHANNEL_OPEN_TIMEOUT.getRequired(config));
        } catch (IOException e) {
            throw wrapChannelFailure(null, command.getCommandLine(), e);
        }
    }

    /**
     * Opens an interactive shell with a pseudo-terminal
     *
     * @param  in          Terminal input
     * @param  out         Terminal output
     * @param  err         Terminal error output
     * @return             The opened shell channel - the caller closes it
     * @throws IOException If failed to open the channel
     */
    public ChannelShell openShell(InputStream in, OutputStream out, OutputStream err) throws IOException {
        ClientSession session = requireTransport();
        ChannelShell shell = session.createShellChannel();
        shell.setIn(in);
        shell.setOut(out);
        shell.setErr(err);
        try {
            shell.open().verify(SshLiteModuleProperties.CHANNEL_OPEN_TIMEOUT.getRequired(config));
        } catch (IOException | RuntimeException e) {
            shell.close(true);
            throw wrapChannelFailure(null, "shell", e);
        }
        return shell;
    }

    protected IOException wrapChannelFailure(String path, String command, Throwable e) {
        TransportMonitor monitor = transport;
        if ((monitor == null) || (!monitor.getSession().isOpen())) {
            return new ConnectionException(getId(), ConnectionFailure.CLOSED,
                    "Connection lost while running " + Objects.toString(command, path), e);
        }
        return new TransferException(getId(), path, command, null, null,
                (command == null ? "File operation failed on " + path : "Failed to run " + command)
                                                                        + ": " + e.getMessage(),
                e);
    }

    /* -------------------------------------------------------------------------------------------- */

    /**
     * @return The SFTP client of the current transport - opened on first use and reused afterwards
     * @throws IOException If not connected or failed to open the subsystem
     */
    protected SftpClient sftp() throws IOException {
        ClientSession session = requireTransport();
        synchronized (resourceLock) {
            if (sftp != null) {
                if (!sftp.isOpen()) {
                    throw new TransferException(getId(), null, "File transfer channel closed by the server", null);
                }
                return sftp;
            }

            sftp = createSftpClient(session);
            if (log.isDebugEnabled()) {
                log.debug("sftp({}) opened SFTP client", this);
            }
            return sftp;
        }
    }

    protected SftpClient createSftpClient(ClientSession session) throws IOException {
        return SftpClientFactory.instance().createSftpClient(session);
    }

    public String getDefaultRemotePath() {
        return SshLiteModuleProperties.DEFAULT_REMOTE_PATH.getRequired(config);
    }

    /**
     * @param  path        Remote path - {@code ~} (or a {@code ~/} prefix) refers to the login directory
     * @return             The absolute path
     * @throws IOException If failed to resolve the login directory
     */
    public String resolvePath(String path) throws IOException {
        String p = GenericUtils.isEmpty(path) ? getDefaultRemotePath() : path;
        if (HOME_ALIAS.equals(p)) {
            return sftp().canonicalPath(".");
        }
        if (p.startsWith(HOME_ALIAS + "/")) {
            String home = sftp().canonicalPath(".");
            return joinPath(home, p.substring(2));
        }
        return p;
    }

    /**
     * @param  path        Remote directory - {@code ~} lists the login directory
     * @return             The entries - directories first, then by name
     * @throws IOException If failed to list the directory
     */
    public List<RemoteFile> listFiles(String path) throws IOException {
        String dir = resolvePath(path);
        try {
            List<RemoteFile> result = new ArrayList<>();
            for (DirEntry entry : sftp().readDir(dir)) {
                String name = entry.getFilename();
                if (".".equals(name) || "..".equals(name)) {
                    continue;
                }
                result.add(toRemoteFile(name, joinPath(dir, name), entry.getAttributes(), entry.getLongFilename()));
            }
            result.sort(RemoteFile.LISTING_ORDER);
            return result;
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(dir, null, e);
        }
    }

    @Override
    public RemoteFile stat(String path) throws IOException {
        try {
            Attributes attrs = sftp().stat(path);
            return toRemoteFile(baseName(path), path, attrs, null);
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(path, null, e);
        }
    }

    public byte[] readFile(String path) throws IOException {
        try (InputStream input = sftp().read(path)) {
            return readFully(input, null, null, -1L, SshLiteModuleProperties.CHUNK_SIZE.getRequired(config), path);
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(path, null, e);
        }
    }

    /**
     * Downloads a file in bounded chunks
     *
     * @param  path                        Remote file
     * @param  listener                    Invoked once per received chunk - may be {@code null}
     * @param  token                       Cancellation token - may be {@code null}
     * @param  chunkSize                   Chunk size - non-positive for the configured default
     * @return                             The file contents
     * @throws OperationCancelledException If the token was cancelled before the download completed
     * @throws IOException                 If the download failed
     */
    public byte[] readFileChunked(String path, TransferProgressListener listener, CancelToken token, int chunkSize)
            throws IOException {
        int size = (chunkSize > 0) ? chunkSize : SshLiteModuleProperties.CHUNK_SIZE.getRequired(config);
        if ((token != null) && token.isCancelled()) {
            throw new OperationCancelledException(getId(), "Download cancelled by user: " + path, 0L);
        }

        long total = stat(path).getSize();
        SftpClient client = sftp();
        InputStream input;
        try {
            input = client.read(path, size);
        } catch (IOException e) {
            throw wrapChannelFailure(path, null, e);
        }

        Runnable abort = () -> {
            try {
                input.close();
            } catch (IOException e) {
                log.debug("readFileChunked({})[{}] close on cancel failed: {}", this, path, e.getMessage());
            }
        };
        if (token != null) {
            token.onCancel(abort);
        }

        try (InputStream in = input) {
            return readFully(in, listener, token, total, size, path);
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            if ((token != null) && token.isCancelled()) {
                throw new OperationCancelledException(getId(), "Download cancelled by user: " + path, 0L);
            }
            throw wrapChannelFailure(path, null, e);
        } finally {
            if (token != null) {
                token.removeHandler(abort);
            }
        }
    }

    protected byte[] readFully(
            InputStream input, TransferProgressListener listener, CancelToken token, long total, int chunkSize,
            String path)
            throws IOException {
        // grows as data arrives - the announced size may be stale
        ByteArrayOutputStream data = new ByteArrayOutputStream(chunkSize);
        byte[] chunk = new byte[chunkSize];
        long transferred = 0L;
        for (int read = input.read(chunk); read >= 0; read = input.read(chunk)) {
            if ((token != null) && token.isCancelled()) {
                throw new OperationCancelledException(getId(), "Download cancelled by user: " + path, transferred);
            }
            data.write(chunk, 0, read);
            transferred += read;
            if (listener != null) {
                listener.progress(transferred, total);
            }
        }
        return data.toByteArray();
    }

    /**
     * Writes a file and returns only once the server confirmed that it closed the file
     *
     * @param  path        Remote file - created or truncated
     * @param  data        Contents
     * @throws IOException If the write failed or was not confirmed within the write timeout
     */
    public void writeFile(String path, byte[] data) throws IOException {
        Objects.requireNonNull(data, "No data");
        SftpClient client = sftp();
        Duration timeout = SshLiteModuleProperties.WRITE_TIMEOUT.getRequired(config);
        int chunkSize = SshLiteModuleProperties.CHUNK_SIZE.getRequired(config);
        Future<?> pending;
        try {
            pending = workers.submit(() -> {
                try (CloseableHandle handle = client.open(path, OpenMode.Write, OpenMode.Create, OpenMode.Truncate)) {
                    for (int offset = 0; offset < data.length; offset += chunkSize) {
                        client.write(handle, offset, data, offset, Math.min(chunkSize, data.length - offset));
                    }
                } // closing the handle waits for the server's status reply
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new TransferException(getId(), path, "Write rejected - session is shutting down", e);
        }

        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new TransferException(getId(), path,
                    "Write not confirmed by the server within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransferException(getId(), path, "Interrupted while writing", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw wrapChannelFailure(path, null, (cause == null) ? e : cause);
        }

        if (log.isDebugEnabled()) {
            log.debug("writeFile({})[{}] wrote {} bytes", this, path, data.length);
        }
    }

    public void mkdir(String path) throws IOException {
        try {
            sftp().mkdir(path);
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(path, null, e);
        }
    }

    public void rename(String oldPath, String newPath) throws IOException {
        try {
            sftp().rename(oldPath, newPath);
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(oldPath, null, e);
        }
    }

    /**
     * Removes a file - or an empty directory
     *
     * @param  path        Remote path
     * @throws IOException If failed to remove
     */
    public void deleteFile(String path) throws IOException {
        try {
            SftpClient client = sftp();
            if (client.stat(path).isDirectory()) {
                client.rmdir(path);
            } else {
                client.remove(path);
            }
        } catch (SshLiteException e) {
            throw e;
        } catch (IOException e) {
            throw wrapChannelFailure(path, null, e);
        }
    }

    /**
     * @param  path        Remote file
     * @param  byteOffset  Zero based offset of the first byte to return
     * @return             The file contents from the offset - decoded as UTF-8
     * @throws IOException If failed to read
     */
    public String readFileTail(String path, long byteOffset) throws IOException {
        return execForPath(RemoteCommand.tailFromByte(path, byteOffset), path);
    }

    public String readFileFirstLines(String path, int lines) throws IOException {
        return execForPath(RemoteCommand.headLines(path, lines), path);
    }

    public String readFileLastLines(String path, int lines) throws IOException {
        return execForPath(RemoteCommand.tailLines(path, lines), path);
    }

    protected String execForPath(RemoteCommand command, String path) throws IOException {
        ExecResult result = execute(command);
        if (!result.isSuccess()) {
            throw new TransferException(getId(), path, command.getCommandLine(), result.getExitStatus(),
                    result.getStderr(), "Failed to read " + path + ": " + result.getStderr().trim(), null);
        }
        return result.getStdout();
    }

    /* -------------------------------------------------------------------------------------------- */

    /**
     * Searches file contents or file names under one or more remote roots
     *
     * @param  request     The search - cancelled via its token
     * @return             The matches ordered by path then line number
     * @throws IOException If the search could not be started
     * @see                RemoteSearchEngine
     */
    public List<SearchMatch> search(SearchRequest request) throws IOException {
        requireTransport();
        return createSearchEngine().search(request);
    }

    protected RemoteSearchEngine createSearchEngine() {
        return new RemoteSearchEngine(this, this, config);
    }

    /* -------------------------------------------------------------------------------------------- */

    /**
     * @param  path The remote path
     * @return      {@code true} if a native monitor was started, {@code false} if the caller must poll
     */
    public boolean watchFile(String path) {
        if (!isConnected()) {
            return false;
        }
        return watchBroker.watch(path);
    }

    public boolean unwatchFile(String path) {
        return watchBroker.unwatch(path);
    }

    public int unwatchAll() {
        return watchBroker.unwatchAll();
    }

    public boolean isWatching(String path) {
        return watchBroker.isWatching(path);
    }

    public Collection<String> getWatchedPaths() {
        return watchBroker.getWatchedPaths();
    }

    /* -------------------------------------------------------------------------------------------- */

    /**
     * Listens on a local port and forwards every accepted connection to {@code remoteHost:remotePort} as seen from the
     * remote host
     *
     * @param  localPort               Local port - zero for an ephemeral one
     * @param  remoteHost              Target host
     * @param  remotePort              Target port
     * @return                         The bound local port
     * @throws PortForwardingException If the port is already forwarded or the listener could not be bound
     * @throws ConnectionException     If not connected
     */
    public int forwardPort(int localPort, String remoteHost, int remotePort) throws IOException {
        ValidateUtils.checkNotNullAndNotEmpty(remoteHost, "No remote host");
        ClientSession session = requireTransport();
        synchronized (resourceLock) {
            if ((localPort > 0) && forwards.containsKey(localPort)) {
                throw new PortForwardingException(getId(), localPort, "Port " + localPort + " is already forwarded", null);
            }
        }

        SshdSocketAddress local = new SshdSocketAddress(SshdSocketAddress.LOCALHOST_IPV4, localPort);
        SshdSocketAddress remote = new SshdSocketAddress(remoteHost, remotePort);
        SshdSocketAddress bound;
        try {
            bound = session.startLocalPortForwarding(local, remote);
        } catch (IOException | RuntimeException e) {
            throw new PortForwardingException(getId(), localPort,
                    "Failed to forward local port " + localPort + " to " + remote + ": " + e.getMessage(), e);
        }

        PortForward forward = new PortForward(bound, remote);
        synchronized (resourceLock) {
            PortForward prev = forwards.putIfAbsent(bound.getPort(), forward);
            if (prev != null) {
                session.stopLocalPortForwarding(bound);
                throw new PortForwardingException(getId(), bound.getPort(), "Port " + bound.getPort() + " is already forwarded", null);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("forwardPort({}) {}", this, forward);
        }
        return bound.getPort();
    }

    /**
     * @param  localPort   The bound local port
     * @return             {@code true} if a forward was stopped
     * @throws IOException If failed to stop the listener
     */
    public boolean stopForward(int localPort) throws IOException {
        PortForward forward;
        synchronized (resourceLock) {
            forward = forwards.remove(localPort);
        }
        if (forward == null) {
            return false;
        }

        TransportMonitor monitor = transport;
        if (monitor != null) {
            monitor.getSession().stopLocalPortForwarding(forward.getLocalAddress());
        }
        return true;
    }

    public List<PortForward> getActiveForwards() {
        synchronized (resourceLock) {
            return forwards.isEmpty() ? Collections.emptyList() : new ArrayList<>(forwards.values());
        }
    }

    /* -------------------------------------------------------------------------------------------- */

    protected RemoteFile toRemoteFile(String name, String path, Attributes attrs, String longName) {
        String owner = null;
        String group = null;
        // ls -l style: permissions, links, owner, group, size, month, day, time/year, name
        String[] parts = GenericUtils.isEmpty(longName) ? GenericUtils.EMPTY_STRING_ARRAY : longName.trim().split("\\s+");
        if (parts.length >= 9) {
            owner = parts[2];
            group = parts[3];
        }
        if (owner == null) {
            owner = GenericUtils.isEmpty(attrs.getOwner()) ? Integer.toString(attrs.getUserId()) : attrs.getOwner();
        }
        if (group == null) {
            group = GenericUtils.isEmpty(attrs.getGroup()) ? Integer.toString(attrs.getGroupId()) : attrs.getGroup();
        }

        return new RemoteFile(name, path, attrs.isDirectory(), attrs.getSize(),
                toInstant(attrs.getModifyTime()), toInstant(attrs.getAccessTime()),
                owner, group, PermissionsFormatter.format(attrs.getPermissions()));
    }

    protected static Instant toInstant(FileTime time) {
        return (time == null) ? null : time.toInstant();
    }

    public static String joinPath(String dir, String name) {
        return dir.endsWith("/") ? dir + name : dir + "/" + name;
    }

    public static String baseName(String path) {
        String p = path.endsWith("/") && (path.length() > 1) ? path.substring(0, path.length() - 1) : path;
        int pos = p.lastIndexOf('/');
        return (pos < 0) ? p : p.substring(pos + 1);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getId() + "]";
    }

    /**
     * An active local port forward
     */
    public static class PortForward {
        private final SshdSocketAddress localAddress;
        private final SshdSocketAddress remoteAddress;

        public PortForward(SshdSocketAddress localAddress, SshdSocketAddress remoteAddress) {
            this.localAddress = localAddress;
            this.remoteAddress = remoteAddress;
        }

        public SshdSocketAddress getLocalAddress() {
            return localAddress;
        }

        public int getLocalPort() {
            return localAddress.getPort();
        }

        public SshdSocketAddress getRemoteAddress() {
            return remoteAddress;
        }

        @Override
        public String toString() {
            return localAddress + " -> " + remoteAddress;
        }
    }

    /**
     * Tracks one transport instance - its close notification is handled exactly once
     */
    protected class TransportMonitor implements SshFutureListener<CloseFuture> {
        private final ClientSession session;
        private final AtomicBoolean handled = new AtomicBoolean(false);

        protected TransportMonitor(ClientSession session) {
            this.session = session;
        }

        public ClientSession getSession() {
            return session;
        }

        protected boolean markHandled() {
            return handled.compareAndSet(false, true);
        }

        @Override
        public void operationComplete(CloseFuture future) {
            handleTransportClosed(this);
        }

        @Override
        public String toString() {
            return HostSession.this + "@" + session;
        }
    }
}
