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
import java.io.IOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.SshConstants;
import org.apache.sshd.common.session.Session;
import org.apache.sshd.common.util.buffer.Buffer;
import org.apache.sshd.common.util.io.output.LineLevelAppender;
import org.apache.sshd.common.util.io.output.LineLevelAppenderStream;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * A {@link RemoteProcess} running over a {@link ChannelExec}. The command is prefixed so that the remote shell first
 * reports its PID, which is later used to kill the whole remote process tree - closing the channel alone does not
 * reliably stop a remote process that has no pseudo-terminal.
 */
public class ChannelRemoteProcess extends AbstractLoggingBean implements RemoteProcess {
    public static final String PID_MARKER = "__SSHLITE_PID__";
    public static final String TERMINATION_SIGNAL = "TERM";

    /**
     * How long {@link #terminate()} waits for a PID that was not reported yet
     */
    public static final Duration PID_WAIT_TIMEOUT = Duration.ofSeconds(2L);

    private final RemoteCommand command;
    private final RemoteCommandExecutor executor;
    private final ChannelExec channel;
    private final LineLevelAppender output;
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private final CountDownLatch pidReported = new CountDownLatch(1);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile Long remotePid;

    protected ChannelRemoteProcess(
            RemoteCommand command, RemoteCommandExecutor executor, ChannelExec channel, LineLevelAppender output) {
        this.command = Objects.requireNonNull(command, "No command");
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.channel = Objects.requireNonNull(channel, "No channel");
        this.output = (output == null) ? LineLevelAppender.EMPTY : output;
    }

    /**
     * @param  session     The transport
     * @param  executor    Used to run the kill command when terminating
     * @param  command     The command to run
     * @param  output      Receives the standard output lines
     * @param  openTimeout Channel open timeout
     * @return             The started process
     * @throws IOException If failed to open the channel
     */
    public static ChannelRemoteProcess start(
            ClientSession session, RemoteCommandExecutor executor, RemoteCommand command, LineLevelAppender output,
            Duration openTimeout)
            throws IOException {
        RemoteCommand wrapped = RemoteCommand.withPidMarker(PID_MARKER, command);
        ChannelExec channel = session.createExecChannel(wrapped.getCommandLine());
        ChannelRemoteProcess process = new ChannelRemoteProcess(command, executor, channel, output);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        channel.setOut(new LineLevelAppenderStream(decoder, process.new OutputAppender()));
        channel.setErr(process.stderr);
        try {
            channel.open().verify(openTimeout);
        } catch (IOException | RuntimeException e) {
            channel.close(true);
            throw e;
        }
        return process;
    }

    @Override
    public RemoteCommand getCommand() {
        return command;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public Long getRemotePid() {
        return remotePid;
    }

    @Override
    public Integer waitFor(Duration timeout) throws IOException {
        long millis = (timeout == null) ? 0L : timeout.toMillis();
        Set<ClientChannelEvent> events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), millis);
        if (events.contains(ClientChannelEvent.TIMEOUT)) {
            return null;
        }
        return channel.getExitStatus();
    }

    @Override
    public String getStderr() {
        synchronized (stderr) {
            return new String(stderr.toByteArray(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public void terminate() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }

        Long pid = awaitRemotePid();
        if (pid != null) {
            try {
                executor.execute(RemoteCommand.terminateProcessTree(pid));
            } catch (IOException | RuntimeException e) {
                log.warn("terminate({}) failed to kill remote process {}: {}", command, pid, e.getMessage());
            }
        }

        if (channel.isOpen()) {
            try {
                sendSignal(TERMINATION_SIGNAL);
            } catch (IOException e) {
                if (log.isDebugEnabled()) {
                    log.debug("terminate({}) failed to send signal: {}", command, e.getMessage());
                }
            }
        }

        channel.close(true);
        if (log.isDebugEnabled()) {
            log.debug("terminate({}) pid={}", command, pid);
        }
    }

    @Override
    public void close() throws IOException {
        terminated.set(true);
        channel.close(true);
    }

    /**
     * Sends an RFC 4254 section 6.9 {@code signal} request - servers are free to ignore it
     *
     * @param  signal      Signal name without the {@code SIG} prefix
     * @throws IOException If failed to send the request
     */
    public void sendSignal(String signal) throws IOException {
        Session session = channel.getSession();
        Buffer buffer = session.createBuffer(SshConstants.SSH_MSG_CHANNEL_REQUEST, Long.SIZE);
        buffer.putUInt(channel.getRecipient());
        buffer.putString("signal");
        buffer.putBoolean(false); // want-reply
        buffer.putString(signal);
        channel.writePacket(buffer);
    }

    protected Long awaitRemotePid() {
        Long pid = remotePid;
        if ((pid != null) || (!channel.isOpen())) {
            return pid;
        }

        try {
            pidReported.await(PID_WAIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return remotePid;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + command + "]";
    }

    /**
     * Extracts the PID line, then relays the output lines until the process is terminated
     */
    protected class OutputAppender implements LineLevelAppender {
        @Override
        public boolean isWriteEnabled() {
            return !terminated.get();
        }

        @Override
        public void writeLineData(CharSequence lineData) throws IOException {
            if (remotePid == null) {
                String line = lineData.toString();
                if (line.startsWith(PID_MARKER)) {
                    try {
                        remotePid = Long.valueOf(line.substring(PID_MARKER.length()).trim());
                    } catch (NumberFormatException e) {
                        log.warn("writeLineData({}) bad PID line: {}", command, line);
                    }
                    pidReported.countDown();
                    return;
                }
            }

            if (isWriteEnabled() && output.isWriteEnabled()) {
                output.writeLineData(lineData);
            }
        }

        @Override
        public void close() throws IOException {
            pidReported.countDown();
        }
    }
}
