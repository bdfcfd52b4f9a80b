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

package io.sshlite.client.watch;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.sshlite.client.session.RemoteCommandExecutor;
import io.sshlite.client.session.RemoteProcess;
import io.sshlite.common.event.FileChangeEvent;
import io.sshlite.common.event.FileChangeKind;
import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.common.util.io.output.LineLevelAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class ChangeWatchBrokerTest {
    private static final ServerCapabilities LINUX = new ServerCapabilities(RemoteOs.LINUX, true, false);

    private RemoteCommandExecutor executor;
    private List<FileChangeEvent> events;

    public ChangeWatchBrokerTest() {
        super();
    }

    @BeforeEach
    void setUp() {
        executor = Mockito.mock(RemoteCommandExecutor.class);
        Mockito.when(executor.getIdentity()).thenReturn("host:22:user");
        events = new ArrayList<>();
    }

    private ChangeWatchBroker newBroker(ServerCapabilities caps) {
        return new ChangeWatchBroker(executor, timeout -> caps, Duration.ofMillis(10L), events::add);
    }

    private RemoteProcess mockProcess() {
        RemoteProcess process = Mockito.mock(RemoteProcess.class);
        Mockito.when(process.isOpen()).thenReturn(true);
        return process;
    }

    @Test
    void nativeMonitorEventsReachSink() throws Exception {
        RemoteProcess process = mockProcess();
        Mockito.when(executor.start(Mockito.any(RemoteCommand.class), Mockito.any(LineLevelAppender.class)))
                .thenReturn(process);

        ChangeWatchBroker broker = newBroker(LINUX);
        assertTrue(broker.watch("/var/log/app.log"), "Native monitor not started");

        ArgumentCaptor<RemoteCommand> command = ArgumentCaptor.forClass(RemoteCommand.class);
        ArgumentCaptor<LineLevelAppender> output = ArgumentCaptor.forClass(LineLevelAppender.class);
        Mockito.verify(executor).start(command.capture(), output.capture());
        assertEquals(WatchMethod.INOTIFYWAIT.buildCommand("/var/log/app.log"), command.getValue());

        output.getValue().writeLineData("MODIFY");
        output.getValue().writeLineData("IGNORED");
        output.getValue().writeLineData("DELETE_SELF");
        assertEquals(2, events.size(), "Mismatched events: " + events);
        assertEquals(FileChangeKind.MODIFY, events.get(0).getKind());
        assertEquals(FileChangeKind.DELETE, events.get(1).getKind());
        assertEquals("host:22:user", events.get(0).getIdentity());
        assertEquals("/var/log/app.log", events.get(0).getRemotePath());
    }

    @Test
    void unknownCapabilitiesMeanPolling() throws Exception {
        ChangeWatchBroker broker = newBroker(null);
        assertFalse(broker.watch("/x"), "Native monitor reported without capabilities");
        Mockito.verify(executor, Mockito.never()).start(Mockito.any(), Mockito.any());
        assertFalse(broker.isWatching("/x"), "Polled path reported as watched");
    }

    @Test
    void startFailureMeansPolling() throws Exception {
        Mockito.when(executor.start(Mockito.any(RemoteCommand.class), Mockito.any(LineLevelAppender.class)))
                .thenThrow(new IOException("channel refused"));
        assertFalse(newBroker(LINUX).watch("/x"), "Failed monitor reported as started");
    }

    @Test
    void rewatchReplacesPreviousMonitor() throws Exception {
        RemoteProcess first = mockProcess();
        RemoteProcess second = mockProcess();
        Mockito.when(executor.start(Mockito.any(RemoteCommand.class), Mockito.any(LineLevelAppender.class)))
                .thenReturn(first, second);

        ChangeWatchBroker broker = newBroker(LINUX);
        broker.watch("/x");
        broker.watch("/x");
        Mockito.verify(first).terminate();
        Mockito.verify(second, Mockito.never()).terminate();
        assertEquals(Arrays.asList("/x"), new ArrayList<>(broker.getWatchedPaths()));
    }

    @Test
    void unwatchTerminatesMonitors() throws Exception {
        RemoteProcess a = mockProcess();
        RemoteProcess b = mockProcess();
        Mockito.when(executor.start(Mockito.any(RemoteCommand.class), Mockito.any(LineLevelAppender.class)))
                .thenReturn(a, b);

        ChangeWatchBroker broker = newBroker(LINUX);
        broker.watch("/a");
        broker.watch("/b");
        assertTrue(broker.unwatch("/a"), "Watcher not stopped");
        assertFalse(broker.unwatch("/a"), "Watcher stopped twice");
        Mockito.verify(a).terminate();

        assertEquals(1, broker.unwatchAll(), "Mismatched stopped watchers");
        Mockito.verify(b).terminate();
        assertTrue(broker.getWatchedPaths().isEmpty(), "Watchers left");
    }

    @Test
    void clearClosesWithoutRemoteTermination() throws Exception {
        RemoteProcess process = mockProcess();
        Mockito.when(executor.start(Mockito.any(RemoteCommand.class), Mockito.any(LineLevelAppender.class)))
                .thenReturn(process);

        ChangeWatchBroker broker = newBroker(LINUX);
        broker.watch("/a");
        broker.clear();
        Mockito.verify(process).close();
        Mockito.verify(process, Mockito.never()).terminate();
        assertFalse(broker.isWatching("/a"), "Watcher left after clear");
    }

    @Test
    void endedMonitorNoLongerWatching() throws Exception {
        RemoteProcess process = mockProcess();
        Mockito.when(executor.start(Mockito.any(RemoteCommand.class), Mockito.any(LineLevelAppender.class)))
                .thenReturn(process);

        ChangeWatchBroker broker = newBroker(LINUX);
        broker.watch("/a");
        assertTrue(broker.isWatching("/a"), "Watcher not reported");

        Mockito.when(process.isOpen()).thenReturn(false);
        assertFalse(broker.isWatching("/a"), "Ended watcher reported");
    }
}
