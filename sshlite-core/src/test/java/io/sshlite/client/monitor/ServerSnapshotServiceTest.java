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

package io.sshlite.client.monitor;

import java.time.Instant;
import java.util.List;

import io.sshlite.client.monitor.ServerSnapshot.DiskUsage;
import io.sshlite.client.monitor.ServerSnapshot.ProcessInfo;
import io.sshlite.client.session.ExecResult;
import io.sshlite.client.session.RemoteCommandExecutor;
import io.sshlite.common.util.RemoteCommand;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class ServerSnapshotServiceTest {
    private final ServerSnapshotService service = new ServerSnapshotService();

    public ServerSnapshotServiceTest() {
        super();
    }

    @Test
    void snapshotRunsSingleCommand() throws Exception {
        RemoteCommandExecutor executor = Mockito.mock(RemoteCommandExecutor.class);
        Mockito.when(executor.getIdentity()).thenReturn("deploy@10.0.0.5:22");
        Mockito.when(executor.execute(Mockito.any(RemoteCommand.class))).thenAnswer(invocation -> new ExecResult(
                (RemoteCommand) invocation.getArgument(0), 0, "===HOSTNAME===\nweb-01\n===CPUS===\n8\n", ""));

        ServerSnapshot snapshot = service.snapshot(executor);
        assertEquals("web-01", snapshot.getHostname());
        assertEquals(8, snapshot.getCpuCount(), "Mismatched CPU count");
        Mockito.verify(executor).execute(ServerSnapshotService.snapshotCommand());
    }

    @Test
    void snapshotCommandCoversEverySection() {
        String line = ServerSnapshotService.snapshotCommand().getCommandLine();
        for (String section : new String[] {
                ServerSnapshotParser.HOSTNAME, ServerSnapshotParser.UPTIME, ServerSnapshotParser.LOAD,
                ServerSnapshotParser.CPUS, ServerSnapshotParser.CPU, ServerSnapshotParser.MEMORY,
                ServerSnapshotParser.DISK, ServerSnapshotParser.TOP_CPU, ServerSnapshotParser.TOP_MEM,
                ServerSnapshotParser.CONNECTIONS, ServerSnapshotParser.ZOMBIES }) {
            assertTrue(line.contains("echo " + ServerSnapshotParser.sectionHeader(section) + " ;"),
                    "Missing section " + section + ": " + line);
        }
        assertTrue(line.contains("--sort=-pcpu 2>/dev/null | head -n 5"), line);
        assertTrue(line.contains("if command -v ss >/dev/null 2>/dev/null ; then ss -tuan"), line);
        assertTrue(line.endsWith("ps -eo stat= 2>/dev/null ; true"), line);
    }

    @Test
    void healthyServerHasNoIssues() {
        ServerSnapshot snapshot = ServerSnapshot.builder(Instant.EPOCH)
                .loadAverage(0.5d, 0.4d, 0.3d)
                .cpuCount(2)
                .cpuUsage(12.0d, 1.0d)
                .memory(4000000L, 3000000L)
                .swap(1000000L, 1000000L)
                .disk(new DiskUsage("/dev/sda1", 1000L, 400L, 600L, 40, "/"))
                .topCpuProcess(new ProcessInfo(1L, "root", 2.0d, 1.0d, "init"))
                .zombieProcesses(0)
                .build();
        assertTrue(service.diagnose(snapshot).isEmpty(), "Issues reported for a healthy server");
    }

    @Test
    void unknownValuesAreNotIssues() {
        assertTrue(service.diagnose(ServerSnapshot.builder(Instant.EPOCH).build()).isEmpty(),
                "Issues reported without data");
    }

    @Test
    void overloadedServerIssues() {
        ServerSnapshot snapshot = ServerSnapshot.builder(Instant.EPOCH)
                .loadAverage(9.0d, 8.0d, 7.0d)
                .cpuCount(4)
                .cpuUsage(95.0d, 35.0d)
                .memory(1000000L, 50000L)
                .swap(2048000L, 512000L)
                .disk(new DiskUsage("/dev/sda1", 1000L, 950L, 50L, 95, "/var"))
                .topCpuProcess(new ProcessInfo(42L, "app", 180.5d, 3.0d, "java"))
                .topMemoryProcess(new ProcessInfo(43L, "db", 1.0d, 45.0d, "postgres"))
                .zombieProcesses(3)
                .build();

        List<String> issues = service.diagnose(snapshot);
        assertEquals(8, issues.size(), "Mismatched issues: " + issues);
        assertEquals("HIGH LOAD: 9.00 (4 CPUs) - system overloaded", issues.get(0));
        assertTrue(issues.get(1).startsWith("LOW MEMORY: only 48 MB available"), issues.get(1));
        assertEquals("HIGH SWAP USAGE: 1500 MB / 2000 MB - memory pressure", issues.get(2));
        assertEquals("HIGH I/O WAIT: 35.0% - disk bottleneck", issues.get(3));
        assertEquals("DISK FULL: /var at 95%", issues.get(4));
        assertEquals("HIGH CPU PROCESS: java (180.5%)", issues.get(5));
        assertEquals("HIGH MEM PROCESS: postgres (45.0%)", issues.get(6));
        assertEquals("ZOMBIE PROCESSES: 3", issues.get(7));
    }

    @Test
    void moderateLoad() {
        ServerSnapshot snapshot = ServerSnapshot.builder(Instant.EPOCH)
                .loadAverage(3.0d, 2.0d, 1.0d)
                .cpuCount(2)
                .build();
        assertEquals("MODERATE LOAD: 3.00 (2 CPUs) - system busy", service.diagnose(snapshot).get(0));
    }
}
