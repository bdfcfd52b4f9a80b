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

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.sshlite.client.monitor.ServerSnapshot.DiskUsage;
import io.sshlite.client.monitor.ServerSnapshot.ProcessInfo;
import io.sshlite.client.session.ExecResult;
import io.sshlite.client.session.RemoteCommandExecutor;
import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Collects a {@link ServerSnapshot} through a single remote command and diagnoses the usual causes of a slow server.
 * The command reads {@code /proc} where available and falls back to {@code sysctl}, {@code getconf} and
 * {@code netstat} for the values other systems report.
 */
public class ServerSnapshotService extends AbstractLoggingBean {
    public static final int TOP_PROCESSES = 5;

    public static final double DISK_FULL_PERCENT = 90.0d;
    public static final double LOW_MEMORY_PERCENT = 10.0d;
    public static final double HIGH_SWAP_PERCENT = 50.0d;
    public static final double HIGH_IO_WAIT_PERCENT = 20.0d;
    public static final double HIGH_CPU_PROCESS_PERCENT = 50.0d;
    public static final double HIGH_MEM_PROCESS_PERCENT = 30.0d;

    public ServerSnapshotService() {
        super();
    }

    /**
     * @param  executor    The session to inspect
     * @return             The snapshot
     * @throws IOException If the command could not be run
     */
    public ServerSnapshot snapshot(RemoteCommandExecutor executor) throws IOException {
        Instant timestamp = Instant.now();
        ExecResult result = executor.execute(snapshotCommand());
        ServerSnapshot snapshot = ServerSnapshotParser.parse(result.getStdout(), timestamp);
        if (log.isDebugEnabled()) {
            log.debug("snapshot({}) status={}: {}", executor.getIdentity(), result.getExitStatus(), snapshot);
        }
        return snapshot;
    }

    /**
     * @param  snapshot The snapshot to examine
     * @return          The detected issues - empty if the server appears healthy
     */
    public List<String> diagnose(ServerSnapshot snapshot) {
        List<String> issues = new ArrayList<>();
        double load1 = snapshot.getLoad1();
        int cpus = Math.max(1, snapshot.getCpuCount());
        if (load1 > (cpus * 2)) {
            issues.add(format("HIGH LOAD: %.2f (%d CPUs) - system overloaded", load1, cpus));
        } else if (load1 > cpus) {
            issues.add(format("MODERATE LOAD: %.2f (%d CPUs) - system busy", load1, cpus));
        }

        long total = snapshot.getMemoryTotalKb();
        long available = snapshot.getMemoryAvailableKb();
        if ((total > 0L) && (available >= 0L) && ((available * 100.0d) / total < LOW_MEMORY_PERCENT)) {
            issues.add(format("LOW MEMORY: only %d MB available (%.1f%%)",
                    available / 1024L, (available * 100.0d) / total));
        }

        long swapTotal = snapshot.getSwapTotalKb();
        long swapUsed = snapshot.getSwapUsedKb();
        if ((swapTotal > 0L) && ((swapUsed * 100.0d) / swapTotal > HIGH_SWAP_PERCENT)) {
            issues.add(format("HIGH SWAP USAGE: %d MB / %d MB - memory pressure",
                    swapUsed / 1024L, swapTotal / 1024L));
        }

        if (snapshot.getIoWait() > HIGH_IO_WAIT_PERCENT) {
            issues.add(format("HIGH I/O WAIT: %.1f%% - disk bottleneck", snapshot.getIoWait()));
        }

        for (DiskUsage disk : snapshot.getDiskUsage()) {
            if (disk.getPercent() > DISK_FULL_PERCENT) {
                issues.add(format("DISK FULL: %s at %d%%", disk.getMountPoint(), disk.getPercent()));
            }
        }

        for (ProcessInfo p : snapshot.getTopCpuProcesses()) {
            if (p.getCpu() > HIGH_CPU_PROCESS_PERCENT) {
                issues.add(format("HIGH CPU PROCESS: %s (%.1f%%)", p.getCommand(), p.getCpu()));
            }
        }

        for (ProcessInfo p : snapshot.getTopMemoryProcesses()) {
            if (p.getMemory() > HIGH_MEM_PROCESS_PERCENT) {
                issues.add(format("HIGH MEM PROCESS: %s (%.1f%%)", p.getCommand(), p.getMemory()));
            }
        }

        if (snapshot.getZombieProcesses() > 0) {
            issues.add(format("ZOMBIE PROCESSES: %d", snapshot.getZombieProcesses()));
        }
        return issues;
    }

    /**
     * @return The command printing every snapshot section - each preceded by its {@code ===NAME===} header
     */
    public static RemoteCommand snapshotCommand() {
        RemoteCommand.Builder builder = RemoteCommand.builder("echo").token(ServerSnapshotParser.sectionHeader(
                ServerSnapshotParser.HOSTNAME))
                .operator(";").token("uname").token("-n").operator(RemoteCommand.DISCARD_STDERR);
        section(builder, ServerSnapshotParser.UPTIME)
                .token("cat").token("/proc/uptime").operator(RemoteCommand.DISCARD_STDERR);
        section(builder, ServerSnapshotParser.LOAD)
                .token("cat").token("/proc/loadavg").operator(RemoteCommand.DISCARD_STDERR)
                .operator("||").token("sysctl").token("-n").token("vm.loadavg").operator(RemoteCommand.DISCARD_STDERR);
        section(builder, ServerSnapshotParser.CPUS)
                .token("nproc").operator(RemoteCommand.DISCARD_STDERR)
                .operator("||").token("getconf").token("_NPROCESSORS_ONLN").operator(RemoteCommand.DISCARD_STDERR);
        section(builder, ServerSnapshotParser.CPU)
                .token("head").token("-n").number(1).token("/proc/stat").operator(RemoteCommand.DISCARD_STDERR)
                .operator("&&").token("sleep").number(1)
                .operator("&&").token("head").token("-n").number(1).token("/proc/stat");
        section(builder, ServerSnapshotParser.MEMORY)
                .token("cat").token("/proc/meminfo").operator(RemoteCommand.DISCARD_STDERR);
        section(builder, ServerSnapshotParser.DISK)
                .token("df").token("-Pk").operator(RemoteCommand.DISCARD_STDERR);
        topProcesses(section(builder, ServerSnapshotParser.TOP_CPU), "-pcpu");
        topProcesses(section(builder, ServerSnapshotParser.TOP_MEM), "-pmem");
        section(builder, ServerSnapshotParser.CONNECTIONS)
                .token("if").append(RemoteCommand.toolLookup("ss"))
                .operator(";").token("then").token("ss").token("-tuan").operator(RemoteCommand.DISCARD_STDERR)
                .operator("|").token("tail").token("-n").token("+2").operator("|").token("wc").token("-l")
                .operator(";").token("elif").append(RemoteCommand.toolLookup("netstat"))
                .operator(";").token("then").token("netstat").token("-tuan").operator(RemoteCommand.DISCARD_STDERR)
                .operator("|").token("grep").token("-c").token("-E").arg("^(tcp|udp)")
                .operator(";").token("fi");
        section(builder, ServerSnapshotParser.ZOMBIES)
                .token("ps").token("-eo").token("stat=").operator(RemoteCommand.DISCARD_STDERR)
                .operator(";").token("true");
        return builder.build();
    }

    protected static RemoteCommand.Builder section(RemoteCommand.Builder builder, String name) {
        return builder.operator(";").token("echo").token(ServerSnapshotParser.sectionHeader(name)).operator(";");
    }

    protected static RemoteCommand.Builder topProcesses(RemoteCommand.Builder builder, String sortKey) {
        return builder.token("ps").token("-eo").token("pid=,user=,pcpu=,pmem=,comm=").token("--sort=" + sortKey)
                .operator(RemoteCommand.DISCARD_STDERR)
                .operator("|").token("head").token("-n").number(TOP_PROCESSES);
    }

    private static String format(String fmt, Object... args) {
        return String.format(Locale.ROOT, fmt, args);
    }
}
