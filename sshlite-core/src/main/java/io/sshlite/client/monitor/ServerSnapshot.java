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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A point in time view of the remote server health. Values the server could not report are negative (or
 * {@code null} for the uptime) and empty lists.
 */
public class ServerSnapshot {
    public static final int UNKNOWN = -1;

    private final Instant timestamp;
    private final String hostname;
    private final Duration uptime;
    private final double[] loadAverage;
    private final int cpuCount;
    private final double cpuUsage;
    private final double ioWait;
    private final long memoryTotalKb;
    private final long memoryAvailableKb;
    private final long swapTotalKb;
    private final long swapFreeKb;
    private final List<DiskUsage> diskUsage;
    private final List<ProcessInfo> topCpuProcesses;
    private final List<ProcessInfo> topMemoryProcesses;
    private final int networkConnections;
    private final int zombieProcesses;

    protected ServerSnapshot(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "No timestamp");
        this.hostname = builder.hostname;
        this.uptime = builder.uptime;
        this.loadAverage = builder.loadAverage.clone();
        this.cpuCount = builder.cpuCount;
        this.cpuUsage = builder.cpuUsage;
        this.ioWait = builder.ioWait;
        this.memoryTotalKb = builder.memoryTotalKb;
        this.memoryAvailableKb = builder.memoryAvailableKb;
        this.swapTotalKb = builder.swapTotalKb;
        this.swapFreeKb = builder.swapFreeKb;
        this.diskUsage = Collections.unmodifiableList(new ArrayList<>(builder.diskUsage));
        this.topCpuProcesses = Collections.unmodifiableList(new ArrayList<>(builder.topCpuProcesses));
        this.topMemoryProcesses = Collections.unmodifiableList(new ArrayList<>(builder.topMemoryProcesses));
        this.networkConnections = builder.networkConnections;
        this.zombieProcesses = builder.zombieProcesses;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return The remote node name - {@code null} if not reported
     */
    public String getHostname() {
        return hostname;
    }

    /**
     * @return Time since the remote boot - {@code null} if not reported
     */
    public Duration getUptime() {
        return uptime;
    }

    /**
     * @return The 1, 5 and 15 minutes load averages - negative if not reported
     */
    public double[] getLoadAverage() {
        return loadAverage.clone();
    }

    public double getLoad1() {
        return loadAverage[0];
    }

    public int getCpuCount() {
        return cpuCount;
    }

    /**
     * @return Busy CPU percentage over the sampling interval
     */
    public double getCpuUsage() {
        return cpuUsage;
    }

    /**
     * @return Percentage of the sampling interval spent waiting for I/O
     */
    public double getIoWait() {
        return ioWait;
    }

    public long getMemoryTotalKb() {
        return memoryTotalKb;
    }

    public long getMemoryAvailableKb() {
        return memoryAvailableKb;
    }

    public long getMemoryUsedKb() {
        return (memoryTotalKb < 0L) || (memoryAvailableKb < 0L) ? UNKNOWN : memoryTotalKb - memoryAvailableKb;
    }

    public double getMemoryPercent() {
        long used = getMemoryUsedKb();
        return (used < 0L) || (memoryTotalKb <= 0L) ? UNKNOWN : (used * 100.0d) / memoryTotalKb;
    }

    public long getSwapTotalKb() {
        return swapTotalKb;
    }

    public long getSwapUsedKb() {
        return (swapTotalKb < 0L) || (swapFreeKb < 0L) ? UNKNOWN : swapTotalKb - swapFreeKb;
    }

    public List<DiskUsage> getDiskUsage() {
        return diskUsage;
    }

    /**
     * @return The busiest processes - highest CPU usage first
     */
    public List<ProcessInfo> getTopCpuProcesses() {
        return topCpuProcesses;
    }

    public List<ProcessInfo> getTopMemoryProcesses() {
        return topMemoryProcesses;
    }

    /**
     * @return Number of TCP and UDP sockets
     */
    public int getNetworkConnections() {
        return networkConnections;
    }

    public int getZombieProcesses() {
        return zombieProcesses;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getHostname() + "@" + getTimestamp() + "]"
               + " load=" + getLoad1()
               + ", cpu=" + getCpuUsage()
               + ", memory=" + getMemoryUsedKb() + "/" + getMemoryTotalKb();
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    public static class DiskUsage {
        private final String filesystem;
        private final long sizeKb;
        private final long usedKb;
        private final long availableKb;
        private final int percent;
        private final String mountPoint;

        public DiskUsage(String filesystem, long sizeKb, long usedKb, long availableKb, int percent,
                         String mountPoint) {
            this.filesystem = filesystem;
            this.sizeKb = sizeKb;
            this.usedKb = usedKb;
            this.availableKb = availableKb;
            this.percent = percent;
            this.mountPoint = mountPoint;
        }

        public String getFilesystem() {
            return filesystem;
        }

        public long getSizeKb() {
            return sizeKb;
        }

        public long getUsedKb() {
            return usedKb;
        }

        public long getAvailableKb() {
            return availableKb;
        }

        public int getPercent() {
            return percent;
        }

        public String getMountPoint() {
            return mountPoint;
        }

        @Override
        public String toString() {
            return getMountPoint() + " (" + getFilesystem() + ") " + getPercent() + "%";
        }
    }

    public static class ProcessInfo {
        private final long pid;
        private final String user;
        private final double cpu;
        private final double memory;
        private final String command;

        public ProcessInfo(long pid, String user, double cpu, double memory, String command) {
            this.pid = pid;
            this.user = user;
            this.cpu = cpu;
            this.memory = memory;
            this.command = command;
        }

        public long getPid() {
            return pid;
        }

        public String getUser() {
            return user;
        }

        public double getCpu() {
            return cpu;
        }

        public double getMemory() {
            return memory;
        }

        public String getCommand() {
            return command;
        }

        @Override
        public String toString() {
            return getPid() + " " + getUser() + " cpu=" + getCpu() + "% mem=" + getMemory() + "% " + getCommand();
        }
    }

    public static class Builder {
        private final Instant timestamp;
        private String hostname;
        private Duration uptime;
        private final double[] loadAverage = { UNKNOWN, UNKNOWN, UNKNOWN };
        private int cpuCount = UNKNOWN;
        private double cpuUsage = UNKNOWN;
        private double ioWait = UNKNOWN;
        private long memoryTotalKb = UNKNOWN;
        private long memoryAvailableKb = UNKNOWN;
        private long swapTotalKb = UNKNOWN;
        private long swapFreeKb = UNKNOWN;
        private final List<DiskUsage> diskUsage = new ArrayList<>();
        private final List<ProcessInfo> topCpuProcesses = new ArrayList<>();
        private final List<ProcessInfo> topMemoryProcesses = new ArrayList<>();
        private int networkConnections = UNKNOWN;
        private int zombieProcesses = UNKNOWN;

        protected Builder(Instant timestamp) {
            this.timestamp = timestamp;
        }

        public Builder hostname(String value) {
            this.hostname = value;
            return this;
        }

        public Builder uptime(Duration value) {
            this.uptime = value;
            return this;
        }

        public Builder loadAverage(double load1, double load5, double load15) {
            loadAverage[0] = load1;
            loadAverage[1] = load5;
            loadAverage[2] = load15;
            return this;
        }

        public Builder cpuCount(int value) {
            this.cpuCount = value;
            return this;
        }

        public Builder cpuUsage(double usage, double wait) {
            this.cpuUsage = usage;
            this.ioWait = wait;
            return this;
        }

        public Builder memory(long totalKb, long availableKb) {
            this.memoryTotalKb = totalKb;
            this.memoryAvailableKb = availableKb;
            return this;
        }

        public Builder swap(long totalKb, long freeKb) {
            this.swapTotalKb = totalKb;
            this.swapFreeKb = freeKb;
            return this;
        }

        public Builder disk(DiskUsage value) {
            diskUsage.add(Objects.requireNonNull(value, "No disk usage"));
            return this;
        }

        public Builder topCpuProcess(ProcessInfo value) {
            topCpuProcesses.add(Objects.requireNonNull(value, "No process"));
            return this;
        }

        public Builder topMemoryProcess(ProcessInfo value) {
            topMemoryProcesses.add(Objects.requireNonNull(value, "No process"));
            return this;
        }

        public Builder networkConnections(int value) {
            this.networkConnections = value;
            return this;
        }

        public Builder zombieProcesses(int value) {
            this.zombieProcesses = value;
            return this;
        }

        public ServerSnapshot build() {
            return new ServerSnapshot(this);
        }
    }
}
