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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.sshlite.client.monitor.ServerSnapshot.DiskUsage;
import io.sshlite.client.monitor.ServerSnapshot.ProcessInfo;
import org.apache.sshd.common.util.GenericUtils;

/**
 * Parses the sectioned output of the server snapshot command. Sections and lines that cannot be parsed are skipped so
 * that a partially equipped server still yields a snapshot.
 */
public final class ServerSnapshotParser {
    public static final String HOSTNAME = "HOSTNAME";
    public static final String UPTIME = "UPTIME";
    public static final String LOAD = "LOAD";
    public static final String CPUS = "CPUS";
    public static final String CPU = "CPU";
    public static final String MEMORY = "MEMORY";
    public static final String DISK = "DISK";
    public static final String TOP_CPU = "TOP_CPU";
    public static final String TOP_MEM = "TOP_MEM";
    public static final String CONNECTIONS = "CONNECTIONS";
    public static final String ZOMBIES = "ZOMBIES";

    /**
     * Section header line - {@code ===NAME===}
     */
    public static final Pattern SECTION_HEADER = Pattern.compile("^===([A-Z_]+)===$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern MEMINFO_LINE = Pattern.compile("^(\\w+):\\s+([0-9]+)(\\s+kB)?$");

    private ServerSnapshotParser() {
        throw new UnsupportedOperationException("No instance");
    }

    public static String sectionHeader(String name) {
        return "===" + name + "===";
    }

    public static ServerSnapshot parse(String output, Instant timestamp) {
        Map<String, List<String>> sections = splitSections(output);
        ServerSnapshot.Builder builder = ServerSnapshot.builder(timestamp);
        List<String> lines = sections.getOrDefault(HOSTNAME, Collections.emptyList());
        if (!lines.isEmpty()) {
            builder.hostname(lines.get(0));
        }
        builder.uptime(parseUptime(sections.getOrDefault(UPTIME, Collections.emptyList())));
        parseLoadAverage(sections.getOrDefault(LOAD, Collections.emptyList()), builder);
        builder.cpuCount(parseCount(sections.getOrDefault(CPUS, Collections.emptyList())));
        parseCpuSamples(sections.getOrDefault(CPU, Collections.emptyList()), builder);
        parseMemInfo(sections.getOrDefault(MEMORY, Collections.emptyList()), builder);
        parseDiskUsage(sections.getOrDefault(DISK, Collections.emptyList()), builder::disk);
        parseProcesses(sections.getOrDefault(TOP_CPU, Collections.emptyList()), builder::topCpuProcess);
        parseProcesses(sections.getOrDefault(TOP_MEM, Collections.emptyList()), builder::topMemoryProcess);
        builder.networkConnections(parseCount(sections.getOrDefault(CONNECTIONS, Collections.emptyList())));
        builder.zombieProcesses(countZombies(sections.get(ZOMBIES)));
        return builder.build();
    }

    /**
     * @param  output The command output
     * @return        The trimmed non-empty lines of each section - in order of appearance
     */
    public static Map<String, List<String>> splitSections(String output) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        List<String> current = null;
        for (String line : GenericUtils.split(GenericUtils.trimToEmpty(output).replace("\r", ""), '\n')) {
            String text = GenericUtils.trimToEmpty(line);
            Matcher m = SECTION_HEADER.matcher(text);
            if (m.matches()) {
                current = new ArrayList<>();
                sections.put(m.group(1), current);
            } else if ((current != null) && (!text.isEmpty())) {
                current.add(text);
            }
        }
        return sections;
    }

    /**
     * @param  lines {@code /proc/uptime} - seconds since boot followed by the idle seconds
     * @return       The uptime - {@code null} if not available
     */
    public static Duration parseUptime(List<String> lines) {
        if (lines.isEmpty()) {
            return null;
        }
        String[] fields = WHITESPACE.split(lines.get(0));
        try {
            double seconds = Double.parseDouble(fields[0]);
            return (seconds < 0.0d) ? null : Duration.ofMillis(Math.round(seconds * 1000.0d));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accepts both {@code /proc/loadavg} ({@code 0.12 0.34 0.56 1/234 5678}) and the BSD {@code sysctl vm.loadavg}
     * format ({@code { 0.12 0.34 0.56 }})
     */
    public static void parseLoadAverage(List<String> lines, ServerSnapshot.Builder builder) {
        if (lines.isEmpty()) {
            return;
        }
        String text = GenericUtils.trimToEmpty(lines.get(0).replace('{', ' ').replace('}', ' '));
        String[] fields = WHITESPACE.split(text);
        if (fields.length < 3) {
            return;
        }
        try {
            builder.loadAverage(
                    Double.parseDouble(fields[0]), Double.parseDouble(fields[1]), Double.parseDouble(fields[2]));
        } catch (NumberFormatException e) {
            builder.loadAverage(ServerSnapshot.UNKNOWN, ServerSnapshot.UNKNOWN, ServerSnapshot.UNKNOWN);
        }
    }

    /**
     * @param lines Two {@code /proc/stat} aggregate lines sampled one after the other
     */
    public static void parseCpuSamples(List<String> lines, ServerSnapshot.Builder builder) {
        if (lines.size() < 2) {
            return;
        }
        long[] first = parseCpuLine(lines.get(0));
        long[] second = parseCpuLine(lines.get(1));
        if ((first == null) || (second == null)) {
            return;
        }

        long total = 0L;
        for (int index = 0; index < first.length; index++) {
            total += second[index] - first[index];
        }
        if (total <= 0L) {
            builder.cpuUsage(0.0d, 0.0d);
            return;
        }
        long idle = second[3] - first[3];
        long iowait = second[4] - first[4];
        builder.cpuUsage(((total - idle - iowait) * 100.0d) / total, (iowait * 100.0d) / total);
    }

    /**
     * @param  line {@code cpu user nice system idle iowait irq softirq steal ...}
     * @return      The first 8 counters - {@code null} if not a CPU line
     */
    public static long[] parseCpuLine(String line) {
        String[] fields = WHITESPACE.split(GenericUtils.trimToEmpty(line));
        if ((fields.length < 9) || (!"cpu".equals(fields[0]))) {
            return null;
        }
        long[] counters = new long[8];
        try {
            for (int index = 0; index < counters.length; index++) {
                counters[index] = Long.parseLong(fields[index + 1]);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return counters;
    }

    /**
     * Reads {@code MemTotal}, {@code MemAvailable}, {@code SwapTotal} and {@code SwapFree} from {@code /proc/meminfo}.
     * Kernels without {@code MemAvailable} get the sum of the free, buffers and cached memory.
     */
    public static void parseMemInfo(List<String> lines, ServerSnapshot.Builder builder) {
        Map<String, Long> values = new LinkedHashMap<>();
        for (String line : lines) {
            Matcher m = MEMINFO_LINE.matcher(line);
            if (m.matches()) {
                try {
                    values.put(m.group(1), Long.valueOf(m.group(2)));
                } catch (NumberFormatException e) {
                    continue; // overflow
                }
            }
        }

        Long total = values.get("MemTotal");
        if (total != null) {
            Long available = values.get("MemAvailable");
            if (available == null) {
                available = values.getOrDefault("MemFree", 0L)
                            + values.getOrDefault("Buffers", 0L)
                            + values.getOrDefault("Cached", 0L);
            }
            builder.memory(total, Math.min(total, available));
        }

        Long swapTotal = values.get("SwapTotal");
        Long swapFree = values.get("SwapFree");
        if ((swapTotal != null) && (swapFree != null)) {
            builder.swap(swapTotal, Math.min(swapTotal, swapFree));
        }
    }

    /**
     * @param lines {@code df -Pk} output - the header line is skipped, mount points may contain spaces
     */
    public static void parseDiskUsage(List<String> lines, Consumer<? super DiskUsage> consumer) {
        for (String line : lines) {
            String[] fields = WHITESPACE.split(line, 6);
            if (fields.length < 6) {
                continue;
            }
            String capacity = fields[4];
            if (!capacity.endsWith("%")) {
                continue; // header
            }
            try {
                long size = Long.parseLong(fields[1]);
                if (size <= 0L) {
                    continue; // pseudo file system
                }
                consumer.accept(new DiskUsage(fields[0], size, Long.parseLong(fields[2]), Long.parseLong(fields[3]),
                        Integer.parseInt(capacity.substring(0, capacity.length() - 1)), fields[5]));
            } catch (NumberFormatException e) {
                continue;
            }
        }
    }

    /**
     * @param lines {@code ps -eo pid=,user=,pcpu=,pmem=,comm=} output - the command may contain spaces
     */
    public static void parseProcesses(List<String> lines, Consumer<? super ProcessInfo> consumer) {
        for (String line : lines) {
            String[] fields = WHITESPACE.split(line, 5);
            if (fields.length < 5) {
                continue;
            }
            try {
                consumer.accept(new ProcessInfo(Long.parseLong(fields[0]), fields[1],
                        Double.parseDouble(fields[2]), Double.parseDouble(fields[3]), fields[4]));
            } catch (NumberFormatException e) {
                continue;
            }
        }
    }

    /**
     * @param  lines A single number line
     * @return       The number - {@link ServerSnapshot#UNKNOWN} if missing or not a number
     */
    public static int parseCount(List<String> lines) {
        if (lines.isEmpty()) {
            return ServerSnapshot.UNKNOWN;
        }
        try {
            int value = Integer.parseInt(lines.get(0));
            return (value < 0) ? ServerSnapshot.UNKNOWN : value;
        } catch (NumberFormatException e) {
            return ServerSnapshot.UNKNOWN;
        }
    }

    /**
     * @param  lines The {@code ps -eo stat=} process states - {@code null} if the section is missing
     * @return       Number of states starting with {@code Z}
     */
    public static int countZombies(List<String> lines) {
        if (GenericUtils.isEmpty(lines)) {
            return ServerSnapshot.UNKNOWN;
        }
        int count = 0;
        for (String state : lines) {
            if (state.charAt(0) == 'Z') {
                count++;
            }
        }
        return count;
    }
}
