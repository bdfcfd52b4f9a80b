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

package io.sshlite.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;

import io.sshlite.client.monitor.ServerSnapshot;
import io.sshlite.client.monitor.ServerSnapshot.DiskUsage;
import io.sshlite.client.monitor.ServerSnapshot.ProcessInfo;
import io.sshlite.client.session.RemoteFile;
import io.sshlite.client.session.SessionRegistry;
import io.sshlite.client.session.SshLiteClientBuilder;
import io.sshlite.common.HostConfig;
import io.sshlite.common.store.PropertiesFileKeyValueStore;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.OsUtils;
import org.apache.sshd.common.util.io.PathUtils;

/**
 * Option parsing and session setup shared by the command line front end
 */
public abstract class SshLiteCliSupport {
    public static final String STORE_FOLDER_NAME = ".sshlite";
    public static final String STORE_FILE_NAME = "store.properties";

    public static final String USAGE = "usage: sshlite [-v[v][v]] [-p port] [-l login] [-i identity] [-w password]"
                                       + " [-o name=value] [user@]host <command> [args]" + System.lineSeparator()
                                       + "  commands: exec <cmd> | ls [path] | cat <path> | tail <path> <n>"
                                       + " | head <path> <n>" + System.lineSeparator()
                                       + "            search [-name] [-case] [-regex] [-include glob] [-exclude glob]"
                                       + " [-max n] <pattern> <root>..." + System.lineSeparator()
                                       + "            watch <path> | forward <localPort> <remoteHost> <remotePort>"
                                       + " | status";

    public static final DateTimeFormatter LISTING_TIME_FORMATTER
            = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    protected SshLiteCliSupport() {
        super();
    }

    public static boolean isArgumentedOption(String argName) {
        return "-p".equals(argName) || "-l".equals(argName) || "-i".equals(argName)
                || "-w".equals(argName) || "-o".equals(argName);
    }

    /**
     * @param  stderr Error stream for output of error messages
     * @param  args   The command line arguments
     * @return        The parsed options - {@code null} if errors were encountered
     */
    public static CliOptions parseOptions(PrintStream stderr, String... args) {
        CliOptions options = new CliOptions();
        int numArgs = GenericUtils.length(args);
        int targetIndex = numArgs;
        for (int i = 0; i < numArgs; i++) {
            String argName = args[i];
            if (options.getTarget() != null) {
                if (options.getCommand() == null) {
                    options.setCommand(argName);
                } else {
                    options.addCommandArg(argName);
                }
                continue;
            }

            if (CliLogger.isVerbosityOption(argName)) {
                continue;
            }

            if (isArgumentedOption(argName)) {
                if ((i + 1) >= numArgs) {
                    CliLogger.showError(stderr, "option requires an argument: " + argName);
                    return null;
                }

                String argVal = args[++i];
                if (!applyOption(options, argName, argVal, stderr)) {
                    return null;
                }
                continue;
            }

            if (argName.startsWith("-")) {
                CliLogger.showError(stderr, "unknown option: " + argName);
                return null;
            }

            options.setTarget(argName);
            targetIndex = i;
        }

        options.setLevel(CliLogger.resolveLoggingVerbosity(args, targetIndex));
        if (GenericUtils.isEmpty(options.getTarget())) {
            CliLogger.showError(stderr, "no target host specified");
            return null;
        }
        if (GenericUtils.isEmpty(options.getCommand())) {
            CliLogger.showError(stderr, "no command specified");
            return null;
        }
        return options;
    }

    protected static boolean applyOption(CliOptions options, String argName, String argVal, PrintStream stderr) {
        switch (argName) {
            case "-p":
                if (options.getPort() > 0) {
                    return !CliLogger.showError(stderr, argName + " option value re-specified: " + options.getPort());
                }
                int port = parsePositiveInt(argVal);
                if (port <= 0) {
                    return !CliLogger.showError(stderr, "Bad option value for " + argName + ": " + argVal);
                }
                options.setPort(port);
                return true;
            case "-l":
                if (options.getLogin() != null) {
                    return !CliLogger.showError(stderr, argName + " option value re-specified: " + options.getLogin());
                }
                options.setLogin(argVal);
                return true;
            case "-i":
                if (options.getIdentity() != null) {
                    return !CliLogger.showError(stderr, argName + " option value re-specified: " + options.getIdentity());
                }
                options.setIdentity(argVal);
                return true;
            case "-w":
                if (options.getPassword() != null) {
                    return !CliLogger.showError(stderr, argName + " option value re-specified");
                }
                options.setPassword(argVal);
                return true;
            case "-o":
                int pos = argVal.indexOf('=');
                if (pos <= 0) {
                    return !CliLogger.showError(stderr, "Bad option value for " + argName + ": " + argVal);
                }
                options.getProperties().put(argVal.substring(0, pos).trim(), argVal.substring(pos + 1).trim());
                return true;
            default:
                return !CliLogger.showError(stderr, "unknown option: " + argName);
        }
    }

    /**
     * @param  value The string value
     * @return       The parsed value - negative if not a positive number
     */
    public static int parsePositiveInt(String value) {
        try {
            int result = Integer.parseInt(value);
            return (result > 0) ? result : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * @param  options The parsed options
     * @return         The target host - {@code user@host} wins over {@code -l}, which wins over the local user
     */
    public static HostConfig resolveHost(CliOptions options) {
        String target = options.getTarget();
        String user = options.getLogin();
        int pos = target.lastIndexOf('@');
        if (pos > 0) {
            user = target.substring(0, pos);
            target = target.substring(pos + 1);
        }
        if (GenericUtils.isEmpty(user)) {
            user = OsUtils.getCurrentUser();
        }

        int port = (options.getPort() > 0) ? options.getPort() : HostConfig.DEFAULT_PORT;
        String identity = options.getIdentity();
        String keyPath = GenericUtils.isEmpty(identity) ? null : PathUtils.normalizePath(identity);
        return new HostConfig(target, port, user, keyPath, options.getTarget());
    }

    public static Path resolveDefaultStoreFile() {
        return PathUtils.getUserHomeFolder().resolve(STORE_FOLDER_NAME).resolve(STORE_FILE_NAME);
    }

    /**
     * @param  options     The parsed options
     * @param  storeFile   Where the trusted host keys and the credential index are kept
     * @param  prompter    Answers the credential and host key questions
     * @return             A registry owning a started client
     * @throws IOException If failed to start the client
     */
    public static SessionRegistry setupRegistry(CliOptions options, Path storeFile, ConsolePrompter prompter)
            throws IOException {
        return SshLiteClientBuilder.builder()
                .properties(options.getProperties())
                .keyValueStore(new PropertiesFileKeyValueStore(storeFile))
                .prompter(prompter)
                .hostKeyDecisionHandler(prompter)
                .build();
    }

    /**
     * @param  file The remote file
     * @return      An {@code ls -l} like line
     */
    public static String formatListingEntry(RemoteFile file) {
        String mtime = (file.getModifiedTime() == null) ? "-" : LISTING_TIME_FORMATTER.format(file.getModifiedTime());
        return String.format("%s%s %-8s %-8s %10d %s %s%s",
                file.isDirectory() ? "d" : "-", file.getPermissions(), file.getOwner(), file.getGroup(),
                file.getSize(), mtime, file.getName(), file.isDirectory() ? "/" : "");
    }

    /**
     * @param  snapshot The server snapshot
     * @return          The report lines - values the server did not report are omitted
     */
    public static List<String> formatSnapshot(ServerSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        lines.add("Host: " + GenericUtils.trimToEmpty(snapshot.getHostname()) + " @ " + snapshot.getTimestamp());
        Duration uptime = snapshot.getUptime();
        if (uptime != null) {
            lines.add(String.format(Locale.ROOT, "Uptime: %dd %02dh %02dm",
                    uptime.toDays(), uptime.toHours() % 24L, uptime.toMinutes() % 60L));
        }
        double[] load = snapshot.getLoadAverage();
        if (load[0] >= 0.0d) {
            lines.add(String.format(Locale.ROOT, "Load: %.2f %.2f %.2f (%d CPUs)",
                    load[0], load[1], load[2], snapshot.getCpuCount()));
        }
        if (snapshot.getCpuUsage() >= 0.0d) {
            lines.add(String.format(Locale.ROOT, "CPU: %.1f%% busy, %.1f%% I/O wait",
                    snapshot.getCpuUsage(), snapshot.getIoWait()));
        }
        if (snapshot.getMemoryTotalKb() >= 0L) {
            lines.add(String.format(Locale.ROOT, "Memory: %d MB / %d MB (%.1f%%)",
                    snapshot.getMemoryUsedKb() / 1024L, snapshot.getMemoryTotalKb() / 1024L,
                    snapshot.getMemoryPercent()));
        }
        if (snapshot.getSwapTotalKb() > 0L) {
            lines.add(String.format(Locale.ROOT, "Swap: %d MB / %d MB",
                    snapshot.getSwapUsedKb() / 1024L, snapshot.getSwapTotalKb() / 1024L));
        }
        for (DiskUsage disk : snapshot.getDiskUsage()) {
            lines.add(String.format(Locale.ROOT, "Disk: %-20s %3d%% of %d MB (%s)",
                    disk.getMountPoint(), disk.getPercent(), disk.getSizeKb() / 1024L, disk.getFilesystem()));
        }
        for (ProcessInfo p : snapshot.getTopCpuProcesses()) {
            lines.add(String.format(Locale.ROOT, "Top CPU: %6.1f%% %d %s", p.getCpu(), p.getPid(), p.getCommand()));
        }
        for (ProcessInfo p : snapshot.getTopMemoryProcesses()) {
            lines.add(String.format(Locale.ROOT, "Top MEM: %6.1f%% %d %s", p.getMemory(), p.getPid(), p.getCommand()));
        }
        if (snapshot.getNetworkConnections() >= 0) {
            lines.add("Network connections: " + snapshot.getNetworkConnections());
        }
        if (snapshot.getZombieProcesses() >= 0) {
            lines.add("Zombie processes: " + snapshot.getZombieProcesses());
        }
        return lines;
    }

    public static boolean isVerbose(Level level) {
        return (level != null) && (level.intValue() <= Level.INFO.intValue());
    }
}
