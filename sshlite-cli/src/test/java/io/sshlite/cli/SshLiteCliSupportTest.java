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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;

import io.sshlite.client.monitor.ServerSnapshot;
import io.sshlite.client.search.SearchRequest;
import io.sshlite.client.session.RemoteFile;
import io.sshlite.common.HostConfig;
import org.apache.sshd.common.util.OsUtils;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class SshLiteCliSupportTest {
    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();
    private final PrintStream stderr = new PrintStream(errors, true);

    public SshLiteCliSupportTest() {
        super();
    }

    @Test
    void parseFullCommandLine() {
        CliOptions options = SshLiteCliSupport.parseOptions(stderr,
                "-vv", "-p", "2222", "-l", "ops", "-i", "/keys/id", "-o", "sshlite-auto-reconnect = false",
                "deploy@web", "exec", "ls", "-l");
        assertNotNull(options, errorText());
        assertEquals(2222, options.getPort(), "Mismatched port");
        assertEquals("ops", options.getLogin());
        assertEquals("/keys/id", options.getIdentity());
        assertEquals("false", options.getProperties().get("sshlite-auto-reconnect"));
        assertEquals(Level.FINE, options.getLevel(), "Mismatched verbosity");
        assertEquals("deploy@web", options.getTarget());
        assertEquals("exec", options.getCommand());
        assertEquals(Arrays.asList("ls", "-l"), options.getCommandArgs());
    }

    @Test
    void verbosityAfterTargetBelongsToCommand() {
        CliOptions options = SshLiteCliSupport.parseOptions(stderr, "web", "exec", "-v");
        assertNotNull(options, errorText());
        assertEquals(Level.WARNING, options.getLevel(), "Command argument taken as verbosity");
        assertEquals(Arrays.asList("-v"), options.getCommandArgs());
    }

    @Test
    void parseErrors() {
        assertNull(SshLiteCliSupport.parseOptions(stderr), "No target accepted");
        assertNull(SshLiteCliSupport.parseOptions(stderr, "web"), "No command accepted");
        assertNull(SshLiteCliSupport.parseOptions(stderr, "-p"), "Missing option value accepted");
        assertNull(SshLiteCliSupport.parseOptions(stderr, "-p", "0", "web", "ls"), "Bad port accepted");
        assertNull(SshLiteCliSupport.parseOptions(stderr, "-p", "1", "-p", "2", "web", "ls"), "Re-specified port accepted");
        assertNull(SshLiteCliSupport.parseOptions(stderr, "-o", "novalue", "web", "ls"), "Bad property accepted");
        assertNull(SshLiteCliSupport.parseOptions(stderr, "-x", "web", "ls"), "Unknown option accepted");
        assertTrue(errorText().startsWith("ERROR: "), errorText());
    }

    @Test
    void resolveHostPrecedence() {
        CliOptions options = SshLiteCliSupport.parseOptions(stderr, "-l", "ops", "-p", "2200", "deploy@10.1.1.1", "ls");
        HostConfig host = SshLiteCliSupport.resolveHost(options);
        assertEquals("10.1.1.1", host.getAddress());
        assertEquals(2200, host.getPort(), "Mismatched port");
        assertEquals("deploy", host.getUsername(), "Target user does not win");
        assertNull(host.getPrivateKeyPath(), "Unexpected key");

        host = SshLiteCliSupport.resolveHost(SshLiteCliSupport.parseOptions(stderr, "-l", "ops", "web", "ls"));
        assertEquals("ops", host.getUsername(), "Login option ignored");
        assertEquals(HostConfig.DEFAULT_PORT, host.getPort(), "Mismatched default port");

        host = SshLiteCliSupport.resolveHost(SshLiteCliSupport.parseOptions(stderr, "web", "ls"));
        assertEquals(OsUtils.getCurrentUser(), host.getUsername(), "Mismatched default user");
    }

    @Test
    void searchArguments() {
        SearchRequest request = SshLiteMain.parseSearchRequest(Arrays.asList(
                "-name", "-case", "-include", "*.log", "-exclude", "tmp", "-max", "20", "error", "/var/log", "/srv"));
        assertFalse(request.isContentSearch(), "Content search requested");
        assertTrue(request.isCaseSensitive(), "Case insensitive");
        assertFalse(request.isRegex(), "Regex requested");
        assertEquals(Arrays.asList("*.log"), request.getIncludes());
        assertEquals(Arrays.asList("tmp"), request.getExcludes());
        assertEquals(20, request.getMaxResults(), "Mismatched cap");
        assertEquals("error", request.getPattern());
        assertEquals(Arrays.asList("/var/log", "/srv"), request.getRoots());

        SearchRequest defaults = SshLiteMain.parseSearchRequest(Arrays.asList("-regex", "a.*b", "~"));
        assertTrue(defaults.isContentSearch(), "Not a content search");
        assertTrue(defaults.isRegex(), "Not a regex");
        assertEquals(SearchRequest.DEFAULT_MAX_RESULTS, defaults.getMaxResults(), "Mismatched default cap");

        assertThrows(IllegalArgumentException.class, () -> SshLiteMain.parseSearchRequest(Arrays.asList("needle")));
        assertThrows(IllegalArgumentException.class, () -> SshLiteMain.parseSearchRequest(Arrays.asList("-max")));
        assertThrows(IllegalArgumentException.class,
                () -> SshLiteMain.parseSearchRequest(Arrays.asList("-max", "x", "needle", "/")));
        assertThrows(IllegalArgumentException.class,
                () -> SshLiteMain.parseSearchRequest(Arrays.asList("-max", "-2", "needle", "/")));
    }

    @Test
    void snapshotReportSkipsUnknownValues() {
        ServerSnapshot snapshot = ServerSnapshot.builder(Instant.EPOCH)
                .hostname("web-01")
                .uptime(Duration.ofHours(50L).plusMinutes(7L))
                .loadAverage(0.5d, 0.25d, 0.125d)
                .cpuCount(2)
                .memory(2048L * 1024L, 512L * 1024L)
                .disk(new ServerSnapshot.DiskUsage("/dev/sda1", 10240L, 5120L, 5120L, 50, "/"))
                .build();
        List<String> lines = SshLiteCliSupport.formatSnapshot(snapshot);
        assertEquals(Arrays.asList(
                "Host: web-01 @ 1970-01-01T00:00:00Z",
                "Uptime: 2d 02h 07m",
                "Load: 0.50 0.25 0.13 (2 CPUs)",
                "Memory: 1536 MB / 2048 MB (75.0%)",
                "Disk: /                     50% of 10 MB (/dev/sda1)"), lines);
    }

    @Test
    void zeroSearchCapMeansUnlimited() {
        SearchRequest request = SshLiteMain.parseSearchRequest(Arrays.asList("-max", "0", "needle", "/srv"));
        assertEquals(0, request.getMaxResults(), "Unlimited cap not kept");
        assertEquals(Arrays.asList("/srv"), request.getRoots());
    }

    @Test
    void listingEntryFormat() {
        RemoteFile dir = new RemoteFile("src", "/p/src", true, 4096L, Instant.EPOCH, Instant.EPOCH,
                "alice", "staff", "rwxr-xr-x");
        String line = SshLiteCliSupport.formatListingEntry(dir);
        assertTrue(line.startsWith("drwxr-xr-x alice    staff"), line);
        assertTrue(line.endsWith(" src/"), line);

        RemoteFile file = new RemoteFile("a.txt", "/p/a.txt", false, 17L, null, null, "alice", "staff", "rw-r--r--");
        line = SshLiteCliSupport.formatListingEntry(file);
        assertTrue(line.startsWith("-rw-r--r--"), line);
        assertTrue(line.endsWith("17 - a.txt"), line);
    }

    private String errorText() {
        return new String(errors.toByteArray(), StandardCharsets.UTF_8);
    }
}
