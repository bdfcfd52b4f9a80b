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

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Properties;

import io.sshlite.client.auth.CredentialService;
import io.sshlite.client.keyverifier.HostKeyTrustStore;
import org.apache.sshd.common.util.net.SshdSocketAddress;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;
import org.apache.sshd.server.shell.ProcessShellFactory;
import org.apache.sshd.sftp.server.SftpSubsystemFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodName.class)
@DisabledOnOs(OS.WINDOWS)
public class SshLiteMainTest {
    private static final String USER = "sshlite";
    private static final String PASSWORD = "sshlite-password";

    @TempDir
    protected Path tempDir;

    private SshServer sshd;
    private Path storeFile;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    public SshLiteMainTest() {
        super();
    }

    @BeforeEach
    void setUp() throws IOException {
        sshd = SshServer.setUpDefaultServer();
        sshd.setHost(SshdSocketAddress.LOCALHOST_IPV4);
        sshd.setPort(0);
        sshd.setKeyPairProvider(new SimpleGeneratorHostKeyProvider(tempDir.resolve("hostkey.ser")));
        sshd.setPasswordAuthenticator((username, password, session) -> USER.equals(username) && PASSWORD.equals(password));
        sshd.setSubsystemFactories(Collections.singletonList(new SftpSubsystemFactory()));
        sshd.setCommandFactory(
                (channel, command) -> new ProcessShellFactory(command, "/bin/sh", "-c", command).createShell(channel));
        sshd.start();

        storeFile = tempDir.resolve("store").resolve("store.properties");
        resetStreams();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (sshd != null) {
            sshd.stop(true);
        }
    }

    @Test
    void execTrustsHostKeyOnFirstUse() throws Exception {
        int status = run("yes\n", "exec", "echo", "hi");
        assertEquals(0, status, errorText());
        assertTrue(outputText().contains("can't be established"), outputText());
        assertTrue(outputText().endsWith("hi\n"), outputText());

        Properties props = loadStore();
        assertTrue(props.stringPropertyNames().stream().anyMatch(k -> k.startsWith(HostKeyTrustStore.KEY_PREFIX)),
                "Host key not trusted: " + props);
        assertTrue(props.stringPropertyNames().stream().anyMatch(k -> k.startsWith(CredentialService.INDEX_PREFIX)),
                "Credential not indexed: " + props);

        resetStreams();
        status = run("", "exec", "echo oops >&2; exit 3");
        assertEquals(3, status, "Mismatched exit status");
        assertFalse(outputText().contains("can't be established"), "Trusted host prompted again");
        assertEquals("oops\n", errorText());
    }

    @Test
    void rejectedHostKey() throws Exception {
        int status = run("no\n", "exec", "echo", "hi");
        assertEquals(SshLiteMain.COMMAND_ERROR, status, outputText());
        assertTrue(errorText().startsWith("ERROR: "), errorText());
        assertFalse(outputText().contains("hi\n"), outputText());

        Properties props = loadStore();
        assertFalse(props.stringPropertyNames().stream().anyMatch(k -> k.startsWith(HostKeyTrustStore.KEY_PREFIX)),
                "Rejected host key stored: " + props);
    }

    @Test
    void fileCommands() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("data"));
        Files.write(dir.resolve("app.log"), "first\nsecond error\nthird\n".getBytes(StandardCharsets.UTF_8));
        String remoteDir = dir.toAbsolutePath().toString();
        String remoteFile = dir.resolve("app.log").toAbsolutePath().toString();

        assertEquals(0, run("yes\n", "cat", remoteFile), errorText());
        assertTrue(outputText().endsWith("first\nsecond error\nthird\n"), outputText());

        resetStreams();
        assertEquals(0, run("", "tail", remoteFile, "1"), errorText());
        assertTrue(outputText().endsWith("third\n"), outputText());
        assertFalse(outputText().contains("first"), outputText());

        resetStreams();
        assertEquals(0, run("", "head", remoteFile, "1"), errorText());
        assertTrue(outputText().startsWith("first"), outputText());
        assertFalse(outputText().contains("third"), outputText());

        resetStreams();
        assertEquals(0, run("", "ls", remoteDir), errorText());
        assertTrue(outputText().contains(" app.log"), outputText());

        resetStreams();
        assertEquals(0, run("", "search", "error", remoteDir), errorText());
        assertTrue(outputText().contains("app.log:2"), outputText());

        resetStreams();
        assertEquals(SshLiteMain.COMMAND_ERROR, run("", "search", "-case", "ERROR", remoteDir), "Matches found");
    }

    @Test
    void statusReportsServerHealth() throws Exception {
        assertEquals(0, run("yes\n", "status"), errorText());
        String report = outputText();
        assertTrue(report.contains("Host: "), report);
        assertTrue(report.contains("No obvious issues found") || report.contains("Issues:"), report);
    }

    @Test
    void unlimitedSearchCap() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("many"));
        for (int index = 0; index < 3; index++) {
            Files.write(dir.resolve("f" + index + ".txt"), "match\n".getBytes(StandardCharsets.UTF_8));
        }

        assertEquals(0, run("yes\n", "search", "-max", "0", "match", dir.toAbsolutePath().toString()), errorText());
        for (int index = 0; index < 3; index++) {
            assertTrue(outputText().contains("f" + index + ".txt:1"), outputText());
        }
    }

    @Test
    void usageErrors() throws Exception {
        assertEquals(SshLiteMain.USAGE_ERROR, runRaw("", "-p", Integer.toString(sshd.getPort())),
                "Missing target accepted");
        assertTrue(errorText().contains(SshLiteCliSupport.USAGE), errorText());

        resetStreams();
        assertEquals(SshLiteMain.USAGE_ERROR, run("yes\n", "frobnicate"), "Unknown command accepted");
        assertTrue(errorText().contains("Unknown command: frobnicate"), errorText());
    }

    private int run(String input, String... command) throws IOException {
        String[] args = new String[command.length + 7];
        args[0] = "-p";
        args[1] = Integer.toString(sshd.getPort());
        args[2] = "-w";
        args[3] = PASSWORD;
        args[4] = "-o";
        args[5] = "sshlite-auto-reconnect=false";
        args[6] = USER + "@" + SshdSocketAddress.LOCALHOST_IPV4;
        System.arraycopy(command, 0, args, 7, command.length);
        return runRaw(input, args);
    }

    private int runRaw(String input, String... args) throws IOException {
        try (PrintStream out = new PrintStream(stdout, true, "UTF-8");
             PrintStream err = new PrintStream(stderr, true, "UTF-8")) {
            return SshLiteMain.run(new BufferedReader(new StringReader(input)), out, err, storeFile, args);
        }
    }

    private Properties loadStore() throws IOException {
        Properties props = new Properties();
        if (Files.exists(storeFile)) {
            try (InputStream input = Files.newInputStream(storeFile)) {
                props.load(input);
            }
        }
        return props;
    }

    private void resetStreams() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private String outputText() {
        return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
    }

    private String errorText() {
        return new String(stderr.toByteArray(), StandardCharsets.UTF_8);
    }
}
