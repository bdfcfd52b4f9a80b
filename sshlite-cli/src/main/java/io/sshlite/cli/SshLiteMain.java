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
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import io.sshlite.client.auth.Credential;
import io.sshlite.client.monitor.ServerSnapshot;
import io.sshlite.client.monitor.ServerSnapshotService;
import io.sshlite.client.search.SearchMatch;
import io.sshlite.client.search.SearchRequest;
import io.sshlite.client.session.ExecResult;
import io.sshlite.client.session.HostSession;
import io.sshlite.client.session.RemoteFile;
import io.sshlite.client.session.SessionRegistry;
import io.sshlite.common.ConnectionException;
import io.sshlite.common.ConnectionState;
import io.sshlite.common.HostConfig;
import io.sshlite.common.SshLiteException;
import io.sshlite.common.event.FileChangeEvent;
import io.sshlite.common.event.ReconnectEvent;
import io.sshlite.common.event.SessionEventListener;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.input.NoCloseInputStream;
import org.slf4j.Logger;

/**
 * Runs a single command against a host through a persistent session
 */
public class SshLiteMain extends SshLiteCliSupport {
    public static final int USAGE_ERROR = -1;
    public static final int COMMAND_ERROR = 1;

    protected SshLiteMain() {
        super();
    }

    public static void main(String[] args) throws Exception {
        int status;
        try (BufferedReader stdin = new BufferedReader(
                new InputStreamReader(new NoCloseInputStream(System.in), Charset.defaultCharset()))) {
            CliLogger.setupLibraryLogging(CliLogger.resolveLoggingVerbosity(args, GenericUtils.length(args)));
            status = run(stdin, System.out, System.err, resolveDefaultStoreFile(), args);
        }
        System.exit(status);
    }

    /**
     * @param  stdin       Answers to the prompts - and end of input for the long running commands
     * @param  stdout      Command output
     * @param  stderr      Error and progress messages
     * @param  storeFile   Where the trusted host keys and the credential index are kept
     * @param  args        The command line arguments
     * @return             The exit status
     * @throws IOException If failed to release the session resources
     */
    public static int run(BufferedReader stdin, PrintStream stdout, PrintStream stderr, Path storeFile, String... args)
            throws IOException {
        CliOptions options = parseOptions(stderr, args);
        if (options == null) {
            stderr.println(USAGE);
            return USAGE_ERROR;
        }

        Logger logger = CliLogger.getLogger(SshLiteMain.class, options.getLevel(), stderr);
        HostConfig host = resolveHost(options);
        ConsolePrompter prompter = new ConsolePrompter(stdin, stdout);
        try (SessionRegistry registry = setupRegistry(options, storeFile, prompter)) {
            if (logger.isInfoEnabled()) {
                registry.addSessionEventListener(createLoggingListener(logger));
            }

            Credential credential = null;
            if (options.getPassword() != null) {
                credential = registry.getCredentialService()
                        .saveDefaultPassword(host.getIdentityKey(), options.getPassword());
            }

            if (logger.isInfoEnabled()) {
                logger.info("Connecting to {} ({})", host, host.getIdentityKey());
            }
            HostSession session = registry.connect(host, credential);
            return executeCommand(registry, session, options, stdin, stdout, stderr);
        } catch (IllegalArgumentException e) {
            CliLogger.showError(stderr, e.getMessage());
            stderr.println(USAGE);
            return USAGE_ERROR;
        } catch (ConnectionException e) {
            CliLogger.showError(stderr, e.getMessage());
            stderr.append("    ").println(e.getHint());
            return COMMAND_ERROR;
        } catch (SshLiteException e) {
            CliLogger.showError(stderr, e.getMessage());
            return COMMAND_ERROR;
        }
    }

    public static int executeCommand(
            SessionRegistry registry, HostSession session, CliOptions options,
            BufferedReader stdin, PrintStream stdout, PrintStream stderr)
            throws IOException {
        String command = options.getCommand();
        List<String> args = options.getCommandArgs();
        switch (command) {
            case "exec":
                return exec(session, args, stdout, stderr);
            case "ls":
                return list(session, args, stdout);
            case "cat":
                requireArgs(command, args, 1);
                stdout.write(session.readFile(args.get(0)));
                stdout.flush();
                return 0;
            case "tail":
                requireArgs(command, args, 2);
                stdout.print(session.readFileLastLines(args.get(0), parseCount(args.get(1))));
                return 0;
            case "head":
                requireArgs(command, args, 2);
                stdout.print(session.readFileFirstLines(args.get(0), parseCount(args.get(1))));
                return 0;
            case "search":
                return search(session, args, stdout);
            case "watch":
                return watch(registry, session, args, stdin, stdout, stderr);
            case "forward":
                return forward(session, args, stdin, stdout);
            case "status":
                return status(session, stdout);
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    protected static int exec(HostSession session, List<String> args, PrintStream stdout, PrintStream stderr)
            throws IOException {
        requireArgs("exec", args, 1);
        ExecResult result = session.execute(String.join(" ", args));
        stdout.print(result.getStdout());
        stdout.flush();
        stderr.print(result.getStderr());
        Integer status = result.getExitStatus();
        return (status == null) ? COMMAND_ERROR : status;
    }

    protected static int list(HostSession session, List<String> args, PrintStream stdout) throws IOException {
        String path = args.isEmpty() ? null : args.get(0);
        for (RemoteFile file : session.listFiles(path)) {
            stdout.println(formatListingEntry(file));
        }
        return 0;
    }

    /**
     * Parses {@code [-name] [-case] [-regex] [-include glob] [-exclude glob] [-max n] <pattern> <root>...} - where
     * {@code -max 0} lifts the result cap
     *
     * @param  args The command arguments
     * @return      The search request
     */
    public static SearchRequest parseSearchRequest(List<String> args) {
        boolean contentSearch = true;
        boolean caseSensitive = false;
        boolean regex = false;
        int maxResults = SearchRequest.DEFAULT_MAX_RESULTS;
        List<String> includes = new ArrayList<>();
        List<String> excludes = new ArrayList<>();
        int index = 0;
        for (; index < args.size(); index++) {
            String argName = args.get(index);
            if ("-name".equals(argName)) {
                contentSearch = false;
            } else if ("-case".equals(argName)) {
                caseSensitive = true;
            } else if ("-regex".equals(argName)) {
                regex = true;
            } else if ("-include".equals(argName) || "-exclude".equals(argName) || "-max".equals(argName)) {
                if ((index + 1) >= args.size()) {
                    throw new IllegalArgumentException("option requires an argument: " + argName);
                }
                String argVal = args.get(++index);
                if ("-include".equals(argName)) {
                    includes.add(argVal);
                } else if ("-exclude".equals(argName)) {
                    excludes.add(argVal);
                } else {
                    maxResults = parseLimit(argVal);
                }
            } else {
                break;
            }
        }

        if ((args.size() - index) < 2) {
            throw new IllegalArgumentException("search requires a pattern and at least one root");
        }

        SearchRequest.Builder builder = SearchRequest.builder(args.get(index))
                .contentSearch(contentSearch)
                .caseSensitive(caseSensitive)
                .regex(regex)
                .maxResults(maxResults)
                .roots(args.subList(index + 1, args.size()));
        includes.forEach(builder::include);
        excludes.forEach(builder::exclude);
        return builder.build();
    }

    protected static int search(HostSession session, List<String> args, PrintStream stdout) throws IOException {
        SearchRequest request = parseSearchRequest(args);
        List<SearchMatch> matches = session.search(request);
        for (SearchMatch m : matches) {
            stdout.println(request.isContentSearch() ? m.toString() : m.getPath());
        }
        return matches.isEmpty() ? COMMAND_ERROR : 0;
    }

    protected static int watch(
            SessionRegistry registry, HostSession session, List<String> args,
            BufferedReader stdin, PrintStream stdout, PrintStream stderr)
            throws IOException {
        requireArgs("watch", args, 1);
        String path = args.get(0);
        SessionEventListener listener = new SessionEventListener() {
            @Override
            public void remoteFileChanged(HostSession source, FileChangeEvent event) {
                synchronized (stdout) {
                    stdout.append(event.getKind().name()).append(' ').println(event.getRemotePath());
                }
            }
        };

        registry.addSessionEventListener(listener);
        try {
            if (!session.watchFile(path)) {
                CliLogger.showError(stderr, "No change notification tool on " + session.getHost() + " for " + path);
                return COMMAND_ERROR;
            }

            stderr.println("Watching " + path + " - end the input to stop");
            awaitEndOfInput(stdin);
            session.unwatchFile(path);
            return 0;
        } finally {
            registry.removeSessionEventListener(listener);
        }
    }

    protected static int forward(HostSession session, List<String> args, BufferedReader stdin, PrintStream stdout)
            throws IOException {
        requireArgs("forward", args, 3);
        int localPort = Integer.parseInt(args.get(0));
        if (localPort < 0) {
            throw new IllegalArgumentException("Bad local port: " + localPort);
        }
        int remotePort = parseCount(args.get(2));
        int bound = session.forwardPort(localPort, args.get(1), remotePort);
        stdout.println("Forwarding localhost:" + bound + " to " + args.get(1) + ":" + remotePort
                       + " - end the input to stop");
        stdout.flush();
        awaitEndOfInput(stdin);
        session.stopForward(bound);
        return 0;
    }

    protected static int status(HostSession session, PrintStream stdout) throws IOException {
        ServerSnapshotService service = new ServerSnapshotService();
        ServerSnapshot snapshot = service.snapshot(session);
        formatSnapshot(snapshot).forEach(stdout::println);
        List<String> issues = service.diagnose(snapshot);
        if (issues.isEmpty()) {
            stdout.println("No obvious issues found");
        } else {
            stdout.println("Issues:");
            for (int index = 0; index < issues.size(); index++) {
                stdout.append("  ").append(Integer.toString(index + 1)).append(". ").println(issues.get(index));
            }
        }
        return 0;
    }

    protected static void awaitEndOfInput(BufferedReader stdin) throws IOException {
        String line = stdin.readLine();
        while (line != null) {
            line = stdin.readLine();
        }
    }

    protected static void requireArgs(String command, List<String> args, int minArgs) {
        if (args.size() < minArgs) {
            throw new IllegalArgumentException(command + " requires " + minArgs + " argument(s)");
        }
    }

    protected static int parseCount(String value) {
        int count = parsePositiveInt(value);
        if (count <= 0) {
            throw new IllegalArgumentException("Not a positive number: " + value);
        }
        return count;
    }

    /**
     * @param  value The option value
     * @return       The parsed cap - zero for unlimited
     */
    protected static int parseLimit(String value) {
        int limit;
        try {
            limit = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value, e);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("Negative limit: " + value);
        }
        return limit;
    }

    public static SessionEventListener createLoggingListener(Logger logger) {
        return new SessionEventListener() {
            @Override
            public void sessionStateChanged(HostSession session, ConnectionState state) {
                logger.info("{} is now {}", session.getId(), state);
            }

            @Override
            public void sessionReconnecting(ReconnectEvent event) {
                if (event.isReconnecting()) {
                    logger.info("{} reconnecting - attempt {}", event.getIdentity(), event.getAttempt());
                } else {
                    logger.info("{} reconnection ended after {} attempt(s)", event.getIdentity(), event.getAttempt());
                }
            }
        };
    }
}
