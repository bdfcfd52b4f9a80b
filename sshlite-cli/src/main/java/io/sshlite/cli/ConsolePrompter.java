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
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.sshlite.client.auth.Credential;
import io.sshlite.client.auth.CredentialPrompter;
import io.sshlite.client.keyverifier.HostKeyDecision;
import io.sshlite.client.keyverifier.HostKeyDecisionHandler;
import io.sshlite.common.HostConfig;
import org.apache.sshd.common.util.GenericUtils;

/**
 * Answers the credential and host key questions on the terminal. Answers are read line by line from the given
 * reader, so secrets are echoed unless the terminal hides them.
 */
public class ConsolePrompter implements CredentialPrompter, HostKeyDecisionHandler {
    private final BufferedReader stdin;
    private final PrintStream stdout;

    public ConsolePrompter(BufferedReader stdin, PrintStream stdout) {
        this.stdin = Objects.requireNonNull(stdin, "No input");
        this.stdout = Objects.requireNonNull(stdout, "No output");
    }

    @Override
    public String promptPassword(HostConfig host, String prompt) {
        return ask(prompt + ": ");
    }

    @Override
    public String promptPassphrase(HostConfig host, String keyLocation, int retryIndex) {
        String prefix = (retryIndex > 0) ? "Wrong passphrase - " : "";
        return ask(prefix + "Enter passphrase for " + keyLocation + ": ");
    }

    @Override
    public boolean confirmSaveSecret(HostConfig host, Credential credential) {
        return isYes(ask("Remember the secret of '" + credential.getLabel() + "' for this run? [yes/no]: "));
    }

    @Override
    public Credential chooseCredential(HostConfig host, List<Credential> candidates) {
        stdout.println("Several credentials are registered for " + host.getIdentityKey() + ":");
        for (int index = 0; index < candidates.size(); index++) {
            Credential c = candidates.get(index);
            stdout.append("    ").append(Integer.toString(index + 1)).append(") ").append(c.getLabel())
                    .append(" (").append(c.getKind().name()).println(")");
        }

        String answer = ask("Credential to use [1-" + candidates.size() + ", empty for defaults]: ");
        if (GenericUtils.isEmpty(answer)) {
            return null;
        }

        try {
            int index = Integer.parseInt(answer.trim()) - 1;
            return ((index >= 0) && (index < candidates.size())) ? candidates.get(index) : null;
        } catch (NumberFormatException e) {
            stdout.println("Not a number: " + answer + " - using the defaults");
            return null;
        }
    }

    @Override
    public String[] respondToChallenge(
            HostConfig host, String name, String instruction, String[] prompts, boolean[] echo) {
        if (GenericUtils.isNotEmpty(name)) {
            stdout.println(name);
        }
        if (GenericUtils.isNotEmpty(instruction)) {
            stdout.println(instruction);
        }

        String[] answers = new String[prompts.length];
        for (int index = 0; index < prompts.length; index++) {
            answers[index] = ask(prompts[index]);
            if (answers[index] == null) {
                return null;
            }
        }
        return answers;
    }

    @Override
    public CompletableFuture<HostKeyDecision> requestDecision(
            String hostAlias, String presentedDigest, String storedDigest) {
        if (storedDigest == null) {
            stdout.println("The authenticity of host " + hostAlias + " can't be established.");
        } else {
            stdout.println("WARNING: the host key of " + hostAlias + " has changed!");
            stdout.println("Trusted key fingerprint is " + storedDigest + ".");
        }
        stdout.println("Key fingerprint is " + presentedDigest + ".");

        String answer = ask("Are you sure you want to continue connecting [yes/no]? ");
        return CompletableFuture.completedFuture(isYes(answer) ? HostKeyDecision.ACCEPT : HostKeyDecision.REJECT);
    }

    /**
     * @param  prompt The prompt
     * @return        The trimmed answer - {@code null} if the input was closed
     */
    protected String ask(String prompt) {
        synchronized (stdin) {
            stdout.print(prompt);
            stdout.flush();
            try {
                String line = stdin.readLine();
                return (line == null) ? null : line.trim();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read answer to: " + prompt, e);
            }
        }
    }

    public static boolean isYes(String answer) {
        return "yes".equalsIgnoreCase(answer) || "y".equalsIgnoreCase(answer);
    }
}
