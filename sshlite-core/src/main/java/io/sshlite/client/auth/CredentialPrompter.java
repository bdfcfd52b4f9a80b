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

package io.sshlite.client.auth;

import java.util.List;

import io.sshlite.common.HostConfig;

/**
 * Callbacks through which the session core asks the user for secrets and choices. Every method may return
 * {@code null} to indicate that the user cancelled the request.
 */
public interface CredentialPrompter {
    /**
     * Never prompts - used when no user is available
     */
    CredentialPrompter NONE = new CredentialPrompter() {
        @Override
        public String promptPassword(HostConfig host, String prompt) {
            return null;
        }

        @Override
        public String promptPassphrase(HostConfig host, String keyLocation, int retryIndex) {
            return null;
        }

        @Override
        public String toString() {
            return "NONE";
        }
    };

    String promptPassword(HostConfig host, String prompt);

    /**
     * @param  host        The target host
     * @param  keyLocation The encrypted key location
     * @param  retryIndex  Zero based attempt index - non-zero if previous passphrase was wrong
     * @return             The passphrase - {@code null} to skip the key
     */
    String promptPassphrase(HostConfig host, String keyLocation, int retryIndex);

    /**
     * Invoked after a successful login with a prompted secret of a registered credential
     *
     * @param  host       The target host
     * @param  credential The credential whose secret was prompted
     * @return            {@code true} if the secret should be persisted
     */
    default boolean confirmSaveSecret(HostConfig host, Credential credential) {
        return false;
    }

    /**
     * @param  host       The host being reconnected
     * @param  candidates The credentials registered for the host - more than one
     * @return            The chosen credential - {@code null} to fall back to the default probing
     */
    default Credential chooseCredential(HostConfig host, List<Credential> candidates) {
        return null;
    }

    /**
     * Answers a keyboard-interactive challenge that could not be answered with a known password
     *
     * @param  host        The target host
     * @param  name        The interaction name (may be empty)
     * @param  instruction The instruction (may be empty)
     * @param  prompts     The server's prompts
     * @param  echo        For each prompt whether the answer may be echoed
     * @return             The answers - {@code null} to abort the challenge
     */
    default String[] respondToChallenge(
            HostConfig host, String name, String instruction, String[] prompts, boolean[] echo) {
        return null;
    }
}
