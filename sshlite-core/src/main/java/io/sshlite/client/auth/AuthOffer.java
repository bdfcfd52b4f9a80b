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

import java.security.KeyPair;
import java.util.Objects;

import org.apache.sshd.common.config.keys.KeyUtils;

/**
 * One authentication method offered to the server, with the material it needs
 */
public final class AuthOffer {
    public enum Kind {
        PUBLIC_KEY("publickey"),
        AGENT("publickey"),
        PASSWORD("password"),
        KEYBOARD_INTERACTIVE("keyboard-interactive");

        private final String methodName;

        Kind(String methodName) {
            this.methodName = methodName;
        }

        /**
         * @return The SSH user authentication method name
         */
        public String getMethodName() {
            return methodName;
        }
    }

    private final Kind kind;
    private final String source;
    private final KeyPair keyPair;
    private final String password;

    private AuthOffer(Kind kind, String source, KeyPair keyPair, String password) {
        this.kind = Objects.requireNonNull(kind, "No kind");
        this.source = source;
        this.keyPair = keyPair;
        this.password = password;
    }

    public static AuthOffer publicKey(String location, KeyPair keyPair) {
        return new AuthOffer(Kind.PUBLIC_KEY, location, Objects.requireNonNull(keyPair, "No key pair"), null);
    }

    public static AuthOffer agent(String socket) {
        return new AuthOffer(Kind.AGENT, socket, null, null);
    }

    public static AuthOffer password(String source, String password) {
        return new AuthOffer(Kind.PASSWORD, source, null, Objects.requireNonNull(password, "No password"));
    }

    /**
     * @param  password The password used to answer the challenges - may be {@code null}
     * @return          A keyboard-interactive offer
     */
    public static AuthOffer keyboardInteractive(String password) {
        return new AuthOffer(Kind.KEYBOARD_INTERACTIVE, null, null, password);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return Where the material comes from - key location, agent socket, credential id
     */
    public String getSource() {
        return source;
    }

    public KeyPair getKeyPair() {
        return keyPair;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        // never expose the secret
        String detail = (keyPair == null)
                ? Objects.toString(source, "")
                : source + "/" + KeyUtils.getFingerPrint(keyPair.getPublic());
        return getKind() + "[" + detail + "]";
    }
}
