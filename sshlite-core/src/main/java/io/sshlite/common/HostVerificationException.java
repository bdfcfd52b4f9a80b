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

package io.sshlite.common;

/**
 * The presented host key was not trusted (see {@link Reason}) or the trusted keys could not be read or updated.
 * Distinct from {@link ConnectionException} so that it is never retried like a network blip.
 */
public class HostVerificationException extends SshLiteException {
    private static final long serialVersionUID = 7705370418327754935L;

    public enum Reason {
        REJECTED_UNKNOWN,
        REJECTED_CHANGED,
        DECISION_TIMEOUT,
        /**
         * The trust store or the decision handler failed - see the cause
         */
        VERIFICATION_ERROR
    }

    private final Reason reason;
    private final String presentedDigest;
    private final String storedDigest;

    public HostVerificationException(
            String identity, Reason reason, String presentedDigest, String storedDigest, String message) {
        this(identity, reason, presentedDigest, storedDigest, message, null);
    }

    public HostVerificationException(
            String identity, Reason reason, String presentedDigest, String storedDigest, String message,
            Throwable cause) {
        super(identity, message, cause);
        this.reason = reason;
        this.presentedDigest = presentedDigest;
        this.storedDigest = storedDigest;
    }

    public Reason getReason() {
        return reason;
    }

    public String getPresentedDigest() {
        return presentedDigest;
    }

    /**
     * @return The previously trusted digest - {@code null} if the host was unknown
     */
    public String getStoredDigest() {
        return storedDigest;
    }
}
