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

package io.sshlite.client.keyverifier;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the user whether to trust a host key that is unknown or differs from the trusted one. The answer may be given
 * asynchronously - the verifier waits for it at most the configured decision timeout.
 */
@FunctionalInterface
public interface HostKeyDecisionHandler {
    /**
     * Rejects every key that is not already trusted
     */
    HostKeyDecisionHandler REJECT_ALL = of(HostKeyDecision.REJECT);

    /**
     * @param  hostAlias       {@code address:port}
     * @param  presentedDigest Digest of the key presented by the server
     * @param  storedDigest    The previously trusted digest - {@code null} if the host is unknown
     * @return                 The pending decision
     */
    CompletableFuture<HostKeyDecision> requestDecision(String hostAlias, String presentedDigest, String storedDigest);

    static HostKeyDecisionHandler of(HostKeyDecision decision) {
        return (alias, presented, stored) -> CompletableFuture.completedFuture(decision);
    }
}
