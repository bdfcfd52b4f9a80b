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

import java.util.Objects;

import org.apache.sshd.common.util.ValidateUtils;

/**
 * A labeled credential registered for a host identity. The secret value itself is never part of this object - it is
 * kept by the {@link CredentialService} in the secret store or the session overlay.
 */
public final class Credential {
    private final String id;
    private final String label;
    private final CredentialKind kind;
    private final String privateKeyPath;

    public Credential(String id, String label, CredentialKind kind, String privateKeyPath) {
        this.id = ValidateUtils.checkNotNullAndNotEmpty(id, "No credential id");
        this.label = ValidateUtils.checkNotNullAndNotEmpty(label, "No credential label");
        this.kind = Objects.requireNonNull(kind, "No credential kind");
        if (kind == CredentialKind.PRIVATE_KEY) {
            ValidateUtils.checkNotNullAndNotEmpty(privateKeyPath, "No private key path for credential %s", id);
        }
        this.privateKeyPath = privateKeyPath;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public CredentialKind getKind() {
        return kind;
    }

    /**
     * @return The key file location - {@code null} for {@link CredentialKind#PASSWORD} credentials
     */
    public String getPrivateKeyPath() {
        return privateKeyPath;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getId(), getLabel(), getKind(), getPrivateKeyPath());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        Credential other = (Credential) obj;
        return Objects.equals(getId(), other.getId())
                && Objects.equals(getLabel(), other.getLabel())
                && (getKind() == other.getKind())
                && Objects.equals(getPrivateKeyPath(), other.getPrivateKeyPath());
    }

    @Override
    public String toString() {
        return getKind() + "[" + getId() + "](" + getLabel() + ")";
    }
}
