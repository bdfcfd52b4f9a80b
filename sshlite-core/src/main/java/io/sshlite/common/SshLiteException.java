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

import java.io.IOException;

/**
 * Base class of every failure reported by the session core. Carries the identity key ({@code address:port:user}) of
 * the session that reported it, when known.
 */
public class SshLiteException extends IOException {
    private static final long serialVersionUID = -4781529153066931276L;

    private final String identity;

    public SshLiteException(String message) {
        this(null, message, null);
    }

    public SshLiteException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public SshLiteException(String identity, String message, Throwable cause) {
        super(message, cause);
        this.identity = identity;
    }

    /**
     * @return The identity key of the originating session - {@code null} if not known
     */
    public String getIdentity() {
        return identity;
    }
}
