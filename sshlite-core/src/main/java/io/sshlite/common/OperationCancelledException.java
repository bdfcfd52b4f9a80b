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
 * Raised by a chunked download whose {@link io.sshlite.common.util.CancelToken} fired. Not a failure of the remote
 * side - callers should treat it as the user's decision.
 */
public class OperationCancelledException extends SshLiteException {
    private static final long serialVersionUID = 5420963398137762158L;

    private final long transferred;

    public OperationCancelledException(String identity, String message, long transferred) {
        super(identity, message, null);
        this.transferred = transferred;
    }

    /**
     * @return Number of bytes received before the cancellation was noticed
     */
    public long getTransferred() {
        return transferred;
    }
}
