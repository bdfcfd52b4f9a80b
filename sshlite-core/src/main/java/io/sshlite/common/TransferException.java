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
 * A remote file system or command operation failed. Carries whatever context is available: the path, the command,
 * the remote exit status and the captured standard error.
 */
public class TransferException extends SshLiteException {
    private static final long serialVersionUID = 3197521384250916754L;

    private final String path;
    private final String command;
    private final Integer exitStatus;
    private final String stderr;

    public TransferException(String identity, String path, String message, Throwable cause) {
        this(identity, path, null, null, null, message, cause);
    }

    public TransferException(
            String identity, String path, String command, Integer exitStatus, String stderr,
            String message, Throwable cause) {
        super(identity, message, cause);
        this.path = path;
        this.command = command;
        this.exitStatus = exitStatus;
        this.stderr = stderr;
    }

    public String getPath() {
        return path;
    }

    public String getCommand() {
        return command;
    }

    /**
     * @return The remote exit status - {@code null} if not an exec based operation or none was reported
     */
    public Integer getExitStatus() {
        return exitStatus;
    }

    public String getStderr() {
        return stderr;
    }
}
