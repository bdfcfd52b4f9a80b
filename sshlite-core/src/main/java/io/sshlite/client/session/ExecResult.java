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

package io.sshlite.client.session;

import io.sshlite.common.util.RemoteCommand;

/**
 * Outcome of a remote command that ran to completion
 */
public class ExecResult {
    private final String command;
    private final Integer exitStatus;
    private final String stdout;
    private final String stderr;

    public ExecResult(String command, Integer exitStatus, String stdout, String stderr) {
        this.command = command;
        this.exitStatus = exitStatus;
        this.stdout = (stdout == null) ? "" : stdout;
        this.stderr = (stderr == null) ? "" : stderr;
    }

    public ExecResult(RemoteCommand command, Integer exitStatus, String stdout, String stderr) {
        this(command.getCommandLine(), exitStatus, stdout, stderr);
    }

    public String getCommand() {
        return command;
    }

    /**
     * @return The remote exit status - {@code null} if the server did not report any
     */
    public Integer getExitStatus() {
        return exitStatus;
    }

    public boolean isSuccess() {
        return (exitStatus != null) && (exitStatus.intValue() == 0);
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getCommand() + "] status=" + getExitStatus();
    }
}
