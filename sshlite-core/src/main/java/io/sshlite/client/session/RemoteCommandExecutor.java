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

import java.io.IOException;

import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.common.util.io.output.LineLevelAppender;

/**
 * Runs remote commands over a multiplexed exec channel
 */
public interface RemoteCommandExecutor {
    /**
     * @return The identity key of the session running the commands
     */
    String getIdentity();

    /**
     * Runs a command to completion
     *
     * @param  command     The command
     * @return             The outcome - regardless of the exit status
     * @throws IOException If the command could not be run
     */
    ExecResult execute(RemoteCommand command) throws IOException;

    /**
     * Starts a command whose standard output is streamed line by line
     *
     * @param  command     The command
     * @param  output      Receives the output lines as they arrive
     * @return             The running process
     * @throws IOException If the exec channel could not be opened
     */
    RemoteProcess start(RemoteCommand command, LineLevelAppender output) throws IOException;
}
