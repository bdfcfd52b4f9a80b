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

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

import io.sshlite.common.util.RemoteCommand;

/**
 * A command running on the remote host over its own exec channel
 */
public interface RemoteProcess extends Closeable {
    RemoteCommand getCommand();

    boolean isOpen();

    /**
     * @return The PID of the remote shell running the command - {@code null} until reported
     */
    Long getRemotePid();

    /**
     * Waits for the remote process to exit
     *
     * @param  timeout     Maximum time to wait - {@code null} or zero to wait forever
     * @return             The exit status - {@code null} if the process did not exit in time or none was reported
     * @throws IOException If failed to wait
     */
    Integer waitFor(Duration timeout) throws IOException;

    /**
     * @return Captured standard error so far
     */
    String getStderr();

    /**
     * Stops the remote process: sends it a {@code TERM} signal, kills its process tree and closes the channel. Never
     * throws - failures are logged.
     */
    void terminate();

    /**
     * Closes the channel without trying to signal the remote process
     */
    @Override
    void close() throws IOException;
}
