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

package io.sshlite.client.watch;

import java.io.IOException;

import io.sshlite.client.session.ExecResult;
import io.sshlite.client.session.RemoteCommandExecutor;
import io.sshlite.common.util.RemoteCommand;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Detects the remote OS family and the available change notification tools. Only the tool matching the OS family is
 * looked up.
 */
public class CapabilityProbe extends AbstractLoggingBean {
    public CapabilityProbe() {
        super();
    }

    /**
     * @param  executor The session to probe
     * @return          The detected capabilities - {@link ServerCapabilities#UNKNOWN} if probing failed
     */
    public ServerCapabilities probe(RemoteCommandExecutor executor) {
        try {
            ExecResult uname = executor.execute(RemoteCommand.osName());
            RemoteOs os = RemoteOs.fromKernelName(uname.getStdout());
            boolean inotifywait = (os == RemoteOs.LINUX) && isAvailable(executor, WatchMethod.INOTIFYWAIT);
            boolean fswatch = os.isBsdFamily() && isAvailable(executor, WatchMethod.FSWATCH);
            ServerCapabilities caps = new ServerCapabilities(os, inotifywait, fswatch);
            if (log.isDebugEnabled()) {
                log.debug("probe({}) {}", executor.getIdentity(), caps);
            }
            return caps;
        } catch (IOException | RuntimeException e) {
            log.warn("probe({}) failed ({}) - falling back to polling: {}",
                    executor.getIdentity(), e.getClass().getSimpleName(), e.getMessage());
            return ServerCapabilities.UNKNOWN;
        }
    }

    protected boolean isAvailable(RemoteCommandExecutor executor, WatchMethod method) throws IOException {
        ExecResult result = executor.execute(RemoteCommand.toolLookup(method.getToolName()));
        return result.isSuccess();
    }
}
