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

package io.sshlite.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * The parsed command line - options, target and command
 */
public class CliOptions {
    private int port = -1;
    private String login;
    private String identity;
    private String password;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private Level level = Level.WARNING;
    private String target;
    private String command;
    private final List<String> commandArgs = new ArrayList<>();

    public CliOptions() {
        super();
    }

    /**
     * @return The {@code -p} port - negative if not specified
     */
    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    /**
     * @return The {@code -i} private key file - {@code null} to probe the defaults
     */
    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    /**
     * @return The {@code -o name=value} settings
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    public Level getLevel() {
        return level;
    }

    public void setLevel(Level level) {
        this.level = level;
    }

    /**
     * @return The {@code [user@]host} argument
     */
    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public List<String> getCommandArgs() {
        return Collections.unmodifiableList(commandArgs);
    }

    public void addCommandArg(String arg) {
        commandArgs.add(arg);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[target=" + getTarget()
               + ", port=" + getPort()
               + ", login=" + getLogin()
               + ", identity=" + getIdentity()
               + ", command=" + getCommand()
               + ", args=" + commandArgs
               + "]";
    }
}
