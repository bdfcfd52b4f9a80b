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

package io.sshlite.common.util;

import java.util.Collection;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Cooperative cancellation handle shared between a caller and a long running remote operation (search, chunked
 * download). Cancelling never touches the shared transport - only the channel owned by the operation.
 */
public class CancelToken extends AbstractLoggingBean {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Collection<Runnable> handlers = new CopyOnWriteArrayList<>();

    public CancelToken() {
        super();
    }

    /**
     * @return A token that is never cancelled
     */
    public static CancelToken none() {
        return new CancelToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Signals cancellation and runs the registered handlers - only the first call has any effect
     *
     * @return {@code true} if this call cancelled the token
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }

        for (Runnable h : handlers) {
            if (handlers.remove(h)) {
                invokeHandler(h);
            }
        }
        return true;
    }

    /**
     * Registers a handler invoked upon cancellation. If the token is already cancelled the handler is invoked
     * immediately.
     *
     * @param handler The handler
     */
    public void onCancel(Runnable handler) {
        handlers.add(handler);
        if (isCancelled() && handlers.remove(handler)) {
            invokeHandler(handler);
        }
    }

    public void removeHandler(Runnable handler) {
        handlers.remove(handler);
    }

    protected void invokeHandler(Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.warn("invokeHandler({}) {} while running cancellation handler: {}",
                    this, e.getClass().getSimpleName(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[cancelled=" + isCancelled() + "]";
    }
}
