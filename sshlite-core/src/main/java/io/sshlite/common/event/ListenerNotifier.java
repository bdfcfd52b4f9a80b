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

package io.sshlite.common.event;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

import io.sshlite.client.session.HostSession;
import io.sshlite.common.ConnectionState;
import org.apache.sshd.common.util.EventListenerUtils;
import org.apache.sshd.common.util.logging.AbstractLoggingBean;

/**
 * Delivers {@link SessionEventListener} events. Listeners are invoked in registration order and a failing listener
 * does not prevent the others from being invoked. An event fired by a listener while an event is being delivered on
 * the same thread is queued and delivered once the current one completes.
 */
public class ListenerNotifier extends AbstractLoggingBean {
    private final Collection<SessionEventListener> listeners = new CopyOnWriteArraySet<>();
    private final SessionEventListener proxy;
    private final ThreadLocal<Deque<Consumer<SessionEventListener>>> pending = new ThreadLocal<>();

    public ListenerNotifier() {
        proxy = EventListenerUtils.proxyWrapper(SessionEventListener.class, listeners);
    }

    public void addListener(SessionEventListener listener) {
        listeners.add(SessionEventListener.validateListener(listener));
    }

    public void removeListener(SessionEventListener listener) {
        if (listener != null) {
            listeners.remove(listener);
        }
    }

    public boolean hasListeners() {
        return !listeners.isEmpty();
    }

    /**
     * @return A single listener relaying every invocation to {@link #fire(Consumer)} - suitable for registration on
     *         another notifier
     */
    public SessionEventListener asRelay() {
        return new SessionEventListener() {
            @Override
            public void sessionStateChanged(HostSession session, ConnectionState state) {
                fire(l -> l.sessionStateChanged(session, state));
            }

            @Override
            public void sessionReconnecting(ReconnectEvent event) {
                fire(l -> l.sessionReconnecting(event));
            }

            @Override
            public void remoteFileChanged(HostSession session, FileChangeEvent event) {
                fire(l -> l.remoteFileChanged(session, event));
            }

            @Override
            public String toString() {
                return "relay(" + ListenerNotifier.this + ")";
            }
        };
    }

    public void fire(Consumer<SessionEventListener> event) {
        Deque<Consumer<SessionEventListener>> queue = pending.get();
        if (queue != null) {
            queue.addLast(event);
            return;
        }

        queue = new ArrayDeque<>();
        pending.set(queue);
        try {
            for (Consumer<SessionEventListener> e = event; e != null; e = queue.pollFirst()) {
                deliver(e);
            }
        } finally {
            pending.remove();
        }
    }

    protected void deliver(Consumer<SessionEventListener> event) {
        try {
            event.accept(proxy);
        } catch (RuntimeException e) {
            log.warn("deliver({}) listener failure {}: {}", this, e.getClass().getSimpleName(), e.getMessage());
            if (log.isDebugEnabled()) {
                log.warn("deliver(" + this + ") listener failure details", e);
            }
        }
    }
}
