/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.streamstore.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamstore.core.StoreNotifier;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Keeps the listeners of a notifier. Subclasses decide when to signal.
 *
 * @author Tommy Wassgren
 */
public abstract class AbstractStoreNotifier implements StoreNotifier {
    protected final Logger log = LoggerFactory.getLogger(getClass());
    private final Map<String, Runnable> listeners = new ConcurrentHashMap<>();

    @Override
    public String addListener(final Runnable listener) {
        requireNonNull(listener, "Listener must not be null");
        final String registrationId = UUID.randomUUID().toString();
        listeners.put(registrationId, listener);
        log.debug("Listener added [registrationId={}]", registrationId);
        return registrationId;
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public void removeListener(final String registrationId) {
        if (listeners.remove(registrationId) != null) {
            log.debug("Listener removed [registrationId={}]", registrationId);
        }
    }

    /**
     * Signals all listeners. A failing listener does not prevent the others from being signalled.
     */
    protected void signalListeners() {
        listeners.forEach((registrationId, listener) -> {
            try {
                listener.run();
            } catch (final RuntimeException e) {
                log.warn("Listener failed [registrationId={}]", registrationId, e);
            }
        });
    }
}
