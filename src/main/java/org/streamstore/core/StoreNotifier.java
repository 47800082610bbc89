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

package org.streamstore.core;

/**
 * Signals subscriptions that new events may exist. A notifier never carries events itself, subscriptions react to a signal
 * by reading from the store. Spurious signals are allowed.
 *
 * <p>One notifier is created per store, lazily, by the {@link StoreNotifierFactory} given in the {@link EventStoreSettings}.
 * It is closed by the store when the store is closed.</p>
 *
 * @author Tommy Wassgren
 */
public interface StoreNotifier extends AutoCloseable {
    /**
     * Registers a listener that is invoked each time new events may exist.
     *
     * @param listener The listener, must return quickly.
     * @return The registration id, used to remove the listener.
     */
    String addListener(Runnable listener);

    /**
     * Invoked by the store after each successful local append. Push-based notifiers publish the new head here, polling
     * notifiers may ignore it.
     *
     * @param result The result of the append.
     */
    default void appended(final AppendResult result) {
        // Nothing by default
    }

    @Override
    void close();

    void removeListener(String registrationId);
}
