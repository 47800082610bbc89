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

import org.streamstore.core.EventStore;
import org.streamstore.core.EventStoreDisposedException;
import org.streamstore.core.StoreNotifierFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Notifier that polls the head checkpoint of the store at a fixed interval and signals its listeners whenever the head has
 * moved. It works with any backend but signals late by up to one interval.
 *
 * @author Tommy Wassgren
 */
public class PollingStoreNotifier extends AbstractStoreNotifier {
    private final Duration interval;
    private long lastHead;
    private final ScheduledExecutorService scheduler;
    private final EventStore store;

    /**
     * Creates the notifier and starts polling. The current head is read immediately, construction fails if the store cannot be
     * read.
     */
    public PollingStoreNotifier(final EventStore store, final Duration interval) {
        this.store = requireNonNull(store, "Store must not be null");
        this.interval = requireNonNull(interval, "Interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive [interval=" + interval + "]");
        }

        this.lastHead = store.readHeadCheckpoint();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "poll-notifier-" + store.logName());
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::poll, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Polling notifier started [store={}, interval={}]", store.logName(), interval);
    }

    public static StoreNotifierFactory factory(final Duration interval) {
        return store -> new PollingStoreNotifier(store, interval);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        log.info("Polling notifier stopped [store={}]", store.logName());
    }

    public Duration interval() {
        return interval;
    }

    private void poll() {
        try {
            final long head = store.readHeadCheckpoint();
            if (head != lastHead) {
                log.trace("Head moved [store={}, from={}, to={}]", store.logName(), lastHead, head);
                lastHead = head;
                signalListeners();
            }
        } catch (final EventStoreDisposedException e) {
            log.debug("Store disposed, polling stops [store={}]", store.logName());
            scheduler.shutdown();
        } catch (final RuntimeException e) {
            // Keep polling, the backend may come back
            log.warn("Unable to poll head checkpoint [store={}]", store.logName(), e);
        }
    }
}
