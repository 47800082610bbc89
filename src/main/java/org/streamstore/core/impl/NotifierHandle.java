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

package org.streamstore.core.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamstore.core.InvalidConfigurationException;
import org.streamstore.core.NotifierInitializationException;
import org.streamstore.core.StoreNotifier;
import org.streamstore.core.support.Closeables;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Holds the notifier of a store. The notifier is constructed on first use and at most once: concurrent first users all wait
 * for the same construction. A failed construction is kept and reported to every caller, it is never retried.
 *
 * @author Tommy Wassgren
 */
public class NotifierHandle implements AutoCloseable {
    private final Callable<StoreNotifier> factory;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private volatile boolean closed;
    private final String logName;
    private final AtomicReference<CompletableFuture<StoreNotifier>> notifier = new AtomicReference<>();
    private final AtomicBoolean released = new AtomicBoolean();

    public NotifierHandle(final String logName, final Callable<StoreNotifier> factory) {
        this.logName = logName;
        this.factory = factory;
    }

    /**
     * Closes the notifier if it was created. A handle that was never used is left alone, no notifier is constructed here. A
     * construction still running is closed as soon as it completes.
     */
    @Override
    public void close() {
        closed = true;
        final CompletableFuture<StoreNotifier> existing = notifier.get();
        if (existing != null) {
            existing.thenAccept(this::release);
        }
    }

    /**
     * Returns the notifier, constructing it on the first call.
     *
     * @throws NotifierInitializationException If the notifier could not be constructed (now or by an earlier call).
     */
    public StoreNotifier get() {
        if (closed) {
            throw new NotifierInitializationException("Notifier handle is closed [store=" + logName + "]", null);
        }
        final StoreNotifier created;
        try {
            created = future().join();
        } catch (final CompletionException e) {
            throw (NotifierInitializationException) e.getCause();
        }
        if (closed) {
            release(created);
            throw new NotifierInitializationException(
                    "Notifier handle was closed during construction [store=" + logName + "]", null);
        }
        return created;
    }

    /**
     * False if no notifier factory was configured, every call to {@link #get()} fails in that case.
     */
    public boolean hasFactory() {
        return factory != null;
    }

    public boolean isCreated() {
        final CompletableFuture<StoreNotifier> existing = notifier.get();
        return existing != null && existing.isDone() && !existing.isCompletedExceptionally();
    }

    private StoreNotifier create() {
        if (factory == null) {
            throw new NotifierInitializationException(
                    "Cannot create notifier because no notifier factory was configured",
                    new InvalidConfigurationException("Notifier factory is missing [store=" + logName + "]"));
        }

        try {
            log.debug("Creating notifier [store={}]", logName);
            return requireNonNull(factory.call(), "Notifier factory returned null");
        } catch (final Exception e) {
            log.error("Unable to create notifier [store={}]", logName, e);
            throw new NotifierInitializationException("Unable to create notifier [store=" + logName + "]", e);
        }
    }

    private void release(final StoreNotifier created) {
        if (released.compareAndSet(false, true)) {
            log.debug("Closing notifier [store={}]", logName);
            Closeables.closeSilently(created);
        }
    }

    private CompletableFuture<StoreNotifier> future() {
        final CompletableFuture<StoreNotifier> existing = notifier.get();
        if (existing != null) {
            return existing;
        }

        final CompletableFuture<StoreNotifier> created = new CompletableFuture<>();
        if (!notifier.compareAndSet(null, created)) {
            // Someone else is constructing, wait for theirs
            return notifier.get();
        }

        try {
            created.complete(create());
        } catch (final NotifierInitializationException e) {
            created.completeExceptionally(e);
        }
        return created;
    }
}
