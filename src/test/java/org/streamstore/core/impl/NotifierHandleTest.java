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

import org.junit.Test;
import org.streamstore.core.InvalidConfigurationException;
import org.streamstore.core.NotifierInitializationException;
import org.streamstore.core.StoreNotifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Tommy Wassgren
 */
public class NotifierHandleTest {
    /**
     * Notifier that only counts how often it was closed.
     */
    private static class CountingNotifier implements StoreNotifier {
        private final AtomicInteger closed = new AtomicInteger();

        @Override
        public String addListener(final Runnable listener) {
            return "listener";
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }

        @Override
        public void removeListener(final String registrationId) {
            // Nothing to remove
        }
    }

    @Test
    public void closeWithoutUseDoesNotCreate() {
        // Given
        final AtomicInteger created = new AtomicInteger();
        final NotifierHandle handle = new NotifierHandle("test", () -> {
            created.incrementAndGet();
            return new CountingNotifier();
        });

        // When
        handle.close();

        // Then
        assertEquals(0, created.get());
        assertFalse(handle.isCreated());
    }

    @Test
    public void closesCreatedNotifierOnce() {
        // Given
        final CountingNotifier notifier = new CountingNotifier();
        final NotifierHandle handle = new NotifierHandle("test", () -> notifier);
        handle.get();

        // When
        handle.close();
        handle.close();

        // Then
        assertEquals(1, notifier.closed.get());
    }

    @Test
    public void closeDuringConstructionClosesNotifierOnceConstructed() throws Exception {
        // Given
        final CountingNotifier notifier = new CountingNotifier();
        final CountDownLatch constructing = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final NotifierHandle handle = new NotifierHandle("test", () -> {
            constructing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return notifier;
        });
        final ExecutorService executorService = Executors.newSingleThreadExecutor();
        final Future<StoreNotifier> firstUse = executorService.submit(handle::get);
        assertTrue(constructing.await(5, TimeUnit.SECONDS));

        // When
        handle.close();
        release.countDown();

        // Then
        try {
            firstUse.get(5, TimeUnit.SECONDS);
            fail("A handle closed during construction should not hand out the notifier");
        } catch (final ExecutionException e) {
            assertTrue(e.getCause() instanceof NotifierInitializationException);
        }
        assertEquals(1, notifier.closed.get());
        handle.close();
        assertEquals(1, notifier.closed.get());
        executorService.shutdown();
    }

    @Test
    public void concurrentFirstUsesShareOneConstruction() throws Exception {
        // Given
        final AtomicInteger created = new AtomicInteger();
        final CountDownLatch constructing = new CountDownLatch(1);
        final NotifierHandle handle = new NotifierHandle("test", () -> {
            created.incrementAndGet();
            constructing.await(5, TimeUnit.SECONDS);
            return new CountingNotifier();
        });
        final ExecutorService executorService = Executors.newFixedThreadPool(8);
        final List<Future<StoreNotifier>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 8; i++) {
            futures.add(executorService.submit(handle::get));
        }
        Thread.sleep(100);
        constructing.countDown();

        // Then
        final StoreNotifier first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (final Future<StoreNotifier> future : futures) {
            assertSame(first, future.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, created.get());
        executorService.shutdown();
    }

    @Test
    public void failedConstructionIsReportedToEveryCallerAndNotRetried() {
        // Given
        final AtomicInteger attempts = new AtomicInteger();
        final NotifierHandle handle = new NotifierHandle("test", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("No connection");
        });

        // When / Then
        for (int i = 0; i < 3; i++) {
            try {
                handle.get();
                fail("Notifier construction should fail");
            } catch (final NotifierInitializationException e) {
                assertTrue(e.getCause() instanceof IllegalStateException);
            }
        }
        assertEquals(1, attempts.get());
        assertFalse(handle.isCreated());
    }

    @Test
    public void missingFactoryIsAConfigurationError() {
        // Given
        final NotifierHandle handle = new NotifierHandle("test", null);

        // When
        try {
            handle.get();
            fail("Notifier construction should fail without factory");
        } catch (final NotifierInitializationException e) {
            // Then
            assertTrue(e.getCause() instanceof InvalidConfigurationException);
        }
        assertFalse(handle.hasFactory());
    }
}
