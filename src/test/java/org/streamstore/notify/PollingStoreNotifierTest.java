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

import org.junit.Test;
import org.streamstore.core.Checkpoint;
import org.streamstore.core.EventStore;
import org.streamstore.core.EventStoreSettings;
import org.streamstore.core.ExpectedVersion;
import org.streamstore.core.NewEvent;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.support.Closeables;
import org.streamstore.store.jdbc.H2EventStore;
import org.streamstore.store.jdbc.H2Stores;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author Tommy Wassgren
 */
public class PollingStoreNotifierTest {
    @Test
    public void signalsWhenHeadMoves() throws Exception {
        // Given
        final EventStore eventStore = H2Stores.create(EventStoreSettings.builder());
        final PollingStoreNotifier notifier = new PollingStoreNotifier(eventStore, Duration.ofMillis(20));
        final CountDownLatch signalled = new CountDownLatch(1);
        notifier.addListener(signalled::countDown);

        // When
        eventStore.append("stream-1", ExpectedVersion.NO_STREAM, new NewEvent(UUID.randomUUID(), "a", null));

        // Then
        assertTrue(signalled.await(10, TimeUnit.SECONDS));

        // Cleanup
        Closeables.closeSilently(notifier, eventStore);
    }

    @Test
    public void removedListenerIsNotSignalled() throws Exception {
        // Given
        final EventStore eventStore = H2Stores.create(EventStoreSettings.builder());
        final PollingStoreNotifier notifier = new PollingStoreNotifier(eventStore, Duration.ofMillis(20));
        final CountDownLatch removed = new CountDownLatch(1);
        final CountDownLatch kept = new CountDownLatch(1);
        notifier.removeListener(notifier.addListener(removed::countDown));
        notifier.addListener(kept::countDown);

        // When
        eventStore.append("stream-1", ExpectedVersion.NO_STREAM, new NewEvent(UUID.randomUUID(), "a", null));

        // Then
        assertTrue(kept.await(10, TimeUnit.SECONDS));
        assertFalse(removed.await(100, TimeUnit.MILLISECONDS));
        assertEquals(1, notifier.listenerCount());

        // Cleanup
        Closeables.closeSilently(notifier, eventStore);
    }

    @Test
    public void wakesSubscriptionsOfAnotherStoreOnTheSameDatabase() throws Exception {
        // Given
        final String url = H2Stores.uniqueUrl();
        final H2EventStore writer = new H2EventStore(EventStoreSettings.builder().jdbcUrl(url).build());
        writer.initialize(false);
        final H2EventStore reader = new H2EventStore(EventStoreSettings.builder()
                .jdbcUrl(url)
                .notifierFactory(PollingStoreNotifier.factory(Duration.ofMillis(20)))
                .build());
        final List<StoredEvent> received = new CopyOnWriteArrayList<>();
        final CountDownLatch caughtUp = new CountDownLatch(1);
        final CountDownLatch liveReceived = new CountDownLatch(1);
        reader.subscribeToAll(
                "subscription",
                Checkpoint.END,
                event -> {
                    received.add(event);
                    liveReceived.countDown();
                },
                (subscription, reason, exception) -> { },
                caughtUp::countDown);
        assertTrue(caughtUp.await(10, TimeUnit.SECONDS));

        // When
        writer.append("stream-1", ExpectedVersion.NO_STREAM, new NewEvent(UUID.randomUUID(), "a", null));

        // Then
        assertTrue(liveReceived.await(10, TimeUnit.SECONDS));
        assertEquals(1, received.size());

        // Cleanup
        Closeables.closeSilently(reader, writer);
    }
}
